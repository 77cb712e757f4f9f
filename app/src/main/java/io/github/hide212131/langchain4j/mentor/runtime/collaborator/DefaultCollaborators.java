package io.github.hide212131.langchain4j.mentor.runtime.collaborator;

import dev.langchain4j.model.chat.ChatModel;
import io.github.hide212131.langchain4j.mentor.runtime.agent.Collaborator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Collaborator factories keyed by capability id, ready for
 * {@link io.github.hide212131.langchain4j.mentor.runtime.agent.CollaboratorRegistry}.
 */
public final class DefaultCollaborators {

    private DefaultCollaborators() {
    }

    /** Chat-model backed collaborators plus the deterministic Markdown exporter. */
    public static Map<String, Supplier<Collaborator>> llm(ChatModel chatModel) {
        Objects.requireNonNull(chatModel, "chatModel");
        Map<String, Supplier<Collaborator>> factories = new LinkedHashMap<>();
        for (CollaboratorRole role : CollaboratorRole.defaults()) {
            factories.put(role.agentId(), () -> new PromptedArtifactCollaborator(role, chatModel));
        }
        factories.put("exporter", MarkdownExportCollaborator::new);
        return factories;
    }

    /** Offline collaborators that never call a model. */
    public static Map<String, Supplier<Collaborator>> dryRun() {
        Map<String, Supplier<Collaborator>> factories = new LinkedHashMap<>();
        factories.put(CollaboratorRole.REQUIREMENTS.agentId(), DryRunCollaborators::requirements);
        factories.put(CollaboratorRole.ARCHITECTURE.agentId(), DryRunCollaborators::architecture);
        factories.put(CollaboratorRole.ROADMAP.agentId(), DryRunCollaborators::roadmap);
        factories.put(CollaboratorRole.MOCKUPS.agentId(), DryRunCollaborators::mockups);
        factories.put("exporter", MarkdownExportCollaborator::new);
        return factories;
    }
}
