package io.github.hide212131.langchain4j.mentor.runtime.collaborator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agentic.AgenticServices;
import dev.langchain4j.model.chat.ChatModel;
import io.github.hide212131.langchain4j.mentor.runtime.agent.Collaborator;
import io.github.hide212131.langchain4j.mentor.runtime.agent.CollaboratorException;
import io.github.hide212131.langchain4j.mentor.runtime.agent.CollaboratorInput;
import io.github.hide212131.langchain4j.mentor.runtime.agent.CollaboratorOutput;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Collaborator that asks a chat model to write one artifact and a short reply.
 */
public final class PromptedArtifactCollaborator implements Collaborator {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final CollaboratorRole role;
    private final ArtifactAuthoringAgent agent;

    public PromptedArtifactCollaborator(CollaboratorRole role, ChatModel chatModel) {
        this(role, AgenticServices.agentBuilder(ArtifactAuthoringAgent.class)
                .chatModel(Objects.requireNonNull(chatModel, "chatModel"))
                .build());
    }

    PromptedArtifactCollaborator(CollaboratorRole role, ArtifactAuthoringAgent agent) {
        this.role = Objects.requireNonNull(role, "role");
        this.agent = Objects.requireNonNull(agent, "agent");
    }

    @Override
    public CollaboratorOutput process(CollaboratorInput input) {
        String raw = agent.write(
                role.role(), role.artifactName(), role.instructions(), toJson(input.context()), input.userInput());
        return parse(raw);
    }

    CollaboratorOutput parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new CollaboratorException(role.agentId() + " returned an empty answer");
        }
        JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(stripCodeFence(raw));
        } catch (JsonProcessingException e) {
            throw new CollaboratorException(role.agentId() + " did not answer with JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new CollaboratorException(role.agentId() + " must answer with a JSON object");
        }
        String reply = root.path("reply").asText("");
        JsonNode artifact = root.get("artifact");
        if (artifact == null || artifact.isNull()) {
            return CollaboratorOutput.reply(reply);
        }
        Map<String, Object> delta = new LinkedHashMap<>();
        try {
            delta.put(role.artifactName(), OBJECT_MAPPER.treeToValue(artifact, Object.class));
        } catch (JsonProcessingException e) {
            throw new CollaboratorException(role.agentId() + " returned an unreadable artifact", e);
        }
        return CollaboratorOutput.success(delta, reply);
    }

    public CollaboratorRole role() {
        return role;
    }

    private String toJson(Map<String, Object> context) {
        try {
            return OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(context);
        } catch (JsonProcessingException e) {
            throw new CollaboratorException("Cannot serialize context for " + role.agentId(), e);
        }
    }

    private static String stripCodeFence(String raw) {
        String trimmed = raw.trim();
        if (!trimmed.startsWith("```")) {
            return trimmed;
        }
        int firstLineEnd = trimmed.indexOf('\n');
        int closing = trimmed.lastIndexOf("```");
        if (firstLineEnd < 0 || closing <= firstLineEnd) {
            return trimmed;
        }
        return trimmed.substring(firstLineEnd + 1, closing).trim();
    }
}
