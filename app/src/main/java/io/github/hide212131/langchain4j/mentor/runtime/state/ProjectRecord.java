package io.github.hide212131.langchain4j.mentor.runtime.state;

import io.github.hide212131.langchain4j.mentor.runtime.capability.Phase;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Shared project state for one session. Immutable; every change goes through {@link StateManager}.
 */
public record ProjectRecord(
        String sessionId,
        Phase phase,
        Map<String, Object> artifacts,
        List<ConversationEntry> conversationHistory,
        SelectionMode agentSelectionMode,
        String selectedAgentId,
        Instant createdAt,
        Instant updatedAt) {

    public ProjectRecord {
        Objects.requireNonNull(sessionId, "sessionId");
        phase = phase == null ? Phase.INITIALIZATION : phase;
        Map<String, Object> frozen = new LinkedHashMap<>();
        if (artifacts != null) {
            artifacts.forEach((key, value) -> frozen.put(key, ArtifactValues.freeze(value)));
        }
        artifacts = Collections.unmodifiableMap(frozen);
        conversationHistory = conversationHistory == null ? List.of() : List.copyOf(conversationHistory);
        agentSelectionMode = agentSelectionMode == null ? SelectionMode.AUTO : agentSelectionMode;
        Objects.requireNonNull(createdAt, "createdAt");
        updatedAt = updatedAt == null ? createdAt : updatedAt;
    }

    /** Record for a session seen for the first time. */
    public static ProjectRecord initial(String sessionId, Instant now) {
        return new ProjectRecord(
                sessionId, Phase.INITIALIZATION, Map.of(), List.of(), SelectionMode.AUTO, null, now, now);
    }

    public Optional<Object> artifact(String name) {
        return Optional.ofNullable(artifacts.get(name));
    }

    /** Whether the artifact exists and is non-empty in the sense of {@link ArtifactValues#isPresent}. */
    public boolean hasArtifact(String name) {
        return ArtifactValues.isPresent(artifacts.get(name));
    }
}
