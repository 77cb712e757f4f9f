package io.github.hide212131.langchain4j.mentor.runtime.workflow;

import io.github.hide212131.langchain4j.mentor.runtime.state.SelectionMode;
import java.util.Objects;

/** One user turn. {@code selectedAgentId} only matters in manual mode. */
public record OrchestratorRequest(String sessionId, String message, SelectionMode mode, String selectedAgentId) {

    public OrchestratorRequest {
        Objects.requireNonNull(sessionId, "sessionId");
        if (sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        message = message == null ? "" : message;
        mode = mode == null ? SelectionMode.AUTO : mode;
        selectedAgentId = selectedAgentId == null || selectedAgentId.isBlank() ? null : selectedAgentId.trim();
    }

    public static OrchestratorRequest auto(String sessionId, String message) {
        return new OrchestratorRequest(sessionId, message, SelectionMode.AUTO, null);
    }

    public static OrchestratorRequest manual(String sessionId, String message, String selectedAgentId) {
        return new OrchestratorRequest(sessionId, message, SelectionMode.MANUAL, selectedAgentId);
    }
}
