package io.github.hide212131.langchain4j.mentor.runtime.agent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of one collaborator call: artifact changes, reply text, or an error message.
 */
public record CollaboratorOutput(Map<String, Object> stateDelta, String content, String error) {

    public CollaboratorOutput {
        stateDelta = stateDelta == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(stateDelta));
    }

    public static CollaboratorOutput success(Map<String, Object> stateDelta, String content) {
        return new CollaboratorOutput(stateDelta, content, null);
    }

    public static CollaboratorOutput reply(String content) {
        return new CollaboratorOutput(Map.of(), content, null);
    }

    public static CollaboratorOutput failure(String error) {
        return new CollaboratorOutput(Map.of(), null, error == null || error.isBlank() ? "collaborator failed" : error);
    }

    public boolean isError() {
        return error != null;
    }
}
