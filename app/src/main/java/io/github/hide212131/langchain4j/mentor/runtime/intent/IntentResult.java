package io.github.hide212131.langchain4j.mentor.runtime.intent;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of classifying one user message.
 *
 * @param primaryIntent  intent name, {@value #UNKNOWN} when nothing matched
 * @param requiresAgents collaborator ids that seed planning, in order
 * @param confidence     score in {@code [0, 1]}
 * @param source         classifier that produced the result
 */
public record IntentResult(String primaryIntent, List<String> requiresAgents, double confidence, IntentSource source) {

    public static final String UNKNOWN = "unknown";
    public static final String MANUAL = "manual";

    public IntentResult {
        Objects.requireNonNull(primaryIntent, "primaryIntent");
        requiresAgents = List.copyOf(Objects.requireNonNull(requiresAgents, "requiresAgents"));
        if (Double.isNaN(confidence)) {
            confidence = 0.0;
        }
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        Objects.requireNonNull(source, "source");
    }

    public static IntentResult unknown(IntentSource source) {
        return new IntentResult(UNKNOWN, List.of(), 0.0, source);
    }

    /** Intent synthesized for a manual turn: the user picked the collaborator, so confidence is 1. */
    public static IntentResult manual(String selectedAgentId) {
        List<String> agents = selectedAgentId == null ? List.of() : List.of(selectedAgentId);
        return new IntentResult(MANUAL, agents, 1.0, IntentSource.MANUAL);
    }

    public boolean isUnknown() {
        return UNKNOWN.equals(primaryIntent) && requiresAgents.isEmpty();
    }
}
