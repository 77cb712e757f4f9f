package io.github.hide212131.langchain4j.mentor.runtime.workflow;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * @param content        reply text on success, error summary on error, {@code null} when skipped
 * @param stateDeltaKeys artifact names the task changed
 */
public record AgentResult(String agentId, String agentName, AgentStatus status, String content, Set<String> stateDeltaKeys) {

    public AgentResult {
        Objects.requireNonNull(agentId, "agentId");
        agentName = agentName == null ? agentId : agentName;
        Objects.requireNonNull(status, "status");
        stateDeltaKeys = stateDeltaKeys == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(stateDeltaKeys));
    }

    static AgentResult skipped(String agentId, String agentName) {
        return new AgentResult(agentId, agentName, AgentStatus.SKIPPED, null, Set.of());
    }

    static AgentResult error(String agentId, String agentName, String summary) {
        return new AgentResult(agentId, agentName, AgentStatus.ERROR, summary, Set.of());
    }
}
