package io.github.hide212131.langchain4j.mentor.runtime.workflow;

import io.github.hide212131.langchain4j.mentor.runtime.intent.IntentResult;
import io.github.hide212131.langchain4j.mentor.runtime.plan.AgentAvailability;
import io.github.hide212131.langchain4j.mentor.runtime.plan.ExecutionPlan;
import io.github.hide212131.langchain4j.mentor.runtime.state.ProjectRecord;
import java.util.List;
import java.util.Objects;

/** Everything a caller needs to render one turn. */
public record OrchestratorResponse(
        String message,
        ProjectRecord stateSnapshot,
        ExecutionPlan plan,
        List<AgentResult> agentResults,
        List<AgentAvailability> availableAgents,
        IntentResult intent) {

    public OrchestratorResponse {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(stateSnapshot, "stateSnapshot");
        Objects.requireNonNull(plan, "plan");
        agentResults = List.copyOf(Objects.requireNonNull(agentResults, "agentResults"));
        availableAgents = List.copyOf(Objects.requireNonNull(availableAgents, "availableAgents"));
        Objects.requireNonNull(intent, "intent");
    }

    public boolean awaitingSelection() {
        return plan.awaitingSelection();
    }
}
