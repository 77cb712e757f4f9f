package io.github.hide212131.langchain4j.mentor.runtime.plan;

import java.util.List;
import java.util.Objects;

/**
 * Ordered tasks for one turn. An {@code awaitingSelection} plan is empty and tells the orchestrator to
 * ask the user to pick a collaborator instead of running anything.
 */
public record ExecutionPlan(List<Task> tasks, boolean awaitingSelection) {

    public ExecutionPlan {
        tasks = List.copyOf(Objects.requireNonNull(tasks, "tasks"));
        if (awaitingSelection && !tasks.isEmpty()) {
            throw new IllegalArgumentException("A plan awaiting selection must be empty");
        }
    }

    public static ExecutionPlan of(List<Task> tasks) {
        return new ExecutionPlan(tasks, false);
    }

    public static ExecutionPlan awaitingSelectionPlan() {
        return new ExecutionPlan(List.of(), true);
    }

    public List<String> agentIds() {
        return tasks.stream().map(Task::agentId).toList();
    }

    public boolean isEmpty() {
        return tasks.isEmpty();
    }
}
