package io.github.hide212131.langchain4j.mentor.runtime.plan;

import io.github.hide212131.langchain4j.mentor.runtime.capability.Requirement;
import java.util.List;
import java.util.Objects;

/**
 * One scheduled collaborator invocation.
 *
 * @param agentId         collaborator to run
 * @param requiredContext artifacts handed to the collaborator; mirrors its declared requirement
 * @param inputOverride   text used instead of the user message, or {@code null}
 * @param tools           tool names made available to the collaborator
 */
public record Task(String agentId, Requirement requiredContext, String inputOverride, List<String> tools) {

    public Task {
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(requiredContext, "requiredContext");
        tools = tools == null ? List.of() : List.copyOf(tools);
    }

    public Task(String agentId, Requirement requiredContext) {
        this(agentId, requiredContext, null, List.of());
    }
}
