package io.github.hide212131.langchain4j.mentor.runtime.agent;

import io.github.hide212131.langchain4j.mentor.runtime.state.ProjectRecord;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * What a collaborator receives for one task.
 *
 * @param agentId   id the collaborator was scheduled under
 * @param context   the required artifacts by name; missing ones map to {@code null}
 * @param record    the whole record when the collaborator requires every artifact, otherwise {@code null}
 * @param userInput the user message, or the task's input override
 * @param tools     tool names granted for this task
 */
public record CollaboratorInput(
        String agentId, Map<String, Object> context, ProjectRecord record, String userInput, List<String> tools) {

    public CollaboratorInput {
        Objects.requireNonNull(agentId, "agentId");
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        userInput = userInput == null ? "" : userInput;
        tools = tools == null ? List.of() : List.copyOf(tools);
    }

    public Optional<Object> artifact(String name) {
        return Optional.ofNullable(context.get(name));
    }

    public Optional<ProjectRecord> fullRecord() {
        return Optional.ofNullable(record);
    }
}
