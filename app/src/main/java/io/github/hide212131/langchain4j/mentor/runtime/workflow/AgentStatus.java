package io.github.hide212131.langchain4j.mentor.runtime.workflow;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Outcome of one task in a turn. */
public enum AgentStatus {
    SUCCESS,
    /** No collaborator is registered for the id. */
    SKIPPED,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
