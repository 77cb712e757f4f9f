package io.github.hide212131.langchain4j.mentor.runtime.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** How collaborators are chosen for a turn. */
public enum SelectionMode {
    /** Intent classification seeds the plan. */
    AUTO,
    /** The user picked one collaborator. */
    MANUAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SelectionMode from(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "auto" -> AUTO;
            case "manual" -> MANUAL;
            default -> throw new IllegalArgumentException("Unknown selection mode: " + value);
        };
    }
}
