package io.github.hide212131.langchain4j.mentor.runtime.capability;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Project lifecycle phases in the only order a project may move through them.
 */
public enum Phase {
    INITIALIZATION("initialization"),
    DISCOVERY("discovery"),
    REQUIREMENTS_COMPLETE("requirements_complete"),
    ARCHITECTURE_COMPLETE("architecture_complete"),
    PLANNING_COMPLETE("planning_complete"),
    DESIGN_COMPLETE("design_complete"),
    EXPORTABLE("exportable");

    private final String wireName;

    Phase(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** Returns the later of this phase and {@code target}; phases never move backwards. */
    public Phase advanceTo(Phase target) {
        if (target == null || target.ordinal() <= ordinal()) {
            return this;
        }
        return target;
    }

    @JsonCreator
    public static Phase fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Phase name must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Phase phase : values()) {
            if (phase.wireName.equals(normalized)) {
                return phase;
            }
        }
        throw new IllegalArgumentException("Unknown phase: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
