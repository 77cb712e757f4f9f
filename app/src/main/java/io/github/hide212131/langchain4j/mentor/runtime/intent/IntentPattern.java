package io.github.hide212131.langchain4j.mentor.runtime.intent;

import io.github.hide212131.langchain4j.mentor.runtime.capability.PhaseCompatibility;
import java.util.List;
import java.util.Objects;

/** Keyword pattern for one intent and the collaborators it routes to. */
public record IntentPattern(
        String name,
        List<String> keywords,
        List<String> triggers,
        PhaseCompatibility phaseCompatibility,
        List<String> agents) {

    public IntentPattern {
        Objects.requireNonNull(name, "name");
        keywords = List.copyOf(Objects.requireNonNull(keywords, "keywords"));
        triggers = List.copyOf(Objects.requireNonNull(triggers, "triggers"));
        Objects.requireNonNull(phaseCompatibility, "phaseCompatibility");
        agents = List.copyOf(Objects.requireNonNull(agents, "agents"));
    }
}
