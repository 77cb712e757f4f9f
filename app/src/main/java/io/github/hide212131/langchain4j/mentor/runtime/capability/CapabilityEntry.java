package io.github.hide212131.langchain4j.mentor.runtime.capability;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Static declaration of one collaborator: what it needs, what it produces and when it may run.
 */
public record CapabilityEntry(
        String id,
        String name,
        String description,
        Requirement requires,
        Set<String> produces,
        PhaseCompatibility phaseCompatibility,
        Phase phaseTransition) {

    public CapabilityEntry {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        name = name == null || name.isBlank() ? id : name;
        description = description == null ? "" : description;
        Objects.requireNonNull(requires, "requires");
        Objects.requireNonNull(produces, "produces");
        produces = Collections.unmodifiableSet(new LinkedHashSet<>(produces));
        Objects.requireNonNull(phaseCompatibility, "phaseCompatibility");
    }

    public Optional<Phase> transition() {
        return Optional.ofNullable(phaseTransition);
    }

    public boolean requiresAll() {
        return requires.isAll();
    }
}
