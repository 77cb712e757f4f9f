package io.github.hide212131.langchain4j.mentor.runtime.capability;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Phases in which a collaborator is offered to the user.
 */
public interface PhaseCompatibility {

    boolean accepts(Phase phase);

    static PhaseCompatibility of(Collection<Phase> phases) {
        return new Specific(phases.isEmpty() ? EnumSet.noneOf(Phase.class) : EnumSet.copyOf(phases));
    }

    static PhaseCompatibility any() {
        return Any.INSTANCE;
    }

    record Specific(Set<Phase> phases) implements PhaseCompatibility {
        public Specific {
            Objects.requireNonNull(phases, "phases");
            phases = Set.copyOf(phases);
        }

        @Override
        public boolean accepts(Phase phase) {
            return phases.contains(phase);
        }
    }

    final class Any implements PhaseCompatibility {
        static final Any INSTANCE = new Any();

        private Any() {
        }

        @Override
        public boolean accepts(Phase phase) {
            return true;
        }

        @Override
        public String toString() {
            return "Any";
        }
    }
}
