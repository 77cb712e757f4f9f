package io.github.hide212131.langchain4j.mentor.runtime.capability;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Inputs a collaborator needs: either a specific set of artifacts, or every artifact in the record.
 */
public interface Requirement {

    /** Artifact names this requirement names explicitly; empty for {@link All}. */
    Set<String> artifacts();

    default boolean isAll() {
        return false;
    }

    static Requirement of(Collection<String> artifacts) {
        return new Specific(new LinkedHashSet<>(artifacts));
    }

    static Requirement none() {
        return new Specific(Set.of());
    }

    static Requirement all() {
        return All.INSTANCE;
    }

    record Specific(Set<String> artifacts) implements Requirement {
        public Specific {
            Objects.requireNonNull(artifacts, "artifacts");
            artifacts = Collections.unmodifiableSet(new LinkedHashSet<>(artifacts));
        }
    }

    /** Terminal marker: the collaborator consumes the whole record and never joins automatic expansion. */
    final class All implements Requirement {
        static final All INSTANCE = new All();

        private All() {
        }

        @Override
        public Set<String> artifacts() {
            return Set.of();
        }

        @Override
        public boolean isAll() {
            return true;
        }

        @Override
        public String toString() {
            return "All";
        }
    }
}
