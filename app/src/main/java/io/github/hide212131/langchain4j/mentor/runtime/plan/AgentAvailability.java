package io.github.hide212131.langchain4j.mentor.runtime.plan;

import io.github.hide212131.langchain4j.mentor.runtime.capability.PhaseCompatibility;
import java.util.List;
import java.util.Objects;

/**
 * Whether a declared collaborator can be picked in the current state.
 *
 * @param missingArtifacts required artifacts that are absent or empty, in declaration order
 * @param phaseCompatible  whether the collaborator accepts the record's current phase
 */
public record AgentAvailability(
        String agentId,
        String agentName,
        String description,
        PhaseCompatibility phaseCompatibility,
        boolean available,
        boolean phaseCompatible,
        List<String> missingArtifacts) {

    public AgentAvailability {
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(phaseCompatibility, "phaseCompatibility");
        missingArtifacts = List.copyOf(Objects.requireNonNull(missingArtifacts, "missingArtifacts"));
    }
}
