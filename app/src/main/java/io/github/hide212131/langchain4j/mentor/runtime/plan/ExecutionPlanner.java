package io.github.hide212131.langchain4j.mentor.runtime.plan;

import io.github.hide212131.langchain4j.mentor.infra.config.OrchestratorSettings;
import io.github.hide212131.langchain4j.mentor.infra.logging.WorkflowLogger;
import io.github.hide212131.langchain4j.mentor.runtime.capability.CapabilityEntry;
import io.github.hide212131.langchain4j.mentor.runtime.capability.CapabilityGraph;
import io.github.hide212131.langchain4j.mentor.runtime.intent.IntentResult;
import io.github.hide212131.langchain4j.mentor.runtime.state.ProjectRecord;
import io.github.hide212131.langchain4j.mentor.runtime.state.SelectionMode;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Turns an intent (auto mode) or a user selection (manual mode) into an ordered, dependency-resolved
 * plan.
 *
 * <p>Upstream resolution walks the seed depth-first and inserts the producer of every missing
 * required artifact right before its consumer. Downstream resolution (auto mode only) then appends,
 * in declaration order, collaborators whose requirements intersect what this turn will produce,
 * counting the products of each appended collaborator right away, until a pass adds nothing.
 * Appended collaborators go through upstream resolution as well.
 * Collaborators that require every artifact only run when seeded.
 */
public final class ExecutionPlanner {

    private final WorkflowLogger logger = new WorkflowLogger(ExecutionPlanner.class);
    private final CapabilityGraph graph;
    private final boolean expandDownstream;
    private final boolean unknownIntentPipeline;

    public ExecutionPlanner(CapabilityGraph graph) {
        this(graph, true, false);
    }

    public ExecutionPlanner(CapabilityGraph graph, OrchestratorSettings settings) {
        this(graph, settings.expandDownstream(), settings.unknownIntentPipeline());
    }

    public ExecutionPlanner(CapabilityGraph graph, boolean expandDownstream, boolean unknownIntentPipeline) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.expandDownstream = expandDownstream;
        this.unknownIntentPipeline = unknownIntentPipeline;
    }

    /**
     * Builds the plan for one turn. In manual mode {@code intent} carries the selected collaborator as
     * its only required agent; a manual intent without one yields an awaiting-selection plan.
     *
     * @throws PlanningException when a seeded id is not declared or the requirements form a cycle
     */
    public ExecutionPlan plan(SelectionMode mode, IntentResult intent, ProjectRecord record) {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(intent, "intent");
        Objects.requireNonNull(record, "record");

        List<String> seed = intent.requiresAgents();
        if (mode == SelectionMode.MANUAL) {
            if (seed.isEmpty()) {
                return ExecutionPlan.awaitingSelectionPlan();
            }
            seed = List.of(seed.get(0));
        } else if (seed.isEmpty() && unknownIntentPipeline) {
            seed = graph.entries().stream().map(CapabilityEntry::id).toList();
        }

        Resolution resolution = new Resolution(record);
        for (String agentId : seed) {
            CapabilityEntry entry = graph.get(agentId)
                    .orElseThrow(() -> new PlanningException("Unknown agent in plan seed: " + agentId));
            resolution.resolveUpstream(entry, new LinkedHashSet<>());
        }
        if (mode == SelectionMode.AUTO && expandDownstream) {
            resolution.expandDownstream();
        }

        List<Task> tasks = new ArrayList<>();
        for (CapabilityEntry entry : resolution.scheduled) {
            tasks.add(new Task(entry.id(), entry.requires()));
        }
        ExecutionPlan plan = ExecutionPlan.of(tasks);
        logger.debug("Planned {} for intent {} in {} mode", plan.agentIds(), intent.primaryIntent(), mode.wireName());
        return plan;
    }

    /** Every declared collaborator with its availability for {@code record}, in declaration order. */
    public List<AgentAvailability> availableAgents(ProjectRecord record) {
        Objects.requireNonNull(record, "record");
        List<AgentAvailability> result = new ArrayList<>();
        for (CapabilityEntry entry : graph.entries()) {
            boolean phaseCompatible = entry.phaseCompatibility().accepts(record.phase());
            List<String> missing = new ArrayList<>();
            for (String artifact : entry.requires().artifacts()) {
                if (!record.hasArtifact(artifact)) {
                    missing.add(artifact);
                }
            }
            result.add(new AgentAvailability(
                    entry.id(),
                    entry.name(),
                    entry.description(),
                    entry.phaseCompatibility(),
                    phaseCompatible && missing.isEmpty(),
                    phaseCompatible,
                    missing));
        }
        return List.copyOf(result);
    }

    public CapabilityGraph graph() {
        return graph;
    }

    private final class Resolution {
        private final ProjectRecord record;
        private final List<CapabilityEntry> scheduled = new ArrayList<>();
        private final Set<String> scheduledIds = new LinkedHashSet<>();
        private final Set<String> scheduledProducts = new LinkedHashSet<>();

        Resolution(ProjectRecord record) {
            this.record = record;
        }

        void resolveUpstream(CapabilityEntry entry, Set<String> path) {
            if (scheduledIds.contains(entry.id())) {
                return;
            }
            if (!path.add(entry.id())) {
                throw new PlanningException("Dependency cycle: " + String.join(" -> ", path) + " -> " + entry.id());
            }
            for (String artifact : entry.requires().artifacts()) {
                if (record.hasArtifact(artifact) || scheduledProducts.contains(artifact)) {
                    continue;
                }
                Optional<CapabilityEntry> producer = graph.producersOf(artifact).stream()
                        .filter(candidate -> !candidate.requiresAll())
                        .findFirst();
                if (producer.isEmpty()) {
                    logger.debug("No producer declared for {} required by {}", artifact, entry.id());
                    continue;
                }
                resolveUpstream(producer.get(), path);
            }
            path.remove(entry.id());
            schedule(entry);
        }

        void expandDownstream() {
            Set<String> produced = producedThisTurn();
            // Each productive pass schedules at least one more agent, so graph.size() passes suffice.
            for (int pass = 0; pass < graph.size(); pass++) {
                boolean added = false;
                for (CapabilityEntry candidate : graph.entries()) {
                    if (candidate.requiresAll() || scheduledIds.contains(candidate.id())) {
                        continue;
                    }
                    if (candidate.requires().artifacts().stream().noneMatch(produced::contains)) {
                        continue;
                    }
                    resolveUpstream(candidate, new LinkedHashSet<>());
                    produced = producedThisTurn();
                    added = true;
                }
                if (!added) {
                    return;
                }
            }
        }

        private Set<String> producedThisTurn() {
            Set<String> produced = new LinkedHashSet<>();
            for (CapabilityEntry entry : scheduled) {
                if (!entry.requiresAll()) {
                    produced.addAll(entry.produces());
                }
            }
            return produced;
        }

        private void schedule(CapabilityEntry entry) {
            scheduled.add(entry);
            scheduledIds.add(entry.id());
            scheduledProducts.addAll(entry.produces());
        }
    }
}
