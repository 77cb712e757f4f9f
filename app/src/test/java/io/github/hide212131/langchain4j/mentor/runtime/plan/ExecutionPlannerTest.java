package io.github.hide212131.langchain4j.mentor.runtime.plan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.hide212131.langchain4j.mentor.runtime.capability.CapabilityEntry;
import io.github.hide212131.langchain4j.mentor.runtime.capability.CapabilityGraph;
import io.github.hide212131.langchain4j.mentor.runtime.capability.CapabilityGraphLoader;
import io.github.hide212131.langchain4j.mentor.runtime.capability.Phase;
import io.github.hide212131.langchain4j.mentor.runtime.capability.PhaseCompatibility;
import io.github.hide212131.langchain4j.mentor.runtime.capability.Requirement;
import io.github.hide212131.langchain4j.mentor.runtime.intent.IntentResult;
import io.github.hide212131.langchain4j.mentor.runtime.intent.IntentSource;
import io.github.hide212131.langchain4j.mentor.runtime.state.ProjectRecord;
import io.github.hide212131.langchain4j.mentor.runtime.state.SelectionMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ExecutionPlannerTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
    private static final Map<String, Object> REQUIREMENTS = Map.of("functional", List.of("Track orders"));
    private static final Map<String, Object> ARCHITECTURE = Map.of("tech_stack", Map.of("backend", "Java"));

    private final CapabilityGraph graph = new CapabilityGraphLoader().load("capabilities.yaml");

    private static ProjectRecord record(Map<String, Object> artifacts) {
        return new ProjectRecord("s-1", Phase.INITIALIZATION, artifacts, List.of(), SelectionMode.AUTO, null, NOW, NOW);
    }

    private static IntentResult intent(String... agents) {
        return new IntentResult("test", List.of(agents), 1.0, IntentSource.RULES);
    }

    @Test
    @DisplayName("Architecture intent on an empty record prepends the requirements producer")
    void plan_architectureIntentWithoutRequirements_shouldPrependProducer() {
        ExecutionPlanner planner = new ExecutionPlanner(graph, false, false);

        ExecutionPlan plan = planner.plan(SelectionMode.AUTO, intent("project_architect"), record(Map.of()));

        assertThat(plan.agentIds()).containsExactly("requirements_collector", "project_architect");
        assertThat(plan.awaitingSelection()).isFalse();
    }

    @Test
    void plan_architectureIntentWithRequirements_shouldOnlyRunArchitect() {
        ExecutionPlanner planner = new ExecutionPlanner(graph, false, false);

        ExecutionPlan plan = planner.plan(
                SelectionMode.AUTO, intent("project_architect"), record(Map.of("requirements", REQUIREMENTS)));

        assertThat(plan.agentIds()).containsExactly("project_architect");
    }

    @Test
    void plan_exportIntent_shouldNotPrependAnything() {
        ExecutionPlanner planner = new ExecutionPlanner(graph);

        ExecutionPlan plan = planner.plan(
                SelectionMode.AUTO,
                intent("exporter"),
                record(Map.of("requirements", REQUIREMENTS, "architecture", ARCHITECTURE)));

        assertThat(plan.agentIds()).containsExactly("exporter");
        assertThat(plan.tasks().get(0).requiredContext().isAll()).isTrue();
    }

    @Test
    void plan_exportIntentOnEmptyRecord_shouldStillNotPrependAnything() {
        ExecutionPlan plan = new ExecutionPlanner(graph).plan(SelectionMode.AUTO, intent("exporter"), record(Map.of()));

        assertThat(plan.agentIds()).containsExactly("exporter");
    }

    @Test
    void plan_withDownstreamExpansion_shouldAppendConsumersInDeclarationOrder() {
        // Given: Requirements are present and downstream expansion is on
        ExecutionPlanner planner = new ExecutionPlanner(graph, true, false);

        // When
        ExecutionPlan plan = planner.plan(
                SelectionMode.AUTO, intent("project_architect"), record(Map.of("requirements", REQUIREMENTS)));

        // Then: Everything that consumes architecture follows, the exporter never does
        assertThat(plan.agentIds()).containsExactly("project_architect", "execution_planner", "mockup_agent");
    }

    @Test
    void plan_withDownstreamExpansionOnEmptyRecord_shouldCoverWholeChainOnce() {
        ExecutionPlan plan = new ExecutionPlanner(graph, true, false)
                .plan(SelectionMode.AUTO, intent("project_architect"), record(Map.of()));

        assertThat(plan.agentIds())
                .containsExactly("requirements_collector", "project_architect", "execution_planner", "mockup_agent");
    }

    @Test
    void plan_downstreamExpansion_shouldCountEachAppendedCollaboratorsProducts() {
        // Given: Only the requirements collector is seeded
        ExecutionPlanner planner = new ExecutionPlanner(graph, true, false);

        // When
        ExecutionPlan plan = planner.plan(SelectionMode.AUTO, intent("requirements_collector"), record(Map.of()));

        // Then: The architect's architecture makes the execution planner eligible in the same pass
        assertThat(plan.agentIds())
                .containsExactly("requirements_collector", "project_architect", "execution_planner", "mockup_agent");
    }

    @Test
    void plan_manualSelection_shouldNotExpandDownstream() {
        // Given: Downstream expansion is on, but the user picked the architect
        ExecutionPlanner planner = new ExecutionPlanner(graph, true, false);

        // When
        ExecutionPlan plan = planner.plan(SelectionMode.MANUAL, IntentResult.manual("project_architect"), record(Map.of()));

        // Then: Only the missing upstream producer is added
        assertThat(plan.agentIds()).containsExactly("requirements_collector", "project_architect");
    }

    @Test
    void plan_manualWithoutSelection_shouldAwaitSelection() {
        ExecutionPlan plan = new ExecutionPlanner(graph)
                .plan(SelectionMode.MANUAL, IntentResult.manual(null), record(Map.of()));

        assertThat(plan.awaitingSelection()).isTrue();
        assertThat(plan.isEmpty()).isTrue();
    }

    @Test
    void plan_unknownIntent_shouldBeEmptyUnlessPipelineEnabled() {
        ProjectRecord empty = record(Map.of());

        ExecutionPlan quiet = new ExecutionPlanner(graph, true, false)
                .plan(SelectionMode.AUTO, IntentResult.unknown(IntentSource.RULES), empty);
        ExecutionPlan pipeline = new ExecutionPlanner(graph, true, true)
                .plan(SelectionMode.AUTO, IntentResult.unknown(IntentSource.RULES), empty);

        assertThat(quiet.isEmpty()).isTrue();
        assertThat(quiet.awaitingSelection()).isFalse();
        assertThat(pipeline.agentIds())
                .containsExactly(
                        "requirements_collector", "project_architect", "execution_planner", "mockup_agent", "exporter");
    }

    @Test
    void plan_requirementsWithOnlyEmptyValues_shouldCountAsPresent() {
        Map<String, Object> sparseRequirements = Map.of("functional", List.of(), "constraints", List.of());

        ExecutionPlan plan = new ExecutionPlanner(graph, false, false)
                .plan(SelectionMode.AUTO, intent("project_architect"), record(Map.of("requirements", sparseRequirements)));

        assertThat(plan.agentIds()).containsExactly("project_architect");
    }

    @Test
    void plan_requirementsAsEmptyMap_shouldCountAsMissing() {
        ExecutionPlan plan = new ExecutionPlanner(graph, false, false)
                .plan(SelectionMode.AUTO, intent("project_architect"), record(Map.of("requirements", Map.of())));

        assertThat(plan.agentIds()).containsExactly("requirements_collector", "project_architect");
    }

    @Test
    void plan_withUnknownSeed_shouldFail() {
        ExecutionPlanner planner = new ExecutionPlanner(graph);

        assertThatThrownBy(() -> planner.plan(SelectionMode.MANUAL, IntentResult.manual("ghost"), record(Map.of())))
                .isInstanceOf(PlanningException.class)
                .hasMessage("Unknown agent in plan seed: ghost");
    }

    @Test
    void plan_withDependencyCycle_shouldFail() {
        // Given: a needs x from b, b needs y from a
        CapabilityGraph cyclic = new CapabilityGraph(List.of(
                new CapabilityEntry("a", null, null, Requirement.of(List.of("x")), Set.of("y"), PhaseCompatibility.any(), null),
                new CapabilityEntry("b", null, null, Requirement.of(List.of("y")), Set.of("x"), PhaseCompatibility.any(), null)));

        // When / Then
        assertThatThrownBy(() -> new ExecutionPlanner(cyclic).plan(SelectionMode.AUTO, intent("a"), record(Map.of())))
                .isInstanceOf(PlanningException.class)
                .hasMessageContaining("Dependency cycle: a -> b -> a");
    }

    @Test
    void plan_forEverySeedAndRecord_shouldBeUpstreamCompleteAndDuplicateFree() {
        List<String> artifactNames = List.of("requirements", "architecture", "roadmap", "mockups");
        for (boolean downstream : List.of(true, false)) {
            ExecutionPlanner planner = new ExecutionPlanner(graph, downstream, false);
            for (int mask = 0; mask < (1 << artifactNames.size()); mask++) {
                Map<String, Object> artifacts = new LinkedHashMap<>();
                for (int bit = 0; bit < artifactNames.size(); bit++) {
                    if ((mask & (1 << bit)) != 0) {
                        artifacts.put(artifactNames.get(bit), Map.of("value", "present"));
                    }
                }
                ProjectRecord start = record(artifacts);
                for (CapabilityEntry seed : graph.entries()) {
                    ExecutionPlan plan = planner.plan(SelectionMode.AUTO, intent(seed.id()), start);
                    assertUpstreamComplete(plan, start);
                    assertThat(new HashSet<>(plan.agentIds())).hasSize(plan.agentIds().size());
                    assertThat(plan.agentIds().size()).isLessThanOrEqualTo(graph.size());
                    if (!seed.id().equals("exporter")) {
                        assertThat(plan.agentIds()).doesNotContain("exporter");
                    }
                }
            }
        }
    }

    @Test
    void availableAgents_shouldBeIdempotentAndReportMissingArtifacts() {
        ExecutionPlanner planner = new ExecutionPlanner(graph);
        ProjectRecord start = new ProjectRecord(
                "s-1",
                Phase.REQUIREMENTS_COMPLETE,
                Map.of("requirements", REQUIREMENTS),
                List.of(),
                SelectionMode.AUTO,
                null,
                NOW,
                NOW);

        List<AgentAvailability> first = planner.availableAgents(start);
        List<AgentAvailability> second = planner.availableAgents(start);

        assertThat(second).isEqualTo(first);
        AgentAvailability architect = find(first, "project_architect");
        AgentAvailability mockups = find(first, "mockup_agent");
        AgentAvailability roadmapPlanner = find(first, "execution_planner");
        assertThat(architect.available()).isTrue();
        assertThat(mockups.available()).isFalse();
        assertThat(mockups.missingArtifacts()).containsExactly("architecture");
        assertThat(roadmapPlanner.phaseCompatible()).isFalse();
        assertThat(find(first, "exporter").available()).isTrue();
    }

    private static AgentAvailability find(List<AgentAvailability> agents, String id) {
        return agents.stream().filter(agent -> agent.agentId().equals(id)).findFirst().orElseThrow();
    }

    private void assertUpstreamComplete(ExecutionPlan plan, ProjectRecord start) {
        Set<String> available = new HashSet<>();
        start.artifacts().keySet().stream().filter(start::hasArtifact).forEach(available::add);
        List<String> produced = new ArrayList<>();
        for (Task task : plan.tasks()) {
            CapabilityEntry entry = graph.get(task.agentId()).orElseThrow();
            for (String artifact : entry.requires().artifacts()) {
                assertThat(available.contains(artifact) || produced.contains(artifact))
                        .as("%s requires %s in plan %s", entry.id(), artifact, plan.agentIds())
                        .isTrue();
            }
            produced.addAll(entry.produces());
        }
    }
}
