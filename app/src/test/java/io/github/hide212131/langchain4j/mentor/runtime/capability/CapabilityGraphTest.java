package io.github.hide212131.langchain4j.mentor.runtime.capability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CapabilityGraphTest {

    private static CapabilityEntry entry(String id, Requirement requires, String... produces) {
        return new CapabilityEntry(id, null, null, requires, Set.of(produces), PhaseCompatibility.any(), null);
    }

    private final CapabilityGraph graph = new CapabilityGraph(List.of(
            entry("collector", Requirement.none(), "requirements"),
            entry("architect", Requirement.of(List.of("requirements")), "architecture"),
            entry("designer", Requirement.of(List.of("requirements", "architecture")), "mockups"),
            entry("exporter", Requirement.all(), "export")));

    @Test
    void consumersOf_shouldExcludeAgentsRequiringEverything() {
        assertThat(graph.consumersOf("requirements"))
                .extracting(CapabilityEntry::id)
                .containsExactly("architect", "designer");
        assertThat(graph.consumersOf("export")).isEmpty();
    }

    @Test
    void producersOf_shouldListDeclaredProducers() {
        assertThat(graph.producersOf("architecture")).extracting(CapabilityEntry::id).containsExactly("architect");
        assertThat(graph.producersOf("nothing")).isEmpty();
    }

    @Test
    void entry_withoutName_shouldDefaultToId() {
        assertThat(graph.get("collector")).hasValueSatisfying(e -> assertThat(e.name()).isEqualTo("collector"));
        assertThat(graph.get("ghost")).isEmpty();
    }

    @Test
    void declarationIndex_shouldRejectUnknownIds() {
        assertThat(graph.declarationIndex("designer")).isEqualTo(2);
        assertThatThrownBy(() -> graph.declarationIndex("ghost")).isInstanceOf(IllegalArgumentException.class);
    }
}
