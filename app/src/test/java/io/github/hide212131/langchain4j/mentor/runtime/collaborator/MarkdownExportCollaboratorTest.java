package io.github.hide212131.langchain4j.mentor.runtime.collaborator;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.hide212131.langchain4j.mentor.runtime.agent.CollaboratorInput;
import io.github.hide212131.langchain4j.mentor.runtime.agent.CollaboratorOutput;
import io.github.hide212131.langchain4j.mentor.runtime.capability.Phase;
import io.github.hide212131.langchain4j.mentor.runtime.state.ProjectRecord;
import io.github.hide212131.langchain4j.mentor.runtime.state.SelectionMode;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MarkdownExportCollaboratorTest {

    private static final Instant NOW = Instant.parse("2026-04-01T12:00:00Z");

    private final MarkdownExportCollaborator exporter = new MarkdownExportCollaborator();

    @Test
    @SuppressWarnings("unchecked")
    void process_shouldRenderEveryPresentArtifact() {
        // Given
        Map<String, Object> artifacts = new LinkedHashMap<>();
        artifacts.put("requirements", Map.of("functional", List.of("Track orders")));
        artifacts.put("architecture", Map.of("system_diagram", "flowchart LR\n  Client --> API"));
        artifacts.put("mockups", List.of());
        artifacts.put("export", Map.of("content", "old"));
        ProjectRecord record = new ProjectRecord(
                "shop", Phase.ARCHITECTURE_COMPLETE, artifacts, List.of(), SelectionMode.AUTO, null, NOW, NOW);

        // When
        CollaboratorOutput output = exporter.process(
                new CollaboratorInput("exporter", record.artifacts(), record, "export", List.of()));

        // Then
        Map<String, Object> export = (Map<String, Object>) output.stateDelta().get("export");
        String markdown = (String) export.get("content");
        assertThat(export.get("sections")).isEqualTo(List.of("requirements", "architecture"));
        assertThat(markdown)
                .startsWith("# Project plan\n")
                .contains("Session: shop")
                .contains("Phase: architecture_complete")
                .contains("## Requirements")
                .contains("- **Functional**\n  - Track orders")
                .contains("```mermaid\n")
                .doesNotContain("## Mockups")
                .doesNotContain("## Export");
        assertThat(output.content()).isEqualTo("Exported 2 section(s) as Markdown.");
    }

    @Test
    @SuppressWarnings("unchecked")
    void process_onEmptyRecord_shouldSayNothingWasCaptured() {
        ProjectRecord record = ProjectRecord.initial("empty", NOW);

        CollaboratorOutput output = exporter.process(
                new CollaboratorInput("exporter", Map.of(), record, "export", List.of()));

        Map<String, Object> export = (Map<String, Object>) output.stateDelta().get("export");
        assertThat((String) export.get("content")).contains("Nothing has been captured yet.");
        assertThat(output.content()).isEqualTo("Exported 0 section(s) as Markdown.");
    }
}
