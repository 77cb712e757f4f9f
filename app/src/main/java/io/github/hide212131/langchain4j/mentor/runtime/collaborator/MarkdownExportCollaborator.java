package io.github.hide212131.langchain4j.mentor.runtime.collaborator;

import io.github.hide212131.langchain4j.mentor.runtime.agent.Collaborator;
import io.github.hide212131.langchain4j.mentor.runtime.agent.CollaboratorInput;
import io.github.hide212131.langchain4j.mentor.runtime.agent.CollaboratorOutput;
import io.github.hide212131.langchain4j.mentor.runtime.state.ArtifactValues;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Renders every artifact in the record into one Markdown document. Mermaid sources are emitted as
 * fenced {@code mermaid} blocks, multi-line text as plain code blocks.
 */
public final class MarkdownExportCollaborator implements Collaborator {

    static final String ARTIFACT = "export";
    private static final Set<String> MERMAID_PREFIXES =
            Set.of("flowchart", "graph", "erdiagram", "gantt", "sequencediagram", "classdiagram", "statediagram");

    @Override
    public CollaboratorOutput process(CollaboratorInput input) {
        Map<String, Object> artifacts = input.fullRecord()
                .<Map<String, Object>>map(record -> record.artifacts())
                .orElse(input.context());
        StringBuilder markdown = new StringBuilder("# Project plan\n");
        input.fullRecord().ifPresent(record -> markdown
                .append("\nSession: ").append(record.sessionId())
                .append("  \nPhase: ").append(record.phase().wireName()).append('\n'));

        List<String> sections = new ArrayList<>();
        for (Map.Entry<String, Object> artifact : artifacts.entrySet()) {
            if (ARTIFACT.equals(artifact.getKey()) || !ArtifactValues.isPresent(artifact.getValue())) {
                continue;
            }
            sections.add(artifact.getKey());
            markdown.append("\n## ").append(title(artifact.getKey())).append("\n\n");
            render(markdown, artifact.getValue(), 0);
        }
        if (sections.isEmpty()) {
            markdown.append("\nNothing has been captured yet.\n");
        }

        Map<String, Object> export = new LinkedHashMap<>();
        export.put("format", "markdown");
        export.put("sections", sections);
        export.put("content", markdown.toString());
        return CollaboratorOutput.success(
                Map.of(ARTIFACT, export),
                "Exported " + sections.size() + " section(s) as Markdown.");
    }

    private void render(StringBuilder out, Object value, int depth) {
        String indent = "  ".repeat(depth);
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!ArtifactValues.isPresent(entry.getValue())) {
                    continue;
                }
                out.append(indent).append("- **").append(title(String.valueOf(entry.getKey()))).append("**");
                renderChild(out, entry.getValue(), depth);
            }
        } else if (value instanceof List<?> list) {
            for (Object item : list) {
                out.append(indent).append("-");
                renderChild(out, item, depth);
            }
        } else {
            renderScalar(out, String.valueOf(value), indent);
        }
    }

    private void renderChild(StringBuilder out, Object value, int depth) {
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            out.append('\n');
            render(out, value, depth + 1);
        } else if (String.valueOf(value).contains("\n")) {
            out.append('\n');
            renderScalar(out, String.valueOf(value), "  ".repeat(depth + 1));
        } else {
            out.append(out.charAt(out.length() - 1) == '-' ? " " : ": ").append(value).append('\n');
        }
    }

    private static void renderScalar(StringBuilder out, String text, String indent) {
        if (!text.contains("\n")) {
            out.append(indent).append(text).append('\n');
            return;
        }
        String firstWord = text.strip().split("\\s+", 2)[0].toLowerCase(Locale.ROOT);
        String language = MERMAID_PREFIXES.contains(firstWord) ? "mermaid" : "";
        out.append(indent).append("```").append(language).append('\n');
        for (String line : text.split("\n", -1)) {
            out.append(indent).append(line).append('\n');
        }
        out.append(indent).append("```\n");
    }

    private static String title(String key) {
        String spaced = key.replace('_', ' ').trim();
        if (spaced.isEmpty()) {
            return key;
        }
        return Character.toUpperCase(spaced.charAt(0)) + spaced.substring(1);
    }
}
