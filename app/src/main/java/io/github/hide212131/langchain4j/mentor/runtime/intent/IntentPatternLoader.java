package io.github.hide212131.langchain4j.mentor.runtime.intent;

import io.github.hide212131.langchain4j.mentor.infra.config.YamlDocuments;
import io.github.hide212131.langchain4j.mentor.runtime.capability.CapabilityConfigurationException;
import io.github.hide212131.langchain4j.mentor.runtime.capability.CapabilityGraph;
import io.github.hide212131.langchain4j.mentor.runtime.capability.Phase;
import io.github.hide212131.langchain4j.mentor.runtime.capability.PhaseCompatibility;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads intent patterns from YAML, keeping declaration order. Every routed agent id must be
 * declared in the capability graph.
 */
public final class IntentPatternLoader {

    private final CapabilityGraph graph;

    public IntentPatternLoader(CapabilityGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
    }

    public List<IntentPattern> load(String location) {
        Map<String, Object> document;
        try {
            document = YamlDocuments.load(location);
        } catch (IllegalStateException e) {
            throw new CapabilityConfigurationException("Cannot read intent patterns " + location, e);
        }
        if (!(document.get("intents") instanceof List<?> items)) {
            throw new CapabilityConfigurationException("Intent patterns " + location + " have no 'intents' list");
        }
        List<IntentPattern> patterns = new ArrayList<>();
        for (Object item : items) {
            if (!(item instanceof Map<?, ?> raw)) {
                throw new CapabilityConfigurationException("Intent entries must be mappings: " + item);
            }
            patterns.add(parse(raw));
        }
        return List.copyOf(patterns);
    }

    private IntentPattern parse(Map<?, ?> raw) {
        Object name = raw.get("name");
        if (name == null || name.toString().isBlank()) {
            throw new CapabilityConfigurationException("Intent entry without name: " + raw);
        }
        List<String> agents = strings(raw.get("agents"));
        for (String agent : agents) {
            if (!graph.contains(agent)) {
                throw new CapabilityConfigurationException(
                        "Intent " + name + " routes to undeclared agent " + agent);
            }
        }
        return new IntentPattern(
                name.toString(),
                strings(raw.get("keywords")),
                strings(raw.get("triggers")),
                phases(name.toString(), strings(raw.get("phases"))),
                agents);
    }

    private static PhaseCompatibility phases(String intent, List<String> names) {
        EnumSet<Phase> phases = EnumSet.noneOf(Phase.class);
        for (String value : names) {
            if ("any".equalsIgnoreCase(value) || "*".equals(value)) {
                return PhaseCompatibility.any();
            }
            try {
                phases.add(Phase.fromWireName(value));
            } catch (IllegalArgumentException e) {
                throw new CapabilityConfigurationException("Intent " + intent + ": " + e.getMessage(), e);
            }
        }
        return PhaseCompatibility.of(phases);
    }

    private static List<String> strings(Object value) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new CapabilityConfigurationException("Expected a list but was " + value);
        }
        List<String> result = new ArrayList<>();
        list.forEach(item -> result.add(item.toString().trim()));
        return result;
    }
}
