package io.github.hide212131.langchain4j.mentor.runtime.capability;

import io.github.hide212131.langchain4j.mentor.infra.config.YamlDocuments;
import io.github.hide212131.langchain4j.mentor.infra.logging.WorkflowLogger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds a {@link CapabilityGraph} from a YAML table with an {@code agents} list.
 *
 * <pre>
 * agents:
 *   - id: project_architect
 *     requires: [requirements]   # or "all"
 *     produces: [architecture]
 *     phases: [requirements_complete]   # "any" accepts every phase
 *     transition: architecture_complete
 * </pre>
 */
public final class CapabilityGraphLoader {

    private static final String ALL = "all";
    private static final String ANY = "any";
    private static final Set<String> ALLOWED_KEYS =
            Set.of("id", "name", "description", "requires", "produces", "phases", "transition");

    private final WorkflowLogger logger = new WorkflowLogger(CapabilityGraphLoader.class);

    public CapabilityGraph load(String location) {
        Objects.requireNonNull(location, "location");
        Map<String, Object> document;
        try {
            document = YamlDocuments.load(location);
        } catch (IllegalStateException e) {
            throw new CapabilityConfigurationException("Cannot read capability table " + location, e);
        }
        Object agents = document.get("agents");
        if (!(agents instanceof List<?> list)) {
            throw new CapabilityConfigurationException("Capability table " + location + " has no 'agents' list");
        }
        List<CapabilityEntry> entries = new ArrayList<>();
        for (Object item : list) {
            if (!(item instanceof Map<?, ?> raw)) {
                throw new CapabilityConfigurationException("Capability entries must be mappings: " + item);
            }
            entries.add(parseEntry(raw));
        }
        CapabilityGraph graph = new CapabilityGraph(entries);
        logger.debug("Loaded {} capabilities from {}", graph.size(), location);
        return graph;
    }

    private CapabilityEntry parseEntry(Map<?, ?> raw) {
        Object id = raw.get("id");
        if (id == null || id.toString().isBlank()) {
            throw new CapabilityConfigurationException("Capability entry without id: " + raw);
        }
        for (Object key : raw.keySet()) {
            if (!ALLOWED_KEYS.contains(String.valueOf(key))) {
                logger.warn("Ignoring unknown key '{}' on capability {}", key, id);
            }
        }
        try {
            return new CapabilityEntry(
                    id.toString(),
                    stringOrNull(raw.get("name")),
                    stringOrNull(raw.get("description")),
                    parseRequirement(raw.get("requires")),
                    new LinkedHashSet<>(stringList(raw.get("produces"))),
                    parsePhases(raw.get("phases")),
                    parseTransition(raw.get("transition")));
        } catch (IllegalArgumentException e) {
            throw new CapabilityConfigurationException("Invalid capability " + id + ": " + e.getMessage(), e);
        }
    }

    private static Requirement parseRequirement(Object value) {
        if (value instanceof String text && ALL.equalsIgnoreCase(text.trim())) {
            return Requirement.all();
        }
        return Requirement.of(stringList(value));
    }

    private static PhaseCompatibility parsePhases(Object value) {
        List<String> names = value instanceof String text ? List.of(text) : stringList(value);
        Collection<Phase> phases = EnumSet.noneOf(Phase.class);
        for (String name : names) {
            if (ANY.equalsIgnoreCase(name.trim())) {
                return PhaseCompatibility.any();
            }
            phases.add(Phase.fromWireName(name));
        }
        return PhaseCompatibility.of(phases);
    }

    private static Phase parseTransition(Object value) {
        if (value == null || value.toString().isBlank()) {
            return null;
        }
        return Phase.fromWireName(value.toString());
    }

    private static List<String> stringList(Object value) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new IllegalArgumentException("expected a list but was " + value);
        }
        List<String> result = new ArrayList<>();
        for (Object item : list) {
            result.add(item.toString().trim());
        }
        return result;
    }

    private static String stringOrNull(Object value) {
        return value == null ? null : value.toString();
    }
}
