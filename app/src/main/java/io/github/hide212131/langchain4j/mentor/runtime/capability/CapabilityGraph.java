package io.github.hide212131.langchain4j.mentor.runtime.capability;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only view of every declared collaborator and the artifact edges between them.
 *
 * <p>Declaration order is preserved everywhere and acts as the global tie-break. The producer and
 * consumer indexes are built once; collaborators that require {@link Requirement.All} are never
 * listed as consumers.
 */
public final class CapabilityGraph {

    private final Map<String, CapabilityEntry> entries;
    private final Map<String, Integer> declarationIndex;
    private final Map<String, List<CapabilityEntry>> producers;
    private final Map<String, List<CapabilityEntry>> consumers;

    public CapabilityGraph(List<CapabilityEntry> declared) {
        Objects.requireNonNull(declared, "declared");
        Map<String, CapabilityEntry> byId = new LinkedHashMap<>();
        Map<String, Integer> index = new LinkedHashMap<>();
        Map<String, List<CapabilityEntry>> producerIndex = new LinkedHashMap<>();
        Map<String, List<CapabilityEntry>> consumerIndex = new LinkedHashMap<>();
        for (CapabilityEntry entry : declared) {
            if (byId.putIfAbsent(entry.id(), entry) != null) {
                throw new CapabilityConfigurationException("Duplicate capability id: " + entry.id());
            }
            index.put(entry.id(), index.size());
            for (String artifact : entry.produces()) {
                producerIndex.computeIfAbsent(artifact, key -> new ArrayList<>()).add(entry);
            }
            if (!entry.requiresAll()) {
                for (String artifact : entry.requires().artifacts()) {
                    consumerIndex.computeIfAbsent(artifact, key -> new ArrayList<>()).add(entry);
                }
            }
        }
        this.entries = Collections.unmodifiableMap(byId);
        this.declarationIndex = Collections.unmodifiableMap(index);
        this.producers = freeze(producerIndex);
        this.consumers = freeze(consumerIndex);
    }

    public Optional<CapabilityEntry> get(String id) {
        return Optional.ofNullable(entries.get(id));
    }

    public boolean contains(String id) {
        return entries.containsKey(id);
    }

    /** All entries in declaration order. */
    public List<CapabilityEntry> entries() {
        return List.copyOf(entries.values());
    }

    public List<CapabilityEntry> producersOf(String artifact) {
        return producers.getOrDefault(artifact, List.of());
    }

    public List<CapabilityEntry> consumersOf(String artifact) {
        return consumers.getOrDefault(artifact, List.of());
    }

    public int declarationIndex(String id) {
        Integer position = declarationIndex.get(id);
        if (position == null) {
            throw new IllegalArgumentException("Unknown capability: " + id);
        }
        return position;
    }

    public int size() {
        return entries.size();
    }

    private static Map<String, List<CapabilityEntry>> freeze(Map<String, List<CapabilityEntry>> source) {
        Map<String, List<CapabilityEntry>> frozen = new LinkedHashMap<>();
        source.forEach((key, value) -> frozen.put(key, List.copyOf(value)));
        return Collections.unmodifiableMap(frozen);
    }
}
