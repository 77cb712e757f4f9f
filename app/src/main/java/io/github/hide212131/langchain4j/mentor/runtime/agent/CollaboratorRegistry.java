package io.github.hide212131.langchain4j.mentor.runtime.agent;

import io.github.hide212131.langchain4j.mentor.infra.logging.WorkflowLogger;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Creates collaborators on first use and reuses them afterwards.
 *
 * <p>Construction is memoized per id with {@link ConcurrentHashMap#computeIfAbsent}, so concurrent
 * callers never build the same collaborator twice. An id without a factory, or a factory that returns
 * {@code null}, is reported as absent and is asked again on the next lookup.
 */
public final class CollaboratorRegistry {

    private final WorkflowLogger logger = new WorkflowLogger(CollaboratorRegistry.class);
    private final Map<String, Supplier<? extends Collaborator>> factories;
    private final ConcurrentHashMap<String, Collaborator> instances = new ConcurrentHashMap<>();

    public CollaboratorRegistry(Map<String, ? extends Supplier<? extends Collaborator>> factories) {
        Objects.requireNonNull(factories, "factories");
        this.factories = Map.copyOf(new LinkedHashMap<String, Supplier<? extends Collaborator>>(factories));
    }

    /**
     * @throws CollaboratorException when the factory itself fails
     */
    public Optional<Collaborator> getAgent(String agentId) {
        Objects.requireNonNull(agentId, "agentId");
        Supplier<? extends Collaborator> factory = factories.get(agentId);
        if (factory == null) {
            return Optional.empty();
        }
        Collaborator collaborator = instances.computeIfAbsent(agentId, id -> create(id, factory));
        return Optional.ofNullable(collaborator);
    }

    public Set<String> registeredIds() {
        return factories.keySet();
    }

    boolean isInitialized(String agentId) {
        return instances.containsKey(agentId);
    }

    private Collaborator create(String agentId, Supplier<? extends Collaborator> factory) {
        try {
            Collaborator collaborator = factory.get();
            if (collaborator == null) {
                logger.debug("Collaborator {} is declared but not implemented", agentId);
            } else {
                logger.debug("Created collaborator {}", agentId);
            }
            return collaborator;
        } catch (RuntimeException e) {
            throw new CollaboratorException("Failed to create collaborator " + agentId, e);
        }
    }
}
