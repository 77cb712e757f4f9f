package io.github.hide212131.langchain4j.mentor.runtime.state;

import io.github.hide212131.langchain4j.mentor.infra.logging.WorkflowLogger;
import io.github.hide212131.langchain4j.mentor.runtime.capability.Phase;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sole writer of {@link ProjectRecord}s.
 *
 * <p>Reads are served from a per-process cache backed by the {@link ProjectStore}. Updates for one
 * session are applied atomically and written through to the store before the cache changes; when the
 * write fails the cached record stays as it was and a {@link PersistenceException} is raised.
 * Store I/O runs under the session's own lock, so a slow write never holds up another session.
 * Concurrent updates from different processes are last-write-wins.
 */
public final class StateManager {

    private final WorkflowLogger logger = new WorkflowLogger(StateManager.class);
    private final ConcurrentHashMap<String, ProjectRecord> cache = new ConcurrentHashMap<>();
    private final SessionLocks locks = new SessionLocks();
    private final ProjectStore store;
    private final Clock clock;

    public StateManager(ProjectStore store) {
        this(store, Clock.systemUTC());
    }

    public StateManager(ProjectStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Returns the current record, creating a default one on first access. A default record is cached
     * but only persisted by the first {@link #update}.
     */
    public ProjectRecord load(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId");
        ProjectRecord cached = cache.get(sessionId);
        if (cached != null) {
            return cached;
        }
        return locks.withLock(sessionId, () -> {
            ProjectRecord current = cache.get(sessionId);
            if (current != null) {
                return current;
            }
            ProjectRecord loaded = readOrCreate(sessionId);
            cache.put(sessionId, loaded);
            return loaded;
        });
    }

    public ProjectRecord update(String sessionId, StateDelta delta) {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(delta, "delta");
        return locks.withLock(sessionId, () -> {
            ProjectRecord current = cache.get(sessionId);
            ProjectRecord base = current != null ? current : readOrCreate(sessionId);
            ProjectRecord next = apply(base, delta);
            write(next);
            cache.put(sessionId, next);
            logger.debug("Session {} updated: {}", sessionId, delta.keys());
            return next;
        });
    }

    /** Same as {@link #load}; the returned record is immutable so callers may keep it. */
    public ProjectRecord snapshot(String sessionId) {
        return load(sessionId);
    }

    /** Drops the cached record so the next read goes back to the store. */
    public void evict(String sessionId) {
        cache.remove(sessionId);
    }

    private ProjectRecord readOrCreate(String sessionId) {
        try {
            return store.get(sessionId).orElseGet(() -> ProjectRecord.initial(sessionId, clock.instant()));
        } catch (PersistenceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PersistenceException("Failed to read session " + sessionId, e);
        }
    }

    private void write(ProjectRecord record) {
        try {
            store.save(record);
        } catch (PersistenceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PersistenceException("Failed to persist session " + record.sessionId(), e);
        }
    }

    private ProjectRecord apply(ProjectRecord base, StateDelta delta) {
        Map<String, Object> artifacts = new LinkedHashMap<>(base.artifacts());
        delta.artifacts().forEach((name, value) ->
                artifacts.put(name, StateDelta.artifactStrategy().merge(artifacts.get(name), value)));

        Phase phase = delta.phase() != null
                ? (Phase) StateDelta.strategyFor(StateDelta.PHASE).merge(base.phase(), delta.phase())
                : base.phase();
        SelectionMode mode = delta.agentSelectionMode() != null
                ? (SelectionMode) StateDelta.strategyFor(StateDelta.AGENT_SELECTION_MODE)
                        .merge(base.agentSelectionMode(), delta.agentSelectionMode())
                : base.agentSelectionMode();
        String selected = delta.selectedAgentIdChanged()
                ? (String) StateDelta.strategyFor(StateDelta.SELECTED_AGENT_ID)
                        .merge(base.selectedAgentId(), delta.selectedAgentId())
                : base.selectedAgentId();

        List<ConversationEntry> history = base.conversationHistory();
        if (!delta.conversationEntries().isEmpty()) {
            history = new ArrayList<>();
            for (Object entry : (List<?>) StateDelta.strategyFor(StateDelta.CONVERSATION_HISTORY)
                    .merge(base.conversationHistory(), delta.conversationEntries())) {
                history.add((ConversationEntry) entry);
            }
        }

        return new ProjectRecord(
                base.sessionId(),
                phase,
                artifacts,
                history,
                mode,
                selected,
                base.createdAt(),
                clock.instant());
    }
}
