package io.github.hide212131.langchain4j.mentor.runtime.state;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

import io.github.hide212131.langchain4j.mentor.runtime.capability.Phase;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

class StateManagerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

    private final InMemoryProjectStore store = new InMemoryProjectStore();
    private final StateManager stateManager = new StateManager(store, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void load_unknownSession_shouldReturnDefaultWithoutPersisting() {
        ProjectRecord record = stateManager.load("new-session");

        assertThat(record.phase()).isEqualTo(Phase.INITIALIZATION);
        assertThat(record.artifacts()).isEmpty();
        assertThat(record.conversationHistory()).isEmpty();
        assertThat(record.agentSelectionMode()).isEqualTo(SelectionMode.AUTO);
        assertThat(record.createdAt()).isEqualTo(NOW);
        assertThat(store.size()).isZero();
    }

    @Test
    void update_shouldOverwriteArtifactsAndAppendHistory() {
        // Given
        stateManager.update("s-1", StateDelta.builder()
                .artifact("requirements", Map.of("functional", List.of("first")))
                .append(ConversationEntry.user("hello", NOW))
                .build());

        // When
        ProjectRecord record = stateManager.update("s-1", StateDelta.builder()
                .artifact("requirements", Map.of("functional", List.of("second")))
                .append(ConversationEntry.assistant("hi", NOW))
                .build());

        // Then
        assertThat(record.artifact("requirements")).contains(Map.of("functional", List.of("second")));
        assertThat(record.conversationHistory())
                .extracting(ConversationEntry::role)
                .containsExactly(ConversationEntry.USER, ConversationEntry.ASSISTANT);
        assertThat(store.get("s-1")).contains(record);
    }

    @Test
    void update_shouldApplyScalarFields() {
        ProjectRecord record = stateManager.update("s-1", StateDelta.builder()
                .phase(Phase.REQUIREMENTS_COMPLETE)
                .agentSelectionMode(SelectionMode.MANUAL)
                .selectedAgentId("project_architect")
                .build());

        assertThat(record.phase()).isEqualTo(Phase.REQUIREMENTS_COMPLETE);
        assertThat(record.agentSelectionMode()).isEqualTo(SelectionMode.MANUAL);
        assertThat(record.selectedAgentId()).isEqualTo("project_architect");

        ProjectRecord cleared = stateManager.update("s-1", StateDelta.builder().selectedAgentId(null).build());

        assertThat(cleared.selectedAgentId()).isNull();
        assertThat(cleared.agentSelectionMode()).isEqualTo(SelectionMode.MANUAL);
    }

    @Test
    void update_whenStoreFails_shouldKeepCachedRecord() {
        // Given: A store that starts failing after the first write
        AtomicBoolean failing = new AtomicBoolean(false);
        ProjectStore flaky = new ProjectStore() {
            @Override
            public Optional<ProjectRecord> get(String sessionId) {
                return store.get(sessionId);
            }

            @Override
            public void save(ProjectRecord record) {
                if (failing.get()) {
                    throw new IllegalStateException("disk full");
                }
                store.save(record);
            }
        };
        StateManager manager = new StateManager(flaky);
        manager.update("s-1", StateDelta.ofArtifacts(Map.of("requirements", "kept")));
        failing.set(true);

        // When / Then
        assertThatThrownBy(() -> manager.update("s-1", StateDelta.ofArtifacts(Map.of("requirements", "lost"))))
                .isInstanceOf(PersistenceException.class)
                .hasMessageContaining("s-1");
        assertThat(manager.load("s-1").artifact("requirements")).contains("kept");
    }

    @Test
    void update_artifactNamedLikeHistoryField_shouldStillBeOverwritten() {
        stateManager.update("s-1", StateDelta.ofArtifacts(Map.of("conversation_history", List.of("first"))));

        ProjectRecord record = stateManager.update(
                "s-1", StateDelta.ofArtifacts(Map.of("conversation_history", List.of("second"))));

        assertThat(record.artifact("conversation_history")).contains(List.of("second"));
        assertThat(record.conversationHistory()).isEmpty();
    }

    @Test
    void update_slowWriteForOneSession_shouldNotHoldUpAnotherSession() throws Exception {
        // Given: Two ids with the same hash code, and a store that parks every write for "Aa"
        assertThat("Aa".hashCode()).isEqualTo("BB".hashCode());
        CountDownLatch writing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ProjectStore slow = new ProjectStore() {
            @Override
            public Optional<ProjectRecord> get(String sessionId) {
                return store.get(sessionId);
            }

            @Override
            public void save(ProjectRecord record) {
                if ("Aa".equals(record.sessionId())) {
                    writing.countDown();
                    try {
                        release.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                store.save(record);
            }
        };
        StateManager manager = new StateManager(slow);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<ProjectRecord> parked = executor.submit(
                    () -> manager.update("Aa", StateDelta.ofArtifacts(Map.of("requirements", "a"))));
            assertThat(writing.await(5, TimeUnit.SECONDS)).isTrue();

            // When
            ProjectRecord other = assertTimeoutPreemptively(Duration.ofSeconds(2),
                    () -> manager.update("BB", StateDelta.ofArtifacts(Map.of("requirements", "b"))));

            // Then
            assertThat(other.artifact("requirements")).contains("b");
            assertThat(parked.isDone()).isFalse();
            release.countDown();
            assertThat(parked.get(5, TimeUnit.SECONDS).artifact("requirements")).contains("a");
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    void evict_shouldReloadFromStore() {
        stateManager.update("s-1", StateDelta.ofArtifacts(Map.of("roadmap", "v1")));
        store.save(new ProjectRecord("s-1", Phase.PLANNING_COMPLETE, Map.of("roadmap", "v2"), List.of(), null, null, NOW, NOW));

        assertThat(stateManager.load("s-1").artifact("roadmap")).contains("v1");
        stateManager.evict("s-1");
        assertThat(stateManager.load("s-1").artifact("roadmap")).contains("v2");
    }

    @Test
    void record_shouldNotExposeMutableArtifacts() {
        ProjectRecord record = stateManager.update(
                "s-1", StateDelta.ofArtifacts(Map.of("mockups", List.of(Map.of("screen", "Home")))));

        assertThatThrownBy(() -> ((List<Object>) record.artifact("mockups").orElseThrow()).add("x"))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
