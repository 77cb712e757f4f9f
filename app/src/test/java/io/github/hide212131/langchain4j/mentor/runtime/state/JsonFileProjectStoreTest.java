package io.github.hide212131.langchain4j.mentor.runtime.state;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.hide212131.langchain4j.mentor.runtime.capability.Phase;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonFileProjectStoreTest {

    private static final Instant CREATED = Instant.parse("2026-02-01T10:00:00Z");

    @TempDir
    Path tempDir;

    @Test
    void saveThenGet_shouldRestoreRecord() {
        // Given
        JsonFileProjectStore store = new JsonFileProjectStore(tempDir.resolve("sessions"));
        ProjectRecord record = new ProjectRecord(
                "team/alpha",
                Phase.ARCHITECTURE_COMPLETE,
                Map.of("requirements", Map.of("functional", List.of("Login"))),
                List.of(ConversationEntry.user("we need login", CREATED)),
                SelectionMode.MANUAL,
                "project_architect",
                CREATED,
                CREATED.plusSeconds(60));

        // When
        store.save(record);

        // Then
        assertThat(store.get("team/alpha")).contains(record);
        assertThat(store.fileFor("team/alpha").getFileName().toString()).isEqualTo("team%2Falpha.json");
    }

    @Test
    void save_shouldNotLeaveTemporaryFiles() throws IOException {
        JsonFileProjectStore store = new JsonFileProjectStore(tempDir);

        store.save(ProjectRecord.initial("s-1", CREATED));
        store.save(ProjectRecord.initial("s-1", CREATED.plusSeconds(1)));

        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files.map(path -> path.getFileName().toString())).containsExactly("s-1.json");
        }
    }

    @Test
    void get_missingSession_shouldBeEmpty() {
        assertThat(new JsonFileProjectStore(tempDir).get("nobody")).isEmpty();
    }

    @Test
    void get_corruptFile_shouldRaisePersistenceException() throws IOException {
        JsonFileProjectStore store = new JsonFileProjectStore(tempDir);
        Files.writeString(store.fileFor("broken"), "{not json");

        assertThatThrownBy(() -> store.get("broken"))
                .isInstanceOf(PersistenceException.class)
                .hasMessageContaining("broken");
    }
}
