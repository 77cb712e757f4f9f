package io.github.hide212131.langchain4j.mentor.runtime.state;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.hide212131.langchain4j.mentor.infra.logging.WorkflowLogger;
import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

/**
 * Stores each session as one JSON document under a directory. Writes go to a temporary file that is
 * then moved over the target, so readers never observe a partially written record.
 */
public final class JsonFileProjectStore implements ProjectStore {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final WorkflowLogger logger = new WorkflowLogger(JsonFileProjectStore.class);
    private final Path directory;

    public JsonFileProjectStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    @Override
    public Optional<ProjectRecord> get(String sessionId) {
        Path file = fileFor(sessionId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(MAPPER.readValue(file.toFile(), ProjectRecord.class));
        } catch (IOException e) {
            throw new PersistenceException("Failed to read session " + sessionId + " from " + file, e);
        }
    }

    @Override
    public void save(ProjectRecord record) {
        Objects.requireNonNull(record, "record");
        Path target = fileFor(record.sessionId());
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, ".session-", ".tmp");
            MAPPER.writeValue(temp.toFile(), record);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            logger.debug("Saved session {} to {}", record.sessionId(), target);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new PersistenceException("Failed to write session " + record.sessionId() + " to " + target, e);
        }
    }

    public Path directory() {
        return directory;
    }

    Path fileFor(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId");
        return directory.resolve(URLEncoder.encode(sessionId, StandardCharsets.UTF_8) + ".json");
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            logger.warn("Could not remove temporary file {}: {}", temp, e.getMessage());
        }
    }
}
