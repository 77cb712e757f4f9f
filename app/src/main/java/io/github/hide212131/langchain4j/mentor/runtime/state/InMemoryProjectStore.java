package io.github.hide212131.langchain4j.mentor.runtime.state;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Store kept in process memory; records are lost on exit. */
public final class InMemoryProjectStore implements ProjectStore {

    private final Map<String, ProjectRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<ProjectRecord> get(String sessionId) {
        return Optional.ofNullable(records.get(sessionId));
    }

    @Override
    public void save(ProjectRecord record) {
        Objects.requireNonNull(record, "record");
        records.put(record.sessionId(), record);
    }

    public int size() {
        return records.size();
    }
}
