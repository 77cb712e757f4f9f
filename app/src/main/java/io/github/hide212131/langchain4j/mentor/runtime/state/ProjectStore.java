package io.github.hide212131.langchain4j.mentor.runtime.state;

import java.util.Optional;

/** Durable storage for project records, keyed by session id. */
public interface ProjectStore {

    Optional<ProjectRecord> get(String sessionId);

    /**
     * Persists the record, replacing any previous version.
     *
     * @throws PersistenceException when the write fails
     */
    void save(ProjectRecord record);
}
