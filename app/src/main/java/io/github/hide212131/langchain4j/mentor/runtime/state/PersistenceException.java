package io.github.hide212131.langchain4j.mentor.runtime.state;

/** The backing store could not read or write a project record. */
public final class PersistenceException extends RuntimeException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
