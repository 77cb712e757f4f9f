package io.github.hide212131.langchain4j.mentor.runtime.agent;

/** A collaborator could not be created or could not complete its task. */
public class CollaboratorException extends RuntimeException {

    public CollaboratorException(String message) {
        super(message);
    }

    public CollaboratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
