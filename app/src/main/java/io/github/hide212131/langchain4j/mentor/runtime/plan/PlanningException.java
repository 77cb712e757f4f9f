package io.github.hide212131.langchain4j.mentor.runtime.plan;

/** No valid plan exists for the request; nothing was executed. */
public final class PlanningException extends RuntimeException {

    public PlanningException(String message) {
        super(message);
    }

    public PlanningException(String message, Throwable cause) {
        super(message, cause);
    }
}
