package io.github.hide212131.langchain4j.mentor.runtime.intent;

/** Classification could not produce a usable result. Never escapes a turn. */
public final class IntentClassificationException extends RuntimeException {

    public IntentClassificationException(String message) {
        super(message);
    }

    public IntentClassificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
