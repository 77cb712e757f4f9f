package io.github.hide212131.langchain4j.mentor.runtime.capability;

/** Raised at start-up when the capability table is malformed. */
public final class CapabilityConfigurationException extends RuntimeException {

    public CapabilityConfigurationException(String message) {
        super(message);
    }

    public CapabilityConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
