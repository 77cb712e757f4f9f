package io.github.hide212131.langchain4j.mentor.infra.logging;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin wrapper around SLF4J shared by the orchestration components so that log output is
 * grouped under the component that emitted it.
 */
public final class WorkflowLogger {

    private final Logger logger;

    public WorkflowLogger() {
        this(WorkflowLogger.class);
    }

    public WorkflowLogger(Class<?> owner) {
        this.logger = LoggerFactory.getLogger(Objects.requireNonNull(owner, "owner"));
    }

    public WorkflowLogger forComponent(Class<?> owner) {
        return new WorkflowLogger(owner);
    }

    public void info(String message, Object... args) {
        logger.info(message, args);
    }

    public void debug(String message, Object... args) {
        logger.debug(message, args);
    }

    public void warn(String message, Object... args) {
        logger.warn(message, args);
    }

    public void error(String message, Object... args) {
        logger.error(message, args);
    }

    public boolean isDebugEnabled() {
        return logger.isDebugEnabled();
    }
}
