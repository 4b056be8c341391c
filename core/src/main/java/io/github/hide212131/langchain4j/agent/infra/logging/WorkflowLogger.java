package io.github.hide212131.langchain4j.agent.infra.logging;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin wrapper around SLF4J used for infrastructure messages that are not part of the run-level structured log.
 */
public final class WorkflowLogger {

    private final Logger logger;

    public WorkflowLogger(Class<?> owner) {
        this.logger = LoggerFactory.getLogger(Objects.requireNonNull(owner, "owner"));
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
}
