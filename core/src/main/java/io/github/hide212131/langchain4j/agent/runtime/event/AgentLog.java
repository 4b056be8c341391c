package io.github.hide212131.langchain4j.agent.runtime.event;

import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Structured single-line log records for agent runs, written through {@code java.util.logging}.
 *
 * <p>Format: {@code [phase=..][level=..][agent=..][run=..][step=..] message input=.. output=..}</p>
 */
public final class AgentLog {

    private static final int FORMAT_BUFFER_SIZE = 192;
    private static final int MAX_VALUE_LENGTH = 500;

    private final Logger logger;

    public AgentLog(Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public static AgentLog forAgents() {
        return new AgentLog(Logger.getLogger("io.github.hide212131.langchain4j.agent.run"));
    }

    public void info(AgentEventMetadata metadata, String phase, String step, String message, String input,
            String output) {
        if (!logger.isLoggable(Level.INFO)) {
            return;
        }
        logger.log(Level.INFO, format(Level.INFO, metadata, phase, step, message, input, output, null));
    }

    public void fine(AgentEventMetadata metadata, String phase, String step, String message, String input,
            String output) {
        if (!logger.isLoggable(Level.FINE)) {
            return;
        }
        logger.log(Level.FINE, format(Level.FINE, metadata, phase, step, message, input, output, null));
    }

    public void warn(AgentEventMetadata metadata, String phase, String step, String message, Throwable error) {
        if (!logger.isLoggable(Level.WARNING)) {
            return;
        }
        logger.log(Level.WARNING, format(Level.WARNING, metadata, phase, step, message, null, null, error), error);
    }

    public void error(AgentEventMetadata metadata, String phase, String step, String message, Throwable error) {
        if (!logger.isLoggable(Level.SEVERE)) {
            return;
        }
        logger.log(Level.SEVERE, format(Level.SEVERE, metadata, phase, step, message, null, null, error), error);
    }

    String format(Level level, AgentEventMetadata metadata, String phase, String step, String message,
            String input, String output, Throwable error) {
        String agent = metadata == null ? null : indent(metadata.depth()) + metadata.agentName();
        String runId = metadata == null ? null : metadata.runId();
        String header = String.format(Locale.ROOT, "[phase=%s][level=%s][agent=%s][run=%s][step=%s] %s",
                valueOrDash(phase), level.getName(), valueOrDash(agent), valueOrDash(runId), valueOrDash(step),
                message == null ? "" : message);
        StringBuilder sb = new StringBuilder(FORMAT_BUFFER_SIZE);
        sb.append(header);
        if (input != null && !input.isBlank()) {
            sb.append(" input=").append(abbreviate(input.trim()));
        }
        if (output != null && !output.isBlank()) {
            sb.append(" output=").append(abbreviate(output.trim()));
        }
        if (error != null) {
            sb.append(" error=").append(error.getClass().getSimpleName()).append(": ").append(error.getMessage());
        }
        return sb.toString();
    }

    private static String indent(int depth) {
        return depth <= 0 ? "" : ">".repeat(depth) + " ";
    }

    private static String abbreviate(String value) {
        if (value.length() <= MAX_VALUE_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_VALUE_LENGTH) + "...";
    }

    private static String valueOrDash(String value) {
        if (value == null || value.isBlank()) {
            return "-";
        }
        return value.trim();
    }
}
