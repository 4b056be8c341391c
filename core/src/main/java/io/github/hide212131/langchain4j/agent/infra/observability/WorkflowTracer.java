package io.github.hide212131.langchain4j.agent.infra.observability;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Creates spans around agent runs, turns, tool calls and summarizations. A disabled tracer runs the operation
 * without creating any span.
 */
public final class WorkflowTracer {

    private static final WorkflowTracer DISABLED = new WorkflowTracer(null, false);

    private final Tracer tracer;
    private final boolean enabled;

    public WorkflowTracer(Tracer tracer, boolean enabled) {
        if (enabled) {
            Objects.requireNonNull(tracer, "tracer");
        }
        this.tracer = tracer;
        this.enabled = enabled;
    }

    public static WorkflowTracer disabled() {
        return DISABLED;
    }

    public static WorkflowTracer from(ObservabilityConfig config) {
        return new WorkflowTracer(config.tracer(), config.isEnabled());
    }

    /**
     * Runs {@code operation} inside a span named {@code operationName}. Exceptions mark the span as failed and are
     * rethrown unchanged.
     */
    public <T> T trace(String operationName, Map<String, Object> attributes, Supplier<T> operation) {
        if (!enabled) {
            return operation.get();
        }
        Span span = startSpan(operationName, attributes);
        try (Scope scope = span.makeCurrent()) {
            T result = operation.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    public void trace(String operationName, Map<String, Object> attributes, Runnable operation) {
        trace(operationName, attributes, () -> {
            operation.run();
            return null;
        });
    }

    /** Adds an event to the current span, if one is recording. */
    public void addEvent(String eventName, Map<String, Object> attributes) {
        if (!enabled) {
            return;
        }
        Span currentSpan = Span.current();
        if (!currentSpan.isRecording()) {
            return;
        }
        if (attributes == null || attributes.isEmpty()) {
            currentSpan.addEvent(eventName);
        } else {
            currentSpan.addEvent(eventName, toAttributes(attributes));
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    private Span startSpan(String operationName, Map<String, Object> attributes) {
        SpanBuilder builder = tracer.spanBuilder(operationName).setSpanKind(SpanKind.INTERNAL);
        if (attributes != null && !attributes.isEmpty()) {
            builder.setAllAttributes(toAttributes(attributes));
        }
        return builder.startSpan();
    }

    private static Attributes toAttributes(Map<String, Object> attributes) {
        AttributesBuilder builder = Attributes.builder();
        attributes.forEach((key, value) -> {
            if (value instanceof String str) {
                builder.put(key, str);
            } else if (value instanceof Long l) {
                builder.put(key, l);
            } else if (value instanceof Integer i) {
                builder.put(key, i.longValue());
            } else if (value instanceof Double d) {
                builder.put(key, d);
            } else if (value instanceof Boolean b) {
                builder.put(key, b);
            } else if (value != null) {
                builder.put(key, value.toString());
            }
        });
        return builder.build();
    }
}
