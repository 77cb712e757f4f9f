package io.github.hide212131.langchain4j.mentor.infra.observability;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Creates spans for orchestration turns and the collaborator tasks executed inside them.
 */
public final class WorkflowTracer {

    private final Tracer tracer;
    private final boolean enabled;

    public WorkflowTracer(Tracer tracer, boolean enabled) {
        this.tracer = tracer;
        this.enabled = enabled;
    }

    public static WorkflowTracer disabled() {
        return new WorkflowTracer(io.opentelemetry.api.OpenTelemetry.noop().getTracer("noop"), false);
    }

    /**
     * Executes an operation inside a span that is made current for its duration.
     */
    public <T> T trace(String operationName, Map<String, Object> attributes, Supplier<T> operation) {
        return traceWithSpan(operationName, attributes, span -> operation.get());
    }

    /**
     * Executes an operation inside a span and hands the span to the operation so it can record
     * attributes that are only known once the work is done.
     */
    public <T> T traceWithSpan(String operationName, Map<String, Object> attributes, Function<Span, T> operation) {
        if (!enabled) {
            return operation.apply(Span.getInvalid());
        }

        Span span = startSpan(operationName, attributes);
        try (Scope scope = span.makeCurrent()) {
            T result = operation.apply(span);
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
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

    /**
     * Creates a new span and returns it for manual management.
     */
    public Span startSpan(String operationName, Map<String, Object> attributes) {
        if (!enabled) {
            return Span.getInvalid();
        }

        Span span = tracer.spanBuilder(operationName)
                .setSpanKind(SpanKind.INTERNAL)
                .startSpan();
        applyAttributes(span, attributes);
        return span;
    }

    /**
     * Adds an event to the current span.
     */
    public void addEvent(String eventName, Map<String, String> attributes) {
        if (!enabled) {
            return;
        }

        Span currentSpan = Span.current();
        if (!currentSpan.isRecording()) {
            return;
        }
        if (attributes == null || attributes.isEmpty()) {
            currentSpan.addEvent(eventName);
            return;
        }
        AttributesBuilder builder = Attributes.builder();
        attributes.forEach(builder::put);
        currentSpan.addEvent(eventName, builder.build());
    }

    public boolean isEnabled() {
        return enabled;
    }

    static void applyAttributes(Span span, Map<String, Object> attributes) {
        if (attributes == null) {
            return;
        }
        attributes.forEach((key, value) -> {
            if (value instanceof String str) {
                span.setAttribute(key, str);
            } else if (value instanceof Long l) {
                span.setAttribute(key, l);
            } else if (value instanceof Integer i) {
                span.setAttribute(key, i.longValue());
            } else if (value instanceof Double d) {
                span.setAttribute(key, d);
            } else if (value instanceof Boolean b) {
                span.setAttribute(key, b);
            } else if (value != null) {
                span.setAttribute(key, value.toString());
            }
        });
    }
}
