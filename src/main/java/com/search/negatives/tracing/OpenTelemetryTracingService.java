package com.search.negatives.tracing;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;
import java.util.Objects;

/**
 * Emits batch and unit spans through the OpenTelemetry API.
 *
 * <p>Spans are {@link SpanKind#INTERNAL}. Unit spans are started on worker threads,
 * so they only nest under the batch span when the application propagates context;
 * both carry {@code batch.id} or {@code unit.id} for correlation either way.</p>
 */
public class OpenTelemetryTracingService implements TracingService {

    public static final String INSTRUMENTATION_SCOPE = "com.search.negatives";

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer is required");
    }

    /**
     * Uses the tracer of whatever SDK was registered globally. Without one, spans are dropped.
     */
    public static OpenTelemetryTracingService fromGlobal() {
        return new OpenTelemetryTracingService(GlobalOpenTelemetry.getTracer(INSTRUMENTATION_SCOPE));
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        SpanBuilder builder = tracer.spanBuilder(operationName);
        builder.setSpanKind(SpanKind.INTERNAL);
        if (attributes != null) {
            for (Map.Entry<String, String> attribute : attributes.entrySet()) {
                builder.setAttribute(attribute.getKey(), attribute.getValue());
            }
        }
        return new Adapter(builder.startSpan());
    }

    private static final class Adapter implements Span {

        private final io.opentelemetry.api.trace.Span delegate;

        Adapter(io.opentelemetry.api.trace.Span delegate) {
            this.delegate = delegate;
        }

        @Override
        public void setAttribute(String key, String value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, long value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, double value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setStatus(SpanStatus status) {
            delegate.setStatus(status == SpanStatus.OK ? StatusCode.OK : StatusCode.ERROR);
        }

        @Override
        public void recordException(Throwable t) {
            delegate.recordException(t);
        }

        @Override
        public void close() {
            delegate.end();
        }
    }
}
