package com.phodal.aitrace.server.exporter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phodal.aitrace.exporter.TracingExporter;
import com.phodal.aitrace.model.AiTracingEvent;
import com.phodal.aitrace.model.ExportedSpan;
import com.phodal.aitrace.model.SpanType;
import com.phodal.aitrace.serialization.BoundedSerializer;
import com.phodal.aitrace.util.ObjectMappers;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Mirrors AI spans into OpenTelemetry so they show up next to the rest of a service's traces.
 *
 * <p>Each AI span becomes one OpenTelemetry span with the original start and end times.
 * Parent links are kept while the parent is still open. Span attributes are flattened under
 * {@code ai.attributes.*}, metadata under {@code ai.metadata.*}; input and output are stored
 * as bounded JSON.</p>
 */
@Slf4j
public class OtelBridgeExporter implements TracingExporter {

    public static final String NAME = "otel-bridge-exporter";
    public static final String INSTRUMENTATION_NAME = "com.phodal.aitrace";

    static final AttributeKey<String> SPAN_TYPE = AttributeKey.stringKey("ai.span.type");
    static final AttributeKey<String> SPAN_ID = AttributeKey.stringKey("ai.span.id");
    static final AttributeKey<String> TRACE_ID = AttributeKey.stringKey("ai.trace.id");
    static final AttributeKey<String> PARENT_SPAN_ID = AttributeKey.stringKey("ai.parent_span.id");
    static final AttributeKey<Boolean> IS_EVENT = AttributeKey.booleanKey("ai.span.is_event");
    static final AttributeKey<String> INPUT = AttributeKey.stringKey("ai.input");
    static final AttributeKey<String> OUTPUT = AttributeKey.stringKey("ai.output");

    private final SdkTracerProvider tracerProvider;
    private final Tracer tracer;
    private final BoundedSerializer serializer;
    private final ObjectMapper objectMapper = ObjectMappers.create();
    private final Map<String, Span> openSpans = new ConcurrentHashMap<>();

    public OtelBridgeExporter(SdkTracerProvider tracerProvider) {
        this(tracerProvider, new BoundedSerializer());
    }

    public OtelBridgeExporter(SdkTracerProvider tracerProvider, BoundedSerializer serializer) {
        this.tracerProvider = tracerProvider;
        this.tracer = tracerProvider.get(INSTRUMENTATION_NAME);
        this.serializer = serializer;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void exportEvent(AiTracingEvent event) {
        ExportedSpan span = event.exportedSpan();
        switch (event.type()) {
            case SPAN_STARTED -> openSpans.put(span.id(), startOtelSpan(span));
            case SPAN_UPDATED -> {
                Span otelSpan = openSpans.get(span.id());
                if (otelSpan != null) {
                    otelSpan.setAllAttributes(attributesOf(span));
                } else {
                    log.debug("Update for span {} that was never started, ignoring", span.id());
                }
            }
            case SPAN_ENDED -> {
                Span otelSpan = openSpans.remove(span.id());
                if (otelSpan == null) {
                    otelSpan = startOtelSpan(span);
                }
                otelSpan.setAllAttributes(attributesOf(span));
                if (span.errorInfo() != null) {
                    Object message = span.errorInfo().get("message");
                    otelSpan.setStatus(StatusCode.ERROR, message != null ? message.toString() : "error");
                } else {
                    otelSpan.setStatus(StatusCode.OK);
                }
                Instant end = span.endTime() != null ? span.endTime() : span.startTime();
                otelSpan.end(end);
            }
        }
    }

    private Span startOtelSpan(ExportedSpan span) {
        SpanBuilder builder = tracer.spanBuilder(span.name())
                .setSpanKind(span.type() == SpanType.MODEL_GENERATION ? SpanKind.CLIENT : SpanKind.INTERNAL)
                .setStartTimestamp(span.startTime())
                .setAllAttributes(attributesOf(span));
        Span parent = span.parentSpanId() != null ? openSpans.get(span.parentSpanId()) : null;
        if (parent != null) {
            builder.setParent(Context.root().with(parent));
        } else {
            builder.setNoParent();
        }
        return builder.startSpan();
    }

    Attributes attributesOf(ExportedSpan span) {
        AttributesBuilder attributes = Attributes.builder()
                .put(SPAN_TYPE, span.type().getValue())
                .put(SPAN_ID, span.id())
                .put(TRACE_ID, span.traceId())
                .put(IS_EVENT, span.isEvent());
        if (span.parentSpanId() != null) {
            attributes.put(PARENT_SPAN_ID, span.parentSpanId());
        }
        flatten(attributes, "ai.attributes.", span.attributes());
        flatten(attributes, "ai.metadata.", span.metadata());
        flatten(attributes, "ai.error.", span.errorInfo());
        if (span.input() != null) {
            attributes.put(INPUT, serializer.toJson(span.input()));
        }
        if (span.output() != null) {
            attributes.put(OUTPUT, serializer.toJson(span.output()));
        }
        return attributes.build();
    }

    private void flatten(AttributesBuilder attributes, String prefix, Map<String, Object> values) {
        if (values == null) {
            return;
        }
        values.forEach((key, value) -> {
            String name = prefix + key;
            if (value == null) {
                return;
            }
            if (value instanceof String text) {
                attributes.put(name, text);
            } else if (value instanceof Boolean bool) {
                attributes.put(name, bool);
            } else if (value instanceof Integer || value instanceof Long || value instanceof Short) {
                attributes.put(name, ((Number) value).longValue());
            } else if (value instanceof Number number) {
                attributes.put(name, number.doubleValue());
            } else {
                attributes.put(name, toJson(value));
            }
        });
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(serializer.bound(value));
        } catch (JsonProcessingException e) {
            return BoundedSerializer.SERIALIZATION_ERROR;
        }
    }

    public int getOpenSpanCount() {
        return openSpans.size();
    }

    @Override
    public void shutdown() {
        if (!openSpans.isEmpty()) {
            log.warn("{} shutting down with {} spans still open, they are not exported", NAME, openSpans.size());
            openSpans.clear();
        }
        tracerProvider.forceFlush().join(10, TimeUnit.SECONDS);
        log.info("{} shutdown complete", NAME);
    }
}
