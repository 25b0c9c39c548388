package com.phodal.aitrace.server.exporter;

import com.phodal.aitrace.AiTracing;
import com.phodal.aitrace.TracingConfig;
import com.phodal.aitrace.model.AiSpan;
import com.phodal.aitrace.model.EndSpanOptions;
import com.phodal.aitrace.model.ErrorSpanOptions;
import com.phodal.aitrace.model.GenerationAttributes;
import com.phodal.aitrace.model.SpanType;
import com.phodal.aitrace.model.StartSpanOptions;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class OtelBridgeExporterTest {

    private static final Instant NOW = Instant.parse("2025-01-01T12:00:00Z");

    private InMemorySpanExporter spanExporter;
    private SdkTracerProvider tracerProvider;
    private OtelBridgeExporter bridge;
    private AiTracing tracing;

    @BeforeEach
    void setUp() {
        spanExporter = InMemorySpanExporter.create();
        tracerProvider = SdkTracerProvider.builder()
                .addSpanProcessor(SimpleSpanProcessor.create(spanExporter))
                .build();
        bridge = new OtelBridgeExporter(tracerProvider);
        tracing = new AiTracing(TracingConfig.builder()
                .exporter(bridge)
                .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                .build());
    }

    @AfterEach
    void tearDown() {
        tracerProvider.close();
    }

    @Test
    void shouldMirrorSpanTreeWithParentLinks() {
        AiSpan root = tracing.startSpan(StartSpanOptions.builder(SpanType.AGENT_RUN, "agent run").input("hi").build());
        AiSpan generation = root.createChildSpan(StartSpanOptions.builder(SpanType.MODEL_GENERATION, "llm: gpt-4o")
                .attributes(GenerationAttributes.of("gpt-4o", "openai"))
                .build());
        generation.end(EndSpanOptions.output(Map.of("text", "hello")));
        root.end();

        List<SpanData> spans = spanExporter.getFinishedSpanItems();
        assertEquals(2, spans.size());
        SpanData otelGeneration = spans.get(0);
        SpanData otelRoot = spans.get(1);

        assertEquals("llm: gpt-4o", otelGeneration.getName());
        assertEquals(SpanKind.CLIENT, otelGeneration.getKind());
        assertEquals(otelRoot.getSpanId(), otelGeneration.getParentSpanId());
        assertEquals(otelRoot.getTraceId(), otelGeneration.getTraceId());
        assertEquals("model_generation", otelGeneration.getAttributes().get(OtelBridgeExporter.SPAN_TYPE));
        assertEquals("gpt-4o", otelGeneration.getAttributes().get(AttributeKey.stringKey("ai.attributes.model")));
        assertEquals("{\"text\":\"hello\"}", otelGeneration.getAttributes().get(OtelBridgeExporter.OUTPUT));
        assertEquals(StatusCode.OK, otelGeneration.getStatus().getStatusCode());

        assertEquals(TimeUnit.SECONDS.toNanos(NOW.getEpochSecond()), otelRoot.getStartEpochNanos());
        assertEquals(root.getId(), otelRoot.getAttributes().get(OtelBridgeExporter.SPAN_ID));
        assertEquals("\"hi\"", otelRoot.getAttributes().get(OtelBridgeExporter.INPUT));
        assertEquals(0, bridge.getOpenSpanCount());
    }

    @Test
    void shouldRecordErrorsAsErrorStatus() {
        AiSpan root = tracing.startSpan(StartSpanOptions.builder(SpanType.TOOL_CALL, "tool: search").build());

        root.error(ErrorSpanOptions.of(new IllegalStateException("quota exceeded")));

        SpanData span = spanExporter.getFinishedSpanItems().get(0);
        assertEquals(StatusCode.ERROR, span.getStatus().getStatusCode());
        assertEquals("quota exceeded", span.getStatus().getDescription());
        assertEquals("quota exceeded", span.getAttributes().get(AttributeKey.stringKey("ai.error.message")));
    }

    @Test
    void shouldExportEventSpansWithZeroDuration() {
        AiSpan root = tracing.startSpan(StartSpanOptions.builder(SpanType.AGENT_RUN, "agent").build());
        root.createEventSpan(StartSpanOptions.builder(SpanType.MODEL_CHUNK, "chunk: 'file'").build());

        SpanData event = spanExporter.getFinishedSpanItems().get(0);
        assertEquals(event.getStartEpochNanos(), event.getEndEpochNanos());
        assertEquals(true, event.getAttributes().get(AttributeKey.booleanKey("ai.span.is_event")));
        assertEquals(1, bridge.getOpenSpanCount(), "Root span is still open");
    }
}
