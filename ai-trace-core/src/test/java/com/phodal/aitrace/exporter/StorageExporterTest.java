package com.phodal.aitrace.exporter;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.phodal.aitrace.AiTracing;
import com.phodal.aitrace.TracingConfig;
import com.phodal.aitrace.fixtures.LinkedNode;
import com.phodal.aitrace.fixtures.MutableClock;
import com.phodal.aitrace.fixtures.TestSpans;
import com.phodal.aitrace.model.AiSpan;
import com.phodal.aitrace.model.EndSpanOptions;
import com.phodal.aitrace.model.GenerationAttributes;
import com.phodal.aitrace.model.SpanType;
import com.phodal.aitrace.model.StartSpanOptions;
import com.phodal.aitrace.storage.CreateSpanRecord;
import com.phodal.aitrace.storage.InMemoryTracingStorage;
import com.phodal.aitrace.storage.TracingStorage;
import com.phodal.aitrace.storage.UpdateSpanRecord;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StorageExporterTest {

    @Test
    void shouldCreateOnStartAndUpdateOnEnd() {
        MutableClock clock = new MutableClock();
        InMemoryTracingStorage storage = new InMemoryTracingStorage();
        AiTracing tracing = new AiTracing(TracingConfig.builder()
                .serviceName("storage-test")
                .exporter(new StorageExporter(storage))
                .clock(clock)
                .build());

        AiSpan root = tracing.startSpan(StartSpanOptions.builder(SpanType.AGENT_RUN, "agent run").input("hi").build());
        CreateSpanRecord created = storage.findSpan(root.getTraceId(), root.getId()).orElseThrow();
        assertNull(created.endedAt());
        assertNull(created.updatedAt());
        assertEquals("hi", created.input());
        assertEquals("storage-test", created.metadata().get("serviceName"));

        AiSpan generation = root.createChildSpan(StartSpanOptions.builder(SpanType.MODEL_GENERATION, "llm")
                .attributes(GenerationAttributes.of("gpt-4o", "openai"))
                .build());
        clock.advanceMillis(250);
        generation.end(EndSpanOptions.output("done"));
        root.end();

        CreateSpanRecord storedGeneration = storage.findSpan(root.getTraceId(), generation.getId()).orElseThrow();
        assertEquals(root.getId(), storedGeneration.parentSpanId());
        assertEquals("done", storedGeneration.output());
        assertEquals("gpt-4o", storedGeneration.attributes().get("model"));
        assertEquals(clock.instant(), storedGeneration.endedAt());
        assertNotNull(storedGeneration.updatedAt());
        assertEquals(2, storage.getTrace(root.getTraceId()).size());
    }

    @Test
    void shouldStoreCyclicOutputAsPlaceholderWithoutFailingTheCaller() {
        InMemoryTracingStorage storage = new InMemoryTracingStorage();
        AiTracing tracing = new AiTracing(TracingConfig.builder().exporter(new StorageExporter(storage)).build());

        AiSpan span = tracing.startSpan(StartSpanOptions.builder(SpanType.TOOL_CALL, "tool").build());
        assertDoesNotThrow(() -> span.end(EndSpanOptions.output(LinkedNode.cycle())));

        CreateSpanRecord stored = storage.findSpan(span.getTraceId(), span.getId()).orElseThrow();
        assertEquals("[LinkedNode]", stored.output());
        assertNotNull(stored.endedAt());
    }

    @Test
    void shouldCreateEventSpansWhenTheyEnd() {
        InMemoryTracingStorage storage = new InMemoryTracingStorage();
        AiTracing tracing = new AiTracing(TracingConfig.builder().exporter(new StorageExporter(storage)).build());

        AiSpan root = tracing.startSpan(StartSpanOptions.builder(SpanType.AGENT_RUN, "agent").build());
        AiSpan event = root.createEventSpan(StartSpanOptions.builder(SpanType.GENERIC, "checkpoint").output(Map.of("ok", true)).build());

        CreateSpanRecord stored = storage.findSpan(root.getTraceId(), event.getId()).orElseThrow();
        assertTrue(stored.isEvent());
        assertEquals(stored.startedAt(), stored.endedAt());
    }

    @Test
    void shouldLogInsteadOfThrowingWhenStorageFails() {
        StorageExporter exporter = new StorageExporter(new TracingStorage() {
            @Override
            public void createSpan(CreateSpanRecord record) throws IOException {
                throw new IOException("disk full");
            }

            @Override
            public void updateSpan(UpdateSpanRecord record) throws IOException {
                throw new IOException("disk full");
            }
        });

        assertDoesNotThrow(() -> exporter.exportEvent(TestSpans.started("a")));
        assertDoesNotThrow(() -> exporter.exportEvent(TestSpans.ended("a")));
    }

    @Test
    void shouldBeDisabledWithoutStorage() {
        Logger logger = (Logger) LoggerFactory.getLogger(StorageExporter.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            StorageExporter exporter = new StorageExporter(null);

            assertFalse(exporter.isEnabled());
            assertDoesNotThrow(() -> exporter.exportEvent(TestSpans.ended("a")));
            assertDoesNotThrow(() -> exporter.exportEvent(TestSpans.ended("b")));

            List<ILoggingEvent> warnings = appender.list.stream()
                    .filter(event -> event.getLevel() == Level.WARN)
                    .toList();
            assertEquals(1, warnings.size(), "Missing storage is reported once, when the exporter is built");
            assertTrue(warnings.get(0).getFormattedMessage().contains("No tracing storage configured"));
        } finally {
            logger.detachAppender(appender);
        }
    }

    @Test
    void shouldReplaceOnlyProvidedFieldsOnUpdate() {
        InMemoryTracingStorage storage = new InMemoryTracingStorage();
        StorageExporter exporter = new StorageExporter(storage);
        exporter.exportEvent(TestSpans.started("a"));

        exporter.exportEvent(TestSpans.ended("a"));

        List<CreateSpanRecord> spans = storage.getAllSpans();
        assertEquals(1, spans.size());
        assertEquals(Map.of("text", "world"), spans.get(0).output());
        assertEquals(TestSpans.START, spans.get(0).startedAt());
    }
}
