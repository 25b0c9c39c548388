package com.phodal.aitrace.server.controller;

import com.phodal.aitrace.AiTracing;
import com.phodal.aitrace.TracingConfig;
import com.phodal.aitrace.exporter.BatchConfig;
import com.phodal.aitrace.exporter.BatchStorageExporter;
import com.phodal.aitrace.model.AiSpan;
import com.phodal.aitrace.model.SpanType;
import com.phodal.aitrace.model.StartSpanOptions;
import com.phodal.aitrace.processor.SensitiveDataFilter;
import com.phodal.aitrace.storage.InMemoryTracingStorage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TracingControllerTest {

    private InMemoryTracingStorage storage;
    private AiTracing aiTracing;
    private TracingController controller;

    @BeforeEach
    void setUp() {
        storage = new InMemoryTracingStorage();
        BatchStorageExporter exporter = new BatchStorageExporter(storage, BatchConfig.of(50, 60_000, 1));
        aiTracing = new AiTracing(TracingConfig.builder()
                .processor(new SensitiveDataFilter())
                .exporter(exporter)
                .build());
        controller = new TracingController(aiTracing);
    }

    @AfterEach
    void tearDown() {
        aiTracing.shutdown();
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldDescribeExportersAndProcessors() {
        AiSpan span = aiTracing.startSpan(StartSpanOptions.builder(SpanType.AGENT_RUN, "agent").build());
        span.end();

        var response = controller.getExporters();

        assertEquals(HttpStatus.OK, response.getStatusCode());
        Map<String, Object> body = response.getBody();
        assertNotNull(body);
        assertEquals(List.of(SensitiveDataFilter.NAME), body.get("processors"));
        assertEquals(false, body.get("shutdown"));

        List<Map<String, Object>> exporters = (List<Map<String, Object>>) body.get("exporters");
        assertEquals(1, exporters.size());
        Map<String, Object> exporter = exporters.get(0);
        assertEquals(BatchStorageExporter.NAME, exporter.get("name"));
        assertEquals(true, exporter.get("enabled"));
        assertEquals(1, exporter.get("bufferSize"));
        assertEquals(true, exporter.get("flushScheduled"));
        assertEquals(50, exporter.get("maxBatchSize"));
    }

    @Test
    void shouldFlushBufferedExportersAndWait() {
        AiSpan root = aiTracing.startSpan(StartSpanOptions.builder(SpanType.AGENT_RUN, "agent").build());
        root.createChildSpan(StartSpanOptions.builder(SpanType.TOOL_CALL, "tool: search").build()).end();
        root.end();

        var response = controller.flush();

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(Map.of(BatchStorageExporter.NAME, 2), response.getBody().get("flushed"));
        assertEquals(2, storage.size());
    }
}
