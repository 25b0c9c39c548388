package com.phodal.aitrace.server;

import com.phodal.aitrace.AiTracing;
import com.phodal.aitrace.exporter.StorageExporter;
import com.phodal.aitrace.exporter.TracingExporter;
import com.phodal.aitrace.processor.SensitiveDataFilter;
import com.phodal.aitrace.processor.SpanProcessor;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE, properties = {
        "ai-trace.cloud.enabled=false",
        "ai-trace.otel.enabled=false"
})
class AiTraceServerApplicationTests {

    @Autowired
    private AiTracing aiTracing;

    @Test
    void shouldWireDefaultPipeline() {
        assertEquals(List.of(StorageExporter.NAME),
                aiTracing.getExporters().stream().map(TracingExporter::getName).toList());
        assertEquals(List.of(SensitiveDataFilter.NAME),
                aiTracing.getProcessors().stream().map(SpanProcessor::getName).toList());
    }
}
