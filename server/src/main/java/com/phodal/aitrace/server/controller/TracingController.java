package com.phodal.aitrace.server.controller;

import com.phodal.aitrace.AiTracing;
import com.phodal.aitrace.exporter.BufferedExporter;
import com.phodal.aitrace.exporter.TracingExporter;
import com.phodal.aitrace.processor.SpanProcessor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Read-only view of the tracing pipeline, plus a manual flush.
 */
@Slf4j
@RestController
@RequestMapping("/ai-trace")
@RequiredArgsConstructor
public class TracingController {

    private final AiTracing aiTracing;

    @GetMapping("/exporters")
    public ResponseEntity<Map<String, Object>> getExporters() {
        List<Map<String, Object>> exporters = aiTracing.getExporters().stream()
                .map(this::describe)
                .toList();
        List<String> processors = aiTracing.getProcessors().stream()
                .map(SpanProcessor::getName)
                .toList();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("exporters", exporters);
        response.put("processors", processors);
        response.put("shutdown", aiTracing.isShutdown());
        return ResponseEntity.ok(response);
    }

    /**
     * Flush every buffered exporter and wait for the uploads.
     */
    @PostMapping("/exporters/flush")
    public ResponseEntity<Map<String, Object>> flush() {
        List<CompletableFuture<Void>> flushes = new ArrayList<>();
        Map<String, Object> flushed = new LinkedHashMap<>();
        for (TracingExporter exporter : aiTracing.getExporters()) {
            if (exporter instanceof BufferedExporter<?> buffered && buffered.isEnabled()) {
                flushed.put(buffered.getName(), buffered.getBufferSize());
                flushes.add(buffered.flush());
            }
        }
        CompletableFuture.allOf(flushes.toArray(CompletableFuture[]::new)).join();
        log.info("Manual flush of {} exporters", flushed.size());
        return ResponseEntity.ok(Map.of("flushed", flushed));
    }

    private Map<String, Object> describe(TracingExporter exporter) {
        Map<String, Object> description = new LinkedHashMap<>();
        description.put("name", exporter.getName());
        description.put("enabled", exporter.isEnabled());
        if (exporter instanceof BufferedExporter<?> buffered) {
            description.put("bufferSize", buffered.getBufferSize());
            description.put("flushScheduled", buffered.isFlushScheduled());
            description.put("maxBatchSize", buffered.getConfig().maxBatchSize());
        }
        return description;
    }
}
