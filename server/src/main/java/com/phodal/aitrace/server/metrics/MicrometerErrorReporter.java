package com.phodal.aitrace.server.metrics;

import com.phodal.aitrace.exporter.ExportErrorReporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;

/**
 * Counts exported and dropped batches per exporter.
 */
@RequiredArgsConstructor
public class MicrometerErrorReporter implements ExportErrorReporter {

    public static final String BATCHES_DROPPED = "ai_trace.batches.dropped";
    public static final String SPANS_DROPPED = "ai_trace.spans.dropped";
    public static final String BATCHES_EXPORTED = "ai_trace.batches.exported";

    private final MeterRegistry meterRegistry;

    @Override
    public void onBatchDropped(String exporterName, int batchSize, Throwable error) {
        Counter.builder(BATCHES_DROPPED)
                .description("Batches dropped after all upload attempts failed")
                .tag("exporter", exporterName)
                .tag("error", error != null ? error.getClass().getSimpleName() : "unknown")
                .register(meterRegistry)
                .increment();
        Counter.builder(SPANS_DROPPED)
                .description("Spans lost with dropped batches")
                .tag("exporter", exporterName)
                .register(meterRegistry)
                .increment(batchSize);
    }

    @Override
    public void onBatchExported(String exporterName, int batchSize) {
        Counter.builder(BATCHES_EXPORTED)
                .description("Batches uploaded successfully")
                .tag("exporter", exporterName)
                .register(meterRegistry)
                .increment();
    }
}
