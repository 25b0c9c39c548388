package com.phodal.aitrace.exporter;

import com.phodal.aitrace.model.AiTracingEvent;
import com.phodal.aitrace.serialization.BoundedSerializer;
import com.phodal.aitrace.storage.CreateSpanRecord;
import com.phodal.aitrace.storage.TracingStorage;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Insert-only storage exporter: buffers finished spans and creates them in bulk.
 *
 * <p>For stores that cannot update rows in place. Spans are written once, complete,
 * when they end.</p>
 */
public class BatchStorageExporter extends BufferedExporter<CreateSpanRecord> {
    public static final String NAME = "batch-storage-exporter";

    private final TracingStorage storage;
    private final SpanRecordMapper mapper;

    public BatchStorageExporter(TracingStorage storage, BatchConfig config) {
        super(NAME, config);
        this.storage = storage;
        this.mapper = new SpanRecordMapper();
    }

    public BatchStorageExporter(TracingStorage storage, BatchConfig config, BatchScheduler scheduler,
                                Clock clock, ExportErrorReporter errorReporter) {
        super(NAME, config, scheduler, clock, errorReporter);
        this.storage = storage;
        this.mapper = new SpanRecordMapper(new BoundedSerializer(), clock);
    }

    @Override
    public boolean isEnabled() {
        return storage != null;
    }

    @Override
    protected boolean accepts(AiTracingEvent.Type type) {
        return type == AiTracingEvent.Type.SPAN_ENDED;
    }

    @Override
    protected CreateSpanRecord toRecord(AiTracingEvent event) {
        return mapper.toCreateRecord(event.exportedSpan());
    }

    @Override
    protected CompletableFuture<Void> uploadBatch(List<CreateSpanRecord> batch) {
        return Retries.withRetry(() -> storage.batchCreateSpans(batch), config.maxRetries(),
                config.retryDelayMs(), scheduler, getName() + " batch of " + batch.size() + " spans");
    }
}
