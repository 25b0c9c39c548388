package com.phodal.aitrace.exporter;

import com.phodal.aitrace.model.AiTracingEvent;
import com.phodal.aitrace.model.ExportedSpan;
import com.phodal.aitrace.storage.TracingStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Writes every span event straight through to a {@link TracingStorage}.
 *
 * <p>Started spans are created, updates and ends are applied as updates. Event spans only
 * ever produce an end event, so they are created at that point.</p>
 */
public class StorageExporter implements TracingExporter {
    private static final Logger log = LoggerFactory.getLogger(StorageExporter.class);
    public static final String NAME = "storage-exporter";

    private final TracingStorage storage;
    private final SpanRecordMapper mapper;

    public StorageExporter(TracingStorage storage) {
        this(storage, new SpanRecordMapper());
    }

    public StorageExporter(TracingStorage storage, SpanRecordMapper mapper) {
        this.storage = storage;
        this.mapper = mapper;
        if (storage == null) {
            log.warn("No tracing storage configured, {} will not persist spans", NAME);
        }
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean isEnabled() {
        return storage != null;
    }

    @Override
    public void exportEvent(AiTracingEvent event) {
        if (storage == null) {
            return;
        }
        ExportedSpan span = event.exportedSpan();
        try {
            switch (event.type()) {
                case SPAN_STARTED -> {
                    if (!span.isEvent()) {
                        storage.createSpan(mapper.toCreateRecord(span));
                    }
                }
                case SPAN_UPDATED -> storage.updateSpan(mapper.toUpdateRecord(span));
                case SPAN_ENDED -> {
                    if (span.isEvent()) {
                        storage.createSpan(mapper.toCreateRecord(span));
                    } else {
                        storage.updateSpan(mapper.toUpdateRecord(span));
                    }
                }
            }
        } catch (IOException | RuntimeException e) {
            log.error("Failed to store {} for span {} (trace {}): {}",
                    event.type(), span.id(), span.traceId(), e.getMessage(), e);
        }
    }

    @Override
    public void shutdown() {
        log.info("{} shutdown complete", NAME);
    }
}
