package com.phodal.aitrace.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps spans in memory, keyed by trace and span id. Updates for unknown spans are ignored.
 */
public class InMemoryTracingStorage implements TracingStorage {
    private static final Logger log = LoggerFactory.getLogger(InMemoryTracingStorage.class);

    private final Map<String, CreateSpanRecord> spans = new LinkedHashMap<>();

    @Override
    public synchronized void createSpan(CreateSpanRecord record) {
        spans.put(record.spanKey(), record);
    }

    @Override
    public synchronized void updateSpan(UpdateSpanRecord record) {
        CreateSpanRecord existing = spans.get(record.spanKey());
        if (existing == null) {
            log.warn("Ignoring update for unknown span {}", record.spanKey());
            return;
        }
        spans.put(record.spanKey(), existing.apply(record.updates()));
    }

    public synchronized Optional<CreateSpanRecord> findSpan(String traceId, String spanId) {
        return Optional.ofNullable(spans.get(traceId + ":" + spanId));
    }

    public synchronized List<CreateSpanRecord> getTrace(String traceId) {
        return spans.values().stream()
                .filter(span -> span.traceId().equals(traceId))
                .toList();
    }

    public synchronized List<CreateSpanRecord> getAllSpans() {
        return new ArrayList<>(spans.values());
    }

    public synchronized int size() {
        return spans.size();
    }

    public synchronized void clear() {
        spans.clear();
    }
}
