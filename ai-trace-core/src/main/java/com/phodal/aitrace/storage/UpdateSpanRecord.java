package com.phodal.aitrace.storage;

/**
 * Update of an already stored span.
 */
public record UpdateSpanRecord(String traceId, String spanId, SpanUpdates updates) {

    public String spanKey() {
        return traceId + ":" + spanId;
    }
}
