package com.phodal.aitrace.storage;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.phodal.aitrace.model.SpanType;

import java.time.Instant;
import java.util.Map;

/**
 * Storage projection of a span, written when the span is first seen.
 */
public record CreateSpanRecord(
    String traceId,
    String spanId,
    String parentSpanId,
    String name,
    SpanType spanType,
    Map<String, Object> attributes,
    Map<String, Object> metadata,
    Instant startedAt,
    Instant endedAt,
    Object input,
    Object output,
    Object error,
    @JsonProperty("isEvent") boolean isEvent,
    Instant createdAt,
    Instant updatedAt
) {

    public String spanKey() {
        return traceId + ":" + spanId;
    }

    /**
     * Apply an update, returning the merged record.
     */
    public CreateSpanRecord apply(SpanUpdates updates) {
        return new CreateSpanRecord(
                traceId,
                spanId,
                parentSpanId,
                updates.name() != null ? updates.name() : name,
                spanType,
                updates.attributes() != null ? updates.attributes() : attributes,
                updates.metadata() != null ? updates.metadata() : metadata,
                startedAt,
                updates.endedAt() != null ? updates.endedAt() : endedAt,
                updates.input() != null ? updates.input() : input,
                updates.output() != null ? updates.output() : output,
                updates.error() != null ? updates.error() : error,
                isEvent,
                createdAt,
                updates.updatedAt()
        );
    }
}
