package com.phodal.aitrace.server.exporter;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.phodal.aitrace.model.SpanType;
import com.phodal.aitrace.storage.CreateSpanRecord;

import java.time.Instant;
import java.util.Map;

/**
 * Span as uploaded to the cloud collector: the storage projection plus the owning team and project.
 */
public record CloudSpanRecord(
    String teamId,
    String projectId,
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

    public static CloudSpanRecord from(CreateSpanRecord record, String teamId, String projectId) {
        return new CloudSpanRecord(
                teamId,
                projectId,
                record.traceId(),
                record.spanId(),
                record.parentSpanId(),
                record.name(),
                record.spanType(),
                record.attributes(),
                record.metadata(),
                record.startedAt(),
                record.endedAt(),
                record.input(),
                record.output(),
                record.error(),
                record.isEvent(),
                record.createdAt(),
                null
        );
    }
}
