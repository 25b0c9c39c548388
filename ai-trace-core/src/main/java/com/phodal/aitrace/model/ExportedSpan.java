package com.phodal.aitrace.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable snapshot of a span as seen by processors and exporters.
 * Processors produce modified copies; exporters only read.
 */
public record ExportedSpan(
    String id,
    String traceId,
    String parentSpanId,
    String name,
    SpanType type,
    Instant startTime,
    Instant endTime,
    Map<String, Object> attributes,
    Map<String, Object> metadata,
    Object input,
    Object output,
    Map<String, Object> errorInfo,
    boolean isEvent
) {

    public ExportedSpan {
        attributes = freeze(attributes);
        metadata = freeze(metadata);
        errorInfo = freeze(errorInfo);
    }

    public boolean isRootSpan() {
        return parentSpanId == null;
    }

    /**
     * Copy this snapshot with new payload fields, keeping identity and timing.
     */
    public ExportedSpan withPayload(Map<String, Object> attributes, Map<String, Object> metadata,
                                    Object input, Object output, Map<String, Object> errorInfo) {
        return new ExportedSpan(id, traceId, parentSpanId, name, type, startTime, endTime,
                attributes, metadata, input, output, errorInfo, isEvent);
    }

    private static Map<String, Object> freeze(Map<String, Object> map) {
        if (map == null) {
            return null;
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}
