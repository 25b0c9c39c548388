package com.phodal.aitrace.model;

import java.time.Instant;
import java.util.Map;

/**
 * Attributes of a {@link SpanType#WORKFLOW_SLEEP} span.
 */
public record SleepAttributes(
    Long durationMs,
    Instant untilDate
) implements SpanAttributes {

    @Override
    public SpanType spanType() {
        return SpanType.WORKFLOW_SLEEP;
    }

    @Override
    public Map<String, Object> toMap() {
        return Attributes.create()
                .put("durationMs", durationMs)
                .put("untilDate", untilDate)
                .toMap();
    }
}
