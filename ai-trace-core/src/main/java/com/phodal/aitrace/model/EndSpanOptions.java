package com.phodal.aitrace.model;

import java.util.Map;

/**
 * Final values applied when a span ends.
 */
public record EndSpanOptions(
    Object output,
    SpanAttributes attributes,
    Map<String, Object> metadata
) {

    public static final EndSpanOptions EMPTY = new EndSpanOptions(null, null, null);

    public static EndSpanOptions output(Object output) {
        return new EndSpanOptions(output, null, null);
    }
}
