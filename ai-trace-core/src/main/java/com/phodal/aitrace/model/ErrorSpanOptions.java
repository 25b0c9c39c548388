package com.phodal.aitrace.model;

import java.util.Map;

/**
 * Describes a failure recorded on a span.
 *
 * @param error the error to record
 * @param attributes extra attributes merged before the span ends
 * @param metadata extra metadata merged before the span ends
 * @param endSpan whether recording the error also ends the span
 */
public record ErrorSpanOptions(
    SpanErrorInfo error,
    SpanAttributes attributes,
    Map<String, Object> metadata,
    boolean endSpan
) {

    public static ErrorSpanOptions of(Throwable error) {
        return new ErrorSpanOptions(SpanErrorInfo.from(error), null, null, true);
    }

    public static ErrorSpanOptions of(SpanErrorInfo error, boolean endSpan) {
        return new ErrorSpanOptions(error, null, null, endSpan);
    }
}
