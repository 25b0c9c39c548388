package com.phodal.aitrace.model;

import java.util.Map;

/**
 * Changes applied to a running span. Null fields leave the span untouched;
 * attributes and metadata are merged key by key.
 */
public record UpdateSpanOptions(
    SpanAttributes attributes,
    Map<String, Object> metadata,
    Object input,
    Object output
) {

    public static UpdateSpanOptions attributes(SpanAttributes attributes) {
        return new UpdateSpanOptions(attributes, null, null, null);
    }

    public static UpdateSpanOptions input(Object input, SpanAttributes attributes) {
        return new UpdateSpanOptions(attributes, null, input, null);
    }
}
