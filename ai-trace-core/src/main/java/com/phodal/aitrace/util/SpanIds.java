package com.phodal.aitrace.util;

import java.util.UUID;

/**
 * Generates identifiers in the W3C trace-context shape:
 * 32 hex characters for traces, 16 for spans.
 */
public final class SpanIds {

    private SpanIds() {
        // Utility class
    }

    public static String newTraceId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    public static String newSpanId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }
}
