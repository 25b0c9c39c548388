package com.phodal.aitrace.processor;

import com.phodal.aitrace.model.ExportedSpan;

/**
 * Transforms a span snapshot before it leaves the process.
 */
public interface SpanProcessor {

    String getName();

    /**
     * Return a processed copy of the span, or {@code null} to drop the event.
     */
    ExportedSpan process(ExportedSpan span);

    default void shutdown() {
    }
}
