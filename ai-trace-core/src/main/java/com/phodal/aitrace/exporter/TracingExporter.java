package com.phodal.aitrace.exporter;

import com.phodal.aitrace.model.AiTracingEvent;

/**
 * Receives span lifecycle events after the processor chain has run.
 * Implementations must not throw from {@link #exportEvent}; tracing failures never reach
 * the instrumented code.
 */
public interface TracingExporter {

    /**
     * Export one lifecycle event.
     */
    void exportEvent(AiTracingEvent event);

    /**
     * Flush whatever is pending and release resources. Safe to call more than once.
     */
    void shutdown();

    /**
     * Get exporter name
     */
    String getName();

    /**
     * Check if exporter is enabled
     */
    default boolean isEnabled() {
        return true;
    }
}
