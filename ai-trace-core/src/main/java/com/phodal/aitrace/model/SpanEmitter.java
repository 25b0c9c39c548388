package com.phodal.aitrace.model;

import java.time.Instant;

/**
 * Receives span lifecycle transitions and supplies the clock and ids spans are created with.
 */
public interface SpanEmitter {

    Instant now();

    String newSpanId();

    String newTraceId();

    void emit(AiTracingEvent.Type type, AiSpan span);
}
