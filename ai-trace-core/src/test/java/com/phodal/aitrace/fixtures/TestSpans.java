package com.phodal.aitrace.fixtures;

import com.phodal.aitrace.model.AiTracingEvent;
import com.phodal.aitrace.model.ExportedSpan;
import com.phodal.aitrace.model.SpanType;

import java.time.Instant;
import java.util.Map;

/**
 * Ready-made span snapshots.
 */
public final class TestSpans {
    public static final Instant START = Instant.parse("2025-01-01T00:00:00Z");

    private TestSpans() {
    }

    public static ExportedSpan span(String id) {
        return new ExportedSpan(id, "trace-1", null, "agent run " + id, SpanType.AGENT_RUN,
                START, START.plusSeconds(1), Map.of("agentId", "agent-1"), Map.of("serviceName", "test"),
                Map.of("prompt", "hello"), Map.of("text", "world"), null, false);
    }

    public static AiTracingEvent ended(String id) {
        return AiTracingEvent.ended(span(id));
    }

    public static AiTracingEvent started(String id) {
        return AiTracingEvent.started(span(id));
    }
}
