package com.phodal.aitrace.model;

/**
 * Notification of a span lifecycle transition.
 *
 * @param type the transition
 * @param exportedSpan immutable snapshot of the span taken at the transition
 */
public record AiTracingEvent(Type type, ExportedSpan exportedSpan) {

    public enum Type {
        SPAN_STARTED,
        SPAN_UPDATED,
        SPAN_ENDED
    }

    public static AiTracingEvent started(ExportedSpan span) {
        return new AiTracingEvent(Type.SPAN_STARTED, span);
    }

    public static AiTracingEvent updated(ExportedSpan span) {
        return new AiTracingEvent(Type.SPAN_UPDATED, span);
    }

    public static AiTracingEvent ended(ExportedSpan span) {
        return new AiTracingEvent(Type.SPAN_ENDED, span);
    }

    public AiTracingEvent withSpan(ExportedSpan span) {
        return new AiTracingEvent(type, span);
    }
}
