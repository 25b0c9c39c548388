package com.phodal.aitrace.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A live span owned by the code that created it.
 *
 * <p>Lifecycle: created, zero or more updates, ended. The start time is set once in the
 * constructor and the end time once by {@link #end}; later updates and ends are ignored.
 * Event spans are created already ended and emit a single {@code SPAN_ENDED}.</p>
 */
public class AiSpan {

    private final SpanEmitter emitter;
    private final String id;
    private final String traceId;
    private final String parentId;
    private final SpanType type;
    private final String name;
    private final Instant startTime;
    private final boolean event;

    private Instant endTime;
    private Object input;
    private Object output;
    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private SpanErrorInfo errorInfo;

    AiSpan(SpanEmitter emitter, String traceId, String parentId, StartSpanOptions options, boolean event) {
        this.emitter = emitter;
        this.id = emitter.newSpanId();
        this.traceId = traceId;
        this.parentId = parentId;
        this.type = options.type();
        this.name = options.name();
        this.startTime = emitter.now();
        this.event = event;
        this.input = options.input();
        this.output = options.output();
        mergeAttributes(options.attributes());
        if (options.metadata() != null) {
            this.metadata.putAll(options.metadata());
        }
        if (event) {
            this.endTime = startTime;
        }
    }

    /**
     * Create and start a root span of a new trace.
     */
    public static AiSpan startRoot(SpanEmitter emitter, StartSpanOptions options) {
        AiSpan span = new AiSpan(emitter, emitter.newTraceId(), null, options, false);
        emitter.emit(AiTracingEvent.Type.SPAN_STARTED, span);
        return span;
    }

    public AiSpan createChildSpan(StartSpanOptions options) {
        AiSpan child = new AiSpan(emitter, traceId, id, options, false);
        emitter.emit(AiTracingEvent.Type.SPAN_STARTED, child);
        return child;
    }

    /**
     * Create a zero-duration child span. It is ended on creation and only ever emits
     * {@code SPAN_ENDED}.
     */
    public AiSpan createEventSpan(StartSpanOptions options) {
        AiSpan child = new AiSpan(emitter, traceId, id, options, true);
        emitter.emit(AiTracingEvent.Type.SPAN_ENDED, child);
        return child;
    }

    public void update(UpdateSpanOptions options) {
        synchronized (this) {
            if (endTime != null) {
                return;
            }
            applyUpdate(options.attributes(), options.metadata());
            if (options.input() != null) {
                this.input = options.input();
            }
            if (options.output() != null) {
                this.output = options.output();
            }
        }
        emitter.emit(AiTracingEvent.Type.SPAN_UPDATED, this);
    }

    public void end() {
        end(EndSpanOptions.EMPTY);
    }

    public void end(EndSpanOptions options) {
        synchronized (this) {
            if (endTime != null) {
                return;
            }
            this.endTime = emitter.now();
            applyUpdate(options.attributes(), options.metadata());
            if (options.output() != null) {
                this.output = options.output();
            }
        }
        emitter.emit(AiTracingEvent.Type.SPAN_ENDED, this);
    }

    /**
     * Record an error. Ends the span unless {@link ErrorSpanOptions#endSpan()} is false,
     * in which case an update is emitted instead.
     */
    public void error(ErrorSpanOptions options) {
        synchronized (this) {
            if (endTime != null) {
                return;
            }
            this.errorInfo = options.error();
            applyUpdate(options.attributes(), options.metadata());
        }
        if (options.endSpan()) {
            end();
        } else {
            emitter.emit(AiTracingEvent.Type.SPAN_UPDATED, this);
        }
    }

    /**
     * Take an immutable snapshot of the current state.
     */
    public synchronized ExportedSpan exportSpan() {
        return new ExportedSpan(
                id,
                traceId,
                parentId,
                name,
                type,
                startTime,
                endTime,
                attributes.isEmpty() ? null : attributes,
                metadata.isEmpty() ? null : metadata,
                input,
                output,
                errorInfo != null ? errorInfo.toMap() : null,
                event
        );
    }

    private void applyUpdate(SpanAttributes newAttributes, Map<String, Object> newMetadata) {
        mergeAttributes(newAttributes);
        if (newMetadata != null) {
            metadata.putAll(newMetadata);
        }
    }

    private void mergeAttributes(SpanAttributes newAttributes) {
        if (newAttributes == null) {
            return;
        }
        if (!newAttributes.appliesTo(type)) {
            throw new IllegalArgumentException("Attributes for " + newAttributes.spanType()
                    + " cannot be attached to a " + type + " span");
        }
        attributes.putAll(newAttributes.toMap());
    }

    public String getId() {
        return id;
    }

    public String getTraceId() {
        return traceId;
    }

    public String getParentId() {
        return parentId;
    }

    public SpanType getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public synchronized Instant getEndTime() {
        return endTime;
    }

    public synchronized boolean isEnded() {
        return endTime != null;
    }

    public boolean isEvent() {
        return event;
    }

    public boolean isRootSpan() {
        return parentId == null;
    }
}
