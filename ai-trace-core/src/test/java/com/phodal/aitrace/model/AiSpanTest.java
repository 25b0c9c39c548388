package com.phodal.aitrace.model;

import com.phodal.aitrace.fixtures.MutableClock;
import com.phodal.aitrace.util.SpanIds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AiSpanTest {

    private MutableClock clock;
    private RecordingEmitter emitter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        emitter = new RecordingEmitter();
    }

    @Test
    void shouldUseTraceContextShapedIds() {
        AiSpan root = AiSpan.startRoot(emitter, StartSpanOptions.builder(SpanType.AGENT_RUN, "agent").build());
        AiSpan child = root.createChildSpan(StartSpanOptions.builder(SpanType.TOOL_CALL, "tool").build());

        assertTrue(root.getTraceId().matches("[0-9a-f]{32}"));
        assertTrue(root.getId().matches("[0-9a-f]{16}"));
        assertEquals(root.getTraceId(), child.getTraceId());
        assertEquals(root.getId(), child.getParentId());
        assertTrue(root.isRootSpan());
        assertFalse(child.isRootSpan());
    }

    @Test
    void shouldSetEndTimeOnce() {
        AiSpan span = AiSpan.startRoot(emitter, StartSpanOptions.builder(SpanType.AGENT_RUN, "agent").build());
        clock.advanceMillis(250);
        span.end(EndSpanOptions.output("first"));
        Instant endTime = span.getEndTime();

        clock.advanceMillis(250);
        span.end(EndSpanOptions.output("second"));
        span.update(new UpdateSpanOptions(null, Map.of("late", true), null, null));

        assertEquals(clock.instant().minusMillis(250), endTime);
        assertEquals(endTime, span.getEndTime());
        assertEquals("first", span.exportSpan().output());
        assertNull(span.exportSpan().metadata());
        assertEquals(List.of(AiTracingEvent.Type.SPAN_STARTED, AiTracingEvent.Type.SPAN_ENDED), emitter.types);
    }

    @Test
    void shouldMergeUpdatesKeyByKey() {
        AiSpan span = AiSpan.startRoot(emitter, StartSpanOptions.builder(SpanType.MODEL_GENERATION, "llm")
                .attributes(GenerationAttributes.of("gpt-4o", "openai"))
                .metadata(Map.of("runId", "r1"))
                .build());

        span.update(new UpdateSpanOptions(GenericAttributes.of(Map.of("temperature", 0.2)),
                Map.of("threadId", "t1"), "prompt", null));

        ExportedSpan exported = span.exportSpan();
        assertEquals("gpt-4o", exported.attributes().get("model"));
        assertEquals(0.2, exported.attributes().get("temperature"));
        assertEquals(Map.of("runId", "r1", "threadId", "t1"), exported.metadata());
        assertEquals("prompt", exported.input());
        assertEquals(AiTracingEvent.Type.SPAN_UPDATED, emitter.types.get(1));
    }

    @Test
    void shouldRejectAttributesOfAnotherSpanType() {
        assertThrows(IllegalArgumentException.class, () -> StartSpanOptions.builder(SpanType.TOOL_CALL, "tool")
                .attributes(GenerationAttributes.of("gpt-4o", "openai"))
                .build());

        AiSpan span = AiSpan.startRoot(emitter, StartSpanOptions.builder(SpanType.TOOL_CALL, "tool").build());
        assertThrows(IllegalArgumentException.class,
                () -> span.update(UpdateSpanOptions.attributes(GenerationAttributes.of("gpt-4o", "openai"))));
    }

    @Test
    void shouldCreateEventSpansAlreadyEnded() {
        AiSpan root = AiSpan.startRoot(emitter, StartSpanOptions.builder(SpanType.MODEL_GENERATION, "llm").build());

        AiSpan event = root.createEventSpan(StartSpanOptions.builder(SpanType.MODEL_CHUNK, "chunk: 'file'").build());
        event.end();

        assertTrue(event.isEvent());
        assertTrue(event.isEnded());
        assertEquals(event.getStartTime(), event.getEndTime());
        assertEquals(List.of(AiTracingEvent.Type.SPAN_STARTED, AiTracingEvent.Type.SPAN_ENDED), emitter.types);
    }

    @Test
    void shouldRecordErrorWithoutEndingWhenAsked() {
        AiSpan span = AiSpan.startRoot(emitter, StartSpanOptions.builder(SpanType.TOOL_CALL, "tool").build());

        span.error(ErrorSpanOptions.of(SpanErrorInfo.of("rate limited"), false));

        assertFalse(span.isEnded());
        assertEquals("rate limited", span.exportSpan().errorInfo().get("message"));
        assertEquals(AiTracingEvent.Type.SPAN_UPDATED, emitter.types.get(1));

        span.error(ErrorSpanOptions.of(new IllegalStateException("boom")));
        assertTrue(span.isEnded());
        assertEquals("boom", span.exportSpan().errorInfo().get("message"));
    }

    private class RecordingEmitter implements SpanEmitter {
        private final List<AiTracingEvent.Type> types = new ArrayList<>();

        @Override
        public Instant now() {
            return clock.instant();
        }

        @Override
        public String newSpanId() {
            return SpanIds.newSpanId();
        }

        @Override
        public String newTraceId() {
            return SpanIds.newTraceId();
        }

        @Override
        public void emit(AiTracingEvent.Type type, AiSpan span) {
            types.add(type);
        }
    }
}
