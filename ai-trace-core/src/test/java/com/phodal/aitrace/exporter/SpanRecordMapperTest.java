package com.phodal.aitrace.exporter;

import com.phodal.aitrace.fixtures.MutableClock;
import com.phodal.aitrace.fixtures.TestSpans;
import com.phodal.aitrace.model.ExportedSpan;
import com.phodal.aitrace.model.SpanType;
import com.phodal.aitrace.serialization.BoundedSerializer;
import com.phodal.aitrace.serialization.SerializationLimits;
import com.phodal.aitrace.storage.CreateSpanRecord;
import com.phodal.aitrace.storage.UpdateSpanRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SpanRecordMapperTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2025-02-01T10:00:00Z"));
    private final SpanRecordMapper mapper = new SpanRecordMapper(
            new BoundedSerializer(SerializationLimits.DEFAULT.withMaxStringLength(16)), clock);

    @Test
    void shouldStampCreatedAtAndLeaveUpdatedAtEmpty() {
        CreateSpanRecord record = mapper.toCreateRecord(TestSpans.span("a"));

        assertEquals(clock.instant(), record.createdAt());
        assertNull(record.updatedAt());
        assertEquals("a", record.spanId());
        assertEquals(SpanType.AGENT_RUN, record.spanType());
        assertEquals(Map.of("agentId", "agent-1"), record.attributes());
    }

    @Test
    void shouldStampUpdatedAtOnUpdates() {
        UpdateSpanRecord update = mapper.toUpdateRecord(TestSpans.span("a"));

        assertEquals(clock.instant(), update.updates().updatedAt());
        assertEquals(TestSpans.START.plusSeconds(1), update.updates().endedAt());
    }

    @Test
    void shouldBoundInputAndOutput() {
        ExportedSpan span = TestSpans.span("a").withPayload(null, null, "x".repeat(100), null, null);

        CreateSpanRecord record = mapper.toCreateRecord(span);

        assertEquals(16, record.input().toString().length());
        assertTrue(record.input().toString().endsWith(BoundedSerializer.TRUNCATION_MARKER));
    }

    @Test
    void shouldRenderDatesInAttributesAsIsoStrings() {
        Instant firstToken = Instant.parse("2025-02-01T10:00:01.500Z");
        ExportedSpan span = TestSpans.span("a").withPayload(Map.of("completionStartTime", firstToken), null, null, null, null);

        Map<String, Object> attributes = mapper.serializeAttributes(span);

        assertEquals("2025-02-01T10:00:01.500Z", attributes.get("completionStartTime"));
    }
}
