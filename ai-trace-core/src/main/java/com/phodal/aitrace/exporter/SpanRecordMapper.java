package com.phodal.aitrace.exporter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phodal.aitrace.model.ExportedSpan;
import com.phodal.aitrace.serialization.BoundedSerializer;
import com.phodal.aitrace.storage.CreateSpanRecord;
import com.phodal.aitrace.storage.SpanUpdates;
import com.phodal.aitrace.storage.UpdateSpanRecord;
import com.phodal.aitrace.util.ObjectMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;

/**
 * Projects exported spans onto storage records.
 *
 * <p>Attributes are converted through Jackson so dates become ISO-8601 strings; a failure
 * stores {@code null} attributes instead of dropping the span. Input, output and metadata
 * are size-bounded.</p>
 */
public class SpanRecordMapper {
    private static final Logger log = LoggerFactory.getLogger(SpanRecordMapper.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final BoundedSerializer serializer;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public SpanRecordMapper() {
        this(new BoundedSerializer(), Clock.systemUTC());
    }

    public SpanRecordMapper(BoundedSerializer serializer, Clock clock) {
        this.serializer = serializer;
        this.objectMapper = ObjectMappers.create();
        this.clock = clock;
    }

    public CreateSpanRecord toCreateRecord(ExportedSpan span) {
        return new CreateSpanRecord(
                span.traceId(),
                span.id(),
                span.parentSpanId(),
                span.name(),
                span.type(),
                serializeAttributes(span),
                boundMap(span.metadata()),
                span.startTime(),
                span.endTime(),
                bound(span.input()),
                bound(span.output()),
                span.errorInfo(),
                span.isEvent(),
                clock.instant(),
                null
        );
    }

    public UpdateSpanRecord toUpdateRecord(ExportedSpan span) {
        return new UpdateSpanRecord(span.traceId(), span.id(), new SpanUpdates(
                span.name(),
                serializeAttributes(span),
                boundMap(span.metadata()),
                span.endTime(),
                bound(span.input()),
                bound(span.output()),
                span.errorInfo(),
                clock.instant()
        ));
    }

    /**
     * Convert attributes to plain JSON values, or {@code null} if they cannot be converted.
     */
    public Map<String, Object> serializeAttributes(ExportedSpan span) {
        if (span.attributes() == null) {
            return null;
        }
        try {
            return objectMapper.convertValue(span.attributes(), MAP_TYPE);
        } catch (IllegalArgumentException e) {
            log.warn("Failed to serialize attributes of span {} ({}), storing as null: {}",
                    span.id(), span.type(), e.getMessage());
            return null;
        }
    }

    private Object bound(Object value) {
        return value == null ? null : serializer.bound(value);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> boundMap(Map<String, Object> value) {
        if (value == null) {
            return null;
        }
        Object bounded = serializer.bound(value);
        return bounded instanceof Map<?, ?> map ? (Map<String, Object>) map : null;
    }

    public Clock getClock() {
        return clock;
    }
}
