package com.phodal.aitrace.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phodal.aitrace.util.ObjectMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Array;
import java.nio.ByteBuffer;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Date;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Produces size-bounded copies of arbitrary values so span payloads can be serialized
 * without exhausting memory.
 *
 * <p>Strings, lists and maps are cut down to the configured limits with an in-band marker,
 * nesting stops at the depth limit and circular references are replaced. The markers
 * count towards the limits and are passed through unchanged on a later pass, so bounding an
 * already bounded value returns an equal value.</p>
 *
 * <p>Objects that Jackson cannot convert are replaced by a {@code [TypeName]} placeholder;
 * their {@code toString()} is never called.</p>
 */
public class BoundedSerializer {
    private static final Logger log = LoggerFactory.getLogger(BoundedSerializer.class);

    public static final String TRUNCATION_MARKER = "...[truncated]";
    public static final String CIRCULAR_MARKER = "[Circular]";
    public static final String DEPTH_MARKER = "[MaxDepth]";
    public static final String SERIALIZATION_ERROR = "[Serialization Error]";
    public static final String TRUNCATED_KEYS_FIELD = "__truncated";

    private static final Set<String> FIXED_MARKERS = Set.of(CIRCULAR_MARKER, DEPTH_MARKER, SERIALIZATION_ERROR);
    private static final Pattern GENERATED_MARKER =
            Pattern.compile("\\[\\d+ more items]|\\d+ more keys|\\[[\\w.$]+(\\[])? length=\\d+]");

    private final SerializationLimits limits;
    private final ObjectMapper objectMapper;

    public BoundedSerializer() {
        this(SerializationLimits.DEFAULT);
    }

    public BoundedSerializer(SerializationLimits limits) {
        this(limits, ObjectMappers.create());
    }

    public BoundedSerializer(SerializationLimits limits, ObjectMapper objectMapper) {
        this.limits = limits;
        this.objectMapper = objectMapper;
    }

    public SerializationLimits getLimits() {
        return limits;
    }

    /**
     * Return a bounded copy of {@code value}. Never throws: on failure the
     * {@link #SERIALIZATION_ERROR} sentinel is returned.
     */
    public Object bound(Object value) {
        try {
            return boundValue(value, 0, Collections.newSetFromMap(new IdentityHashMap<>()));
        } catch (RuntimeException | StackOverflowError e) {
            log.warn("Failed to bound value of type {}: {}", value.getClass().getName(), e.toString());
            return SERIALIZATION_ERROR;
        }
    }

    /**
     * Bound the value, encode it as JSON and cap the resulting text at
     * {@link SerializationLimits#maxTotalChars()}. Never throws.
     */
    public String toJson(Object value) {
        try {
            String json = objectMapper.writeValueAsString(bound(value));
            return truncate(json, limits.maxTotalChars());
        } catch (JsonProcessingException | RuntimeException | StackOverflowError e) {
            log.warn("Failed to serialize value to JSON: {}", e.toString());
            return SERIALIZATION_ERROR;
        }
    }

    /**
     * Cut a string to at most {@code maxLength} characters, the marker included.
     */
    public static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        if (maxLength <= TRUNCATION_MARKER.length()) {
            return value.substring(0, maxLength);
        }
        return value.substring(0, maxLength - TRUNCATION_MARKER.length()) + TRUNCATION_MARKER;
    }

    private Object boundValue(Object value, int depth, Set<Object> path) {
        if (value == null || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof CharSequence || value instanceof Character) {
            String text = value.toString();
            return isMarker(text) ? text : truncate(text, limits.maxStringLength());
        }
        if (value instanceof Enum<?> enumValue) {
            return truncate(enumValue.name(), limits.maxStringLength());
        }
        if (value instanceof TemporalAccessor || value instanceof UUID) {
            return truncate(value.toString(), limits.maxStringLength());
        }
        if (value instanceof Date date) {
            return truncate(date.toInstant().toString(), limits.maxStringLength());
        }
        if (value instanceof ByteBuffer buffer) {
            return "[ByteBuffer length=" + buffer.remaining() + "]";
        }
        if (value.getClass().isArray() && value.getClass().getComponentType().isPrimitive()) {
            return "[" + value.getClass().getComponentType().getName() + "[] length=" + Array.getLength(value) + "]";
        }
        if (value instanceof Throwable error) {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("name", truncate(error.getClass().getSimpleName(), limits.maxStringLength()));
            map.put("message", truncate(error.getMessage(), limits.maxStringLength()));
            return map;
        }
        if (value instanceof JsonNode node) {
            return boundValue(objectMapper.convertValue(node, Object.class), depth, path);
        }
        if (!(value instanceof Map<?, ?>) && !(value instanceof Iterable<?>) && !(value instanceof Object[])) {
            return boundPojo(value, depth, path);
        }

        if (depth >= limits.maxDepth()) {
            return DEPTH_MARKER;
        }
        if (!path.add(value)) {
            return CIRCULAR_MARKER;
        }
        try {
            if (value instanceof Map<?, ?> map) {
                return boundMap(map, depth, path);
            }
            Iterator<?> items = value instanceof Object[] array
                    ? Arrays.asList(array).iterator()
                    : ((Iterable<?>) value).iterator();
            return boundList(items, depth, path);
        } finally {
            path.remove(value);
        }
    }

    private static boolean isMarker(String text) {
        return FIXED_MARKERS.contains(text) || GENERATED_MARKER.matcher(text).matches();
    }

    private Map<String, Object> boundMap(Map<?, ?> map, int depth, Set<Object> path) {
        Map<String, Object> bounded = new LinkedHashMap<>();
        int size = map.size();
        int keep = size > limits.maxObjectKeys() ? limits.maxObjectKeys() - 1 : size;
        int index = 0;
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (index++ >= keep) {
                break;
            }
            String key = String.valueOf(entry.getKey());
            if (!TRUNCATED_KEYS_FIELD.equals(key)) {
                key = truncate(key, limits.maxStringLength());
            }
            bounded.put(key, boundValue(entry.getValue(), depth + 1, path));
        }
        if (size > keep) {
            bounded.put(TRUNCATED_KEYS_FIELD, (size - keep) + " more keys");
        }
        return bounded;
    }

    private List<Object> boundList(Iterator<?> items, int depth, Set<Object> path) {
        List<Object> all = new ArrayList<>();
        items.forEachRemaining(all::add);
        int size = all.size();
        int keep = size > limits.maxArrayLength() ? limits.maxArrayLength() - 1 : size;
        List<Object> bounded = new ArrayList<>(Math.min(size, limits.maxArrayLength()));
        for (int i = 0; i < keep; i++) {
            bounded.add(boundValue(all.get(i), depth + 1, path));
        }
        if (size > keep) {
            bounded.add("[" + (size - keep) + " more items]");
        }
        return bounded;
    }

    private Object boundPojo(Object value, int depth, Set<Object> path) {
        Object converted;
        try {
            converted = objectMapper.convertValue(value, Object.class);
        } catch (IllegalArgumentException e) {
            log.debug("Cannot convert {} for serialization, using a placeholder: {}",
                    value.getClass().getName(), e.getMessage());
            return truncate("[" + value.getClass().getSimpleName() + "]", limits.maxStringLength());
        }
        if (converted == null || converted instanceof String || converted instanceof Number
                || converted instanceof Boolean) {
            return boundValue(converted, depth, path);
        }
        if (!path.add(value)) {
            return CIRCULAR_MARKER;
        }
        try {
            return boundValue(converted, depth, path);
        } finally {
            path.remove(value);
        }
    }
}
