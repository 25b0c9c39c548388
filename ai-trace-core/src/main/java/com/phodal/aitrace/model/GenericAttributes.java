package com.phodal.aitrace.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Free-form attributes. Accepted by every span type, used for agent and workflow runs
 * and for instrumentation that has no dedicated variant.
 */
public record GenericAttributes(Map<String, Object> values) implements SpanAttributes {

    public GenericAttributes {
        values = values == null ? Map.of() : new LinkedHashMap<>(values);
    }

    public static GenericAttributes of(Map<String, Object> values) {
        return new GenericAttributes(values);
    }

    @Override
    public SpanType spanType() {
        return null;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        values.forEach((key, value) -> {
            if (value != null) {
                map.put(key, value);
            }
        });
        return map;
    }
}
