package com.phodal.aitrace.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Small helper for building attribute maps without null entries.
 */
final class Attributes {

    private final Map<String, Object> values = new LinkedHashMap<>();

    static Attributes create() {
        return new Attributes();
    }

    Attributes put(String key, Object value) {
        if (value != null) {
            values.put(key, value);
        }
        return this;
    }

    Map<String, Object> toMap() {
        return values;
    }
}
