package com.phodal.aitrace.model;

import java.util.Map;

/**
 * Options for creating a span.
 */
public record StartSpanOptions(
    SpanType type,
    String name,
    SpanAttributes attributes,
    Map<String, Object> metadata,
    Object input,
    Object output
) {

    public StartSpanOptions {
        if (type == null) {
            throw new IllegalArgumentException("Span type must not be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Span name must not be blank");
        }
        if (attributes != null && !attributes.appliesTo(type)) {
            throw new IllegalArgumentException("Attributes for " + attributes.spanType()
                    + " cannot be attached to a " + type + " span");
        }
    }

    public static Builder builder(SpanType type, String name) {
        return new Builder(type, name);
    }

    public static class Builder {
        private final SpanType type;
        private final String name;
        private SpanAttributes attributes;
        private Map<String, Object> metadata;
        private Object input;
        private Object output;

        Builder(SpanType type, String name) {
            this.type = type;
            this.name = name;
        }

        public Builder attributes(SpanAttributes attributes) {
            this.attributes = attributes;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder input(Object input) {
            this.input = input;
            return this;
        }

        public Builder output(Object output) {
            this.output = output;
            return this;
        }

        public StartSpanOptions build() {
            return new StartSpanOptions(type, name, attributes, metadata, input, output);
        }
    }
}
