package com.phodal.aitrace.model;

import java.util.Map;

/**
 * Type-specific attributes of a span.
 * Each variant belongs to exactly one {@link SpanType}, except {@link GenericAttributes}
 * which may be attached to any span.
 */
public sealed interface SpanAttributes
        permits GenerationAttributes, StepAttributes, ChunkAttributes, ToolCallAttributes,
        WorkflowStepAttributes, SleepAttributes, GenericAttributes {

    /**
     * The span type these attributes describe, or {@code null} when they fit any type.
     */
    SpanType spanType();

    /**
     * Flatten to a map. Null components are left out so partial attributes can be merged
     * into an existing set without erasing values.
     */
    Map<String, Object> toMap();

    /**
     * Check whether these attributes may be attached to a span of the given type.
     */
    default boolean appliesTo(SpanType type) {
        return spanType() == null || spanType() == type;
    }
}
