package com.phodal.aitrace.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of spans recorded for AI executions.
 * The wire value is what sinks receive in the {@code spanType} field.
 */
public enum SpanType {
    AGENT_RUN("agent_run"),
    MODEL_GENERATION("model_generation"),
    MODEL_STEP("model_step"),
    MODEL_CHUNK("model_chunk"),
    TOOL_CALL("tool_call"),
    WORKFLOW_RUN("workflow_run"),
    WORKFLOW_STEP("workflow_step"),
    WORKFLOW_SLEEP("workflow_sleep"),
    GENERIC("generic");

    private final String value;

    SpanType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static SpanType fromValue(String value) {
        for (SpanType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown span type: " + value);
    }
}
