package com.phodal.aitrace.model;

import java.util.Map;

/**
 * Attributes of a {@link SpanType#WORKFLOW_STEP} span.
 */
public record WorkflowStepAttributes(
    String stepId,
    String status
) implements SpanAttributes {

    @Override
    public SpanType spanType() {
        return SpanType.WORKFLOW_STEP;
    }

    @Override
    public Map<String, Object> toMap() {
        return Attributes.create()
                .put("stepId", stepId)
                .put("status", status)
                .toMap();
    }
}
