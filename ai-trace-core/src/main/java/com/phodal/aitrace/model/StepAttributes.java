package com.phodal.aitrace.model;

import java.util.List;
import java.util.Map;

/**
 * Attributes of a {@link SpanType#MODEL_STEP} span, one per provider API call.
 */
public record StepAttributes(
    Integer stepIndex,
    String messageId,
    List<Object> warnings,
    UsageStats usage,
    String finishReason,
    Boolean isContinued
) implements SpanAttributes {

    public static StepAttributes started(int stepIndex, String messageId, List<Object> warnings) {
        return new StepAttributes(stepIndex, messageId, emptyToNull(warnings), null, null, null);
    }

    public static StepAttributes patch(String messageId, List<Object> warnings) {
        return new StepAttributes(null, messageId, emptyToNull(warnings), null, null, null);
    }

    public static StepAttributes finished(UsageStats usage, String finishReason, Boolean isContinued,
                                          List<Object> warnings) {
        return new StepAttributes(null, null, warnings, usage, finishReason, isContinued);
    }

    @Override
    public SpanType spanType() {
        return SpanType.MODEL_STEP;
    }

    @Override
    public Map<String, Object> toMap() {
        return Attributes.create()
                .put("stepIndex", stepIndex)
                .put("messageId", messageId)
                .put("warnings", warnings)
                .put("usage", usage != null ? usage.toMap() : null)
                .put("finishReason", finishReason)
                .put("isContinued", isContinued)
                .toMap();
    }

    private static List<Object> emptyToNull(List<Object> warnings) {
        return warnings == null || warnings.isEmpty() ? null : warnings;
    }
}
