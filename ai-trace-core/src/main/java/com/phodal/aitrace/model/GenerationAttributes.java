package com.phodal.aitrace.model;

import java.time.Instant;
import java.util.Map;

/**
 * Attributes of a {@link SpanType#MODEL_GENERATION} span.
 */
public record GenerationAttributes(
    String model,
    String provider,
    String resultType,
    Boolean streaming,
    Map<String, Object> parameters,
    UsageStats usage,
    String finishReason,
    Instant completionStartTime
) implements SpanAttributes {

    public static GenerationAttributes of(String model, String provider) {
        return new GenerationAttributes(model, provider, null, null, null, null, null, null);
    }

    public GenerationAttributes withUsage(UsageStats usage) {
        return new GenerationAttributes(model, provider, resultType, streaming, parameters,
                usage, finishReason, completionStartTime);
    }

    public GenerationAttributes withCompletionStartTime(Instant completionStartTime) {
        return new GenerationAttributes(model, provider, resultType, streaming, parameters,
                usage, finishReason, completionStartTime);
    }

    @Override
    public SpanType spanType() {
        return SpanType.MODEL_GENERATION;
    }

    @Override
    public Map<String, Object> toMap() {
        return Attributes.create()
                .put("model", model)
                .put("provider", provider)
                .put("resultType", resultType)
                .put("streaming", streaming)
                .put("parameters", parameters)
                .put("usage", usage != null ? usage.toMap() : null)
                .put("finishReason", finishReason)
                .put("completionStartTime", completionStartTime)
                .toMap();
    }
}
