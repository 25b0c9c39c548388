package com.phodal.aitrace.tracker;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Data carried by a {@code step-finish} chunk.
 *
 * @param output step output, without usage
 * @param usage raw provider usage counts
 * @param finishReason why the provider stopped
 * @param isContinued whether another step follows (e.g. after tool calls)
 * @param warnings provider warnings
 * @param metadata response metadata
 */
public record StepFinishPayload(
    Map<String, Object> output,
    Map<String, Object> usage,
    String finishReason,
    Boolean isContinued,
    List<Object> warnings,
    Map<String, Object> metadata
) {

    /**
     * Read the nested chunk layout: {@code output} holds {@code usage},
     * {@code stepResult} holds {@code reason}, {@code isContinued} and {@code warnings}.
     */
    @SuppressWarnings("unchecked")
    public static StepFinishPayload fromMap(Map<String, Object> payload) {
        Map<String, Object> output = payload.get("output") instanceof Map<?, ?> outputMap
                ? new LinkedHashMap<>((Map<String, Object>) outputMap)
                : new LinkedHashMap<>();
        Object rawUsage = output.remove("usage");
        Map<String, Object> stepResult = payload.get("stepResult") instanceof Map<?, ?> resultMap
                ? (Map<String, Object>) resultMap
                : Map.of();
        Object reason = stepResult.get("reason");
        Object continued = stepResult.get("isContinued");
        Object warnings = stepResult.get("warnings");
        return new StepFinishPayload(
                output,
                rawUsage instanceof Map<?, ?> ? (Map<String, Object>) rawUsage : null,
                reason != null ? reason.toString() : null,
                continued instanceof Boolean b ? b : null,
                warnings instanceof List<?> ? (List<Object>) warnings : null,
                payload.get("metadata") instanceof Map<?, ?> metadataMap
                        ? (Map<String, Object>) metadataMap
                        : null
        );
    }
}
