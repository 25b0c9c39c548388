package com.phodal.aitrace.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Token usage reported by a model provider.
 *
 * @param inputTokens tokens in the prompt
 * @param outputTokens tokens generated
 * @param totalTokens provider total, or the sum of input and output when absent
 * @param reasoningTokens tokens spent on hidden reasoning
 * @param cachedInputTokens prompt tokens served from the provider cache
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UsageStats(
    Long inputTokens,
    Long outputTokens,
    Long totalTokens,
    Long reasoningTokens,
    Long cachedInputTokens
) {

    /**
     * Extract usage from a raw provider map. Accepts both camelCase and snake_case
     * keys as well as the older {@code promptTokens}/{@code completionTokens} names.
     *
     * @return the usage, or {@code null} if the map is null or carries no counts
     */
    public static UsageStats fromRaw(Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        Long input = firstNumber(raw, "inputTokens", "input_tokens", "promptTokens", "prompt_tokens");
        Long output = firstNumber(raw, "outputTokens", "output_tokens", "completionTokens", "completion_tokens");
        Long total = firstNumber(raw, "totalTokens", "total_tokens");
        Long reasoning = firstNumber(raw, "reasoningTokens", "reasoning_tokens");
        Long cached = firstNumber(raw, "cachedInputTokens", "cached_input_tokens", "cacheReadInputTokens");
        if (input == null && output == null && total == null && reasoning == null && cached == null) {
            return null;
        }
        if (total == null && (input != null || output != null)) {
            total = (input != null ? input : 0L) + (output != null ? output : 0L);
        }
        return new UsageStats(input, output, total, reasoning, cached);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        putIfPresent(map, "inputTokens", inputTokens);
        putIfPresent(map, "outputTokens", outputTokens);
        putIfPresent(map, "totalTokens", totalTokens);
        putIfPresent(map, "reasoningTokens", reasoningTokens);
        putIfPresent(map, "cachedInputTokens", cachedInputTokens);
        return map;
    }

    private static void putIfPresent(Map<String, Object> map, String key, Long value) {
        if (value != null) {
            map.put(key, value);
        }
    }

    private static Long firstNumber(Map<String, ?> raw, String... keys) {
        for (String key : keys) {
            Object value = raw.get(key);
            if (value instanceof Number number) {
                return number.longValue();
            }
        }
        return null;
    }
}
