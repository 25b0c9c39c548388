package com.phodal.aitrace.tracker;

import java.util.Map;

/**
 * One event of a model output stream.
 *
 * @param type chunk type such as {@code text-delta} or {@code step-finish}
 * @param payload chunk specific fields, never null
 */
public record StreamChunk(String type, Map<String, Object> payload) {

    public StreamChunk {
        if (type == null) {
            throw new IllegalArgumentException("Chunk type must not be null");
        }
        payload = payload != null ? payload : Map.of();
    }

    public static StreamChunk of(String type) {
        return new StreamChunk(type, Map.of());
    }

    public static StreamChunk of(String type, Map<String, Object> payload) {
        return new StreamChunk(type, payload);
    }

    public static StreamChunk textDelta(String text) {
        return new StreamChunk(ChunkTypes.TEXT_DELTA, Map.of("text", text));
    }

    public static StreamChunk reasoningDelta(String text) {
        return new StreamChunk(ChunkTypes.REASONING_DELTA, Map.of("text", text));
    }

    public static StreamChunk toolCallDelta(String argsTextDelta) {
        return new StreamChunk(ChunkTypes.TOOL_CALL_DELTA, Map.of("argsTextDelta", argsTextDelta));
    }

    public String getString(String key) {
        Object value = payload.get(key);
        return value != null ? value.toString() : null;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getMap(String key) {
        Object value = payload.get(key);
        return value instanceof Map<?, ?> ? (Map<String, Object>) value : null;
    }
}
