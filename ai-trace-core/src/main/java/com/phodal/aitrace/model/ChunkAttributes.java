package com.phodal.aitrace.model;

import java.util.Map;

/**
 * Attributes of a {@link SpanType#MODEL_CHUNK} span.
 *
 * @param chunkType semantic unit of the stream, e.g. {@code text} or {@code tool-call}
 * @param sequenceNumber position of the chunk within its step
 */
public record ChunkAttributes(
    String chunkType,
    Integer sequenceNumber,
    String toolCallId,
    String toolName
) implements SpanAttributes {

    public static ChunkAttributes of(String chunkType, int sequenceNumber) {
        return new ChunkAttributes(chunkType, sequenceNumber, null, null);
    }

    @Override
    public SpanType spanType() {
        return SpanType.MODEL_CHUNK;
    }

    @Override
    public Map<String, Object> toMap() {
        return Attributes.create()
                .put("chunkType", chunkType)
                .put("sequenceNumber", sequenceNumber)
                .put("toolCallId", toolCallId)
                .put("toolName", toolName)
                .toMap();
    }
}
