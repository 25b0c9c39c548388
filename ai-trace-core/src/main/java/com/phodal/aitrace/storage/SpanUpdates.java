package com.phodal.aitrace.storage;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * Fields of a stored span that change after creation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SpanUpdates(
    String name,
    Map<String, Object> attributes,
    Map<String, Object> metadata,
    Instant endedAt,
    Object input,
    Object output,
    Object error,
    Instant updatedAt
) {
}
