package com.phodal.aitrace.tracker;

import com.phodal.aitrace.model.GenerationAttributes;

import java.util.Map;

/**
 * Final values for a generation span.
 *
 * @param output generation output
 * @param attributes final generation attributes; usage and completion start time are filled in
 * @param metadata metadata merged into the span
 * @param usage raw provider usage, converted to usage stats
 */
public record EndGenerationOptions(
    Object output,
    GenerationAttributes attributes,
    Map<String, Object> metadata,
    Map<String, Object> usage
) {
}
