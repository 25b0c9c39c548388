package com.phodal.aitrace.model;

import java.util.Map;

/**
 * Attributes of a {@link SpanType#TOOL_CALL} span.
 */
public record ToolCallAttributes(
    String toolId,
    String toolType,
    String toolDescription,
    Boolean success
) implements SpanAttributes {

    @Override
    public SpanType spanType() {
        return SpanType.TOOL_CALL;
    }

    @Override
    public Map<String, Object> toMap() {
        return Attributes.create()
                .put("toolId", toolId)
                .put("toolType", toolType)
                .put("toolDescription", toolDescription)
                .put("success", success)
                .toMap();
    }
}
