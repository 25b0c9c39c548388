package com.phodal.aitrace.tracker;

/**
 * Chunk types with dedicated handling in {@link ModelSpanTracker}.
 */
public final class ChunkTypes {

    private ChunkTypes() {
        // Constants
    }

    public static final String STEP_START = "step-start";
    public static final String STEP_FINISH = "step-finish";

    public static final String TEXT_START = "text-start";
    public static final String TEXT_DELTA = "text-delta";
    public static final String TEXT_END = "text-end";

    public static final String REASONING_START = "reasoning-start";
    public static final String REASONING_DELTA = "reasoning-delta";
    public static final String REASONING_END = "reasoning-end";

    public static final String TOOL_CALL_INPUT_STREAMING_START = "tool-call-input-streaming-start";
    public static final String TOOL_CALL_DELTA = "tool-call-delta";
    public static final String TOOL_CALL_INPUT_STREAMING_END = "tool-call-input-streaming-end";
    public static final String TOOL_CALL = "tool-call";

    public static final String OBJECT = "object";
    public static final String OBJECT_RESULT = "object-result";

    public static final String TOOL_CALL_APPROVAL = "tool-call-approval";
    public static final String TOOL_OUTPUT = "tool-output";
    public static final String TOOL_RESULT = "tool-result";

    public static final String FINISH = "finish";
    public static final String WORKFLOW_FINISH = "workflow-finish";
}
