package com.phodal.aitrace.tracker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phodal.aitrace.model.AiSpan;
import com.phodal.aitrace.model.ChunkAttributes;
import com.phodal.aitrace.model.EndSpanOptions;
import com.phodal.aitrace.model.ErrorSpanOptions;
import com.phodal.aitrace.model.GenerationAttributes;
import com.phodal.aitrace.model.SpanType;
import com.phodal.aitrace.model.StartSpanOptions;
import com.phodal.aitrace.model.StepAttributes;
import com.phodal.aitrace.model.UpdateSpanOptions;
import com.phodal.aitrace.model.UsageStats;
import com.phodal.aitrace.util.ObjectMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Maps the chunks of a streaming model call onto spans.
 *
 * <p>Hierarchy: {@code MODEL_GENERATION -> MODEL_STEP -> MODEL_CHUNK}. One tracker is
 * created per generation span and shared by every step of that generation, including the
 * steps that follow tool calls. At most one step span and one chunk span are open at a
 * time.</p>
 *
 * <p>All operations are no-ops when the tracker was created without a generation span.</p>
 */
public class ModelSpanTracker {
    private static final Logger log = LoggerFactory.getLogger(ModelSpanTracker.class);

    private final AiSpan generationSpan;
    private final Clock clock;
    private final ObjectMapper objectMapper = ObjectMappers.create();

    private AiSpan currentStepSpan;
    private AiSpan currentChunkSpan;
    private String currentChunkType;
    private Map<String, Object> accumulator = new LinkedHashMap<>();
    private int stepIndex;
    private int chunkSequence;
    private Instant completionStartTime;

    private final Map<String, ToolOutputAccumulator> toolOutputs = new HashMap<>();
    private final Set<String> streamedToolCallIds = new HashSet<>();

    public ModelSpanTracker(AiSpan generationSpan) {
        this(generationSpan, Clock.systemUTC());
    }

    public ModelSpanTracker(AiSpan generationSpan, Clock clock) {
        this.generationSpan = generationSpan;
        this.clock = clock;
    }

    /**
     * Span that child spans (for example tool executions) should attach to:
     * the open step, otherwise the generation span.
     */
    public synchronized AiSpan tracingContext() {
        return currentStepSpan != null ? currentStepSpan : generationSpan;
    }

    /**
     * Track every chunk of {@code stream} as it is consumed. Chunks pass through unchanged.
     */
    public Stream<StreamChunk> wrap(Stream<StreamChunk> stream) {
        return stream.map(chunk -> {
            track(chunk);
            return chunk;
        });
    }

    public synchronized void updateGeneration(UpdateSpanOptions options) {
        if (generationSpan != null) {
            generationSpan.update(options);
        }
    }

    public synchronized void reportGenerationError(ErrorSpanOptions options) {
        if (generationSpan != null) {
            generationSpan.error(options);
        }
    }

    /**
     * End the generation span. Raw usage is converted to {@link UsageStats} and the time
     * of the first content chunk is recorded as the completion start time.
     * Open step and chunk spans are left alone.
     */
    public synchronized void endGeneration(EndGenerationOptions options) {
        if (generationSpan == null) {
            return;
        }
        EndGenerationOptions opts = options != null ? options : new EndGenerationOptions(null, null, null, null);
        GenerationAttributes attributes = opts.attributes() != null
                ? opts.attributes()
                : new GenerationAttributes(null, null, null, null, null, null, null, null);
        UsageStats usage = UsageStats.fromRaw(opts.usage());
        if (usage != null) {
            attributes = attributes.withUsage(usage);
        }
        if (completionStartTime != null) {
            attributes = attributes.withCompletionStartTime(completionStartTime);
        }
        generationSpan.end(new EndSpanOptions(opts.output(), attributes, opts.metadata()));
    }

    /**
     * Start a step span unless one is already open. Call this when the provider request is
     * sent so the step start time is accurate; payload data may follow via {@link #updateStep}.
     */
    public synchronized void startStep(StepStartPayload payload) {
        if (currentStepSpan != null || generationSpan == null) {
            return;
        }
        currentStepSpan = generationSpan.createChildSpan(StartSpanOptions.builder(SpanType.MODEL_STEP, "step: " + stepIndex)
                .attributes(StepAttributes.started(stepIndex,
                        payload != null ? payload.messageId() : null,
                        payload != null ? payload.warnings() : null))
                .input(payload != null ? payload.request() : null)
                .build());
        chunkSequence = 0;
    }

    public synchronized void updateStep(StepStartPayload payload) {
        if (currentStepSpan == null || payload == null) {
            return;
        }
        currentStepSpan.update(UpdateSpanOptions.input(payload.request(),
                StepAttributes.patch(payload.messageId(), payload.warnings())));
    }

    /**
     * Feed one stream chunk to the tracker.
     */
    public synchronized void track(StreamChunk chunk) {
        if (generationSpan == null) {
            return;
        }
        switch (chunk.type()) {
            case ChunkTypes.TEXT_DELTA, ChunkTypes.TOOL_CALL_DELTA, ChunkTypes.REASONING_DELTA ->
                    captureCompletionStartTime();
            default -> {
            }
        }

        switch (chunk.type()) {
            case ChunkTypes.STEP_START -> {
                StepStartPayload payload = StepStartPayload.fromMap(chunk.payload());
                if (currentStepSpan != null) {
                    updateStep(payload);
                } else {
                    startStep(payload);
                }
            }
            case ChunkTypes.STEP_FINISH -> endStep(StepFinishPayload.fromMap(chunk.payload()));

            case ChunkTypes.TEXT_START -> startChunkSpan("text", null);
            case ChunkTypes.TEXT_DELTA, ChunkTypes.REASONING_DELTA -> appendToAccumulator("text", chunk.getString("text"));
            case ChunkTypes.TEXT_END, ChunkTypes.REASONING_END -> endChunkSpan(null);
            case ChunkTypes.REASONING_START -> startChunkSpan("reasoning", null);

            case ChunkTypes.TOOL_CALL_INPUT_STREAMING_START -> {
                Map<String, Object> initial = new LinkedHashMap<>();
                initial.put("toolName", chunk.payload().get("toolName"));
                initial.put("toolCallId", chunk.payload().get("toolCallId"));
                startChunkSpan("tool-call", initial);
            }
            case ChunkTypes.TOOL_CALL_DELTA -> appendToAccumulator("toolInput", chunk.getString("argsTextDelta"));
            case ChunkTypes.TOOL_CALL_INPUT_STREAMING_END -> endToolCallChunk();
            case ChunkTypes.TOOL_CALL -> {
                if ("tool-call".equals(currentChunkType)) {
                    endToolCallChunk();
                } else {
                    createEventSpan(chunk.type(), chunk.payload());
                }
            }

            case ChunkTypes.OBJECT -> {
                if (currentChunkSpan == null) {
                    startChunkSpan("object", null);
                }
            }
            case ChunkTypes.OBJECT_RESULT -> endChunkSpan(chunk.payload().get("object"));

            case ChunkTypes.TOOL_CALL_APPROVAL -> handleToolApproval(chunk);
            case ChunkTypes.TOOL_OUTPUT -> handleToolOutput(chunk);
            case ChunkTypes.TOOL_RESULT -> handleToolResult(chunk);

            default -> createEventSpan(chunk.type(), chunk.payload());
        }
    }

    private void captureCompletionStartTime() {
        if (completionStartTime == null) {
            completionStartTime = clock.instant();
        }
    }

    private void ensureStep() {
        if (currentStepSpan == null) {
            startStep(null);
        }
    }

    private void endStep(StepFinishPayload payload) {
        if (currentStepSpan == null) {
            return;
        }
        Map<String, Object> metadata = payload.metadata() != null ? new LinkedHashMap<>(payload.metadata()) : null;
        if (metadata != null) {
            metadata.remove("request");
        }
        currentStepSpan.end(new EndSpanOptions(
                payload.output(),
                StepAttributes.finished(UsageStats.fromRaw(payload.usage()), payload.finishReason(),
                        payload.isContinued(), payload.warnings()),
                metadata));
        currentStepSpan = null;
        stepIndex++;
    }

    private void startChunkSpan(String chunkType, Map<String, Object> initialData) {
        ensureStep();
        if (currentChunkSpan != null) {
            log.debug("Chunk span '{}' still open when '{}' started, closing it", currentChunkType, chunkType);
            endChunkSpan(null);
        }
        currentChunkSpan = currentStepSpan.createChildSpan(StartSpanOptions.builder(SpanType.MODEL_CHUNK, chunkName(chunkType))
                .attributes(ChunkAttributes.of(chunkType, chunkSequence))
                .build());
        currentChunkType = chunkType;
        accumulator = initialData != null ? initialData : new LinkedHashMap<>();
    }

    private void appendToAccumulator(String field, String text) {
        if (text == null) {
            return;
        }
        accumulator.merge(field, text, (existing, added) -> existing.toString() + added);
    }

    /**
     * End the open chunk span with the given output, or the accumulated fields when null.
     * No-op without an open chunk span.
     */
    private void endChunkSpan(Object output) {
        if (currentChunkSpan == null) {
            return;
        }
        currentChunkSpan.end(EndSpanOptions.output(output != null ? output : accumulator));
        currentChunkSpan = null;
        currentChunkType = null;
        accumulator = new LinkedHashMap<>();
        chunkSequence++;
    }

    private void endToolCallChunk() {
        if (currentChunkSpan == null) {
            return;
        }
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("toolName", accumulator.get("toolName"));
        output.put("toolCallId", accumulator.get("toolCallId"));
        output.put("toolInput", parseToolInput(accumulator.get("toolInput")));
        endChunkSpan(output);
    }

    private Object parseToolInput(Object raw) {
        if (raw == null || raw.toString().isEmpty()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(raw.toString(), Object.class);
        } catch (JsonProcessingException e) {
            return raw.toString();
        }
    }

    private void createEventSpan(String chunkType, Map<String, Object> payload) {
        ensureStep();
        currentStepSpan.createEventSpan(StartSpanOptions.builder(SpanType.MODEL_CHUNK, chunkName(chunkType))
                .attributes(ChunkAttributes.of(chunkType, chunkSequence))
                .output(summarizePayload(payload))
                .build());
        chunkSequence++;
    }

    /**
     * Replace a bulk {@code data} field with its {@code size} so binary payloads are not
     * serialized again.
     */
    static Map<String, Object> summarizePayload(Map<String, Object> payload) {
        if (payload == null || payload.isEmpty()) {
            return null;
        }
        if (!payload.containsKey("data")) {
            return payload;
        }
        Map<String, Object> summary = new LinkedHashMap<>(payload);
        Object data = summary.remove("data");
        if (data instanceof CharSequence text) {
            summary.put("size", text.length());
        } else if (data instanceof byte[] bytes) {
            summary.put("size", bytes.length);
        } else if (data instanceof ByteBuffer buffer) {
            summary.put("size", buffer.remaining());
        } else if (data != null) {
            summary.put("size", data.toString().length());
        }
        return summary;
    }

    private void handleToolApproval(StreamChunk chunk) {
        ensureStep();
        String toolCallId = chunk.getString("toolCallId");
        String toolName = chunk.getString("toolName");
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("toolCallId", toolCallId);
        output.put("toolName", toolName);
        output.put("args", chunk.payload().get("args"));
        output.put("resumeSchema", chunk.payload().get("resumeSchema"));
        currentStepSpan.createEventSpan(StartSpanOptions.builder(SpanType.MODEL_CHUNK, chunkName(ChunkTypes.TOOL_CALL_APPROVAL))
                .attributes(new ChunkAttributes(ChunkTypes.TOOL_CALL_APPROVAL, chunkSequence, toolCallId, toolName))
                .output(output)
                .build());
        chunkSequence++;
    }

    /**
     * Consolidate a sub-agent's streamed output into one {@code tool-result} span per tool call.
     */
    private void handleToolOutput(StreamChunk chunk) {
        String toolCallId = chunk.getString("toolCallId");
        if (toolCallId == null) {
            return;
        }
        ToolOutputAccumulator acc = toolOutputs.get(toolCallId);
        if (acc == null) {
            ensureStep();
            String toolName = chunk.getString("toolName");
            int sequence = chunkSequence++;
            AiSpan span = currentStepSpan.createChildSpan(StartSpanOptions.builder(SpanType.MODEL_CHUNK, chunkName(ChunkTypes.TOOL_RESULT))
                    .attributes(ChunkAttributes.of(ChunkTypes.TOOL_RESULT, sequence))
                    .build());
            acc = new ToolOutputAccumulator(toolName != null ? toolName : "unknown", toolCallId, span);
            toolOutputs.put(toolCallId, acc);
        }

        Map<String, Object> inner = chunk.getMap("output");
        if (inner == null || inner.get("type") == null) {
            return;
        }
        Object innerPayload = inner.get("payload");
        Object text = innerPayload instanceof Map<?, ?> map ? map.get("text") : null;
        switch (inner.get("type").toString()) {
            case ChunkTypes.TEXT_DELTA -> {
                if (text != null) {
                    acc.text.append(text);
                }
            }
            case ChunkTypes.REASONING_DELTA -> {
                if (text != null) {
                    acc.reasoning.append(text);
                }
            }
            case ChunkTypes.FINISH, ChunkTypes.WORKFLOW_FINISH -> endToolOutput(toolCallId);
            default -> {
                // start/end markers and other inner chunks are not accumulated
            }
        }
    }

    private void endToolOutput(String toolCallId) {
        ToolOutputAccumulator acc = toolOutputs.remove(toolCallId);
        if (acc == null) {
            return;
        }
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("toolCallId", acc.toolCallId);
        output.put("toolName", acc.toolName);
        if (acc.text.length() > 0) {
            output.put("text", acc.text.toString());
        }
        if (acc.reasoning.length() > 0) {
            output.put("reasoning", acc.reasoning.toString());
        }
        acc.span.end(EndSpanOptions.output(output));
        streamedToolCallIds.add(toolCallId);
    }

    private void handleToolResult(StreamChunk chunk) {
        String toolCallId = chunk.getString("toolCallId");
        if (toolCallId != null && streamedToolCallIds.remove(toolCallId)) {
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>(chunk.payload());
        payload.remove("args");
        createEventSpan(chunk.type(), payload);
    }

    private static String chunkName(String chunkType) {
        return "chunk: '" + chunkType + "'";
    }

    public synchronized int getStepIndex() {
        return stepIndex;
    }

    public synchronized boolean hasActiveStep() {
        return currentStepSpan != null;
    }

    public synchronized boolean hasActiveChunk() {
        return currentChunkSpan != null;
    }

    public synchronized Instant getCompletionStartTime() {
        return completionStartTime;
    }

    private static final class ToolOutputAccumulator {
        private final String toolName;
        private final String toolCallId;
        private final AiSpan span;
        private final StringBuilder text = new StringBuilder();
        private final StringBuilder reasoning = new StringBuilder();

        private ToolOutputAccumulator(String toolName, String toolCallId, AiSpan span) {
            this.toolName = toolName;
            this.toolCallId = toolCallId;
            this.span = span;
        }
    }
}
