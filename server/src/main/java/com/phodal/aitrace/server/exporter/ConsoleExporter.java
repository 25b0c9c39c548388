package com.phodal.aitrace.server.exporter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phodal.aitrace.exporter.TracingExporter;
import com.phodal.aitrace.model.AiTracingEvent;
import com.phodal.aitrace.model.ExportedSpan;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Logs finished spans, for local debugging.
 */
@Slf4j
public class ConsoleExporter implements TracingExporter {

    public static final String NAME = "console-exporter";

    private final ObjectMapper objectMapper;

    public ConsoleExporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void exportEvent(AiTracingEvent event) {
        if (event.type() != AiTracingEvent.Type.SPAN_ENDED) {
            return;
        }
        ExportedSpan span = event.exportedSpan();
        long durationMs = span.endTime() != null
                ? Duration.between(span.startTime(), span.endTime()).toMillis()
                : 0;
        log.info("Span: {} | {} | {}ms | trace={} span={} parent={}{}",
                span.name(),
                span.type().getValue(),
                durationMs,
                span.traceId(),
                span.id(),
                span.parentSpanId() != null ? span.parentSpanId() : "-",
                span.errorInfo() != null ? " | ERROR: " + span.errorInfo().get("message") : "");

        if (log.isDebugEnabled() && span.attributes() != null) {
            try {
                log.debug("    Attributes: {}", objectMapper.writeValueAsString(span.attributes()));
            } catch (JsonProcessingException e) {
                log.debug("    Attributes not serializable: {}", e.getMessage());
            }
        }
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void shutdown() {
        log.debug("{} shutdown complete", NAME);
    }
}
