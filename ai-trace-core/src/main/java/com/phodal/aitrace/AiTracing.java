package com.phodal.aitrace;

import com.phodal.aitrace.exporter.TracingExporter;
import com.phodal.aitrace.model.AiSpan;
import com.phodal.aitrace.model.AiTracingEvent;
import com.phodal.aitrace.model.ExportedSpan;
import com.phodal.aitrace.model.SpanEmitter;
import com.phodal.aitrace.model.StartSpanOptions;
import com.phodal.aitrace.processor.SpanProcessor;
import com.phodal.aitrace.util.SpanIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point of the tracing pipeline.
 *
 * <p>Creates root spans and routes every lifecycle transition of spans in its traces through
 * the processor chain and then to each exporter. Failures in processors or exporters are
 * logged and never propagated to the caller.</p>
 */
public class AiTracing implements SpanEmitter {
    private static final Logger log = LoggerFactory.getLogger(AiTracing.class);

    private final TracingConfig config;
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public AiTracing(TracingConfig config) {
        this.config = config;
        log.info("Initialized AI tracing '{}' with {} processors and {} exporters",
                config.serviceName(), config.processors().size(), config.exporters().size());
        config.exporters().forEach(exporter ->
                log.info("  - {}: {}", exporter.getName(), exporter.isEnabled() ? "enabled" : "disabled"));
    }

    /**
     * Start the root span of a new trace. The service name is added to its metadata.
     */
    public AiSpan startSpan(StartSpanOptions options) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("serviceName", config.serviceName());
        if (options.metadata() != null) {
            metadata.putAll(options.metadata());
        }
        StartSpanOptions withService = new StartSpanOptions(options.type(), options.name(),
                options.attributes(), metadata, options.input(), options.output());
        return AiSpan.startRoot(this, withService);
    }

    @Override
    public Instant now() {
        return config.clock().instant();
    }

    @Override
    public String newSpanId() {
        return SpanIds.newSpanId();
    }

    @Override
    public String newTraceId() {
        return SpanIds.newTraceId();
    }

    @Override
    public void emit(AiTracingEvent.Type type, AiSpan span) {
        if (shutdown.get()) {
            log.debug("Tracing is shut down, dropping {} for span {}", type, span.getId());
            return;
        }
        ExportedSpan processed = process(span.exportSpan());
        if (processed == null) {
            return;
        }
        AiTracingEvent event = new AiTracingEvent(type, processed);
        for (TracingExporter exporter : config.exporters()) {
            if (!exporter.isEnabled()) {
                continue;
            }
            try {
                exporter.exportEvent(event);
            } catch (Exception e) {
                log.error("Error exporting {} to {}: {}", type, exporter.getName(), e.getMessage(), e);
            }
        }
    }

    private ExportedSpan process(ExportedSpan span) {
        ExportedSpan current = span;
        for (SpanProcessor processor : config.processors()) {
            try {
                current = processor.process(current);
            } catch (Exception e) {
                log.error("Span processor {} failed for span {}, dropping event: {}",
                        processor.getName(), span.id(), e.getMessage(), e);
                return null;
            }
            if (current == null) {
                log.debug("Span {} filtered out by {}", span.id(), processor.getName());
                return null;
            }
        }
        return current;
    }

    /**
     * Shut down processors and exporters. Only the first call has an effect.
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        for (SpanProcessor processor : config.processors()) {
            try {
                processor.shutdown();
            } catch (Exception e) {
                log.warn("Failed to shut down processor {}: {}", processor.getName(), e.getMessage());
            }
        }
        for (TracingExporter exporter : config.exporters()) {
            try {
                exporter.shutdown();
            } catch (Exception e) {
                log.warn("Failed to shut down exporter {}: {}", exporter.getName(), e.getMessage());
            }
        }
        log.info("AI tracing '{}' shut down", config.serviceName());
    }

    public List<TracingExporter> getExporters() {
        return config.exporters();
    }

    public List<SpanProcessor> getProcessors() {
        return config.processors();
    }

    public boolean isShutdown() {
        return shutdown.get();
    }
}
