package com.phodal.aitrace;

import com.phodal.aitrace.exporter.TracingExporter;
import com.phodal.aitrace.processor.SpanProcessor;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-instance configuration of an {@link AiTracing} pipeline.
 *
 * @param serviceName name recorded in every root span's metadata
 * @param processors processors applied in order to each span snapshot
 * @param exporters exporters receiving every processed event
 * @param clock time source for span timestamps
 */
public record TracingConfig(
    String serviceName,
    List<SpanProcessor> processors,
    List<TracingExporter> exporters,
    Clock clock
) {

    public static final String DEFAULT_SERVICE_NAME = "ai-trace";

    public TracingConfig {
        serviceName = serviceName != null ? serviceName : DEFAULT_SERVICE_NAME;
        processors = processors != null ? List.copyOf(processors) : List.of();
        exporters = exporters != null ? List.copyOf(exporters) : List.of();
        clock = clock != null ? clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String serviceName = DEFAULT_SERVICE_NAME;
        private final List<SpanProcessor> processors = new ArrayList<>();
        private final List<TracingExporter> exporters = new ArrayList<>();
        private Clock clock = Clock.systemUTC();

        public Builder serviceName(String serviceName) {
            this.serviceName = serviceName;
            return this;
        }

        public Builder processor(SpanProcessor processor) {
            this.processors.add(processor);
            return this;
        }

        public Builder processors(List<? extends SpanProcessor> processors) {
            this.processors.addAll(processors);
            return this;
        }

        public Builder exporter(TracingExporter exporter) {
            this.exporters.add(exporter);
            return this;
        }

        public Builder exporters(List<? extends TracingExporter> exporters) {
            this.exporters.addAll(exporters);
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public TracingConfig build() {
            return new TracingConfig(serviceName, processors, exporters, clock);
        }
    }
}
