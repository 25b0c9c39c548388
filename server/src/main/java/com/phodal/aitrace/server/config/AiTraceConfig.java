package com.phodal.aitrace.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phodal.aitrace.AiTracing;
import com.phodal.aitrace.TracingConfig;
import com.phodal.aitrace.exporter.BatchConfig;
import com.phodal.aitrace.exporter.BatchStorageExporter;
import com.phodal.aitrace.exporter.ExecutorBatchScheduler;
import com.phodal.aitrace.exporter.ExportErrorReporter;
import com.phodal.aitrace.exporter.StorageExporter;
import com.phodal.aitrace.exporter.TracingExporter;
import com.phodal.aitrace.processor.SensitiveDataFilter;
import com.phodal.aitrace.server.exporter.CloudExporter;
import com.phodal.aitrace.server.exporter.ConsoleExporter;
import com.phodal.aitrace.server.exporter.OtelBridgeExporter;
import com.phodal.aitrace.server.metrics.MicrometerErrorReporter;
import com.phodal.aitrace.storage.InMemoryTracingStorage;
import com.phodal.aitrace.storage.JsonlTracingStorage;
import com.phodal.aitrace.storage.TracingStorage;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Wires the tracing pipeline from ai-trace.* properties.
 * Exporters are owned by the {@link AiTracing} bean and shut down with it.
 */
@Slf4j
@Configuration
public class AiTraceConfig {

    @Bean
    public ExportErrorReporter exportErrorReporter(MeterRegistry meterRegistry) {
        return new MicrometerErrorReporter(meterRegistry);
    }

    @Bean
    @ConditionalOnProperty(prefix = "ai-trace.storage", name = "enabled", havingValue = "true", matchIfMissing = true)
    public TracingStorage tracingStorage(AiTraceProperties properties) {
        AiTraceProperties.Storage storage = properties.getStorage();
        String type = storage.getType().toLowerCase(Locale.ROOT);
        if ("jsonl".equals(type)) {
            JsonlTracingStorage jsonl = JsonlTracingStorage.forWorkspace(Path.of(storage.getPath()));
            log.info("Storing spans in {}", jsonl.getSpanPath());
            return jsonl;
        }
        if (!"memory".equals(type)) {
            throw new IllegalArgumentException("Unknown ai-trace.storage.type '" + storage.getType()
                    + "', expected memory or jsonl");
        }
        log.info("Storing spans in memory");
        return new InMemoryTracingStorage();
    }

    @Bean(destroyMethod = "shutdown")
    public AiTracing aiTracing(AiTraceProperties properties,
                               ExportErrorReporter errorReporter,
                               ObjectMapper objectMapper,
                               WebClient.Builder webClientBuilder,
                               ObjectProvider<TracingStorage> storage,
                               ObjectProvider<SdkTracerProvider> tracerProvider) {
        TracingConfig.Builder config = TracingConfig.builder().serviceName(properties.getServiceName());

        AiTraceProperties.SensitiveData sensitiveData = properties.getSensitiveData();
        if (sensitiveData.isEnabled()) {
            config.processor(new SensitiveDataFilter(sensitiveData.getFields(),
                    sensitiveData.getRedactionToken(), sensitiveData.getRedactionStyle()));
        }

        config.exporters(buildExporters(properties, errorReporter, objectMapper, webClientBuilder,
                storage.getIfAvailable(), tracerProvider.getIfAvailable()));
        return new AiTracing(config.build());
    }

    List<TracingExporter> buildExporters(AiTraceProperties properties,
                                         ExportErrorReporter errorReporter,
                                         ObjectMapper objectMapper,
                                         WebClient.Builder webClientBuilder,
                                         TracingStorage storage,
                                         SdkTracerProvider tracerProvider) {
        BatchConfig batchConfig = properties.getBatch().toBatchConfig();
        List<TracingExporter> exporters = new ArrayList<>();

        if (storage != null) {
            if ("insert-only".equalsIgnoreCase(properties.getStorage().getStrategy())) {
                exporters.add(new BatchStorageExporter(storage, batchConfig,
                        new ExecutorBatchScheduler(BatchStorageExporter.NAME), Clock.systemUTC(), errorReporter));
            } else {
                exporters.add(new StorageExporter(storage));
            }
        }

        AiTraceProperties.Cloud cloud = properties.getCloud();
        if (cloud.isEnabled()) {
            exporters.add(new CloudExporter(cloud.getEndpoint(), cloud.getAccessToken(), batchConfig,
                    webClientBuilder.clone(), Duration.ofMillis(cloud.getTimeoutMs()), errorReporter));
        }

        if (tracerProvider != null) {
            exporters.add(new OtelBridgeExporter(tracerProvider));
        }

        if (properties.getConsole().isEnabled()) {
            exporters.add(new ConsoleExporter(objectMapper));
        }

        if (exporters.isEmpty()) {
            log.warn("No AI trace exporters configured, spans are created but not exported");
        }
        return exporters;
    }
}
