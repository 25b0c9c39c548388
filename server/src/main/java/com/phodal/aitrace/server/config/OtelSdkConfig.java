package com.phodal.aitrace.server.config;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.exporter.otlp.http.trace.OtlpHttpSpanExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import io.opentelemetry.semconv.ServiceAttributes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Collection;
import java.util.Locale;

/**
 * OpenTelemetry SDK used by the bridge exporter.
 * Only created when ai-trace.otel.enabled=true.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "ai-trace.otel", name = "enabled", havingValue = "true")
public class OtelSdkConfig {

    private static final AttributeKey<String> SPAN_TYPE = AttributeKey.stringKey("ai.span.type");

    @Bean(destroyMethod = "close")
    public SdkTracerProvider aiTraceTracerProvider(AiTraceProperties properties) {
        AiTraceProperties.Otel otel = properties.getOtel();
        log.info("Initializing OpenTelemetry bridge with service.name={}, environment={}",
                properties.getServiceName(), otel.getEnvironment());

        Resource resource = Resource.getDefault()
                .merge(Resource.create(Attributes.builder()
                        .put(ServiceAttributes.SERVICE_NAME, properties.getServiceName())
                        .put(ServiceAttributes.SERVICE_VERSION, otel.getServiceVersion())
                        .put("deployment.environment", otel.getEnvironment())
                        .build()));

        return SdkTracerProvider.builder()
                .setResource(resource)
                .addSpanProcessor(BatchSpanProcessor.builder(buildSpanExporter(otel.getOtlp()))
                        .setScheduleDelay(Duration.ofSeconds(5))
                        .setMaxExportBatchSize(512)
                        .build())
                .build();
    }

    private SpanExporter buildSpanExporter(AiTraceProperties.Otlp otlp) {
        if (!otlp.isEnabled()) {
            log.info("OTLP export disabled, bridged spans are only logged");
            return new LoggingSpanExporter();
        }

        Duration timeout = Duration.ofMillis(otlp.getTimeoutMs());
        String protocol = otlp.getProtocol().toLowerCase(Locale.ROOT);
        if ("http/protobuf".equals(protocol) || "http".equals(protocol)) {
            log.info("Using OTLP HTTP exporter: {}", otlp.getEndpoint());
            var builder = OtlpHttpSpanExporter.builder()
                    .setEndpoint(otlp.getEndpoint())
                    .setTimeout(timeout);
            otlp.getHeaders().forEach(builder::addHeader);
            return builder.build();
        }
        log.info("Using OTLP gRPC exporter: {}", otlp.getEndpoint());
        var builder = OtlpGrpcSpanExporter.builder()
                .setEndpoint(otlp.getEndpoint())
                .setTimeout(timeout);
        otlp.getHeaders().forEach(builder::addHeader);
        return builder.build();
    }

    /**
     * Writes bridged spans to the debug log.
     */
    static class LoggingSpanExporter implements SpanExporter {
        @Override
        public CompletableResultCode export(Collection<SpanData> spans) {
            for (SpanData span : spans) {
                log.debug("Bridged span: traceId={}, spanId={}, name={}, type={}, duration={}ms",
                        span.getTraceId(), span.getSpanId(), span.getName(),
                        span.getAttributes().get(SPAN_TYPE),
                        (span.getEndEpochNanos() - span.getStartEpochNanos()) / 1_000_000);
            }
            return CompletableResultCode.ofSuccess();
        }

        @Override
        public CompletableResultCode flush() {
            return CompletableResultCode.ofSuccess();
        }

        @Override
        public CompletableResultCode shutdown() {
            return CompletableResultCode.ofSuccess();
        }
    }
}
