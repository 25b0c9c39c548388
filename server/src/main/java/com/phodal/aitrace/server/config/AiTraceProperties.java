package com.phodal.aitrace.server.config;

import com.phodal.aitrace.exporter.BatchConfig;
import com.phodal.aitrace.processor.RedactionStyle;
import com.phodal.aitrace.processor.SensitiveDataFilter;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for AI tracing.
 * Maps to ai-trace.* in application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "ai-trace")
public class AiTraceProperties {

    /**
     * Service name recorded in the metadata of every root span.
     */
    private String serviceName = "ai-trace";

    /**
     * Defaults shared by every buffered exporter.
     */
    private Batch batch = new Batch();

    private Cloud cloud = new Cloud();

    private Storage storage = new Storage();

    private Otel otel = new Otel();

    private Console console = new Console();

    private SensitiveData sensitiveData = new SensitiveData();

    @Data
    public static class Batch {
        private int maxBatchSize = BatchConfig.DEFAULT.maxBatchSize();
        private long maxBatchWaitMs = BatchConfig.DEFAULT.maxBatchWaitMs();

        /**
         * Total upload attempts per batch, the first one included.
         */
        private int maxRetries = BatchConfig.DEFAULT.maxRetries();
        private long retryDelayMs = BatchConfig.DEFAULT.retryDelayMs();
        private int maxBufferSize = BatchConfig.DEFAULT.maxBufferSize();
        private long shutdownTimeoutMs = BatchConfig.DEFAULT.shutdownTimeoutMs();

        public BatchConfig toBatchConfig() {
            return new BatchConfig(maxBatchSize, maxBatchWaitMs, maxRetries, retryDelayMs,
                    maxBufferSize, shutdownTimeoutMs);
        }
    }

    @Data
    public static class Cloud {
        private boolean enabled = false;

        /**
         * Base URL of the collector; spans are posted to {endpoint}/ai-traces/batch.
         */
        private String endpoint;

        /**
         * JWT access token. Its payload carries the teamId and projectId.
         */
        private String accessToken;

        private long timeoutMs = 10000;
    }

    @Data
    public static class Storage {
        private boolean enabled = true;

        /**
         * memory or jsonl.
         */
        private String type = "memory";

        /**
         * Workspace under which .ai-trace/spans.jsonl is written (jsonl only).
         */
        private String path = System.getProperty("user.dir");

        /**
         * realtime writes every lifecycle event, insert-only writes finished spans in batches.
         */
        private String strategy = "realtime";
    }

    @Data
    public static class Otel {
        /**
         * Whether to mirror AI spans into OpenTelemetry (default: false).
         */
        private boolean enabled = false;

        private String serviceVersion = "1.0.0";

        private String environment = "dev";

        private Otlp otlp = new Otlp();
    }

    @Data
    public static class Otlp {
        /**
         * When disabled, spans only go to the log.
         */
        private boolean enabled = true;

        /**
         * For gRPC: http://localhost:4317
         * For HTTP/protobuf: http://localhost:4318/v1/traces
         */
        private String endpoint = "http://localhost:4317";

        /**
         * grpc or http/protobuf.
         */
        private String protocol = "grpc";

        private Map<String, String> headers = new HashMap<>();

        private long timeoutMs = 10000;
    }

    @Data
    public static class Console {
        private boolean enabled = false;
    }

    @Data
    public static class SensitiveData {
        private boolean enabled = true;
        private List<String> fields = new ArrayList<>(SensitiveDataFilter.DEFAULT_SENSITIVE_FIELDS);
        private String redactionToken = SensitiveDataFilter.DEFAULT_REDACTION_TOKEN;
        private RedactionStyle redactionStyle = RedactionStyle.FULL;
    }
}
