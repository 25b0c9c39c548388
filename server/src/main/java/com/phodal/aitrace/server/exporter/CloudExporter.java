package com.phodal.aitrace.server.exporter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phodal.aitrace.exporter.BatchConfig;
import com.phodal.aitrace.exporter.BatchScheduler;
import com.phodal.aitrace.exporter.BufferedExporter;
import com.phodal.aitrace.exporter.ExecutorBatchScheduler;
import com.phodal.aitrace.exporter.ExportErrorReporter;
import com.phodal.aitrace.exporter.SpanRecordMapper;
import com.phodal.aitrace.model.AiTracingEvent;
import com.phodal.aitrace.serialization.BoundedSerializer;
import com.phodal.aitrace.util.ObjectMappers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Uploads finished spans to the cloud collector in batches.
 *
 * <p>Each batch is posted as {@code {"spans": [...]}} to {@code {endpoint}/ai-traces/batch}
 * with the access token as bearer credential. Transport errors and non-2xx responses are
 * retried with exponential backoff until {@link BatchConfig#maxRetries()} attempts were made.</p>
 *
 * <p>Without an endpoint or a decodable access token the exporter disables itself.</p>
 */
@Slf4j
public class CloudExporter extends BufferedExporter<CloudSpanRecord> {

    public static final String NAME = "cloud-exporter";
    public static final String BATCH_PATH = "/ai-traces/batch";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final SpanRecordMapper mapper;
    private final Duration timeout;
    private final String batchUrl;
    private final AccessTokenClaims claims;
    private final String disabledReason;

    public CloudExporter(String endpoint, String accessToken, BatchConfig config, WebClient.Builder webClientBuilder,
                         Duration timeout, ExportErrorReporter errorReporter) {
        this(endpoint, accessToken, config, webClientBuilder, timeout,
                new ExecutorBatchScheduler(NAME), Clock.systemUTC(), errorReporter);
    }

    public CloudExporter(String endpoint, String accessToken, BatchConfig config, WebClient.Builder webClientBuilder,
                         Duration timeout, BatchScheduler scheduler, Clock clock, ExportErrorReporter errorReporter) {
        super(NAME, config, scheduler, clock, errorReporter);
        this.objectMapper = ObjectMappers.create();
        this.mapper = new SpanRecordMapper(new BoundedSerializer(), clock);
        this.timeout = timeout;

        String reason = null;
        AccessTokenClaims decoded = null;
        if (accessToken == null || accessToken.isBlank()) {
            reason = "no access token configured";
        } else if (endpoint == null || endpoint.isBlank()) {
            reason = "no endpoint configured";
        } else {
            try {
                decoded = AccessTokenClaims.decode(accessToken, objectMapper);
            } catch (IllegalArgumentException e) {
                reason = e.getMessage();
            }
        }
        this.claims = decoded;
        this.disabledReason = reason;

        if (reason != null) {
            log.warn("{} disabled: {}. Spans will not be uploaded.", NAME, reason);
            this.batchUrl = null;
            this.webClient = null;
        } else {
            this.batchUrl = stripTrailingSlash(endpoint) + BATCH_PATH;
            this.webClient = webClientBuilder
                    .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
                    .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .build();
            log.info("{} uploading to {} for team {} / project {}", NAME, batchUrl,
                    decoded.teamId(), decoded.projectId());
        }
    }

    @Override
    public boolean isEnabled() {
        return disabledReason == null;
    }

    @Override
    protected boolean accepts(AiTracingEvent.Type type) {
        return type == AiTracingEvent.Type.SPAN_ENDED;
    }

    @Override
    protected CloudSpanRecord toRecord(AiTracingEvent event) {
        return CloudSpanRecord.from(mapper.toCreateRecord(event.exportedSpan()), claims.teamId(), claims.projectId());
    }

    @Override
    protected CompletableFuture<Void> uploadBatch(List<CloudSpanRecord> batch) {
        String body;
        try {
            body = objectMapper.writeValueAsString(Map.of("spans", batch));
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(e);
        }
        return webClient.post()
                .uri(batchUrl)
                .bodyValue(body)
                .retrieve()
                .toBodilessEntity()
                .timeout(timeout)
                .retryWhen(Retry.backoff(config.maxRetries() - 1L, Duration.ofMillis(config.retryDelayMs()))
                        .jitter(0)
                        .doBeforeRetry(signal -> log.warn("{} upload failed, retrying (attempt {}/{}): {}",
                                NAME, signal.totalRetries() + 2, config.maxRetries(), signal.failure().getMessage()))
                        .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()))
                .then()
                .toFuture();
    }

    public String getBatchUrl() {
        return batchUrl;
    }

    public AccessTokenClaims getClaims() {
        return claims;
    }

    private static String stripTrailingSlash(String endpoint) {
        return endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
    }
}
