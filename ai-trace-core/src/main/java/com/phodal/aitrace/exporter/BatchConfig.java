package com.phodal.aitrace.exporter;

/**
 * Batching settings of a {@link BufferedExporter}.
 *
 * @param maxBatchSize buffered records that trigger an immediate flush
 * @param maxBatchWaitMs longest time a record waits in the buffer
 * @param maxRetries total upload attempts per batch before it is dropped
 * @param retryDelayMs base delay of the exponential retry backoff
 * @param maxBufferSize hard cap on buffered records, forces a flush even below {@code maxBatchSize}
 * @param shutdownTimeoutMs how long shutdown waits for the final upload
 */
public record BatchConfig(
    int maxBatchSize,
    long maxBatchWaitMs,
    int maxRetries,
    long retryDelayMs,
    int maxBufferSize,
    long shutdownTimeoutMs
) {

    public static final BatchConfig DEFAULT = new BatchConfig(20, 5000, 3, 500, 10_000, 30_000);

    public BatchConfig {
        if (maxBatchSize < 1) {
            throw new IllegalArgumentException("maxBatchSize must be at least 1, got " + maxBatchSize);
        }
        if (maxBatchWaitMs < 1) {
            throw new IllegalArgumentException("maxBatchWaitMs must be positive, got " + maxBatchWaitMs);
        }
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1, got " + maxRetries);
        }
        if (retryDelayMs < 0 || shutdownTimeoutMs < 0) {
            throw new IllegalArgumentException("Delays must not be negative");
        }
        if (maxBufferSize < 1) {
            throw new IllegalArgumentException("maxBufferSize must be at least 1, got " + maxBufferSize);
        }
    }

    public static BatchConfig of(int maxBatchSize, long maxBatchWaitMs, int maxRetries) {
        return new BatchConfig(maxBatchSize, maxBatchWaitMs, maxRetries, DEFAULT.retryDelayMs,
                Math.max(maxBatchSize, DEFAULT.maxBufferSize), DEFAULT.shutdownTimeoutMs);
    }

    public BatchConfig withRetryDelayMs(long retryDelayMs) {
        return new BatchConfig(maxBatchSize, maxBatchWaitMs, maxRetries, retryDelayMs, maxBufferSize, shutdownTimeoutMs);
    }

    public BatchConfig withMaxBufferSize(int maxBufferSize) {
        return new BatchConfig(maxBatchSize, maxBatchWaitMs, maxRetries, retryDelayMs, maxBufferSize, shutdownTimeoutMs);
    }
}
