package com.phodal.aitrace.exporter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Retry with exponential backoff for sinks that have no retrying transport of their own.
 */
public final class Retries {
    private static final Logger log = LoggerFactory.getLogger(Retries.class);

    private Retries() {
        // Utility class
    }

    /**
     * A unit of work that may fail with a checked exception.
     */
    @FunctionalInterface
    public interface Attempt {
        void run() throws Exception;
    }

    /**
     * Run {@code attempt} up to {@code maxAttempts} times. Attempt {@code n} (0-based) that
     * fails is followed by a pause of {@code baseDelayMs * 2^n}. The returned future fails
     * with the last error once every attempt has failed.
     */
    public static CompletableFuture<Void> withRetry(Attempt attempt, int maxAttempts, long baseDelayMs,
                                                    BatchScheduler scheduler, String description) {
        CompletableFuture<Void> result = new CompletableFuture<>();
        run(attempt, 0, maxAttempts, baseDelayMs, scheduler, description, result);
        return result;
    }

    private static void run(Attempt attempt, int attemptIndex, int maxAttempts, long baseDelayMs,
                            BatchScheduler scheduler, String description, CompletableFuture<Void> result) {
        try {
            attempt.run();
            result.complete(null);
        } catch (Exception e) {
            if (attemptIndex + 1 >= maxAttempts) {
                result.completeExceptionally(e);
                return;
            }
            long delay = baseDelayMs * (1L << attemptIndex);
            log.warn("{} failed, retrying (attempt {}/{}, next retry in {}ms): {}",
                    description, attemptIndex + 1, maxAttempts, delay, e.getMessage());
            try {
                scheduler.schedule(() -> run(attempt, attemptIndex + 1, maxAttempts, baseDelayMs,
                        scheduler, description, result), delay);
            } catch (RuntimeException scheduleError) {
                result.completeExceptionally(new CompletionException(scheduleError));
            }
        }
    }
}
