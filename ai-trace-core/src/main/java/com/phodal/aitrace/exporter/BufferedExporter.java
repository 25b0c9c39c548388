package com.phodal.aitrace.exporter;

import com.phodal.aitrace.model.AiTracingEvent;
import com.phodal.aitrace.model.ExportedSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Accumulates span records and uploads them in batches.
 *
 * <p>A batch is flushed when it reaches {@link BatchConfig#maxBatchSize()}, when its oldest
 * record has waited {@link BatchConfig#maxBatchWaitMs()}, or on shutdown. The first record
 * appended to an empty buffer schedules exactly one flush timer. A flush swaps in a fresh
 * buffer before uploading, so records exported during an upload go to the next batch.</p>
 *
 * <p>Uploads run on the exporter's {@link BatchScheduler}, one batch at a time and in flush
 * order. A batch whose upload fails after all attempts is dropped, logged and reported; it
 * is never re-queued and no error reaches the caller of {@link #exportEvent}.</p>
 *
 * @param <R> the sink-specific record type
 */
public abstract class BufferedExporter<R> implements TracingExporter {
    private static final Logger log = LoggerFactory.getLogger(BufferedExporter.class);

    protected final BatchConfig config;
    protected final BatchScheduler scheduler;
    protected final Clock clock;
    private final ExportErrorReporter errorReporter;
    private final String name;

    private final Object bufferLock = new Object();
    private List<R> records = new ArrayList<>();
    private Instant firstEventTime;
    private BatchScheduler.ScheduledTask flushTimer;
    private long batchId;

    private final Object uploadLock = new Object();
    private CompletableFuture<Void> uploadChain = CompletableFuture.completedFuture(null);

    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    protected BufferedExporter(String name, BatchConfig config) {
        this(name, config, new ExecutorBatchScheduler(name), Clock.systemUTC(), ExportErrorReporter.NOOP);
    }

    protected BufferedExporter(String name, BatchConfig config, BatchScheduler scheduler, Clock clock,
                               ExportErrorReporter errorReporter) {
        this.name = name;
        this.config = config;
        this.scheduler = scheduler;
        this.clock = clock;
        this.errorReporter = errorReporter != null ? errorReporter : ExportErrorReporter.NOOP;
    }

    /**
     * Whether this sink wants records for the given event type.
     */
    protected abstract boolean accepts(AiTracingEvent.Type type);

    /**
     * Project a span onto the sink's record shape.
     */
    protected abstract R toRecord(AiTracingEvent event);

    /**
     * Upload one batch, including any retries. The future fails once the batch is given up.
     */
    protected abstract CompletableFuture<Void> uploadBatch(List<R> batch);

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void exportEvent(AiTracingEvent event) {
        if (!isEnabled()) {
            return;
        }
        if (shutdown.get()) {
            log.debug("{} is shut down, ignoring {} for span {}", name, event.type(), event.exportedSpan().id());
            return;
        }
        if (!accepts(event.type())) {
            return;
        }
        R record;
        try {
            record = toRecord(event);
        } catch (RuntimeException e) {
            ExportedSpan span = event.exportedSpan();
            log.warn("{} could not convert span {} ({}), skipping: {}", name, span.id(), span.type(), e.getMessage());
            return;
        }
        FlushReason reason;
        synchronized (bufferLock) {
            if (records.isEmpty()) {
                firstEventTime = clock.instant();
                scheduleFlush();
            }
            records.add(record);
            reason = flushReason();
        }
        if (reason != null) {
            flush(reason);
        }
    }

    /**
     * Check the size and time triggers. Always false for an empty buffer.
     */
    public boolean shouldFlush() {
        synchronized (bufferLock) {
            return flushReason() != null;
        }
    }

    private FlushReason flushReason() {
        int size = records.size();
        if (size == 0) {
            return null;
        }
        if (size >= config.maxBufferSize()) {
            return FlushReason.OVERFLOW;
        }
        if (size >= config.maxBatchSize()) {
            return FlushReason.SIZE;
        }
        if (firstEventTime != null
                && Duration.between(firstEventTime, clock.instant()).toMillis() >= config.maxBatchWaitMs()) {
            return FlushReason.TIME;
        }
        return null;
    }

    private void scheduleFlush() {
        if (flushTimer != null) {
            return;
        }
        long armedFor = batchId;
        flushTimer = scheduler.schedule(() -> flush(FlushReason.TIME, armedFor), config.maxBatchWaitMs());
    }

    private void cancelFlushTimer() {
        if (flushTimer != null) {
            flushTimer.cancel();
            flushTimer = null;
        }
    }

    /**
     * Upload everything buffered so far. The returned future completes once this batch has
     * been uploaded or dropped; it never completes exceptionally.
     */
    public CompletableFuture<Void> flush() {
        return flush(FlushReason.MANUAL);
    }

    private CompletableFuture<Void> flush(FlushReason reason) {
        return flush(reason, -1);
    }

    /**
     * @param expectedBatchId the batch a flush timer was armed for, or -1 for whatever is buffered
     */
    private CompletableFuture<Void> flush(FlushReason reason, long expectedBatchId) {
        List<R> batch;
        synchronized (bufferLock) {
            if (expectedBatchId >= 0 && expectedBatchId != batchId) {
                log.debug("{} ignoring flush timer of batch {}, already flushed", name, expectedBatchId);
                return CompletableFuture.completedFuture(null);
            }
            cancelFlushTimer();
            if (records.isEmpty()) {
                return CompletableFuture.completedFuture(null);
            }
            batch = records;
            records = new ArrayList<>();
            firstEventTime = null;
            batchId++;
        }
        synchronized (uploadLock) {
            uploadChain = uploadChain.thenComposeAsync(ignored -> upload(batch, reason), scheduler::execute);
            return uploadChain;
        }
    }

    private CompletableFuture<Void> upload(List<R> batch, FlushReason reason) {
        long startNanos = System.nanoTime();
        CompletableFuture<Void> attempt;
        try {
            attempt = uploadBatch(batch);
        } catch (RuntimeException e) {
            attempt = CompletableFuture.failedFuture(e);
        }
        return attempt.handle((ignored, error) -> {
            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
            if (error == null) {
                log.debug("{} batch flushed successfully: batchSize={}, flushReason={}, durationMs={}",
                        name, batch.size(), reason, durationMs);
                errorReporter.onBatchExported(name, batch.size());
            } else {
                Throwable cause = unwrap(error);
                log.error("{} batch flush failed after {} attempts, dropping batch: droppedBatchSize={}, error={}",
                        name, config.maxRetries(), batch.size(), cause.getMessage(), cause);
                errorReporter.onBatchDropped(name, batch.size(), cause);
            }
            return null;
        });
    }

    private static Throwable unwrap(Throwable error) {
        if ((error instanceof CompletionException || error instanceof ExecutionException) && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    /**
     * Stop the flush timer, upload what is left and wait for it. Failures are logged,
     * never thrown. Later calls do nothing.
     */
    @Override
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        int remaining;
        synchronized (bufferLock) {
            cancelFlushTimer();
            remaining = records.size();
        }
        if (remaining > 0) {
            log.info("{} flushing {} remaining records on shutdown", name, remaining);
        }
        CompletableFuture<Void> pending;
        flush(FlushReason.SHUTDOWN);
        synchronized (uploadLock) {
            pending = uploadChain;
        }
        try {
            pending.get(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{} interrupted while flushing on shutdown", name);
        } catch (ExecutionException | TimeoutException e) {
            log.error("{} failed to flush remaining records during shutdown: {}", name, e.getMessage(), e);
        } finally {
            scheduler.shutdown();
        }
        log.info("{} shutdown complete", name);
    }

    public int getBufferSize() {
        synchronized (bufferLock) {
            return records.size();
        }
    }

    public Instant getFirstEventTime() {
        synchronized (bufferLock) {
            return firstEventTime;
        }
    }

    public boolean isFlushScheduled() {
        synchronized (bufferLock) {
            return flushTimer != null;
        }
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    public BatchConfig getConfig() {
        return config;
    }
}
