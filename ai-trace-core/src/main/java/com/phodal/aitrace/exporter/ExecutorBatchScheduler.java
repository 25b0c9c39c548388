package com.phodal.aitrace.exporter;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link BatchScheduler} backed by a single daemon thread, so an exporter's background
 * work never runs concurrently with itself and never keeps the JVM alive.
 */
public class ExecutorBatchScheduler implements BatchScheduler {

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final ScheduledExecutorService executor;

    public ExecutorBatchScheduler(String name) {
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "ai-trace-" + name + "-" + THREAD_COUNTER.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public ScheduledTask schedule(Runnable task, long delayMs) {
        ScheduledFuture<?> future = executor.schedule(task, delayMs, TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public void execute(Runnable task) {
        executor.execute(task);
    }

    @Override
    public void shutdown() {
        executor.shutdown();
    }
}
