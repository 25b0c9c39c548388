package com.phodal.aitrace.exporter;

/**
 * Runs the background work of a buffered exporter: flush timers, uploads and retry delays.
 */
public interface BatchScheduler {

    /**
     * Run {@code task} once after {@code delayMs} milliseconds.
     */
    ScheduledTask schedule(Runnable task, long delayMs);

    /**
     * Run {@code task} as soon as possible, off the caller's thread.
     */
    void execute(Runnable task);

    void shutdown();

    /**
     * Handle of a scheduled task.
     */
    interface ScheduledTask {
        void cancel();
    }
}
