package com.phodal.aitrace.fixtures;

import com.phodal.aitrace.exporter.BatchScheduler;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Scheduler driven by the test. {@link #execute} runs inline; delayed tasks wait until
 * {@link #advance} passes their due time.
 */
public class ManualBatchScheduler implements BatchScheduler {
    private final MutableClock clock;
    private final List<Pending> pending = new ArrayList<>();
    private long elapsedMs;
    private int scheduledCount;
    private int shutdownCount;
    private boolean cancellationIgnored;

    public ManualBatchScheduler(MutableClock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized ScheduledTask schedule(Runnable task, long delayMs) {
        Pending entry = new Pending(task, elapsedMs + delayMs);
        pending.add(entry);
        scheduledCount++;
        return () -> {
            synchronized (ManualBatchScheduler.this) {
                if (!cancellationIgnored) {
                    pending.remove(entry);
                }
            }
        };
    }

    /**
     * Make later cancellations no-ops, as when a timer task has already started running.
     */
    public synchronized void ignoreCancellation() {
        cancellationIgnored = true;
    }

    @Override
    public void execute(Runnable task) {
        task.run();
    }

    @Override
    public synchronized void shutdown() {
        shutdownCount++;
        pending.clear();
    }

    /**
     * Move time forward, running every task that becomes due, in due order.
     */
    public void advance(long millis) {
        long target;
        synchronized (this) {
            target = elapsedMs + millis;
        }
        while (true) {
            Pending next;
            synchronized (this) {
                next = pending.stream()
                        .filter(p -> p.dueAt <= target)
                        .min(Comparator.comparingLong(p -> p.dueAt))
                        .orElse(null);
                if (next == null) {
                    long step = target - elapsedMs;
                    elapsedMs = target;
                    clock.advanceMillis(step);
                    return;
                }
                pending.remove(next);
                long step = next.dueAt - elapsedMs;
                elapsedMs = next.dueAt;
                clock.advanceMillis(step);
            }
            next.task.run();
        }
    }

    public synchronized int getPendingCount() {
        return pending.size();
    }

    public synchronized int getScheduledCount() {
        return scheduledCount;
    }

    public synchronized int getShutdownCount() {
        return shutdownCount;
    }

    private record Pending(Runnable task, long dueAt) {
    }
}
