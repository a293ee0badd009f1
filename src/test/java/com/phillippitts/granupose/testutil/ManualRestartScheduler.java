package com.phillippitts.granupose.testutil;

import com.phillippitts.granupose.service.engine.RestartScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Virtual-time scheduler: tasks run only when a test advances time past their due point.
 */
public class ManualRestartScheduler implements RestartScheduler {

    private final List<Scheduled> tasks = new ArrayList<>();
    private long nowMs;

    @Override
    public synchronized Cancellable schedule(Runnable task, Duration delay) {
        Scheduled scheduled = new Scheduled(task, nowMs + delay.toMillis());
        tasks.add(scheduled);
        return () -> {
            synchronized (ManualRestartScheduler.this) {
                tasks.remove(scheduled);
            }
        };
    }

    /**
     * Advances virtual time and runs every task that became due, in due order.
     */
    public void advance(Duration duration) {
        long target;
        synchronized (this) {
            target = nowMs + duration.toMillis();
        }
        while (true) {
            Scheduled next;
            synchronized (this) {
                next = tasks.stream()
                        .filter(t -> t.dueMs <= target)
                        .min(Comparator.comparingLong(t -> t.dueMs))
                        .orElse(null);
                if (next == null) {
                    nowMs = target;
                    return;
                }
                tasks.remove(next);
                nowMs = next.dueMs;
            }
            next.task.run();
        }
    }

    public synchronized int pendingCount() {
        return tasks.size();
    }

    /** Delay of the earliest pending task relative to virtual now, or -1 when idle. */
    public synchronized long nextDelayMs() {
        return tasks.stream()
                .mapToLong(t -> t.dueMs - nowMs)
                .min()
                .orElse(-1);
    }

    private static final class Scheduled {
        private final Runnable task;
        private final long dueMs;

        private Scheduled(Runnable task, long dueMs) {
            this.task = task;
            this.dueMs = dueMs;
        }
    }
}
