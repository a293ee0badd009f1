package com.phillippitts.granupose.service.engine;

import java.time.Duration;

/**
 * Delayed-task seam used by the supervisor for watchdog restarts and forced kills.
 *
 * <p>Production code delegates to Spring's {@code TaskScheduler}; tests drive a virtual clock.
 */
@FunctionalInterface
public interface RestartScheduler {

    /**
     * Runs {@code task} once after {@code delay}.
     *
     * @return handle that cancels the task if it has not fired yet
     */
    Cancellable schedule(Runnable task, Duration delay);

    /** Handle for a scheduled task. Cancelling twice, or after the task ran, is a no-op. */
    @FunctionalInterface
    interface Cancellable {
        void cancel();
    }
}
