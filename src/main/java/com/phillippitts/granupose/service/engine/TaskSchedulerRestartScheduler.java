package com.phillippitts.granupose.service.engine;

import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;

/**
 * {@link RestartScheduler} backed by Spring's {@link TaskScheduler}.
 */
public class TaskSchedulerRestartScheduler implements RestartScheduler {

    private final TaskScheduler taskScheduler;
    private final Clock clock;

    public TaskSchedulerRestartScheduler(TaskScheduler taskScheduler, Clock clock) {
        this.taskScheduler = Objects.requireNonNull(taskScheduler, "taskScheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable schedule(Runnable task, Duration delay) {
        ScheduledFuture<?> future = taskScheduler.schedule(task, clock.instant().plus(delay));
        return () -> future.cancel(false);
    }
}
