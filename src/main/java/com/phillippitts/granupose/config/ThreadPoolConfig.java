package com.phillippitts.granupose.config;

import com.phillippitts.granupose.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Thread pools owned by the bridge.
 *
 * <p>Pool settings come from {@link ThreadPoolProperties} ({@code threadpool.*}).
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Single-thread executor that serialises every engine lifecycle transition.
     *
     * <p>The queue is unbounded: lifecycle requests are rare and must never be rejected.
     * On shutdown, queued transitions (including the final stop) are allowed to finish.
     *
     * <p>MDC propagation: copies Log4j2 ThreadContext from the submitting thread so that
     * supervisor log lines keep the request id of the REST call that triggered them.
     *
     * @return executor confining supervisor state
     */
    @Bean(name = "engineSupervisorExecutor")
    public Executor engineSupervisorExecutor() {
        ThreadPoolProperties.SupervisorProperties supervisorProps = threadPoolProperties.getSupervisor();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix(supervisorProps.getThreadNamePrefix());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(supervisorProps.getAwaitTerminationSeconds());
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Scheduler for delayed and periodic work: watchdog restarts, forced kills, activity log.
     *
     * @return shared task scheduler
     */
    @Bean(name = "taskScheduler")
    public TaskScheduler taskScheduler() {
        ThreadPoolProperties.SchedulerProperties schedulerProps = threadPoolProperties.getScheduler();

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(schedulerProps.getPoolSize());
        scheduler.setThreadNamePrefix(schedulerProps.getThreadNamePrefix());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
