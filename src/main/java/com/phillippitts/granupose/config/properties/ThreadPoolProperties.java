package com.phillippitts.granupose.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the bridge's own threads.
 *
 * <p>The supervisor executor is always single-threaded (engine state is confined to it);
 * only its name is tunable. The scheduler drives watchdog restarts, forced kills and the
 * periodic activity log.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private SupervisorProperties supervisor = new SupervisorProperties();
    private SchedulerProperties scheduler = new SchedulerProperties();

    public SupervisorProperties getSupervisor() {
        return supervisor;
    }

    public void setSupervisor(SupervisorProperties supervisor) {
        this.supervisor = supervisor;
    }

    public SchedulerProperties getScheduler() {
        return scheduler;
    }

    public void setScheduler(SchedulerProperties scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Engine supervisor executor configuration.
     */
    public static class SupervisorProperties {
        private String threadNamePrefix = "engine-supervisor-";
        private int awaitTerminationSeconds = 10;

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }

        public int getAwaitTerminationSeconds() {
            return awaitTerminationSeconds;
        }

        public void setAwaitTerminationSeconds(int awaitTerminationSeconds) {
            this.awaitTerminationSeconds = awaitTerminationSeconds;
        }
    }

    /**
     * Task scheduler configuration.
     */
    public static class SchedulerProperties {
        private int poolSize = 2;
        private String threadNamePrefix = "bridge-scheduler-";

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
