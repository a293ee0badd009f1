package com.phillippitts.granupose.service.relay;

import com.phillippitts.granupose.config.osc.OscProperties;
import com.phillippitts.granupose.config.telemetry.TelemetryProperties;
import com.phillippitts.granupose.service.metrics.BridgeMetrics;
import com.phillippitts.granupose.util.TimeUtils;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * Periodic one-line activity summary: deltas of OSC sent, telemetry received, rate-limited
 * drops and errors since the previous tick. Quiet intervals are not logged.
 */
@Component
public class OscActivityLogger {

    private static final Logger LOG = LogManager.getLogger(OscActivityLogger.class);

    private final BridgeMetrics metrics;
    private final OscCommandRelay relay;
    private final TelemetryProperties telemetryProps;
    private final TaskScheduler scheduler;
    private final long intervalMs;

    private long lastSent;
    private long lastReceived;
    private long lastDropped;
    private long lastErrors;
    private ScheduledFuture<?> task;

    public OscActivityLogger(BridgeMetrics metrics,
                             OscCommandRelay relay,
                             OscProperties oscProps,
                             TelemetryProperties telemetryProps,
                             TaskScheduler scheduler) {
        this.metrics = metrics;
        this.relay = relay;
        this.telemetryProps = telemetryProps;
        this.scheduler = scheduler;
        this.intervalMs = oscProps.getActivityLogIntervalMs();
    }

    @PostConstruct
    void start() {
        if (intervalMs <= 0) {
            LOG.debug("OSC activity log disabled");
            return;
        }
        lastSent = metrics.oscSentCount();
        lastReceived = metrics.telemetryReceivedCount();
        lastDropped = metrics.oscDroppedCount();
        lastErrors = metrics.oscErrorCount();
        task = scheduler.scheduleAtFixedRate(this::logActivity, Duration.ofMillis(intervalMs));
    }

    @PreDestroy
    void stop() {
        if (task != null) {
            task.cancel(false);
            task = null;
        }
    }

    /**
     * Logs the deltas since the previous call.
     *
     * @return {@code true} if a line was logged
     */
    synchronized boolean logActivity() {
        long sent = metrics.oscSentCount();
        long received = metrics.telemetryReceivedCount();
        long dropped = metrics.oscDroppedCount();
        long errors = metrics.oscErrorCount();

        long sentDelta = sent - lastSent;
        long receivedDelta = received - lastReceived;
        long droppedDelta = dropped - lastDropped;
        long errorDelta = errors - lastErrors;

        lastSent = sent;
        lastReceived = received;
        lastDropped = dropped;
        lastErrors = errors;

        if (sentDelta <= 0 && receivedDelta <= 0 && droppedDelta <= 0 && errorDelta <= 0) {
            return false;
        }
        LOG.info("Activity {}: oscSent={} telemetryRx={} rateLimited={} errors={} target={}:{} telemetry={}:{}",
                TimeUtils.formatMillis(intervalMs), sentDelta, receivedDelta, droppedDelta, errorDelta,
                relay.getTargetHost(), relay.getTargetPort(),
                telemetryProps.getListenHost(), telemetryProps.getListenPort());
        return true;
    }
}
