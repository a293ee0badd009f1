package com.phillippitts.granupose.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized counters for the bridge.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>OSC sends, rate-limit drops, validation rejects and transport errors</li>
 *   <li>Telemetry packets received, broadcast to clients and failed to decode</li>
 *   <li>Engine restarts performed by the watchdog and unexpected exits</li>
 *   <li>Open WebSocket sessions (gauge)</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus. The
 * same counters back the {@code counters} block of {@code GET /health}.
 */
@Component
public class BridgeMetrics {

    private static final String OSC_PREFIX = "granupose.osc";
    private static final String TELEMETRY_PREFIX = "granupose.telemetry";
    private static final String ENGINE_PREFIX = "granupose.engine";

    private final Counter oscSent;
    private final Counter oscDropped;
    private final Counter oscRejected;
    private final Counter oscErrors;
    private final Counter telemetryReceived;
    private final Counter telemetryBroadcast;
    private final Counter telemetryDecodeErrors;
    private final Counter engineRestarts;
    private final Counter engineExits;
    private final AtomicInteger activeWsClients = new AtomicInteger();

    public BridgeMetrics(MeterRegistry registry) {
        this.oscSent = Counter.builder(OSC_PREFIX + ".sent")
                .description("OSC datagrams handed to the transport")
                .register(registry);
        this.oscDropped = Counter.builder(OSC_PREFIX + ".dropped")
                .description("OSC messages dropped by the rate limiter")
                .register(registry);
        this.oscRejected = Counter.builder(OSC_PREFIX + ".rejected")
                .description("Requests rejected by validation")
                .register(registry);
        this.oscErrors = Counter.builder(OSC_PREFIX + ".errors")
                .description("UDP send and receive failures")
                .register(registry);
        this.telemetryReceived = Counter.builder(TELEMETRY_PREFIX + ".received")
                .description("Telemetry scan samples accepted")
                .register(registry);
        this.telemetryBroadcast = Counter.builder(TELEMETRY_PREFIX + ".broadcast")
                .description("Telemetry scan frames pushed to gateway clients")
                .register(registry);
        this.telemetryDecodeErrors = Counter.builder(TELEMETRY_PREFIX + ".decode.errors")
                .description("Inbound datagrams that were not valid OSC")
                .register(registry);
        this.engineRestarts = Counter.builder(ENGINE_PREFIX + ".restarts")
                .description("Engine restarts performed by the watchdog")
                .register(registry);
        this.engineExits = Counter.builder(ENGINE_PREFIX + ".exits")
                .description("Unexpected engine exits")
                .register(registry);
        Gauge.builder("granupose.ws.clients", activeWsClients, AtomicInteger::get)
                .description("Open gateway WebSocket sessions")
                .register(registry);
    }

    public void incrementOscSent() {
        oscSent.increment();
    }

    public void incrementOscDropped() {
        oscDropped.increment();
    }

    public void incrementOscRejected() {
        oscRejected.increment();
    }

    public void incrementOscErrors() {
        oscErrors.increment();
    }

    public void incrementTelemetryReceived() {
        telemetryReceived.increment();
    }

    public void incrementTelemetryBroadcast() {
        telemetryBroadcast.increment();
    }

    public void incrementTelemetryDecodeErrors() {
        telemetryDecodeErrors.increment();
    }

    public void incrementEngineRestarts() {
        engineRestarts.increment();
    }

    public void incrementEngineExits() {
        engineExits.increment();
    }

    public long oscSentCount() {
        return (long) oscSent.count();
    }

    public long oscDroppedCount() {
        return (long) oscDropped.count();
    }

    public long oscRejectedCount() {
        return (long) oscRejected.count();
    }

    public long oscErrorCount() {
        return (long) oscErrors.count();
    }

    public long telemetryReceivedCount() {
        return (long) telemetryReceived.count();
    }

    public long telemetryBroadcastCount() {
        return (long) telemetryBroadcast.count();
    }

    public long telemetryDecodeErrorCount() {
        return (long) telemetryDecodeErrors.count();
    }

    public long engineRestartCount() {
        return (long) engineRestarts.count();
    }

    public long engineExitCount() {
        return (long) engineExits.count();
    }

    public void wsClientConnected() {
        activeWsClients.incrementAndGet();
    }

    public void wsClientDisconnected() {
        activeWsClients.updateAndGet(n -> Math.max(0, n - 1));
    }

    public int activeWsClients() {
        return activeWsClients.get();
    }
}
