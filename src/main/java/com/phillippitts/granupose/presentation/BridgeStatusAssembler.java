package com.phillippitts.granupose.presentation;

import com.phillippitts.granupose.config.gateway.GatewayProperties;
import com.phillippitts.granupose.config.osc.OscProperties;
import com.phillippitts.granupose.config.telemetry.TelemetryProperties;
import com.phillippitts.granupose.presentation.dto.BridgeConfigView;
import com.phillippitts.granupose.presentation.dto.BridgeHealthResponse;
import com.phillippitts.granupose.presentation.dto.BridgeHelloPayload;
import com.phillippitts.granupose.service.metrics.BridgeMetrics;
import com.phillippitts.granupose.service.relay.OscCommandRelay;
import com.phillippitts.granupose.service.telemetry.TelemetryListener;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Builds the gateway's status views (health, effective config, WebSocket hello) from the
 * live relay, listener and counters.
 */
@Component
public class BridgeStatusAssembler {

    private final OscCommandRelay relay;
    private final TelemetryListener telemetry;
    private final BridgeMetrics metrics;
    private final OscProperties oscProps;
    private final TelemetryProperties telemetryProps;
    private final GatewayProperties gatewayProps;
    private final Clock clock;
    private final String bridgeHost;
    private final long startedAtMs;

    private volatile int bridgePort;

    public BridgeStatusAssembler(OscCommandRelay relay,
                                 TelemetryListener telemetry,
                                 BridgeMetrics metrics,
                                 OscProperties oscProps,
                                 TelemetryProperties telemetryProps,
                                 GatewayProperties gatewayProps,
                                 Clock clock,
                                 @Value("${server.address:0.0.0.0}") String bridgeHost,
                                 @Value("${server.port:8787}") int configuredPort) {
        this.relay = relay;
        this.telemetry = telemetry;
        this.metrics = metrics;
        this.oscProps = oscProps;
        this.telemetryProps = telemetryProps;
        this.gatewayProps = gatewayProps;
        this.clock = clock;
        this.bridgeHost = bridgeHost;
        this.bridgePort = configuredPort;
        this.startedAtMs = clock.millis();
    }

    /** Records the port actually bound by the servlet container. */
    @EventListener
    public void onWebServerInitialized(WebServerInitializedEvent event) {
        this.bridgePort = event.getWebServer().getPort();
    }

    public BridgeHealthResponse health() {
        BridgeHealthResponse.Counters counters = new BridgeHealthResponse.Counters(
                metrics.oscSentCount(),
                metrics.telemetryReceivedCount(),
                metrics.telemetryBroadcastCount(),
                metrics.oscDroppedCount(),
                metrics.oscRejectedCount(),
                metrics.oscErrorCount());
        return new BridgeHealthResponse(
                "ok",
                true,
                relay.isReady(),
                telemetry.isReady(),
                metrics.activeWsClients(),
                (clock.millis() - startedAtMs) / 1000,
                counters,
                config());
    }

    public BridgeConfigView config() {
        return new BridgeConfigView(
                bridgeHost,
                bridgePort,
                relay.getTargetHost(),
                relay.getTargetPort(),
                telemetryProps.getListenHost(),
                telemetryListenPort(),
                telemetryProps.getScanAddress(),
                oscProps.getChannelPrefix(),
                relay.getChannelCount(),
                oscProps.getMaxMessagesPerSecond(),
                oscProps.getActivityLogIntervalMs(),
                gatewayProps.allowedOrigin());
    }

    public BridgeHelloPayload hello() {
        return new BridgeHelloPayload(
                relay.isReady(),
                telemetry.isReady(),
                bridgePort,
                relay.getTargetHost(),
                relay.getTargetPort(),
                telemetryListenPort(),
                relay.getChannelCount());
    }

    private int telemetryListenPort() {
        int bound = telemetry.getListenPort();
        return bound > 0 ? bound : telemetryProps.getListenPort();
    }
}
