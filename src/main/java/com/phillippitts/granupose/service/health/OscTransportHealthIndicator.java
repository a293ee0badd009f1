package com.phillippitts.granupose.service.health;

import com.phillippitts.granupose.service.relay.OscCommandRelay;
import com.phillippitts.granupose.service.telemetry.TelemetryListener;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the two UDP transports.
 *
 * <ul>
 *   <li>UP: outbound relay and telemetry listener both bound</li>
 *   <li>DEGRADED: exactly one of them bound</li>
 *   <li>DOWN: neither bound</li>
 * </ul>
 */
@Component
public class OscTransportHealthIndicator implements HealthIndicator {

    private final OscCommandRelay relay;
    private final TelemetryListener telemetry;

    public OscTransportHealthIndicator(OscCommandRelay relay, TelemetryListener telemetry) {
        this.relay = relay;
        this.telemetry = telemetry;
    }

    @Override
    public Health health() {
        boolean oscReady = relay.isReady();
        boolean telemetryReady = telemetry.isReady();

        Health.Builder builder = new Health.Builder();
        if (oscReady && telemetryReady) {
            builder.up();
        } else if (oscReady || telemetryReady) {
            builder.status("DEGRADED");
        } else {
            builder.down();
        }
        builder.withDetail("osc", describe(oscReady, relay.getLastError()))
                .withDetail("oscTarget", relay.getTargetHost() + ":" + relay.getTargetPort())
                .withDetail("telemetry", describe(telemetryReady, telemetry.status().error()))
                .withDetail("telemetryPort", telemetry.getListenPort());
        return builder.build();
    }

    private static String describe(boolean ready, String lastError) {
        if (ready) {
            return "ready";
        }
        return lastError != null ? "unavailable: " + lastError : "unavailable";
    }
}
