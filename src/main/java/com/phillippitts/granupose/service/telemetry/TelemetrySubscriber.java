package com.phillippitts.granupose.service.telemetry;

import com.phillippitts.granupose.domain.telemetry.TelemetryHelloSample;
import com.phillippitts.granupose.domain.telemetry.TelemetryScanSample;

/**
 * Receives telemetry samples as they arrive. Called on the listener's network thread;
 * implementations must not block.
 */
public interface TelemetrySubscriber {

    void onScan(TelemetryScanSample sample);

    default void onHello(TelemetryHelloSample hello) {
    }
}
