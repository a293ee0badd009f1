package com.phillippitts.granupose.domain.telemetry;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Point-in-time view of the telemetry listener.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TelemetryStatus(
        boolean telemetryReady,
        String listenHost,
        int listenPort,
        String helloAddress,
        String scanAddress,
        TelemetryHelloSample lastHello,
        TelemetryScanSample lastScan,
        long bufferedScans,
        String error
) {
}
