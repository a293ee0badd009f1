package com.phillippitts.granupose.presentation.dto;

/**
 * Effective bridge configuration as reported by {@code GET /config} and embedded in
 * {@code GET /health}.
 */
public record BridgeConfigView(
        String bridgeHost,
        int bridgePort,
        String oscTargetHost,
        int oscTargetPort,
        String telemetryListenHost,
        int telemetryListenPort,
        String telemetryScanAddress,
        String oscChannelPrefix,
        int channelCount,
        int maxMessagesPerSecond,
        long oscActivityLogIntervalMs,
        String allowedOrigin
) {
}
