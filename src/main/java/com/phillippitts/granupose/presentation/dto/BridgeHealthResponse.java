package com.phillippitts.granupose.presentation.dto;

/**
 * Body of {@code GET /health}.
 */
public record BridgeHealthResponse(
        String status,
        boolean bridgeReady,
        boolean oscReady,
        boolean telemetryReady,
        int activeWsClients,
        long uptimeSeconds,
        Counters counters,
        BridgeConfigView config
) {

    public record Counters(
            long oscSentCount,
            long telemetryReceivedCount,
            long telemetryBroadcastCount,
            long droppedRateLimitedCount,
            long rejectedValidationCount,
            long oscErrorCount
    ) {
    }
}
