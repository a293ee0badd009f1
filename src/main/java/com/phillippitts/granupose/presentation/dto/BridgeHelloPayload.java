package com.phillippitts.granupose.presentation.dto;

/**
 * Payload of the {@code bridge:hello} frame sent to every new WebSocket session.
 */
public record BridgeHelloPayload(
        boolean oscReady,
        boolean telemetryReady,
        int bridgePort,
        String oscTargetHost,
        int oscTargetPort,
        int telemetryListenPort,
        int channelCount
) {
}
