package com.phillippitts.granupose.exception;

/**
 * Thrown by diagnostic waits (hello wait, capture window) when the engine did not produce
 * the expected telemetry in time.
 */
public class TelemetryTimeoutException extends GranuPoseException {

    private final long timeoutMs;

    public TelemetryTimeoutException(String what, long timeoutMs) {
        super("Timed out after " + timeoutMs + "ms waiting for " + what);
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
