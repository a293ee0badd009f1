package com.phillippitts.granupose.exception;

/**
 * Thrown when a UDP socket cannot be bound (port in use, unknown host, bind timeout).
 * This is the only transport condition surfaced as an exception; send-time failures are
 * reported as results and counted.
 */
public class TransportUnavailableException extends GranuPoseException {

    private final String endpoint;

    public TransportUnavailableException(String endpoint, String reason) {
        super("UDP endpoint " + endpoint + " unavailable: " + reason);
        this.endpoint = endpoint;
    }

    public TransportUnavailableException(String endpoint, Throwable cause) {
        super("UDP endpoint " + endpoint + " unavailable: " + cause.getMessage(), cause);
        this.endpoint = endpoint;
    }

    public String getEndpoint() {
        return endpoint;
    }
}
