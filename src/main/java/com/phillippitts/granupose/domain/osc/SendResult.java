package com.phillippitts.granupose.domain.osc;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of a single relay send.
 *
 * @param sent whether the datagram was handed to the transport
 * @param rateLimited {@code true} when dropped by the rate limiter, otherwise absent
 * @param error error code ({@code transport_not_ready}, {@code invalid_address},
 *              {@code invalid_arg}) or transport message, otherwise absent
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SendResult(boolean sent, Boolean rateLimited, String error) {

    public static final String TRANSPORT_NOT_READY = "transport_not_ready";
    public static final String INVALID_ADDRESS = "invalid_address";
    public static final String INVALID_ARG = "invalid_arg";

    private static final SendResult SENT = new SendResult(true, null, null);
    private static final SendResult DROPPED = new SendResult(false, true, null);

    public static SendResult delivered() {
        return SENT;
    }

    public static SendResult dropped() {
        return DROPPED;
    }

    public static SendResult failed(String error) {
        return new SendResult(false, null, error);
    }

    public boolean isRateLimited() {
        return Boolean.TRUE.equals(rateLimited);
    }

    public boolean isTransportNotReady() {
        return TRANSPORT_NOT_READY.equals(error);
    }
}
