package com.phillippitts.granupose.domain.osc;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of the channel convenience path: the relay result plus the resolved address.
 *
 * @param channel the channel number as requested (before clamping)
 * @param value the value that was sent, clamped to [0,1]
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChannelSendResult(boolean sent, Boolean rateLimited, String error,
                                String address, int channel, double value) {

    public static ChannelSendResult of(SendResult result, String address, int channel, double value) {
        return new ChannelSendResult(result.sent(), result.rateLimited(), result.error(), address, channel, value);
    }

    public boolean isRateLimited() {
        return Boolean.TRUE.equals(rateLimited);
    }

    public boolean isTransportNotReady() {
        return SendResult.TRANSPORT_NOT_READY.equals(error);
    }
}
