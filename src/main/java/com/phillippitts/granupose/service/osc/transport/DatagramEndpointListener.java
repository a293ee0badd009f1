package com.phillippitts.granupose.service.osc.transport;

import java.net.SocketAddress;

/**
 * Callback sink for {@link DatagramEndpoint}.
 */
public interface DatagramEndpointListener {

    /** Called once the socket is bound. */
    default void onTransportUp() {
    }

    /**
     * Called when the socket becomes unusable.
     *
     * @param cause failure cause, or {@code null} for an orderly close
     */
    default void onTransportDown(Throwable cause) {
    }

    /**
     * Called for every received datagram. The payload is a private copy.
     */
    void onDatagram(SocketAddress remote, byte[] payload);
}
