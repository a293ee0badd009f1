package com.phillippitts.granupose.service.osc.transport;

import java.net.InetSocketAddress;

/**
 * Creates unstarted {@link DatagramEndpoint}s. Lets the relay and the listener reopen sockets
 * and lets tests substitute in-memory endpoints.
 */
@FunctionalInterface
public interface DatagramEndpointFactory {

    /**
     * @param bindAddress local address to bind; port 0 selects an ephemeral port
     */
    DatagramEndpoint create(InetSocketAddress bindAddress);
}
