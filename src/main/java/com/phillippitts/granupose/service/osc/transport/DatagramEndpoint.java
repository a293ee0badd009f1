package com.phillippitts.granupose.service.osc.transport;

import java.net.InetSocketAddress;
import java.util.concurrent.CompletableFuture;

/**
 * Minimal port for a UDP socket used by the OSC relay and the telemetry listener.
 *
 * <p>Implementations may be backed by Netty or by an in-memory test harness. Callbacks to the
 * {@link DatagramEndpointListener} are serialized by the implementation.
 */
public interface DatagramEndpoint {

    /**
     * Registers the listener for inbound datagrams and lifecycle signals. Must be called
     * before {@link #start()}.
     */
    void setListener(DatagramEndpointListener listener);

    /**
     * Binds the socket.
     *
     * @return future completing with the bound local address, or exceptionally if the
     *         bind failed
     */
    CompletableFuture<InetSocketAddress> start();

    /**
     * Closes the socket and releases transport resources. Idempotent.
     */
    void stop();

    /**
     * Sends one datagram.
     *
     * @return future completing once the datagram was written, or exceptionally on failure
     */
    CompletableFuture<Void> send(InetSocketAddress remote, byte[] payload);

    /** Whether the socket is currently bound and usable. */
    boolean isBound();
}
