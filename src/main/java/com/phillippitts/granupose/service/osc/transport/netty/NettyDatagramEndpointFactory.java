package com.phillippitts.granupose.service.osc.transport.netty;

import com.phillippitts.granupose.service.osc.transport.DatagramEndpoint;
import com.phillippitts.granupose.service.osc.transport.DatagramEndpointFactory;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Creates {@link NettyUdpDatagramEndpoint}s whose event-loop threads share a name prefix.
 */
public final class NettyDatagramEndpointFactory implements DatagramEndpointFactory {

    private final String threadName;

    public NettyDatagramEndpointFactory(String threadName) {
        this.threadName = Objects.requireNonNull(threadName, "threadName");
    }

    @Override
    public DatagramEndpoint create(InetSocketAddress bindAddress) {
        return new NettyUdpDatagramEndpoint(bindAddress, threadName);
    }
}
