package com.phillippitts.granupose.testutil;

import com.phillippitts.granupose.service.osc.transport.DatagramEndpoint;
import com.phillippitts.granupose.service.osc.transport.DatagramEndpointFactory;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Creates {@link InMemoryDatagramEndpoint}s and keeps them for inspection.
 */
public class InMemoryDatagramEndpointFactory implements DatagramEndpointFactory {

    private final List<InMemoryDatagramEndpoint> created = new CopyOnWriteArrayList<>();
    private volatile String nextBindFailure;

    /** The next created endpoint fails to bind with {@code reason}. */
    public InMemoryDatagramEndpointFactory failNextBind(String reason) {
        this.nextBindFailure = reason;
        return this;
    }

    @Override
    public DatagramEndpoint create(InetSocketAddress bindAddress) {
        InMemoryDatagramEndpoint endpoint = new InMemoryDatagramEndpoint(bindAddress);
        String failure = nextBindFailure;
        if (failure != null) {
            nextBindFailure = null;
            endpoint.failBind(failure);
        }
        created.add(endpoint);
        return endpoint;
    }

    public List<InMemoryDatagramEndpoint> created() {
        return List.copyOf(created);
    }

    public InMemoryDatagramEndpoint last() {
        return created.get(created.size() - 1);
    }
}
