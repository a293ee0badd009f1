package com.phillippitts.granupose.service.relay;

import com.phillippitts.granupose.config.osc.OscProperties;
import com.phillippitts.granupose.domain.osc.BatchSendResult;
import com.phillippitts.granupose.domain.osc.ChannelSendResult;
import com.phillippitts.granupose.domain.osc.ChannelValue;
import com.phillippitts.granupose.domain.osc.CommandArgument;
import com.phillippitts.granupose.domain.osc.CommandRequest;
import com.phillippitts.granupose.domain.osc.OscArgument;
import com.phillippitts.granupose.domain.osc.OscMessage;
import com.phillippitts.granupose.domain.osc.SendResult;
import com.phillippitts.granupose.exception.TransportUnavailableException;
import com.phillippitts.granupose.service.metrics.BridgeMetrics;
import com.phillippitts.granupose.service.osc.OscCodec;
import com.phillippitts.granupose.service.osc.transport.DatagramEndpoint;
import com.phillippitts.granupose.service.osc.transport.DatagramEndpointFactory;
import com.phillippitts.granupose.service.osc.transport.DatagramEndpointListener;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Validated, rate-limited outbound OSC over UDP.
 *
 * <p>Send pipeline: validate and coerce the request, check transport readiness, apply the
 * per-key rate limit, encode and hand the datagram to the socket. None of the steps throw;
 * every outcome is reported as a {@link SendResult} and counted in {@link BridgeMetrics}.
 *
 * <p>The local socket is bound to an ephemeral port. A send while the socket is not ready
 * returns {@code transport_not_ready} immediately and triggers a background reopen.
 */
@Service
public class OscCommandRelay {

    private static final Logger LOG = LogManager.getLogger(OscCommandRelay.class);

    private static final InetSocketAddress EPHEMERAL_BIND = new InetSocketAddress("0.0.0.0", 0);

    private final OscProperties props;
    private final DatagramEndpointFactory endpointFactory;
    private final BridgeMetrics metrics;
    private final RateLimiter rateLimiter;
    private final Object lifecycleLock = new Object();

    private volatile InetSocketAddress target;
    private volatile DatagramEndpoint endpoint;
    private volatile boolean ready;
    private volatile String lastError;
    private volatile boolean closed;
    private CompletableFuture<Void> opening;

    public OscCommandRelay(OscProperties props,
                           @Qualifier("oscEndpointFactory") DatagramEndpointFactory endpointFactory,
                           BridgeMetrics metrics,
                           Clock clock) {
        this.props = Objects.requireNonNull(props, "props");
        this.endpointFactory = Objects.requireNonNull(endpointFactory, "endpointFactory");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.rateLimiter = new RateLimiter(props.getMaxMessagesPerSecond(), clock);
        this.target = InetSocketAddress.createUnresolved(props.getTargetHost(), props.getTargetPort());
    }

    @PostConstruct
    void openOnStartup() {
        open().whenComplete((ok, error) -> {
            if (error != null) {
                LOG.error("OSC relay unavailable at startup: {}", rootMessage(error));
            }
        });
    }

    /**
     * Binds the local UDP socket.
     *
     * <p>Concurrent calls share the same in-flight attempt. The future fails with
     * {@link TransportUnavailableException} if the bind fails or does not complete within
     * {@code bridge.osc.bind-timeout-ms}.
     */
    public CompletableFuture<Void> open() {
        synchronized (lifecycleLock) {
            if (ready && endpoint != null) {
                return CompletableFuture.completedFuture(null);
            }
            if (opening != null) {
                return opening;
            }
            closed = false;
            DatagramEndpoint candidate = endpointFactory.create(EPHEMERAL_BIND);
            candidate.setListener(new RelaySocketListener(candidate));
            String targetLabel = describeTarget();

            CompletableFuture<Void> attempt = candidate.start()
                    .orTimeout(props.getBindTimeoutMs(), TimeUnit.MILLISECONDS)
                    .handle((local, error) -> {
                        if (error != null) {
                            candidate.stop();
                            Throwable cause = unwrap(error);
                            String reason = cause instanceof TimeoutException ? "OSC open timeout" : rootMessage(cause);
                            markNotReady(reason);
                            throw new TransportUnavailableException(targetLabel, reason);
                        }
                        adopt(candidate);
                        LOG.info("OSC ready: forwarding to {} (local {})", targetLabel, local);
                        return null;
                    });
            opening = attempt;
            attempt.whenComplete((v, e) -> {
                synchronized (lifecycleLock) {
                    if (opening == attempt) {
                        opening = null;
                    }
                }
            });
            return attempt;
        }
    }

    /**
     * Retargets the relay and reopens the socket.
     */
    public CompletableFuture<Void> reconfigure(String host, int port) {
        if (host == null || host.isBlank() || port < 1 || port > 65535) {
            throw new IllegalArgumentException("Invalid OSC target " + host + ":" + port);
        }
        close();
        this.target = InetSocketAddress.createUnresolved(host.trim(), port);
        LOG.info("OSC target reconfigured to {}", describeTarget());
        return open();
    }

    @PreDestroy
    public void close() {
        DatagramEndpoint current;
        synchronized (lifecycleLock) {
            closed = true;
            current = endpoint;
            endpoint = null;
            ready = false;
        }
        if (current != null) {
            current.stop();
        }
    }

    /**
     * Validates, rate-limits and sends one command.
     */
    public SendResult send(CommandRequest request) {
        Objects.requireNonNull(request, "request");

        String address = request.address();
        if (address == null || !address.startsWith("/")) {
            metrics.incrementOscRejected();
            return SendResult.failed(SendResult.INVALID_ADDRESS);
        }
        List<OscArgument> args = new ArrayList<>(request.arguments().size());
        for (CommandArgument raw : request.arguments()) {
            OscArgument arg = coerce(raw);
            if (arg == null) {
                metrics.incrementOscRejected();
                return SendResult.failed(SendResult.INVALID_ARG);
            }
            args.add(arg);
        }
        return dispatch(new OscMessage(address, args), request.effectiveRateLimitKey());
    }

    /**
     * Sends {@code value} to channel {@code channel} as a single float.
     *
     * <p>The channel is clamped to {@code [1, channelCount]} and the value to {@code [0,1]};
     * the rate-limit key uses the channel number as requested.
     */
    public ChannelSendResult sendChannel(int channel, double value) {
        double safeValue = clamp01(value);
        String address = channelAddress(channel);
        SendResult result = dispatch(OscMessage.of(address, OscArgument.ofFloat((float) safeValue)),
                "channel:" + channel);
        return ChannelSendResult.of(result, address, channel, safeValue);
    }

    public BatchSendResult sendChannels(List<ChannelValue> channels) {
        int sent = 0;
        int dropped = 0;
        for (ChannelValue cv : channels) {
            ChannelSendResult result = sendChannel(cv.channel(), cv.value());
            if (result.sent()) {
                sent++;
            } else if (result.isRateLimited()) {
                dropped++;
            }
        }
        return new BatchSendResult(channels.size(), sent, dropped);
    }

    public BatchSendResult sendBatch(List<CommandRequest> requests) {
        int sent = 0;
        int dropped = 0;
        for (CommandRequest request : requests) {
            SendResult result = send(request);
            if (result.sent()) {
                sent++;
            } else if (result.isRateLimited()) {
                dropped++;
            }
        }
        return new BatchSendResult(requests.size(), sent, dropped);
    }

    /**
     * Channel address {@code <prefix>/<NN>} with the channel clamped into range.
     */
    public String channelAddress(int channel) {
        int safe = Math.max(1, Math.min(props.getChannelCount(), channel));
        return props.getChannelPrefix() + "/" + String.format(Locale.ROOT, "%02d", safe);
    }

    public boolean isReady() {
        DatagramEndpoint current = endpoint;
        return ready && current != null && current.isBound();
    }

    public String getLastError() {
        return lastError;
    }

    public String getTargetHost() {
        return target.getHostString();
    }

    public int getTargetPort() {
        return target.getPort();
    }

    public int getChannelCount() {
        return props.getChannelCount();
    }

    long minIntervalMs() {
        return rateLimiter.minIntervalMs();
    }

    private SendResult dispatch(OscMessage message, String rateLimitKey) {
        DatagramEndpoint current = endpoint;
        if (!ready || current == null || !current.isBound()) {
            requestReopen();
            return SendResult.failed(SendResult.TRANSPORT_NOT_READY);
        }
        if (!rateLimiter.tryAcquire(rateLimitKey)) {
            metrics.incrementOscDropped();
            return SendResult.dropped();
        }

        CompletableFuture<Void> written;
        try {
            byte[] payload = OscCodec.encode(message);
            written = current.send(resolvedTarget(), payload);
        } catch (RuntimeException e) {
            recordSendFailure(e);
            return SendResult.failed(rootMessage(e));
        }

        if (written.isCompletedExceptionally()) {
            String reason = written.handle((v, e) -> rootMessage(e)).join();
            recordSendFailure(new IllegalStateException(reason));
            return SendResult.failed(reason);
        }
        written.whenComplete((v, error) -> {
            if (error != null) {
                recordSendFailure(error);
            }
        });
        metrics.incrementOscSent();
        return SendResult.delivered();
    }

    private InetSocketAddress resolvedTarget() {
        InetSocketAddress t = target;
        if (t.isUnresolved()) {
            InetSocketAddress resolved = new InetSocketAddress(t.getHostString(), t.getPort());
            if (resolved.isUnresolved()) {
                throw new IllegalStateException("Cannot resolve OSC target host " + t.getHostString());
            }
            target = resolved;
            return resolved;
        }
        return t;
    }

    private void requestReopen() {
        if (closed) {
            return;
        }
        open().whenComplete((v, error) -> {
            if (error != null) {
                LOG.debug("OSC reopen failed: {}", rootMessage(error));
            }
        });
    }

    private void adopt(DatagramEndpoint candidate) {
        DatagramEndpoint previous;
        synchronized (lifecycleLock) {
            if (closed) {
                candidate.stop();
                throw new TransportUnavailableException(describeTarget(), "relay closed while opening");
            }
            previous = endpoint;
            endpoint = candidate;
            ready = true;
            lastError = null;
        }
        if (previous != null && previous != candidate) {
            previous.stop();
        }
    }

    private void recordSendFailure(Throwable error) {
        String reason = rootMessage(error);
        metrics.incrementOscErrors();
        markNotReady(reason);
        LOG.warn("OSC send to {} failed: {}", describeTarget(), reason);
    }

    private void markNotReady(String reason) {
        ready = false;
        lastError = reason;
    }

    private String describeTarget() {
        InetSocketAddress t = target;
        return t.getHostString() + ":" + t.getPort();
    }

    /**
     * Coerces an untrusted argument; {@code null} when the type is unknown or a numeric
     * value is not a finite number.
     */
    static OscArgument coerce(CommandArgument raw) {
        if (raw == null || raw.type() == null) {
            return null;
        }
        String type = raw.type();
        Object value = raw.value();
        if ("s".equals(type)) {
            return OscArgument.ofString(value == null ? "" : String.valueOf(value));
        }
        if (!"f".equals(type) && !"i".equals(type) && !"d".equals(type)) {
            return null;
        }
        Double numeric = toFiniteNumber(value);
        if (numeric == null) {
            return null;
        }
        return switch (type) {
            case "f" -> OscArgument.ofFloat(numeric.floatValue());
            case "i" -> OscArgument.ofInt((int) numeric.doubleValue());
            default -> OscArgument.ofDouble(numeric);
        };
    }

    private static Double toFiniteNumber(Object value) {
        double d;
        if (value instanceof Number n) {
            d = n.doubleValue();
        } else if (value instanceof String s && !s.isBlank()) {
            try {
                d = Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return Double.isFinite(d) ? d : null;
    }

    private static double clamp01(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private static String rootMessage(Throwable error) {
        Throwable t = unwrap(error);
        String message = t.getMessage();
        return message == null || message.isBlank() ? t.getClass().getSimpleName() : message;
    }

    /**
     * Tracks socket-level failures reported by the endpoint.
     */
    private final class RelaySocketListener implements DatagramEndpointListener {

        private final DatagramEndpoint owner;

        RelaySocketListener(DatagramEndpoint owner) {
            this.owner = owner;
        }

        @Override
        public void onTransportDown(Throwable cause) {
            if (endpoint != owner) {
                return;
            }
            if (cause != null) {
                metrics.incrementOscErrors();
                lastError = rootMessage(cause);
                LOG.warn("OSC socket error: {}", lastError);
            }
            if (!owner.isBound()) {
                ready = false;
            }
        }

        @Override
        public void onDatagram(SocketAddress remote, byte[] payload) {
            // the relay socket is send-only
        }
    }
}
