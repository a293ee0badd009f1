package com.phillippitts.granupose.service.telemetry;

import com.phillippitts.granupose.config.telemetry.TelemetryProperties;
import com.phillippitts.granupose.domain.engine.EngineStatus;
import com.phillippitts.granupose.domain.osc.OscMessage;
import com.phillippitts.granupose.domain.telemetry.ScanCapture;
import com.phillippitts.granupose.domain.telemetry.ScanWindowStats;
import com.phillippitts.granupose.domain.telemetry.TelemetryHelloSample;
import com.phillippitts.granupose.domain.telemetry.TelemetryScanSample;
import com.phillippitts.granupose.domain.telemetry.TelemetryStatus;
import com.phillippitts.granupose.exception.OscCodecException;
import com.phillippitts.granupose.exception.TelemetryTimeoutException;
import com.phillippitts.granupose.exception.TransportUnavailableException;
import com.phillippitts.granupose.service.engine.EngineStatusChangedEvent;
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
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Inbound telemetry: owns the telemetry UDP socket, parses hello and scan messages, keeps the
 * latest hello, a bounded ring of scans, and fans samples out to subscribers.
 *
 * <p>Datagrams arrive on the endpoint's single event-loop thread, which is the only writer of
 * the buffers. Bundles are flattened; datagrams that are not valid OSC are counted and
 * discarded. Buffers are cleared whenever the engine enters {@code starting}.
 */
@Service
public class TelemetryListener {

    private static final Logger LOG = LogManager.getLogger(TelemetryListener.class);

    public static final int DEFAULT_CAPTURE_MIN_COUNT = 6;
    public static final long CAPTURE_TIMEOUT_SLACK_MS = 3000;
    static final long DEFAULT_HELLO_TIMEOUT_MS = 20_000;

    private final TelemetryProperties props;
    private final DatagramEndpointFactory endpointFactory;
    private final BridgeMetrics metrics;
    private final Clock clock;
    private final TelemetryParser parser;
    private final ScanRingBuffer scans;
    private final List<TelemetrySubscriber> subscribers = new CopyOnWriteArrayList<>();

    private volatile DatagramEndpoint endpoint;
    private volatile boolean ready;
    private volatile String lastError;
    private volatile int boundPort;
    private volatile TelemetryHelloSample lastHello;
    private volatile TelemetryScanSample lastScan;

    public TelemetryListener(TelemetryProperties props,
                             @Qualifier("telemetryEndpointFactory") DatagramEndpointFactory endpointFactory,
                             BridgeMetrics metrics,
                             Clock clock) {
        this.props = Objects.requireNonNull(props, "props");
        this.endpointFactory = Objects.requireNonNull(endpointFactory, "endpointFactory");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.parser = new TelemetryParser(props.getHelloAddress(), props.getScanAddress());
        this.scans = new ScanRingBuffer(props.getScanBufferCapacity());
        this.boundPort = props.getListenPort();
    }

    @PostConstruct
    void openOnStartup() {
        start().whenComplete((v, error) -> {
            if (error != null) {
                LOG.error("Telemetry listener unavailable: {}", lastError);
            }
        });
    }

    /**
     * Binds the telemetry socket on {@code listen-host:listen-port}, replacing any previous one.
     */
    public CompletableFuture<Void> start() {
        stop();
        InetSocketAddress bindAddress = new InetSocketAddress(props.getListenHost(), props.getListenPort());
        DatagramEndpoint candidate = endpointFactory.create(bindAddress);
        candidate.setListener(new TelemetrySocketListener(candidate));
        endpoint = candidate;
        ready = false;

        return candidate.start().handle((local, error) -> {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                lastError = cause.getMessage() != null ? cause.getMessage() : cause.toString();
                ready = false;
                throw new TransportUnavailableException(bindAddress.toString(), lastError);
            }
            if (endpoint == candidate) {
                boundPort = local.getPort();
                ready = true;
                lastError = null;
                LOG.info("Telemetry OSC ready: listening on {}:{}", props.getListenHost(), boundPort);
            }
            return null;
        });
    }

    @PreDestroy
    public void stop() {
        DatagramEndpoint current = endpoint;
        endpoint = null;
        ready = false;
        if (current != null) {
            current.stop();
        }
    }

    /**
     * Registers a subscriber.
     *
     * @return handle that removes the subscriber when run
     */
    public Runnable subscribe(TelemetrySubscriber subscriber) {
        Objects.requireNonNull(subscriber, "subscriber");
        subscribers.add(subscriber);
        return () -> subscribers.remove(subscriber);
    }

    /**
     * Clears buffered scans and the last hello whenever the engine starts.
     */
    @EventListener
    public void onEngineStatusChanged(EngineStatusChangedEvent event) {
        if (event.current().status() == EngineStatus.STARTING) {
            clearBuffers();
        }
    }

    public void clearBuffers() {
        scans.clear();
        lastScan = null;
        lastHello = null;
    }

    /**
     * Handles one inbound datagram. Visible for the socket listener and tests.
     */
    void onDatagram(byte[] payload) {
        List<OscMessage> messages;
        try {
            messages = OscCodec.decode(payload);
        } catch (OscCodecException e) {
            metrics.incrementTelemetryDecodeErrors();
            LOG.debug("Discarding undecodable telemetry datagram ({} bytes): {}", payload.length, e.getMessage());
            return;
        }
        long now = clock.millis();
        for (OscMessage message : messages) {
            if (parser.isHello(message)) {
                parser.parseHello(message, now).ifPresent(this::acceptHello);
            } else if (parser.isScan(message)) {
                parser.parseScan(message, now).ifPresent(this::acceptScan);
            }
        }
    }

    private void acceptHello(TelemetryHelloSample hello) {
        lastHello = hello;
        LOG.info("Telemetry hello: {}", hello.argsMap());
        for (TelemetrySubscriber subscriber : subscribers) {
            try {
                subscriber.onHello(hello);
            } catch (RuntimeException e) {
                LOG.warn("Telemetry subscriber failed on hello: {}", e.toString());
            }
        }
    }

    private void acceptScan(TelemetryScanSample sample) {
        scans.append(sample);
        lastScan = sample;
        metrics.incrementTelemetryReceived();
        for (TelemetrySubscriber subscriber : subscribers) {
            try {
                subscriber.onScan(sample);
            } catch (RuntimeException e) {
                LOG.warn("Telemetry subscriber failed on scan: {}", e.toString());
            }
        }
    }

    /**
     * Collects the scans that arrive during a time window.
     *
     * <p>Polls until at least {@code windowMs} elapsed and at least {@code minCount} new
     * samples arrived, or until {@code timeoutMs} expired; either way the future completes
     * with whatever was collected.
     *
     * @param windowMs window length, 0..120000
     * @param minCount minimum new samples, clamped to 1..5000
     * @param timeoutMs overall deadline, clamped to 500..120000
     */
    public CompletableFuture<ScanCapture> captureScanWindow(long windowMs, int minCount, long timeoutMs) {
        long window = Math.max(0, Math.min(120_000, windowMs));
        int min = Math.max(1, Math.min(5000, minCount));
        long timeout = Math.max(500, Math.min(120_000, timeoutMs));

        long startSequence = scans.sequence();
        long startedAt = clock.millis();
        CompletableFuture<ScanCapture> result = new CompletableFuture<>();
        pollCapture(result, startSequence, startedAt, window, min, startedAt + timeout);
        return result;
    }

    /** {@link #captureScanWindow(long, int, long)} with the default count and timeout. */
    public CompletableFuture<ScanCapture> captureScanWindow(long windowMs) {
        return captureScanWindow(windowMs, DEFAULT_CAPTURE_MIN_COUNT, windowMs + CAPTURE_TIMEOUT_SLACK_MS);
    }

    private void pollCapture(CompletableFuture<ScanCapture> result, long startSequence, long startedAt,
                             long windowMs, int minCount, long deadline) {
        try {
            long now = clock.millis();
            long collected = scans.sequence() - startSequence;
            boolean satisfied = now - startedAt >= windowMs && collected >= minCount;
            if (satisfied || now >= deadline) {
                List<TelemetryScanSample> samples = scans.since(startSequence);
                result.complete(new ScanCapture(startedAt, now, samples, ScanWindowStats.of(samples)));
                return;
            }
            CompletableFuture.runAsync(
                    () -> pollCapture(result, startSequence, startedAt, windowMs, minCount, deadline),
                    pollExecutor());
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
        }
    }

    /**
     * Waits for a hello no older than {@code sinceMs}.
     *
     * @return future failing with {@link TelemetryTimeoutException} after {@code timeoutMs}
     */
    public CompletableFuture<TelemetryHelloSample> awaitHello(long sinceMs, long timeoutMs) {
        CompletableFuture<TelemetryHelloSample> result = new CompletableFuture<>();
        pollHello(result, sinceMs, clock.millis() + Math.max(0, timeoutMs), timeoutMs);
        return result;
    }

    private void pollHello(CompletableFuture<TelemetryHelloSample> result, long sinceMs, long deadline,
                           long timeoutMs) {
        try {
            TelemetryHelloSample hello = lastHello;
            if (hello != null && hello.timestampMs() >= sinceMs) {
                result.complete(hello);
                return;
            }
            if (clock.millis() >= deadline) {
                result.completeExceptionally(new TelemetryTimeoutException("telemetry hello", timeoutMs));
                return;
            }
            CompletableFuture.runAsync(() -> pollHello(result, sinceMs, deadline, timeoutMs), pollExecutor());
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
        }
    }

    private Executor pollExecutor() {
        return CompletableFuture.delayedExecutor(props.getPollIntervalMs(), TimeUnit.MILLISECONDS);
    }

    public TelemetryStatus status() {
        return new TelemetryStatus(
                isReady(),
                props.getListenHost(),
                boundPort,
                props.getHelloAddress(),
                props.getScanAddress(),
                lastHello,
                lastScan,
                scans.size(),
                lastError);
    }

    public boolean isReady() {
        DatagramEndpoint current = endpoint;
        return ready && current != null && current.isBound();
    }

    public TelemetryHelloSample getLastHello() {
        return lastHello;
    }

    public TelemetryScanSample getLastScan() {
        return lastScan;
    }

    /** Retained scans, oldest first. */
    public List<TelemetryScanSample> recentScans() {
        return scans.snapshot();
    }

    /** Total scans accepted since start, including ones already evicted or cleared. */
    long scanSequence() {
        return scans.sequence();
    }

    /** Port actually bound; differs from the configured one when that is 0. */
    public int getListenPort() {
        return boundPort;
    }

    /**
     * Routes socket callbacks into the listener; ignores callbacks from replaced endpoints.
     */
    private final class TelemetrySocketListener implements DatagramEndpointListener {

        private final DatagramEndpoint owner;

        TelemetrySocketListener(DatagramEndpoint owner) {
            this.owner = owner;
        }

        @Override
        public void onTransportDown(Throwable cause) {
            if (endpoint != owner) {
                return;
            }
            // receive errors leave a bound UDP socket usable
            ready = owner.isBound();
            if (cause != null) {
                metrics.incrementOscErrors();
                lastError = cause.toString();
                LOG.error("Telemetry OSC error: {}", lastError);
            }
        }

        @Override
        public void onDatagram(SocketAddress remote, byte[] payload) {
            if (endpoint == owner) {
                TelemetryListener.this.onDatagram(payload);
            }
        }
    }
}
