package com.phillippitts.granupose.service.telemetry;

import com.phillippitts.granupose.config.telemetry.TelemetryProperties;
import com.phillippitts.granupose.domain.engine.EngineStatus;
import com.phillippitts.granupose.domain.engine.EngineStatusSnapshot;
import com.phillippitts.granupose.domain.osc.OscArgument;
import com.phillippitts.granupose.domain.osc.OscMessage;
import com.phillippitts.granupose.domain.telemetry.ScanCapture;
import com.phillippitts.granupose.domain.telemetry.TelemetryHelloSample;
import com.phillippitts.granupose.domain.telemetry.TelemetryScanSample;
import com.phillippitts.granupose.exception.TelemetryTimeoutException;
import com.phillippitts.granupose.service.engine.EngineStatusChangedEvent;
import com.phillippitts.granupose.service.metrics.BridgeMetrics;
import com.phillippitts.granupose.service.osc.OscCodec;
import com.phillippitts.granupose.testutil.InMemoryDatagramEndpoint;
import com.phillippitts.granupose.testutil.InMemoryDatagramEndpointFactory;
import com.phillippitts.granupose.testutil.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;
import static org.awaitility.Awaitility.await;

class TelemetryListenerTest {

    private static final InetSocketAddress ENGINE = new InetSocketAddress("127.0.0.1", 16447);

    private TelemetryProperties props;
    private InMemoryDatagramEndpointFactory factory;
    private BridgeMetrics metrics;
    private MutableClock clock;
    private TelemetryListener listener;

    @BeforeEach
    void setUp() {
        props = new TelemetryProperties();
        props.setListenHost("127.0.0.1");
        props.setListenPort(0);
        props.setScanBufferCapacity(8);
        props.setPollIntervalMs(5);
        factory = new InMemoryDatagramEndpointFactory();
        metrics = new BridgeMetrics(new SimpleMeterRegistry());
        clock = new MutableClock();
        listener = new TelemetryListener(props, factory, metrics, clock);
        listener.start().join();
    }

    @AfterEach
    void tearDown() {
        listener.stop();
    }

    @Test
    void reportsBoundPortAndReadiness() {
        assertThat(listener.isReady()).isTrue();
        assertThat(listener.getListenPort()).isEqualTo(40000);
        assertThat(listener.status().telemetryReady()).isTrue();
    }

    @Test
    void bufferedScanIsPublishedToSubscribers() {
        List<TelemetryScanSample> seen = new CopyOnWriteArrayList<>();
        listener.subscribe(seen::add);

        deliverScan(0.5f);

        assertThat(listener.getLastScan()).isNotNull();
        assertThat(listener.recentScans()).hasSize(1);
        assertThat(seen).hasSize(1);
        assertThat(metrics.telemetryReceivedCount()).isEqualTo(1);
    }

    @Test
    void unsubscribeStopsDelivery() {
        List<TelemetryScanSample> seen = new CopyOnWriteArrayList<>();
        Runnable unsubscribe = listener.subscribe(seen::add);

        unsubscribe.run();
        deliverScan(0.5f);

        assertThat(seen).isEmpty();
    }

    @Test
    void failingSubscriberDoesNotStopOthers() {
        List<TelemetryScanSample> seen = new CopyOnWriteArrayList<>();
        listener.subscribe(sample -> {
            throw new IllegalStateException("boom");
        });
        listener.subscribe(seen::add);

        deliverScan(0.2f);

        assertThat(seen).hasSize(1);
    }

    @Test
    void undecodableDatagramIsCountedAndDiscarded() {
        endpoint().deliver(ENGINE, new byte[]{1, 2, 3});

        assertThat(metrics.telemetryDecodeErrorCount()).isEqualTo(1);
        assertThat(listener.getLastScan()).isNull();
    }

    @Test
    void helloIsRetainedAndPushed() {
        List<TelemetryHelloSample> hellos = new CopyOnWriteArrayList<>();
        listener.subscribe(new TelemetrySubscriber() {
            @Override
            public void onScan(TelemetryScanSample sample) {
            }

            @Override
            public void onHello(TelemetryHelloSample hello) {
                hellos.add(hello);
            }
        });

        deliverHello("version=2");

        assertThat(listener.getLastHello().argsMap()).containsEntry("version", "2");
        assertThat(hellos).hasSize(1);
    }

    @Test
    void engineStartingClearsBuffers() {
        deliverScan(0.1f);
        deliverHello("version=1");

        listener.onEngineStatusChanged(statusEvent(EngineStatus.STARTING));

        assertThat(listener.recentScans()).isEmpty();
        assertThat(listener.getLastScan()).isNull();
        assertThat(listener.getLastHello()).isNull();
    }

    @Test
    void otherEngineStatesKeepBuffers() {
        deliverScan(0.1f);

        listener.onEngineStatusChanged(statusEvent(EngineStatus.RUNNING));

        assertThat(listener.recentScans()).hasSize(1);
    }

    @Test
    void captureWaitsForWindowAndCollectsNewSamplesOnly() throws Exception {
        deliverScan(0.9f);
        CompletableFuture<ScanCapture> capture = listener.captureScanWindow(1000, 2, 5000);

        clock.advanceMillis(100);
        deliverScan(0.1f);
        clock.advanceMillis(400);
        deliverScan(0.4f);
        clock.advanceMillis(100);
        deliverScan(0.6f);
        assertThat(capture).isNotDone();

        clock.advanceMillis(400);
        await().atMost(Duration.ofSeconds(2)).until(capture::isDone);

        ScanCapture result = capture.get();
        assertThat(result.samples()).hasSize(3);
        assertThat(result.stats().count()).isEqualTo(3);
        assertThat(result.stats().elapsedMs()).isEqualTo(500);
        assertThat(result.stats().playheadSpan()).isCloseTo(0.5, offset(1e-6));
        assertThat(result.completedAtMs() - result.startedAtMs()).isEqualTo(1000);
    }

    @Test
    void captureCompletesAtDeadlineWithWhateverArrived() throws Exception {
        CompletableFuture<ScanCapture> capture = listener.captureScanWindow(100, 50, 600);
        deliverScan(0.3f);

        clock.advanceMillis(600);
        await().atMost(Duration.ofSeconds(2)).until(capture::isDone);

        assertThat(capture.get().samples()).hasSize(1);
    }

    @Test
    void awaitHelloReturnsRecentHelloImmediately() throws Exception {
        deliverHello("version=3");

        TelemetryHelloSample hello = listener.awaitHello(0, 1000).get();

        assertThat(hello.argsMap()).containsEntry("version", "3");
    }

    @Test
    void awaitHelloIgnoresOlderHelloAndTimesOut() {
        deliverHello("version=old");
        clock.advanceMillis(10);
        CompletableFuture<TelemetryHelloSample> pending = listener.awaitHello(clock.millis(), 500);

        clock.advanceMillis(500);
        await().atMost(Duration.ofSeconds(2)).until(pending::isDone);

        assertThatThrownBy(pending::get)
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(TelemetryTimeoutException.class);
    }

    @Test
    void awaitHelloCompletesWhenHelloArrivesLater() throws Exception {
        CompletableFuture<TelemetryHelloSample> pending = listener.awaitHello(clock.millis(), 5000);

        deliverHello("ready=1");
        await().atMost(Duration.ofSeconds(2)).until(pending::isDone);

        assertThat(pending.get().argsMap()).containsEntry("ready", "1");
    }

    @Test
    void stopMakesListenerNotReady() {
        InMemoryDatagramEndpoint endpoint = endpoint();

        listener.stop();

        assertThat(listener.isReady()).isFalse();
        assertThat(endpoint.isStopped()).isTrue();
    }

    @Test
    void bindFailureIsReportedInStatus() {
        listener.stop();
        factory.failNextBind("Address already in use");

        assertThatThrownBy(() -> listener.start().join()).hasMessageContaining("Address already in use");
        assertThat(listener.status().error()).isEqualTo("Address already in use");
        assertThat(listener.isReady()).isFalse();
    }

    private InMemoryDatagramEndpoint endpoint() {
        return factory.last();
    }

    @Test
    void malformedScanLeavesBufferAndLastScanUntouched() {
        deliverScan(0.25f);
        TelemetryScanSample before = listener.getLastScan();
        long sequence = listener.scanSequence();

        endpoint().deliver(ENGINE, OscCodec.encode(OscMessage.of(props.getScanAddress(),
                OscArgument.ofFloat(0.5f), OscArgument.ofString("x"), OscArgument.ofFloat(0.1f))));
        endpoint().deliver(ENGINE, OscCodec.encode(OscMessage.of(props.getScanAddress(), OscArgument.ofFloat(0.5f))));

        assertThat(listener.scanSequence()).isEqualTo(sequence);
        assertThat(listener.getLastScan()).isSameAs(before);
        assertThat(listener.recentScans()).hasSize(1);
        assertThat(metrics.telemetryReceivedCount()).isEqualTo(1);
    }

    private void deliverScan(float playhead) {
        OscMessage scan = OscMessage.of(props.getScanAddress(), OscArgument.ofFloat(playhead),
                OscArgument.ofFloat(0.5f), OscArgument.ofFloat(0.1f));
        endpoint().deliver(ENGINE, OscCodec.encode(scan));
    }

    private void deliverHello(String arg) {
        endpoint().deliver(ENGINE, OscCodec.encode(OscMessage.of(props.getHelloAddress(), OscArgument.ofString(arg))));
    }

    private static EngineStatusChangedEvent statusEvent(EngineStatus status) {
        EngineStatusSnapshot initial = EngineStatusSnapshot.initial(false, true, 5);
        EngineStatusSnapshot next = new EngineStatusSnapshot(status, 1L, "/bin/ec2_headless", List.of(), null, null,
                false, true, 0, 5, null);
        return new EngineStatusChangedEvent(initial, next, 0L);
    }
}
