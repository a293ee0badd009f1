package com.phillippitts.granupose.presentation.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.granupose.config.gateway.GatewayProperties;
import com.phillippitts.granupose.domain.osc.ChannelSendResult;
import com.phillippitts.granupose.domain.osc.SendResult;
import com.phillippitts.granupose.domain.telemetry.TelemetryScanSample;
import com.phillippitts.granupose.presentation.BridgeStatusAssembler;
import com.phillippitts.granupose.service.metrics.BridgeMetrics;
import com.phillippitts.granupose.service.relay.OscCommandRelay;
import com.phillippitts.granupose.service.telemetry.TelemetryListener;
import com.phillippitts.granupose.testutil.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatcher;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BridgeWebSocketHandlerTest {

    private ValidatorFactory validatorFactory;
    private OscCommandRelay relay;
    private BridgeMetrics metrics;
    private BridgeWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        ObjectMapper objectMapper = new ObjectMapper();
        relay = mock(OscCommandRelay.class);
        metrics = new BridgeMetrics(new SimpleMeterRegistry());
        handler = new BridgeWebSocketHandler(
                new GatewayMessageDecoder(objectMapper, validatorFactory.getValidator()),
                objectMapper,
                relay,
                mock(TelemetryListener.class),
                mock(BridgeStatusAssembler.class),
                metrics,
                new GatewayProperties("*", "/ws", 5000, 524288),
                new MutableClock());
    }

    @AfterEach
    void tearDown() {
        validatorFactory.close();
    }

    @Test
    void scanReachesEveryOpenSessionAndSkipsClosedOrFailingOnes() throws Exception {
        WebSocketSession first = openSession("a");
        WebSocketSession second = openSession("b");
        AtomicBoolean closedOpen = new AtomicBoolean(true);
        WebSocketSession closed = session("c", closedOpen);
        WebSocketSession failing = openSession("d");
        doThrow(new IOException("broken pipe")).when(failing).sendMessage(argThat(scanFrame()));
        for (WebSocketSession s : List.of(first, second, closed, failing)) {
            handler.afterConnectionEstablished(s);
        }
        closedOpen.set(false);

        assertThatCode(() -> handler.onScan(sample())).doesNotThrowAnyException();

        verify(first).sendMessage(argThat(scanFrame()));
        verify(second).sendMessage(argThat(scanFrame()));
        verify(failing).sendMessage(argThat(scanFrame()));
        verify(closed, never()).sendMessage(argThat(scanFrame()));
        assertThat(metrics.telemetryBroadcastCount()).isEqualTo(2);
    }

    @Test
    void failingSessionDoesNotStopLaterBroadcasts() throws Exception {
        WebSocketSession healthy = openSession("a");
        WebSocketSession failing = openSession("b");
        doThrow(new IOException("broken pipe")).when(failing).sendMessage(argThat(scanFrame()));
        handler.afterConnectionEstablished(healthy);
        handler.afterConnectionEstablished(failing);

        handler.onScan(sample());
        handler.onScan(sample());

        assertThat(metrics.telemetryBroadcastCount()).isEqualTo(2);
    }

    @Test
    void disconnectedSessionIsNoLongerBroadcastTo() throws Exception {
        WebSocketSession session = openSession("a");
        handler.afterConnectionEstablished(session);
        handler.afterConnectionClosed(session, CloseStatus.NORMAL);

        handler.onScan(sample());

        verify(session, never()).sendMessage(argThat(scanFrame()));
        assertThat(handler.activeSessionCount()).isZero();
        assertThat(metrics.activeWsClients()).isZero();
    }

    @Test
    void greetsOnConnectAndAcknowledgesChannelSet() throws Exception {
        WebSocketSession session = openSession("a");
        when(relay.sendChannel(3, 0.5)).thenReturn(
                ChannelSendResult.of(new SendResult(true, null, null), "/pose/out/03", 3, 0.5));
        handler.afterConnectionEstablished(session);

        handler.handleTextMessage(session,
                new TextMessage("{\"type\":\"channel:set\",\"payload\":{\"channel\":3,\"value\":0.5}}"));

        List<String> frames = sentPayloads(session);
        assertThat(frames).hasSize(2);
        assertThat(frames.get(0)).contains("\"type\":\"bridge:hello\"");
        assertThat(frames.get(1)).contains("\"type\":\"bridge:ack\"").contains("\"address\":\"/pose/out/03\"");
    }

    @Test
    void invalidFrameIsAnsweredWithErrorAndCountedAsRejected() throws Exception {
        WebSocketSession session = openSession("a");
        handler.afterConnectionEstablished(session);

        handler.handleTextMessage(session,
                new TextMessage("{\"type\":\"channel:set\",\"payload\":{\"channel\":1.9,\"value\":0.5}}"));

        List<String> frames = sentPayloads(session);
        assertThat(frames.get(frames.size() - 1))
                .contains("\"type\":\"bridge:error\"")
                .contains("validation_failed");
        assertThat(metrics.oscRejectedCount()).isEqualTo(1);
        verify(relay, never()).sendChannel(1, 0.5);
    }

    private static WebSocketSession openSession(String id) {
        return session(id, new AtomicBoolean(true));
    }

    private static WebSocketSession session(String id, AtomicBoolean open) {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn(id);
        when(session.isOpen()).thenAnswer(inv -> open.get());
        return session;
    }

    private static List<String> sentPayloads(WebSocketSession session) throws IOException {
        @SuppressWarnings("unchecked")
        ArgumentCaptor<WebSocketMessage<?>> captor = ArgumentCaptor.forClass(WebSocketMessage.class);
        verify(session, atLeastOnce()).sendMessage(captor.capture());
        return captor.getAllValues().stream()
                .map(m -> String.valueOf(m.getPayload()))
                .toList();
    }

    private static ArgumentMatcher<WebSocketMessage<?>> scanFrame() {
        return m -> m != null && String.valueOf(m.getPayload()).contains("\"type\":\"telemetry:scan\"");
    }

    private static TelemetryScanSample sample() {
        return new TelemetryScanSample(1L, 0.5, 0.3, 0.2, 1000, 1, List.of(500), List.of(0.5));
    }
}
