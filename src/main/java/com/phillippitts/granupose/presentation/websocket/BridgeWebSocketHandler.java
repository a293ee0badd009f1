package com.phillippitts.granupose.presentation.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.granupose.config.gateway.GatewayProperties;
import com.phillippitts.granupose.domain.telemetry.TelemetryHelloSample;
import com.phillippitts.granupose.domain.telemetry.TelemetryScanSample;
import com.phillippitts.granupose.presentation.BridgeStatusAssembler;
import com.phillippitts.granupose.presentation.dto.BridgeError;
import com.phillippitts.granupose.presentation.dto.ChannelBatchRequest;
import com.phillippitts.granupose.presentation.dto.ChannelRequest;
import com.phillippitts.granupose.presentation.dto.OscBatchRequest;
import com.phillippitts.granupose.presentation.dto.OscMessageRequest;
import com.phillippitts.granupose.service.engine.EngineStatusChangedEvent;
import com.phillippitts.granupose.service.metrics.BridgeMetrics;
import com.phillippitts.granupose.service.relay.OscCommandRelay;
import com.phillippitts.granupose.service.telemetry.TelemetryListener;
import com.phillippitts.granupose.service.telemetry.TelemetrySubscriber;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket side of the transport gateway.
 *
 * <p>Inbound frames ({@code ping}, {@code channel:set}, {@code channels:set}, {@code osc:send},
 * {@code osc:batch}) are validated by {@link GatewayMessageDecoder} and answered on the same
 * session. Invalid frames get a {@code bridge:error} reply; the connection stays open.
 *
 * <p>Outbound pushes ({@code telemetry:scan}, {@code telemetry:hello}, {@code engine:status})
 * are lossy broadcasts: each session is wrapped in a {@link ConcurrentWebSocketSessionDecorator}
 * with the DROP overflow strategy, so a slow client loses frames instead of stalling the
 * telemetry thread, and closed sessions are skipped.
 */
@Component
public class BridgeWebSocketHandler extends TextWebSocketHandler implements TelemetrySubscriber {

    private static final Logger LOG = LogManager.getLogger(BridgeWebSocketHandler.class);

    static final String TYPE_HELLO = "bridge:hello";
    static final String TYPE_ACK = "bridge:ack";
    static final String TYPE_ERROR = "bridge:error";
    static final String TYPE_PONG = "pong";
    static final String TYPE_TELEMETRY_SCAN = "telemetry:scan";
    static final String TYPE_TELEMETRY_HELLO = "telemetry:hello";
    static final String TYPE_ENGINE_STATUS = "engine:status";

    private final GatewayMessageDecoder decoder;
    private final ObjectMapper objectMapper;
    private final OscCommandRelay relay;
    private final TelemetryListener telemetry;
    private final BridgeStatusAssembler status;
    private final BridgeMetrics metrics;
    private final GatewayProperties gatewayProps;
    private final Clock clock;

    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();
    private Runnable unsubscribe;

    public BridgeWebSocketHandler(GatewayMessageDecoder decoder,
                                  ObjectMapper objectMapper,
                                  OscCommandRelay relay,
                                  TelemetryListener telemetry,
                                  BridgeStatusAssembler status,
                                  BridgeMetrics metrics,
                                  GatewayProperties gatewayProps,
                                  Clock clock) {
        this.decoder = decoder;
        this.objectMapper = objectMapper;
        this.relay = relay;
        this.telemetry = telemetry;
        this.status = status;
        this.metrics = metrics;
        this.gatewayProps = gatewayProps;
        this.clock = clock;
    }

    @PostConstruct
    void subscribeToTelemetry() {
        unsubscribe = telemetry.subscribe(this);
    }

    @PreDestroy
    void unsubscribeFromTelemetry() {
        if (unsubscribe != null) {
            unsubscribe.run();
            unsubscribe = null;
        }
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketSession decorated = new ConcurrentWebSocketSessionDecorator(session,
                gatewayProps.sendTimeLimitMs(), gatewayProps.sendBufferSizeBytes(),
                ConcurrentWebSocketSessionDecorator.OverflowStrategy.DROP);
        sessions.put(session.getId(), decorated);
        metrics.wsClientConnected();
        LOG.info("WebSocket client connected: session={} remote={}", session.getId(), session.getRemoteAddress());
        send(decorated, TYPE_HELLO, status.hello());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        WebSocketSession target = sessions.getOrDefault(session.getId(), session);
        ThreadContext.put("wsSession", session.getId());
        try {
            GatewayMessageDecoder.Result result = decoder.decode(message.getPayload());
            if (!result.isOk()) {
                if (BridgeError.VALIDATION_FAILED.equals(result.error().error())) {
                    metrics.incrementOscRejected();
                }
                LOG.debug("Rejected WebSocket frame: {}", result.error().error());
                send(target, TYPE_ERROR, result.error());
                return;
            }
            dispatch(target, result.message());
        } finally {
            ThreadContext.remove("wsSession");
        }
    }

    private void dispatch(WebSocketSession session, GatewayMessage message) {
        switch (message.type()) {
            case PING -> send(session, TYPE_PONG, Map.of("nowMs", clock.millis()));
            case CHANNEL_SET -> {
                ChannelRequest req = message.payloadAs(ChannelRequest.class);
                send(session, TYPE_ACK, relay.sendChannel(req.channel(), req.value()));
            }
            case CHANNELS_SET -> send(session, TYPE_ACK,
                    relay.sendChannels(message.payloadAs(ChannelBatchRequest.class).toChannelValues()));
            case OSC_SEND -> send(session, TYPE_ACK,
                    relay.send(message.payloadAs(OscMessageRequest.class).toCommandRequest()));
            case OSC_BATCH -> send(session, TYPE_ACK,
                    relay.sendBatch(message.payloadAs(OscBatchRequest.class).toCommandRequests()));
            default -> throw new IllegalStateException("Unhandled message type " + message.type());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        LOG.debug("WebSocket transport error: session={} error={}", session.getId(), exception.toString());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus closeStatus) {
        if (sessions.remove(session.getId()) != null) {
            metrics.wsClientDisconnected();
        }
        LOG.info("WebSocket client disconnected: session={} status={}", session.getId(), closeStatus);
    }

    @Override
    public void onScan(TelemetryScanSample sample) {
        int delivered = broadcast(TYPE_TELEMETRY_SCAN, sample);
        for (int i = 0; i < delivered; i++) {
            metrics.incrementTelemetryBroadcast();
        }
    }

    @Override
    public void onHello(TelemetryHelloSample hello) {
        broadcast(TYPE_TELEMETRY_HELLO, hello);
    }

    @EventListener
    public void onEngineStatusChanged(EngineStatusChangedEvent event) {
        broadcast(TYPE_ENGINE_STATUS, event.current());
    }

    public int activeSessionCount() {
        return sessions.size();
    }

    /**
     * Sends one frame to every open session.
     *
     * @return number of sessions the frame was handed to
     */
    private int broadcast(String type, Object payload) {
        if (sessions.isEmpty()) {
            return 0;
        }
        TextMessage frame;
        try {
            frame = encode(type, payload);
        } catch (JsonProcessingException e) {
            LOG.error("Cannot serialise {} frame", type, e);
            return 0;
        }
        int delivered = 0;
        for (WebSocketSession session : sessions.values()) {
            if (!session.isOpen()) {
                continue;
            }
            try {
                session.sendMessage(frame);
                delivered++;
            } catch (IOException | IllegalStateException e) {
                // Lossy by contract: the session is dropped from this frame only
                LOG.debug("Broadcast {} skipped session {}: {}", type, session.getId(), e.toString());
            }
        }
        return delivered;
    }

    private void send(WebSocketSession session, String type, Object payload) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.sendMessage(encode(type, payload));
        } catch (IOException | IllegalStateException e) {
            LOG.warn("Failed to send {} to session {}: {}", type, session.getId(), e.toString());
        }
    }

    private TextMessage encode(String type, Object payload) throws JsonProcessingException {
        return new TextMessage(objectMapper.writeValueAsString(new Envelope(type, payload)));
    }

    /** Wire envelope of every frame. */
    record Envelope(String type, Object payload) {
    }
}
