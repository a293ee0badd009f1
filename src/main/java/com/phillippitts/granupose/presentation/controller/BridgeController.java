package com.phillippitts.granupose.presentation.controller;

import com.phillippitts.granupose.domain.osc.BatchSendResult;
import com.phillippitts.granupose.domain.osc.ChannelSendResult;
import com.phillippitts.granupose.domain.osc.SendResult;
import com.phillippitts.granupose.presentation.BridgeStatusAssembler;
import com.phillippitts.granupose.presentation.dto.BridgeConfigView;
import com.phillippitts.granupose.presentation.dto.BridgeError;
import com.phillippitts.granupose.presentation.dto.BridgeHealthResponse;
import com.phillippitts.granupose.presentation.dto.ChannelBatchRequest;
import com.phillippitts.granupose.presentation.dto.ChannelRequest;
import com.phillippitts.granupose.presentation.dto.OscBatchRequest;
import com.phillippitts.granupose.presentation.dto.OscMessageRequest;
import com.phillippitts.granupose.presentation.dto.OscTargetRequest;
import com.phillippitts.granupose.service.relay.OscCommandRelay;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;

/**
 * Bridge status and parameter-control endpoints.
 *
 * <p>Single sends answer 503 {@code {"error":"transport_not_ready"}} while the OSC socket is
 * not bound; batches never fail as a whole and report per-item outcomes as counts.
 */
@RestController
class BridgeController {

    private static final Logger LOG = LogManager.getLogger(BridgeController.class);

    private final OscCommandRelay relay;
    private final BridgeStatusAssembler status;

    BridgeController(OscCommandRelay relay, BridgeStatusAssembler status) {
        this.relay = relay;
        this.status = status;
    }

    @GetMapping("/health")
    ResponseEntity<BridgeHealthResponse> health() {
        return ResponseEntity.ok(status.health());
    }

    @GetMapping("/config")
    ResponseEntity<BridgeConfigView> config() {
        return ResponseEntity.ok(status.config());
    }

    @PostMapping("/api/channels")
    ResponseEntity<?> sendChannel(@Valid @RequestBody ChannelRequest request) {
        ChannelSendResult result = relay.sendChannel(request.channel(), request.value());
        if (result.isTransportNotReady()) {
            LOG.debug("Channel {} rejected: transport not ready", request.channel());
            return notReady(result.error());
        }
        return ResponseEntity.ok(result);
    }

    @PostMapping("/api/channels/batch")
    ResponseEntity<BatchSendResult> sendChannels(@Valid @RequestBody ChannelBatchRequest request) {
        return ResponseEntity.ok(relay.sendChannels(request.toChannelValues()));
    }

    @PostMapping("/api/osc")
    ResponseEntity<?> sendOsc(@Valid @RequestBody OscMessageRequest request) {
        SendResult result = relay.send(request.toCommandRequest());
        if (result.isTransportNotReady()) {
            LOG.debug("OSC {} rejected: transport not ready", request.address());
            return notReady(result.error());
        }
        return ResponseEntity.ok(result);
    }

    @PostMapping("/api/osc/batch")
    ResponseEntity<BatchSendResult> sendOscBatch(@Valid @RequestBody OscBatchRequest request) {
        return ResponseEntity.ok(relay.sendBatch(request.toCommandRequests()));
    }

    /**
     * Retargets outbound OSC and rebinds the local socket. Fails with 503 when the socket
     * cannot be bound within the bind timeout.
     */
    @PostMapping("/api/osc/target")
    CompletableFuture<BridgeConfigView> retarget(@Valid @RequestBody OscTargetRequest request) {
        LOG.info("OSC retarget requested: {}:{}", request.host(), request.port());
        return relay.reconfigure(request.host(), request.port()).thenApply(v -> status.config());
    }

    private static ResponseEntity<BridgeError> notReady(String error) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(BridgeError.of(error));
    }
}
