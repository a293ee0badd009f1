package com.phillippitts.granupose.presentation.controller;

import com.phillippitts.granupose.domain.telemetry.ScanCapture;
import com.phillippitts.granupose.domain.telemetry.TelemetryHelloSample;
import com.phillippitts.granupose.domain.telemetry.TelemetryStatus;
import com.phillippitts.granupose.service.telemetry.TelemetryListener;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;

/**
 * Telemetry inspection endpoints used by validation tooling.
 */
@RestController
@RequestMapping("/api/telemetry")
class TelemetryController {

    private final TelemetryListener telemetry;

    TelemetryController(TelemetryListener telemetry) {
        this.telemetry = telemetry;
    }

    @GetMapping("/status")
    ResponseEntity<TelemetryStatus> status() {
        return ResponseEntity.ok(telemetry.status());
    }

    /**
     * Collects scans for a window. Out-of-range parameters are clamped by the listener.
     */
    @PostMapping("/capture")
    CompletableFuture<ScanCapture> capture(
            @RequestParam(name = "windowMs", defaultValue = "1000") long windowMs,
            @RequestParam(name = "minCount", required = false) Integer minCount,
            @RequestParam(name = "timeoutMs", required = false) Long timeoutMs) {
        if (minCount == null && timeoutMs == null) {
            return telemetry.captureScanWindow(windowMs);
        }
        return telemetry.captureScanWindow(windowMs,
                minCount != null ? minCount : TelemetryListener.DEFAULT_CAPTURE_MIN_COUNT,
                timeoutMs != null ? timeoutMs : windowMs + TelemetryListener.CAPTURE_TIMEOUT_SLACK_MS);
    }

    /**
     * Waits for a hello emitted at or after {@code sinceMs}; 504 on timeout.
     */
    @GetMapping("/hello")
    CompletableFuture<TelemetryHelloSample> awaitHello(
            @RequestParam(name = "sinceMs", defaultValue = "0") long sinceMs,
            @RequestParam(name = "timeoutMs", defaultValue = "20000") long timeoutMs) {
        return telemetry.awaitHello(sinceMs, timeoutMs);
    }
}
