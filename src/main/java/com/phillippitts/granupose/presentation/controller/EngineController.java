package com.phillippitts.granupose.presentation.controller;

import com.phillippitts.granupose.domain.engine.EngineOperationResult;
import com.phillippitts.granupose.presentation.dto.EngineLogsResponse;
import com.phillippitts.granupose.service.engine.EngineSupervisor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;

/**
 * Engine lifecycle endpoints. Failed operations answer 503 with the
 * {@link EngineOperationResult} (error plus state) as body.
 */
@RestController
@RequestMapping("/api/engine")
class EngineController {

    private static final Logger LOG = LogManager.getLogger(EngineController.class);

    private final EngineSupervisor supervisor;

    EngineController(EngineSupervisor supervisor) {
        this.supervisor = supervisor;
    }

    @GetMapping("/status")
    ResponseEntity<EngineOperationResult> status() {
        return ResponseEntity.ok(supervisor.status());
    }

    @PostMapping("/start")
    CompletableFuture<ResponseEntity<EngineOperationResult>> start() {
        LOG.info("Engine start requested");
        return supervisor.start().thenApply(EngineController::toResponse);
    }

    @PostMapping("/stop")
    CompletableFuture<ResponseEntity<EngineOperationResult>> stop(
            @RequestParam(name = "reason", defaultValue = "api") String reason) {
        LOG.info("Engine stop requested (reason={})", reason);
        return supervisor.stop(reason).thenApply(EngineController::toResponse);
    }

    @PostMapping("/restart")
    CompletableFuture<ResponseEntity<EngineOperationResult>> restart() {
        LOG.info("Engine restart requested");
        return supervisor.restart().thenApply(EngineController::toResponse);
    }

    @GetMapping("/logs")
    ResponseEntity<EngineLogsResponse> logs(@RequestParam(name = "limit", required = false) Integer limit) {
        return ResponseEntity.ok(new EngineLogsResponse(true, supervisor.logs(limit)));
    }

    private static ResponseEntity<EngineOperationResult> toResponse(EngineOperationResult result) {
        return result.ok()
                ? ResponseEntity.ok(result)
                : ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(result);
    }
}
