package com.phillippitts.granupose.presentation.exception;

import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.phillippitts.granupose.exception.EngineBinaryNotFoundException;
import com.phillippitts.granupose.exception.EngineLaunchException;
import com.phillippitts.granupose.exception.TelemetryTimeoutException;
import com.phillippitts.granupose.exception.TransportUnavailableException;
import com.phillippitts.granupose.presentation.dto.BridgeError;
import com.phillippitts.granupose.presentation.dto.ValidationIssue;
import com.phillippitts.granupose.service.metrics.BridgeMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.validation.ObjectError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.List;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Request problems use the compact {@link BridgeError} body the gateway clients expect;
 * everything else uses {@link ApiError}. Internal paths never reach the client.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    private final BridgeMetrics metrics;

    GlobalExceptionHandler(BridgeMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Client error - request body violates a constraint (HTTP 400). Counted as rejected.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<BridgeError> handleValidation(MethodArgumentNotValidException ex) {
        metrics.incrementOscRejected();
        List<ValidationIssue> issues = ex.getBindingResult().getAllErrors().stream()
                .map(GlobalExceptionHandler::toIssue)
                .toList();
        LOG.warn("Request rejected by validation: {} issue(s)", issues.size());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(BridgeError.validationFailed(issues));
    }

    /**
     * Client error - body is not parseable JSON (HTTP 400 invalid_json), or a field holds a
     * value of the wrong type (HTTP 400 validation_failed, counted as rejected).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<BridgeError> handleUnreadable(HttpMessageNotReadableException ex) {
        if (ex.getCause() instanceof MismatchedInputException mismatch && !mismatch.getPath().isEmpty()) {
            metrics.incrementOscRejected();
            ValidationIssue issue = ValidationIssue.fromTypeMismatch("", mismatch);
            LOG.warn("Request rejected: {} {}", issue.path(), issue.message());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(BridgeError.validationFailed(List.of(issue)));
        }
        LOG.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(BridgeError.of(BridgeError.INVALID_JSON));
    }

    /**
     * Transient error - OSC socket could not be bound (HTTP 503).
     */
    @ExceptionHandler(TransportUnavailableException.class)
    ResponseEntity<ApiError> handleTransportUnavailable(TransportUnavailableException ex) {
        LOG.error("Transport unavailable: endpoint={}", ex.getEndpoint(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "OSC transport unavailable",
                "Please retry in a few seconds",
                Instant.now()
            ));
    }

    /**
     * Telemetry did not arrive in time (HTTP 504).
     */
    @ExceptionHandler(TelemetryTimeoutException.class)
    ResponseEntity<ApiError> handleTelemetryTimeout(TelemetryTimeoutException ex) {
        LOG.warn("Telemetry wait timed out after {} ms", ex.getTimeoutMs());
        return ResponseEntity
            .status(HttpStatus.GATEWAY_TIMEOUT)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Engine telemetry not received",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Configuration/setup error - engine binary or runtime unavailable (HTTP 503).
     */
    @ExceptionHandler({EngineBinaryNotFoundException.class, EngineLaunchException.class})
    ResponseEntity<ApiError> handleEngineUnavailable(RuntimeException ex) {
        LOG.error("Engine unavailable: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Audio engine unavailable",
                "Engine binary missing or failed to launch. Check the engine logs.",
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    private static ValidationIssue toIssue(ObjectError error) {
        String path = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
        return new ValidationIssue(path, error.getDefaultMessage());
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
