package com.phillippitts.granupose.presentation.exception;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.phillippitts.granupose.config.gateway.GatewayJsonConfig;
import com.phillippitts.granupose.exception.EngineBinaryNotFoundException;
import com.phillippitts.granupose.exception.TelemetryTimeoutException;
import com.phillippitts.granupose.exception.TransportUnavailableException;
import com.phillippitts.granupose.presentation.dto.BridgeError;
import com.phillippitts.granupose.presentation.dto.ChannelRequest;
import com.phillippitts.granupose.presentation.dto.ValidationIssue;
import com.phillippitts.granupose.service.metrics.BridgeMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.mock.http.MockHttpInputMessage;
import org.springframework.validation.BeanPropertyBindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class GlobalExceptionHandlerTest {

    private BridgeMetrics metrics;
    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        metrics = new BridgeMetrics(new SimpleMeterRegistry());
        handler = new GlobalExceptionHandler(metrics);
    }

    @Test
    void validationFailureListsIssuesAndCountsRejection() throws Exception {
        BeanPropertyBindingResult binding = new BeanPropertyBindingResult(
                new ChannelRequest(99, 0.5), "channelRequest");
        binding.addError(new FieldError("channelRequest", "channel", "must be less than or equal to 64"));
        MethodParameter parameter = new MethodParameter(
                GlobalExceptionHandlerTest.class.getDeclaredMethod("endpoint", ChannelRequest.class), 0);

        ResponseEntity<BridgeError> response =
                handler.handleValidation(new MethodArgumentNotValidException(parameter, binding));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().error()).isEqualTo(BridgeError.VALIDATION_FAILED);
        assertThat(response.getBody().issues())
                .containsExactly(new ValidationIssue("channel", "must be less than or equal to 64"));
        assertThat(metrics.oscRejectedCount()).isEqualTo(1);
    }

    @Test
    void unreadableBodyIsInvalidJsonWithoutIssues() {
        HttpMessageNotReadableException ex = new HttpMessageNotReadableException(
                "JSON parse error", new MockHttpInputMessage(new byte[0]));

        ResponseEntity<BridgeError> response = handler.handleUnreadable(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isEqualTo(BridgeError.of(BridgeError.INVALID_JSON));
        assertThat(metrics.oscRejectedCount()).isZero();
    }

    @Test
    void fractionalChannelIsValidationFailureAndCounted() {
        MismatchedInputException cause = bindingFailure("{\"channel\":1.9,\"value\":0.5}");
        HttpMessageNotReadableException ex = new HttpMessageNotReadableException(
                "JSON parse error", cause, new MockHttpInputMessage(new byte[0]));

        ResponseEntity<BridgeError> response = handler.handleUnreadable(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().error()).isEqualTo(BridgeError.VALIDATION_FAILED);
        assertThat(response.getBody().issues()).containsExactly(new ValidationIssue("channel", "must be an integer"));
        assertThat(metrics.oscRejectedCount()).isEqualTo(1);
    }

    @Test
    void quotedValueIsValidationFailure() {
        MismatchedInputException cause = bindingFailure("{\"channel\":3,\"value\":\"0.5\"}");

        ResponseEntity<BridgeError> response = handler.handleUnreadable(new HttpMessageNotReadableException(
                "JSON parse error", cause, new MockHttpInputMessage(new byte[0])));

        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().issues()).containsExactly(new ValidationIssue("value", "must be a number"));
    }

    private static MismatchedInputException bindingFailure(String json) {
        ObjectMapper mapper = GatewayJsonConfig.strictScalars(new ObjectMapper());
        return catchThrowableOfType(() -> mapper.readValue(json, ChannelRequest.class),
                MismatchedInputException.class);
    }

    @Test
    void transportUnavailableReturns503() {
        ResponseEntity<?> response = handler.handleTransportUnavailable(
                new TransportUnavailableException("127.0.0.1:16447", "Address already in use"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().toString()).contains("TransportUnavailableException");
    }

    @Test
    void telemetryTimeoutReturns504() {
        ResponseEntity<?> response = handler.handleTelemetryTimeout(
                new TelemetryTimeoutException("telemetry hello", 20000));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.GATEWAY_TIMEOUT);
        assertThat(response.getBody().toString()).contains("20000ms");
    }

    @Test
    void engineUnavailableDoesNotExposeCheckedPaths() {
        EngineBinaryNotFoundException ex = new EngineBinaryNotFoundException("ec2_headless",
                List.of("/secret/internal/engine-bin/linux/ec2_headless"));

        ResponseEntity<?> response = handler.handleEngineUnavailable(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().toString()).doesNotContain("/secret/internal");
    }

    @Test
    void unexpectedErrorReturns500WithoutDetails() {
        ResponseEntity<?> response = handler.handleUnexpected(new IllegalStateException("secret state"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString()).contains("InternalServerError").doesNotContain("secret state");
    }

    @SuppressWarnings("unused")
    private void endpoint(ChannelRequest request) {
    }
}
