package com.phillippitts.granupose.presentation.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.phillippitts.granupose.config.gateway.GatewayJsonConfig;
import com.phillippitts.granupose.presentation.dto.BridgeError;
import com.phillippitts.granupose.presentation.dto.ChannelBatchRequest;
import com.phillippitts.granupose.presentation.dto.ChannelRequest;
import com.phillippitts.granupose.presentation.dto.OscBatchRequest;
import com.phillippitts.granupose.presentation.dto.OscMessageRequest;
import com.phillippitts.granupose.presentation.dto.ValidationIssue;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns raw WebSocket text into a validated {@link GatewayMessage}.
 *
 * <p>Frames are {@code {"type": ..., "payload": ...}} envelopes. Payloads are bound to the
 * same request records as the REST API and validated with the same constraints, so both
 * surfaces accept exactly the same shapes. Scalars bind strictly: a fractional or quoted
 * channel number is a validation failure, not a coercion.
 */
@Component
class GatewayMessageDecoder {

    private static final Map<GatewayMessage.Type, Class<?>> PAYLOAD_TYPES = Map.of(
            GatewayMessage.Type.CHANNEL_SET, ChannelRequest.class,
            GatewayMessage.Type.CHANNELS_SET, ChannelBatchRequest.class,
            GatewayMessage.Type.OSC_SEND, OscMessageRequest.class,
            GatewayMessage.Type.OSC_BATCH, OscBatchRequest.class);

    private final ObjectMapper objectMapper;
    private final Validator validator;

    GatewayMessageDecoder(ObjectMapper objectMapper, Validator validator) {
        this.objectMapper = GatewayJsonConfig.strictScalars(objectMapper.copy());
        this.validator = validator;
    }

    /**
     * Outcome of decoding one frame: exactly one of {@code message} and {@code error} is set.
     */
    record Result(GatewayMessage message, BridgeError error) {

        static Result ok(GatewayMessage message) {
            return new Result(message, null);
        }

        static Result failed(BridgeError error) {
            return new Result(null, error);
        }

        boolean isOk() {
            return message != null;
        }
    }

    Result decode(String text) {
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            return Result.failed(BridgeError.of(BridgeError.INVALID_JSON));
        }
        if (root == null || !root.isObject()) {
            return invalid("", "Expected an object envelope");
        }

        JsonNode typeNode = root.get("type");
        Optional<GatewayMessage.Type> type = typeNode != null && typeNode.isTextual()
                ? GatewayMessage.Type.fromWire(typeNode.asText())
                : Optional.empty();
        if (type.isEmpty()) {
            return invalid("type", "Unknown message type");
        }
        if (type.get() == GatewayMessage.Type.PING) {
            return Result.ok(new GatewayMessage(GatewayMessage.Type.PING, null));
        }

        JsonNode payloadNode = root.get("payload");
        if (payloadNode == null || !payloadNode.isObject()) {
            return invalid("payload", "Expected object");
        }
        Object payload;
        try {
            payload = objectMapper.treeToValue(payloadNode, PAYLOAD_TYPES.get(type.get()));
        } catch (MismatchedInputException e) {
            ValidationIssue issue = ValidationIssue.fromTypeMismatch("payload", e);
            return Result.failed(BridgeError.validationFailed(List.of(issue)));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return invalid("payload", "Payload does not match the " + type.get().wireName() + " schema");
        }

        Set<ConstraintViolation<Object>> violations = validator.validate(payload);
        if (!violations.isEmpty()) {
            List<ValidationIssue> issues = violations.stream()
                    .map(v -> new ValidationIssue("payload." + v.getPropertyPath(), v.getMessage()))
                    .sorted(Comparator.comparing(ValidationIssue::path))
                    .toList();
            return Result.failed(BridgeError.validationFailed(issues));
        }
        return Result.ok(new GatewayMessage(type.get(), payload));
    }

    private static Result invalid(String path, String message) {
        return Result.failed(BridgeError.validationFailed(List.of(new ValidationIssue(path, message))));
    }
}
