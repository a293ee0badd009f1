package com.phillippitts.granupose.config.gateway;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the HTTP and WebSocket gateway.
 *
 * @param allowedOrigin CORS origin; {@code *} allows any
 * @param websocketPath path of the WebSocket endpoint
 * @param sendTimeLimitMs maximum time a single WebSocket send may block before the session is closed
 * @param sendBufferSizeBytes per-session outbound buffer; frames beyond it are dropped for that session
 */
@ConfigurationProperties(prefix = "bridge.gateway")
@Validated
public record GatewayProperties(
        @DefaultValue("*")
        @NotBlank(message = "Allowed origin must not be blank")
        String allowedOrigin,

        @DefaultValue("/ws")
        @NotBlank(message = "WebSocket path must not be blank")
        String websocketPath,

        @DefaultValue("5000")
        @Positive(message = "Send time limit must be positive")
        int sendTimeLimitMs,

        @DefaultValue("524288")
        @Positive(message = "Send buffer size must be positive")
        int sendBufferSizeBytes
) {
}
