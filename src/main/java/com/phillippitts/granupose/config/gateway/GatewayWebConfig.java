package com.phillippitts.granupose.config.gateway;

import com.phillippitts.granupose.presentation.websocket.BridgeWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Registers the gateway WebSocket endpoint and applies the configured CORS origin to both
 * the REST API and the WebSocket handshake.
 */
@Configuration
@EnableWebSocket
public class GatewayWebConfig implements WebSocketConfigurer, WebMvcConfigurer {

    private final GatewayProperties gatewayProperties;
    private final BridgeWebSocketHandler webSocketHandler;

    public GatewayWebConfig(GatewayProperties gatewayProperties, BridgeWebSocketHandler webSocketHandler) {
        this.gatewayProperties = gatewayProperties;
        this.webSocketHandler = webSocketHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(webSocketHandler, gatewayProperties.websocketPath())
                .setAllowedOriginPatterns(gatewayProperties.allowedOrigin());
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOriginPatterns(gatewayProperties.allowedOrigin())
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowedHeaders("*");
    }
}
