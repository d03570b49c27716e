package com.transittracker.engine.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * STOMP over WebSocket for live vehicles and geofence alerts.
 *
 * Endpoints:
 * - /ws/transit: connection endpoint (SockJS and native)
 * - /app/location, /app/ping: client to server
 * - /topic/vehicles: vehicle broadcast
 * - /user/queue/alerts: per-client geofence alerts
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    @Value("${transit.websocket.endpoint:/ws/transit}")
    private String websocketEndpoint;

    @Value("${transit.websocket.allowed-origins:*}")
    private String allowedOrigins;

    @Override
    public void configureMessageBroker(MessageBrokerRegistry config) {
        config.enableSimpleBroker("/topic", "/queue");
        config.setApplicationDestinationPrefixes("/app");
        config.setUserDestinationPrefix("/user");
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint(websocketEndpoint)
                .setAllowedOriginPatterns(allowedOrigins)
                .withSockJS();

        // Native WebSocket clients
        registry.addEndpoint(websocketEndpoint)
                .setAllowedOriginPatterns(allowedOrigins);
    }
}
