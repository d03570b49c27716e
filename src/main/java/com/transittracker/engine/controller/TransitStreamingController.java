package com.transittracker.engine.controller;

import com.transittracker.engine.dto.GeofenceAlertResponse;
import com.transittracker.engine.dto.LocationUpdateRecord;
import com.transittracker.engine.service.geofence.GeofenceMatcher;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.handler.annotation.support.MethodArgumentNotValidException;
import org.springframework.messaging.simp.annotation.SendToUser;
import org.springframework.stereotype.Controller;

import java.security.Principal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * WebSocket Controller for rider location updates
 *
 * Message Flow:
 * 1. Client sends its location to /app/location
 * 2. Controller checks the point against active zones
 * 3. The result goes back to the sender via /user/queue/alerts (private)
 *
 * Vehicle positions are pushed separately on /topic/vehicles.
 *
 * Usage:
 * - Connect to: ws://localhost:8080/ws/transit
 * - Send to: /app/location, /app/ping
 * - Subscribe to: /topic/vehicles, /user/queue/alerts
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class TransitStreamingController {

    static final String ALERTS_QUEUE = "/queue/alerts";

    private final GeofenceMatcher geofenceMatcher;

    /**
     * Checks a client location; the result goes to that client's
     * /user/queue/alerts, with or without triggered zones.
     */
    @MessageMapping("/location")
    @SendToUser(ALERTS_QUEUE)
    public GeofenceAlertResponse handleLocation(@Valid @Payload LocationUpdateRecord update, Principal principal) {
        log.debug("Received {} from {}", update.toLogString(), principal != null ? principal.getName() : "anonymous");

        if (!update.hasValidCoordinates()) {
            log.warn("Ignoring location with invalid coordinates from {}", update.clientId());
            return GeofenceAlertResponse.of(List.of());
        }

        GeofenceAlertResponse response = geofenceMatcher.checkAlerts(update.latitude(), update.longitude());
        if (response.hasAlerts()) {
            log.info("Client {} inside zones {}", update.clientId(), response.triggeredZoneIds());
        }
        return response;
    }

    @MessageExceptionHandler
    @SendToUser("/queue/errors")
    public Map<String, Object> handleInvalidLocation(MethodArgumentNotValidException e) {
        log.warn("Rejected location update: {}", e.getMessage());
        return Map.of(
                "status", "ERROR",
                "message", "Invalid location update",
                "timestamp", Instant.now().toString()
        );
    }

    /**
     * Client sends ping, server responds with pong.
     */
    @MessageMapping("/ping")
    @SendToUser("/queue/reply")
    public Map<String, Object> handlePing(Principal principal) {
        log.debug("Ping received from {}", principal != null ? principal.getName() : "anonymous");
        return Map.of(
                "type", "PONG",
                "serverTime", Instant.now().toString(),
                "status", "OK"
        );
    }
}
