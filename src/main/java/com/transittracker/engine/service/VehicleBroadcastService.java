package com.transittracker.engine.service;

import com.transittracker.engine.dto.VehicleFeedResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Pushes the combined vehicle response to /topic/vehicles.
 *
 * Reads go through the shared cache, so the broadcast interval can be
 * shorter than the feed TTL without adding upstream calls.
 */
@Service
@ConditionalOnProperty(prefix = "transit.broadcast", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class VehicleBroadcastService {

    public static final String VEHICLES_TOPIC = "/topic/vehicles";

    private final VehicleFeedService vehicleFeedService;
    private final SimpMessagingTemplate messagingTemplate;

    @Scheduled(fixedRateString = "${transit.broadcast.interval:PT5S}")
    public void broadcastVehicles() {
        try {
            VehicleFeedResponse response = vehicleFeedService.getVehicles();
            messagingTemplate.convertAndSend(VEHICLES_TOPIC, response);
            log.debug("Broadcast {} buses and {} trains ({})",
                response.buses().size(), response.trains().size(), response.source());
        } catch (MessagingException e) {
            log.error("Failed to broadcast vehicle positions", e);
        }
    }
}
