package com.transittracker.engine.controller;

import com.transittracker.engine.service.VehicleFeedService;
import com.transittracker.engine.service.geofence.ZoneSnapshotService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Health")
public class HealthController {

    private final VehicleFeedService vehicleFeedService;
    private final ZoneSnapshotService zoneSnapshotService;
    private final Clock clock;

    @Operation(summary = "Service health")
    @GetMapping("/health")
    public ResponseEntity<?> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("service", "Real-Time Transit Engine");
        body.put("mockMode", vehicleFeedService.isMockMode());
        body.put("activeZones", zoneSnapshotService.activeZones().size());
        body.put("zonesRefreshedAt", zoneSnapshotService.lastRefreshedAt());
        body.put("timestamp", clock.instant());
        return ResponseEntity.ok(body);
    }
}
