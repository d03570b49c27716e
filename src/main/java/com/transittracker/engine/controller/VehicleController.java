package com.transittracker.engine.controller;

import com.transittracker.engine.dto.FeedSnapshot;
import com.transittracker.engine.dto.VehicleClass;
import com.transittracker.engine.dto.VehicleFeedResponse;
import com.transittracker.engine.service.VehicleFeedService;
import com.transittracker.engine.service.feed.PositionCache;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Vehicle positions for map clients.
 *
 * Example:
 * GET /api/vehicles
 * GET /api/vehicles/trains
 */
@RestController
@RequestMapping("/api/vehicles")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Vehicles", description = "Cached bus and train positions")
public class VehicleController {

    private final VehicleFeedService vehicleFeedService;

    @Operation(
            summary = "Get all vehicle positions",
            description = "Returns buses and trains from the shared cache. Never fails for upstream outages; " +
                    "the source field reports live, partial, error or mock."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Combined vehicle positions",
                    content = @Content(
                            mediaType = "application/json",
                            examples = @ExampleObject(
                                    name = "Train feed down",
                                    value = "{\"buses\":[{\"id\":\"2412\",\"vehicleClass\":\"bus\",\"routeId\":\"110\"," +
                                            "\"latitude\":33.7546,\"longitude\":-84.3880,\"heading\":90.0,\"speed\":null," +
                                            "\"observedAt\":\"2024-01-01T12:00:00Z\"}],\"trains\":[]," +
                                            "\"timestamp\":\"2024-01-01T12:00:05Z\",\"source\":\"partial\"}"
                            )
                    )
            )
    })
    @GetMapping
    public ResponseEntity<VehicleFeedResponse> getVehicles() {
        return ResponseEntity.ok(vehicleFeedService.getVehicles());
    }

    @Operation(summary = "Get one feed's snapshot", description = "Accepts bus, buses, train or trains.")
    @GetMapping("/{vehicleClass}")
    public ResponseEntity<FeedSnapshot> getSnapshot(
            @Parameter(description = "Vehicle class", example = "trains") @PathVariable String vehicleClass) {
        return ResponseEntity.ok(vehicleFeedService.getSnapshot(VehicleClass.fromString(vehicleClass)));
    }

    @Operation(summary = "Get position cache statistics")
    @GetMapping("/cache/stats")
    public ResponseEntity<List<PositionCache.FeedCacheStats>> getCacheStats() {
        return ResponseEntity.ok(vehicleFeedService.getCacheStats());
    }

    /**
     * Expires both feed slots so the next read goes upstream.
     *
     * Example:
     * POST /api/vehicles/cache/refresh
     */
    @Operation(summary = "Expire cached feeds", description = "The next read of each feed triggers a refresh.")
    @PostMapping("/cache/refresh")
    public ResponseEntity<?> refreshCache() {
        vehicleFeedService.invalidateAll();
        log.info("Vehicle feed cache invalidated on request");
        return ResponseEntity.ok(Map.of(
            "status", "SUCCESS",
            "message", "Feed cache expired"
        ));
    }
}
