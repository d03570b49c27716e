package com.transittracker.engine.controller;

import com.transittracker.engine.dto.GeofenceAlertResponse;
import com.transittracker.engine.dto.GeofenceZone;
import com.transittracker.engine.service.geofence.GeofenceMatcher;
import com.transittracker.engine.service.geofence.ZoneSnapshotService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Geofence checks and zone administration.
 */
@RestController
@RequestMapping("/api/geofence")
@RequiredArgsConstructor
@Validated
@Slf4j
@Tag(name = "Geofence", description = "Proximity alerts for points of interest")
public class GeofenceController {

    private final GeofenceMatcher geofenceMatcher;
    private final ZoneSnapshotService zoneSnapshotService;

    /**
     * Example:
     * GET /api/geofence/check?lat=33.7550&lng=-84.4030
     */
    @Operation(
            summary = "Check a location against active zones",
            description = "Returns triggered zones ordered by priority (urgent first) and then by distance. " +
                    "Results are cached per grid bucket, so decisions near a boundary may lag by up to a minute."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Check completed",
                    content = @Content(
                            mediaType = "application/json",
                            examples = @ExampleObject(
                                    name = "Inside a zone",
                                    value = "{\"alerts\":[{\"id\":\"stadium\",\"latitude\":33.7545,\"longitude\":-84.4025," +
                                            "\"radiusMeters\":500.0,\"priority\":\"urgent\",\"message\":\"Event traffic\"," +
                                            "\"active\":true}],\"triggeredZoneIds\":[\"stadium\"]}"
                            )
                    )
            ),
            @ApiResponse(responseCode = "400", description = "Coordinates out of range")
    })
    @GetMapping("/check")
    public ResponseEntity<GeofenceAlertResponse> check(
            @Parameter(description = "Latitude", example = "33.7550")
            @RequestParam @DecimalMin("-90.0") @DecimalMax("90.0") double lat,
            @Parameter(description = "Longitude", example = "-84.4030")
            @RequestParam @DecimalMin("-180.0") @DecimalMax("180.0") double lng) {
        if (!Double.isFinite(lat) || !Double.isFinite(lng)) {
            throw new IllegalArgumentException("Coordinates must be finite numbers");
        }
        return ResponseEntity.ok(geofenceMatcher.checkAlerts(lat, lng));
    }

    @Operation(summary = "List all zones", description = "Includes inactive zones from the current snapshot.")
    @GetMapping("/zones")
    public ResponseEntity<List<GeofenceZone>> getZones() {
        return ResponseEntity.ok(zoneSnapshotService.allZones());
    }

    /**
     * Reloads zones from the store and clears cached bucket results.
     *
     * Example:
     * POST /api/geofence/zones/refresh
     */
    @Operation(summary = "Reload zones", description = "Reloads zones and clears the bucket result cache.")
    @PostMapping("/zones/refresh")
    public ResponseEntity<?> refreshZones() {
        int activeCount = geofenceMatcher.refreshZones();
        return ResponseEntity.ok(Map.of(
            "status", "SUCCESS",
            "message", "Zones refreshed",
            "activeZones", activeCount
        ));
    }

    @Operation(summary = "Get geofence cache statistics")
    @GetMapping("/cache/stats")
    public ResponseEntity<?> getCacheStats() {
        GeofenceMatcher.GeofenceCacheStats stats = geofenceMatcher.getCacheStats();

        return ResponseEntity.ok(Map.of(
            "cachedBuckets", stats.cachedBuckets(),
            "activeZones", stats.activeZones(),
            "hits", stats.hits(),
            "misses", stats.misses(),
            "cacheHitRate", String.format("%.1f%%", stats.hitRate())
        ));
    }
}
