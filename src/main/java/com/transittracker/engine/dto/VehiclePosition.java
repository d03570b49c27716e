package com.transittracker.engine.dto;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.Instant;

/**
 * Normalized position report for a single vehicle.
 *
 * Both upstream feeds are decoded into this shape, so everything past the
 * decoder works on one type regardless of whether the data arrived as JSON
 * or as a GTFS-Realtime protobuf.
 *
 * @param id           Unique vehicle identifier within its class
 * @param vehicleClass Bus or train
 * @param routeId      Route the vehicle is serving (may be null)
 * @param latitude     WGS84 latitude in decimal degrees
 * @param longitude    WGS84 longitude in decimal degrees
 * @param heading      Optional bearing in degrees, normalized to [0, 360)
 * @param speed        Optional speed in meters per second
 * @param observedAt   When the upstream observed this position
 */
public record VehiclePosition(
    String id,
    VehicleClass vehicleClass,
    String routeId,
    double latitude,
    double longitude,
    Double heading,
    Double speed,
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant observedAt
) {

    public VehiclePosition {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Vehicle id cannot be blank");
        }
        if (vehicleClass == null) {
            throw new IllegalArgumentException("Vehicle class is required");
        }
        if (observedAt == null) {
            throw new IllegalArgumentException("Observation time is required");
        }

        // Normalize heading to [0, 360)
        if (heading != null) {
            if (heading.isNaN() || heading.isInfinite()) {
                heading = null;
            } else {
                double normalized = heading % 360.0;
                heading = normalized < 0 ? normalized + 360.0 : normalized;
            }
        }

        if (speed != null && (speed.isNaN() || speed < 0)) {
            speed = null;
        }
    }

    /**
     * True when this observation is strictly newer than the other one.
     */
    public boolean isNewerThan(VehiclePosition other) {
        return other == null || observedAt.isAfter(other.observedAt);
    }

    public String toLogString() {
        return String.format(
            "Vehicle[%s %s, route=%s, lat=%.6f, lon=%.6f, at=%s]",
            vehicleClass, id, routeId, latitude, longitude, observedAt
        );
    }
}
