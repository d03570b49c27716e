package com.transittracker.engine.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

/**
 * Location update pushed by a client over the WebSocket connection.
 *
 * @param clientId  Identifier of the sending client
 * @param latitude  WGS84 latitude
 * @param longitude WGS84 longitude
 * @param timestamp When the client captured the fix (defaults to now)
 */
public record LocationUpdateRecord(
    @NotBlank(message = "Client ID cannot be blank")
    String clientId,

    @NotNull(message = "Latitude is required")
    @DecimalMin(value = "-90.0", message = "Latitude must be >= -90")
    @DecimalMax(value = "90.0", message = "Latitude must be <= 90")
    Double latitude,

    @NotNull(message = "Longitude is required")
    @DecimalMin(value = "-180.0", message = "Longitude must be >= -180")
    @DecimalMax(value = "180.0", message = "Longitude must be <= 180")
    Double longitude,

    @JsonFormat(shape = JsonFormat.Shape.NUMBER)
    Instant timestamp
) {

    public LocationUpdateRecord {
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public boolean hasValidCoordinates() {
        return latitude != null && longitude != null
            && latitude >= -90.0 && latitude <= 90.0
            && longitude >= -180.0 && longitude <= 180.0;
    }

    public String toLogString() {
        return String.format("Location[client=%s, lat=%.6f, lon=%.6f, time=%s]",
            clientId, latitude, longitude, timestamp);
    }
}
