package com.transittracker.engine.dto;

/**
 * Circular alert zone, as read from the zone store.
 *
 * The matcher never mutates zones; updates arrive as a new snapshot from
 * the store.
 *
 * @param id           Zone identifier
 * @param latitude     Center latitude
 * @param longitude    Center longitude
 * @param radiusMeters Radius in meters
 * @param priority     Alert priority
 * @param message      Alert text shown to the user
 * @param active       Inactive zones are ignored by the matcher
 */
public record GeofenceZone(
    String id,
    double latitude,
    double longitude,
    double radiusMeters,
    ZonePriority priority,
    String message,
    boolean active
) {

    public GeofenceZone {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Zone id cannot be blank");
        }
        if (radiusMeters < 0 || Double.isNaN(radiusMeters)) {
            throw new IllegalArgumentException("Zone radius must be >= 0: " + id);
        }
        if (priority == null) {
            priority = ZonePriority.NORMAL;
        }
    }

    public String toLogString() {
        return String.format("Zone[id=%s, center=(%.5f, %.5f), r=%.0fm, priority=%s, active=%s]",
            id, latitude, longitude, radiusMeters, priority, active);
    }
}
