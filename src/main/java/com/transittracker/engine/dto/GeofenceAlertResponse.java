package com.transittracker.engine.dto;

import java.util.List;

/**
 * Result of a geofence check, ordered by priority then distance.
 */
public record GeofenceAlertResponse(
    List<GeofenceZone> alerts,
    List<String> triggeredZoneIds
) {

    public static GeofenceAlertResponse of(List<GeofenceZone> zones) {
        return new GeofenceAlertResponse(
            List.copyOf(zones),
            zones.stream().map(GeofenceZone::id).toList()
        );
    }

    public boolean hasAlerts() {
        return !alerts.isEmpty();
    }
}
