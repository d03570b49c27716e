package com.transittracker.engine.service.geofence;

import com.transittracker.engine.dto.GeofenceZone;

import java.util.List;

/**
 * Read access to the externally owned zone definitions.
 */
public interface ZoneStore {

    /**
     * All zones, active or not. Called on warm-up and on each snapshot refresh.
     */
    List<GeofenceZone> loadZones();

    /**
     * Short name for logs ("config", "redis").
     */
    String name();
}
