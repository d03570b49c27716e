package com.transittracker.engine.service.geofence;

import com.transittracker.engine.config.TransitProperties;
import com.transittracker.engine.dto.GeofenceZone;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Zones declared under {@code transit.geofence.zones}. Default store.
 */
@Component
@ConditionalOnProperty(prefix = "transit.geofence", name = "zone-store", havingValue = "config", matchIfMissing = true)
@RequiredArgsConstructor
public class ConfiguredZoneStore implements ZoneStore {

    private final TransitProperties properties;

    @Override
    public List<GeofenceZone> loadZones() {
        return properties.getGeofence().getZones().stream()
            .map(TransitProperties.Zone::toGeofenceZone)
            .toList();
    }

    @Override
    public String name() {
        return "config";
    }
}
