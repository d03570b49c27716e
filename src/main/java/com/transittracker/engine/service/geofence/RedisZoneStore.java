package com.transittracker.engine.service.geofence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.transittracker.engine.dto.GeofenceZone;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Zones maintained in Redis by the zone administration tooling.
 *
 * Redis layout:
 * - Key "geofence:zones": set of zone ids
 * - Key "geofence:zone:{id}": JSON of one zone
 *   ({"id":"...","latitude":..,"longitude":..,"radiusMeters":..,"priority":"urgent","message":"...","active":true})
 *
 * A zone whose JSON is missing or unreadable is skipped and logged; the
 * rest of the set is still returned.
 */
@Component
@ConditionalOnProperty(prefix = "transit.geofence", name = "zone-store", havingValue = "redis")
@RequiredArgsConstructor
@Slf4j
public class RedisZoneStore implements ZoneStore {

    static final String ZONE_IDS_KEY = "geofence:zones";
    static final String ZONE_KEY_PREFIX = "geofence:zone:";

    private final StringRedisTemplate stringRedisTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public List<GeofenceZone> loadZones() {
        Set<String> zoneIds = stringRedisTemplate.opsForSet().members(ZONE_IDS_KEY);

        if (zoneIds == null || zoneIds.isEmpty()) {
            log.warn("No zone ids found in Redis under '{}'", ZONE_IDS_KEY);
            return List.of();
        }

        List<GeofenceZone> zones = new ArrayList<>(zoneIds.size());
        for (String zoneId : new TreeSet<>(zoneIds)) {
            String json = stringRedisTemplate.opsForValue().get(ZONE_KEY_PREFIX + zoneId);
            if (json == null) {
                log.warn("Zone {} listed in '{}' but has no definition", zoneId, ZONE_IDS_KEY);
                continue;
            }

            try {
                zones.add(objectMapper.readValue(json, GeofenceZone.class));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.error("Failed to parse zone {} from Redis", zoneId, e);
            }
        }

        log.debug("Loaded {} zones from Redis", zones.size());
        return zones;
    }

    @Override
    public String name() {
        return "redis";
    }
}
