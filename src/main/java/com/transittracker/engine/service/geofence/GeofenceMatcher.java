package com.transittracker.engine.service.geofence;

import com.transittracker.engine.config.TransitProperties;
import com.transittracker.engine.dto.GeofenceAlertResponse;
import com.transittracker.engine.dto.GeofenceZone;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Finds the zones containing a point.
 *
 * Performance Strategy:
 * - Results are cached per coordinate bucket (a square grid cell of
 *   {@code bucket-resolution-meters}) for {@code result-ttl}, so a user
 *   standing still or walking slowly does not trigger a full zone scan on
 *   every location tick.
 * - Near a zone boundary the decision can therefore lag by up to the TTL.
 * - At most {@code max-cached-buckets} results are kept; past that, expired
 *   buckets go first and then the oldest live ones.
 * - Cached results store ids only and are resolved against the current
 *   active snapshot, so a deactivated zone stops alerting immediately.
 *
 * Ordering: priority (urgent first), then distance to the zone center.
 */
@Service
@Slf4j
public class GeofenceMatcher {

    private static final Comparator<Match> MATCH_ORDER =
        Comparator.<Match, Integer>comparing(match -> match.zone().priority().ordinal())
            .thenComparingDouble(Match::distanceMeters);

    private final ZoneSnapshotService zoneSnapshotService;
    private final Clock clock;
    private final double bucketDegrees;
    private final Duration resultTtl;
    private final int maxCachedBuckets;

    private final Map<BucketKey, GeofenceCheckResult> resultCache = new ConcurrentHashMap<>();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong cacheMisses = new AtomicLong();

    record BucketKey(long latitudeIndex, long longitudeIndex) {
    }

    private record Match(GeofenceZone zone, double distanceMeters) {
    }

    /**
     * Cached outcome for one bucket.
     *
     * @param triggeredZoneIds ids in alert order
     * @param expiresAt        end of validity
     */
    public record GeofenceCheckResult(List<String> triggeredZoneIds, Instant expiresAt) {

        public boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }

    public record GeofenceCacheStats(int cachedBuckets, long hits, long misses, int activeZones) {

        public double hitRate() {
            long total = hits + misses;
            return total == 0 ? 0.0 : (double) hits / total * 100.0;
        }
    }

    public GeofenceMatcher(ZoneSnapshotService zoneSnapshotService, Clock clock, TransitProperties properties) {
        TransitProperties.Geofence geofence = properties.getGeofence();
        this.zoneSnapshotService = zoneSnapshotService;
        this.clock = clock;
        this.bucketDegrees = geofence.getBucketResolutionMeters() / GeoDistance.METERS_PER_DEGREE_LATITUDE;
        this.resultTtl = geofence.getResultTtl();
        this.maxCachedBuckets = geofence.getMaxCachedBuckets();
    }

    /**
     * Active zones containing the point, in alert order.
     */
    public List<GeofenceZone> check(double latitude, double longitude) {
        // One snapshot read per check
        List<GeofenceZone> zones = zoneSnapshotService.activeZones();
        Instant now = clock.instant();
        BucketKey bucket = bucketFor(latitude, longitude);

        GeofenceCheckResult cached = resultCache.get(bucket);
        if (cached != null && !cached.isExpired(now)) {
            cacheHits.incrementAndGet();
            return resolve(cached.triggeredZoneIds(), zones);
        }

        cacheMisses.incrementAndGet();
        List<GeofenceZone> triggered = scan(latitude, longitude, zones);
        resultCache.put(bucket, new GeofenceCheckResult(
            triggered.stream().map(GeofenceZone::id).toList(),
            now.plus(resultTtl)
        ));
        pruneIfNeeded(now);

        if (!triggered.isEmpty()) {
            log.debug("Point ({}, {}) triggered zones {}", latitude, longitude,
                triggered.stream().map(GeofenceZone::id).toList());
        }
        return triggered;
    }

    public GeofenceAlertResponse checkAlerts(double latitude, double longitude) {
        return GeofenceAlertResponse.of(check(latitude, longitude));
    }

    /**
     * Reloads zones and drops every cached bucket result.
     *
     * @return number of active zones after the refresh
     */
    public int refreshZones() {
        int activeCount = zoneSnapshotService.refreshZones();
        clearCache();
        return activeCount;
    }

    public void clearCache() {
        int size = resultCache.size();
        resultCache.clear();
        log.info("Cleared {} cached geofence bucket results", size);
    }

    public GeofenceCacheStats getCacheStats() {
        return new GeofenceCacheStats(
            resultCache.size(),
            cacheHits.get(),
            cacheMisses.get(),
            zoneSnapshotService.activeZones().size()
        );
    }

    private List<GeofenceZone> scan(double latitude, double longitude, List<GeofenceZone> zones) {
        List<Match> matches = new ArrayList<>();
        for (GeofenceZone zone : zones) {
            if (!zone.active()) {
                continue;
            }
            double distance = GeoDistance.haversineMeters(latitude, longitude, zone.latitude(), zone.longitude());
            if (distance <= zone.radiusMeters()) {
                matches.add(new Match(zone, distance));
            }
        }

        matches.sort(MATCH_ORDER);
        return matches.stream().map(Match::zone).toList();
    }

    private static List<GeofenceZone> resolve(List<String> zoneIds, List<GeofenceZone> zones) {
        if (zoneIds.isEmpty()) {
            return List.of();
        }

        Map<String, GeofenceZone> byId = new HashMap<>();
        for (GeofenceZone zone : zones) {
            byId.put(zone.id(), zone);
        }

        List<GeofenceZone> resolved = new ArrayList<>(zoneIds.size());
        for (String zoneId : zoneIds) {
            GeofenceZone zone = byId.get(zoneId);
            if (zone != null && zone.active()) {
                resolved.add(zone);
            }
        }
        return resolved;
    }

    BucketKey bucketFor(double latitude, double longitude) {
        return new BucketKey(
            Math.round(latitude / bucketDegrees),
            Math.round(longitude / bucketDegrees)
        );
    }

    private void pruneIfNeeded(Instant now) {
        if (resultCache.size() <= maxCachedBuckets) {
            return;
        }
        int before = resultCache.size();
        resultCache.values().removeIf(result -> result.isExpired(now));

        // Still over the cap inside one TTL: drop the earliest-expiring buckets
        int excess = resultCache.size() - maxCachedBuckets;
        if (excess > 0) {
            resultCache.entrySet().stream()
                .sorted(Map.Entry.comparingByValue(Comparator.comparing(GeofenceCheckResult::expiresAt)))
                .limit(excess)
                .map(Map.Entry::getKey)
                .toList()
                .forEach(resultCache::remove);
        }
        log.debug("Pruned geofence result cache from {} to {} buckets", before, resultCache.size());
    }
}
