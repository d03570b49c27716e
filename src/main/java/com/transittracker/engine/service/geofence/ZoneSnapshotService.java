package com.transittracker.engine.service.geofence;

import com.transittracker.engine.dto.GeofenceZone;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Holds the read-only snapshot of zones the matcher works against.
 *
 * Architecture:
 * 1. Warm-up: load all zones from the store on startup
 * 2. Refresh: scheduled, plus on demand from the admin endpoint
 * 3. Readers: take the current snapshot once per check; a refresh swaps
 *    the reference and never mutates a published list
 *
 * A failing store never empties the snapshot; the previous one stays
 * published until a refresh succeeds.
 */
@Service
@Slf4j
public class ZoneSnapshotService {

    private final ZoneStore zoneStore;
    private final Clock clock;

    private volatile Snapshot snapshot = new Snapshot(List.of(), List.of(), null);

    private record Snapshot(List<GeofenceZone> allZones, List<GeofenceZone> activeZones, Instant refreshedAt) {
    }

    public ZoneSnapshotService(ZoneStore zoneStore, Clock clock) {
        this.zoneStore = zoneStore;
        this.clock = clock;
    }

    @PostConstruct
    public void warmUp() {
        log.info("Starting zone snapshot warm-up from {} store...", zoneStore.name());
        long startTime = System.currentTimeMillis();

        try {
            int activeCount = refreshZones();
            log.info("Zone snapshot warm-up completed: {} active zones in {}ms",
                activeCount, System.currentTimeMillis() - startTime);
        } catch (RuntimeException e) {
            // Start anyway: checks return no alerts until a refresh succeeds
            log.error("Zone snapshot warm-up failed", e);
        }
    }

    @Scheduled(fixedRateString = "${transit.geofence.refresh-interval:PT5M}",
               initialDelayString = "${transit.geofence.refresh-interval:PT5M}")
    public void scheduledRefresh() {
        try {
            int activeCount = refreshZones();
            log.debug("Scheduled zone refresh completed: {} active zones", activeCount);
        } catch (RuntimeException e) {
            log.error("Scheduled zone refresh failed, keeping previous snapshot", e);
        }
    }

    /**
     * Reloads zones from the store and publishes a new snapshot.
     *
     * @return number of active zones now published
     */
    public int refreshZones() {
        List<GeofenceZone> zones = List.copyOf(zoneStore.loadZones());
        List<GeofenceZone> active = zones.stream().filter(GeofenceZone::active).toList();

        if (zones.isEmpty()) {
            log.warn("Zone store '{}' returned no zones", zoneStore.name());
        }

        snapshot = new Snapshot(zones, active, clock.instant());
        log.info("Published zone snapshot: {} zones, {} active", zones.size(), active.size());
        return active.size();
    }

    public List<GeofenceZone> activeZones() {
        return snapshot.activeZones();
    }

    public List<GeofenceZone> allZones() {
        return snapshot.allZones();
    }

    public Instant lastRefreshedAt() {
        return snapshot.refreshedAt();
    }
}
