package com.transittracker.engine.service;

import com.transittracker.engine.config.TransitProperties;
import com.transittracker.engine.dto.FeedSnapshot;
import com.transittracker.engine.dto.VehicleClass;
import com.transittracker.engine.dto.VehicleFeedResponse;
import com.transittracker.engine.service.feed.FeedFallbackPolicy;
import com.transittracker.engine.service.feed.FeedLoader;
import com.transittracker.engine.service.feed.PositionCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Query boundary for vehicle positions.
 *
 * Owns the {@link PositionCache}; every caller goes through it, so polling
 * clients never multiply upstream calls. Both feeds are started before
 * either is awaited, so a slow train feed never delays the bus feed's fetch.
 *
 * Never throws for data unavailability: failures surface only in the
 * {@code source} tag of the response.
 */
@Service
@Slf4j
public class VehicleFeedService {

    private final PositionCache positionCache;
    private final boolean mockMode;
    private final Clock clock;

    public VehicleFeedService(
        FeedLoader feedLoader,
        TransitProperties properties,
        @Qualifier("feedExecutor") Executor feedExecutor,
        Clock clock
    ) {
        TransitProperties.Cache cache = properties.getCache();
        this.mockMode = properties.getFeeds().isMockMode();
        this.clock = clock;
        this.positionCache = new PositionCache(
            feedLoader,
            new FeedFallbackPolicy(cache.graceWindow(), clock),
            feedExecutor,
            clock,
            cache.getTtl(),
            cache.getFetchTimeout()
        );

        log.info("Vehicle feed service ready: ttl={}s, grace={}s, timeout={}s, mockMode={}",
            cache.getTtl().toSeconds(), cache.graceWindow().toSeconds(),
            cache.getFetchTimeout().toSeconds(), mockMode);
    }

    /**
     * Combined bus and train positions with an overall provenance tag.
     */
    public VehicleFeedResponse getVehicles() {
        CompletableFuture<FeedSnapshot> buses = positionCache.getOrFetchAsync(VehicleClass.BUS);
        CompletableFuture<FeedSnapshot> trains = positionCache.getOrFetchAsync(VehicleClass.TRAIN);

        FeedSnapshot busSnapshot = positionCache.await(VehicleClass.BUS, buses);
        FeedSnapshot trainSnapshot = positionCache.await(VehicleClass.TRAIN, trains);

        VehicleFeedResponse response = VehicleFeedResponse.combine(
            busSnapshot, trainSnapshot, mockMode, clock.instant());

        log.debug("Serving {} buses ({}) and {} trains ({}), source={}",
            busSnapshot.size(), busSnapshot.provenance(),
            trainSnapshot.size(), trainSnapshot.provenance(),
            response.source());
        return response;
    }

    public FeedSnapshot getSnapshot(VehicleClass vehicleClass) {
        return positionCache.getOrFetch(vehicleClass);
    }

    /**
     * Expires both cache slots; the next read refreshes them.
     */
    public void invalidateAll() {
        for (VehicleClass vehicleClass : VehicleClass.values()) {
            positionCache.invalidate(vehicleClass);
        }
    }

    public List<PositionCache.FeedCacheStats> getCacheStats() {
        return positionCache.stats();
    }

    public boolean isMockMode() {
        return mockMode;
    }
}
