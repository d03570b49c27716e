package com.transittracker.engine.service.feed;

import com.transittracker.engine.dto.FeedSnapshot;
import com.transittracker.engine.dto.Provenance;
import com.transittracker.engine.dto.VehicleClass;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * TTL cache of feed snapshots with single-flight refresh, one slot per
 * vehicle class.
 *
 * Read path:
 * - fresh entry: returned, no upstream call
 * - stale entry: returned immediately, a refresh is started (or joined)
 * - no entry yet (cold start): callers wait for the in-flight fetch
 *
 * At most one upstream call per vehicle class is in flight. Every caller
 * arriving while it runs gets the same future. Each fetch is bounded by
 * the fetch timeout; a timed-out fetch completes with a degraded snapshot
 * and releases its slot, so the next refresh can try again.
 *
 * Instances hold their own state. The owning service creates one; tests
 * create as many isolated ones as they need.
 */
@Slf4j
public class PositionCache {

    // Cold-start callers wait slightly longer than the fetch bound itself
    private static final long COLD_START_MARGIN_MILLIS = 500;

    /**
     * @param snapshot  what callers are served
     * @param expiresAt end of the TTL window
     * @param lastLive  last snapshot obtained live (for the grace window)
     */
    public record CacheEntry(FeedSnapshot snapshot, Instant expiresAt, FeedSnapshot lastLive) {

        public boolean isFresh(Instant now) {
            return now.isBefore(expiresAt);
        }
    }

    public record FeedCacheStats(
        VehicleClass vehicleClass,
        Provenance provenance,
        Instant capturedAt,
        Instant expiresAt,
        long ageSeconds,
        int vehicleCount,
        boolean refreshInFlight
    ) {
    }

    private final Map<VehicleClass, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Map<VehicleClass, CompletableFuture<FeedSnapshot>> inFlight = new ConcurrentHashMap<>();

    private final FeedLoader loader;
    private final FeedFallbackPolicy fallbackPolicy;
    private final Executor executor;
    private final Clock clock;
    private final Duration ttl;
    private final Duration fetchTimeout;

    public PositionCache(
        FeedLoader loader,
        FeedFallbackPolicy fallbackPolicy,
        Executor executor,
        Clock clock,
        Duration ttl,
        Duration fetchTimeout
    ) {
        this.loader = loader;
        this.fallbackPolicy = fallbackPolicy;
        this.executor = executor;
        this.clock = clock;
        this.ttl = ttl;
        this.fetchTimeout = fetchTimeout;
    }

    /**
     * Returns the snapshot for a feed, fetching only when needed.
     * Never throws and never returns null.
     */
    public FeedSnapshot getOrFetch(VehicleClass vehicleClass) {
        return await(vehicleClass, getOrFetchAsync(vehicleClass));
    }

    /**
     * Non-blocking variant: already completed unless this is a cold start.
     * Lets callers start several feeds before waiting on any of them.
     */
    public CompletableFuture<FeedSnapshot> getOrFetchAsync(VehicleClass vehicleClass) {
        Instant now = clock.instant();
        CacheEntry entry = entries.get(vehicleClass);

        if (entry != null && entry.isFresh(now)) {
            log.debug("Cache hit for {} feed (expires {})", vehicleClass, entry.expiresAt());
            return CompletableFuture.completedFuture(entry.snapshot());
        }

        CompletableFuture<FeedSnapshot> refresh = refresh(vehicleClass);

        if (entry != null) {
            log.debug("Serving stale {} snapshot from {} while refreshing",
                vehicleClass, entry.snapshot().capturedAt());
            return CompletableFuture.completedFuture(entry.snapshot());
        }

        log.debug("Cold start for {} feed, waiting for first fetch", vehicleClass);
        return refresh;
    }

    /**
     * Waits for a future obtained from {@link #getOrFetchAsync}, bounded by
     * the fetch timeout. Falls back to a degraded snapshot instead of throwing.
     */
    public FeedSnapshot await(VehicleClass vehicleClass, CompletableFuture<FeedSnapshot> future) {
        try {
            return future.get(fetchTimeout.toMillis() + COLD_START_MARGIN_MILLIS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fallbackPolicy.degrade(vehicleClass, lastLive(vehicleClass), e);
        } catch (ExecutionException | TimeoutException e) {
            return fallbackPolicy.degrade(vehicleClass, lastLive(vehicleClass), e);
        }
    }

    /**
     * Starts a refresh for the feed, or joins the one already in flight.
     */
    CompletableFuture<FeedSnapshot> refresh(VehicleClass vehicleClass) {
        CompletableFuture<FeedSnapshot> pending = new CompletableFuture<>();
        CompletableFuture<FeedSnapshot> existing = inFlight.putIfAbsent(vehicleClass, pending);
        if (existing != null) {
            return existing;
        }

        CompletableFuture<FeedSnapshot> fetch;
        try {
            fetch = CompletableFuture.supplyAsync(() -> load(vehicleClass), executor);
        } catch (RejectedExecutionException e) {
            fetch = CompletableFuture.failedFuture(e);
        }

        fetch.orTimeout(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS)
            .handle((snapshot, error) -> store(vehicleClass, snapshot, error))
            .whenComplete((stored, error) -> {
                inFlight.remove(vehicleClass, pending);
                if (error != null) {
                    log.error("Unexpected failure storing {} snapshot", vehicleClass, error);
                    pending.complete(fallbackPolicy.degrade(vehicleClass, lastLive(vehicleClass), error));
                } else {
                    pending.complete(stored);
                }
            });

        return pending;
    }

    private FeedSnapshot load(VehicleClass vehicleClass) {
        try {
            return loader.load(vehicleClass);
        } catch (Exception e) {
            throw new CompletionException(e);
        }
    }

    private FeedSnapshot store(VehicleClass vehicleClass, FeedSnapshot fetched, Throwable error) {
        CacheEntry previous = entries.get(vehicleClass);
        FeedSnapshot lastLive = previous == null ? null : previous.lastLive();

        FeedSnapshot served;
        if (error == null && fetched != null) {
            served = fetched.reconcileWith(lastLive);
            lastLive = served;
            log.debug("Stored fresh {}", served.toLogString());
        } else {
            served = fallbackPolicy.degrade(vehicleClass, lastLive, error);
        }

        entries.put(vehicleClass, new CacheEntry(served, clock.instant().plus(ttl), lastLive));
        return served;
    }

    /**
     * Expires the entry so the next read triggers a refresh. The stale
     * snapshot keeps being served until the refresh completes.
     */
    public void invalidate(VehicleClass vehicleClass) {
        Instant now = clock.instant();
        entries.computeIfPresent(vehicleClass,
            (key, entry) -> new CacheEntry(entry.snapshot(), now, entry.lastLive()));
        log.info("Invalidated cached {} snapshot", vehicleClass);
    }

    public boolean isRefreshInFlight(VehicleClass vehicleClass) {
        return inFlight.containsKey(vehicleClass);
    }

    public CacheEntry entry(VehicleClass vehicleClass) {
        return entries.get(vehicleClass);
    }

    public List<FeedCacheStats> stats() {
        Instant now = clock.instant();
        List<FeedCacheStats> stats = new ArrayList<>();
        for (VehicleClass vehicleClass : VehicleClass.values()) {
            CacheEntry entry = entries.get(vehicleClass);
            if (entry == null) {
                stats.add(new FeedCacheStats(vehicleClass, null, null, null, 0, 0,
                    isRefreshInFlight(vehicleClass)));
                continue;
            }
            FeedSnapshot snapshot = entry.snapshot();
            stats.add(new FeedCacheStats(
                vehicleClass,
                snapshot.provenance(),
                snapshot.capturedAt(),
                entry.expiresAt(),
                Duration.between(snapshot.capturedAt(), now).toSeconds(),
                snapshot.size(),
                isRefreshInFlight(vehicleClass)
            ));
        }
        return stats;
    }

    private FeedSnapshot lastLive(VehicleClass vehicleClass) {
        CacheEntry entry = entries.get(vehicleClass);
        return entry == null ? null : entry.lastLive();
    }
}
