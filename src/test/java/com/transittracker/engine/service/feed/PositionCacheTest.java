package com.transittracker.engine.service.feed;

import com.transittracker.engine.dto.FeedSnapshot;
import com.transittracker.engine.dto.Provenance;
import com.transittracker.engine.dto.VehicleClass;
import com.transittracker.engine.dto.VehiclePosition;
import com.transittracker.engine.exception.FeedFetchException;
import com.transittracker.engine.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;

class PositionCacheTest {

    private static final Instant START = Instant.parse("2024-03-01T12:00:00Z");
    private static final Duration TTL = Duration.ofSeconds(30);

    private final MutableClock clock = new MutableClock(START);
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private PositionCache cache(FeedLoader loader, Duration fetchTimeout) {
        return new PositionCache(loader, new FeedFallbackPolicy(TTL.multipliedBy(5), clock),
            executor, clock, TTL, fetchTimeout);
    }

    private FeedSnapshot liveSnapshot(VehicleClass vehicleClass, String... ids) {
        List<VehiclePosition> positions = new ArrayList<>();
        for (String id : ids) {
            positions.add(new VehiclePosition(id, vehicleClass, "R1", 33.75, -84.39, null, null, clock.instant()));
        }
        return new FeedSnapshot(vehicleClass, positions, clock.instant(), Provenance.LIVE);
    }

    @Test
    void shouldIssueSingleUpstreamCallForConcurrentColdStartCallers() throws Exception {
        AtomicInteger loads = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);
        FeedLoader loader = vehicleClass -> {
            loads.incrementAndGet();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return liveSnapshot(vehicleClass, "B1");
        };
        PositionCache cache = cache(loader, Duration.ofSeconds(5));

        int callers = 10;
        ExecutorService callerPool = Executors.newFixedThreadPool(callers);
        try {
            CountDownLatch ready = new CountDownLatch(callers);
            List<Future<FeedSnapshot>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                results.add(callerPool.submit(() -> {
                    ready.countDown();
                    return cache.getOrFetch(VehicleClass.BUS);
                }));
            }
            ready.await(5, TimeUnit.SECONDS);
            Thread.sleep(200);
            release.countDown();

            for (Future<FeedSnapshot> result : results) {
                FeedSnapshot snapshot = result.get(5, TimeUnit.SECONDS);
                assertThat(snapshot.provenance()).isEqualTo(Provenance.LIVE);
                assertThat(snapshot.size()).isEqualTo(1);
            }
        } finally {
            callerPool.shutdownNow();
        }

        assertThat(loads).hasValue(1);
    }

    @Test
    void shouldServeFromCacheWithinTtl() {
        AtomicInteger loads = new AtomicInteger();
        PositionCache cache = cache(vehicleClass -> {
            loads.incrementAndGet();
            return liveSnapshot(vehicleClass, "T1");
        }, Duration.ofSeconds(2));

        cache.getOrFetch(VehicleClass.TRAIN);
        clock.advance(Duration.ofSeconds(29));
        FeedSnapshot second = cache.getOrFetch(VehicleClass.TRAIN);

        assertThat(loads).hasValue(1);
        assertThat(second.provenance()).isEqualTo(Provenance.LIVE);
    }

    @Test
    void shouldServeStaleSnapshotWhileRefreshing() throws Exception {
        AtomicInteger loads = new AtomicInteger();
        CountDownLatch secondLoadStarted = new CountDownLatch(1);
        CountDownLatch releaseSecondLoad = new CountDownLatch(1);
        FeedLoader loader = vehicleClass -> {
            int call = loads.incrementAndGet();
            if (call == 2) {
                secondLoadStarted.countDown();
                try {
                    releaseSecondLoad.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return liveSnapshot(vehicleClass, "B2");
            }
            return liveSnapshot(vehicleClass, "B1");
        };
        PositionCache cache = cache(loader, Duration.ofSeconds(5));

        FeedSnapshot first = cache.getOrFetch(VehicleClass.BUS);
        clock.advance(TTL.plusSeconds(1));

        FeedSnapshot stale = cache.getOrFetch(VehicleClass.BUS);
        assertThat(stale).isEqualTo(first);
        assertThat(secondLoadStarted.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(cache.isRefreshInFlight(VehicleClass.BUS)).isTrue();

        // A second stale read joins the running refresh
        assertThat(cache.getOrFetch(VehicleClass.BUS)).isEqualTo(first);

        releaseSecondLoad.countDown();
        awaitCondition(() -> !cache.isRefreshInFlight(VehicleClass.BUS));

        FeedSnapshot refreshed = cache.getOrFetch(VehicleClass.BUS);
        assertThat(refreshed.positions()).extracting(VehiclePosition::id).containsExactly("B2");
        assertThat(loads).hasValue(2);
    }

    @Test
    void shouldReleaseInFlightMarkerWhenFetchTimesOut() {
        AtomicInteger loads = new AtomicInteger();
        CountDownLatch never = new CountDownLatch(1);
        FeedLoader loader = vehicleClass -> {
            loads.incrementAndGet();
            try {
                never.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return liveSnapshot(vehicleClass, "T1");
        };
        PositionCache cache = cache(loader, Duration.ofMillis(200));

        FeedSnapshot result = cache.getOrFetch(VehicleClass.TRAIN);

        assertThat(result.provenance()).isEqualTo(Provenance.ERROR);
        assertThat(result.positions()).isEmpty();
        assertThat(cache.isRefreshInFlight(VehicleClass.TRAIN)).isFalse();

        clock.advance(TTL.plusSeconds(1));
        cache.getOrFetch(VehicleClass.TRAIN);
        awaitCondition(() -> loads.get() == 2);
        assertThat(loads).hasValue(2);
        never.countDown();
    }

    @Test
    void shouldServeCachedWithinGraceWindowThenError() {
        AtomicInteger loads = new AtomicInteger();
        FeedLoader loader = vehicleClass -> {
            if (loads.incrementAndGet() == 1) {
                return liveSnapshot(vehicleClass, "B1", "B2");
            }
            throw FeedFetchException.unreachable("http://feed.test/bus", null);
        };
        PositionCache cache = new PositionCache(loader, new FeedFallbackPolicy(TTL.multipliedBy(5), clock),
            Runnable::run, clock, TTL, Duration.ofSeconds(2));

        cache.getOrFetch(VehicleClass.BUS);

        clock.advance(TTL.plusSeconds(1));
        cache.getOrFetch(VehicleClass.BUS);
        FeedSnapshot degraded = cache.getOrFetch(VehicleClass.BUS);
        assertThat(degraded.provenance()).isEqualTo(Provenance.CACHED);
        assertThat(degraded.size()).isEqualTo(2);

        clock.advance(TTL.multipliedBy(5));
        cache.getOrFetch(VehicleClass.BUS);
        FeedSnapshot expired = cache.getOrFetch(VehicleClass.BUS);
        assertThat(expired.provenance()).isEqualTo(Provenance.ERROR);
        assertThat(expired.positions()).isEmpty();
    }

    @Test
    void shouldKeepNewerObservationAcrossRefreshes() {
        AtomicInteger loads = new AtomicInteger();
        Instant newer = START.plusSeconds(20);
        FeedLoader loader = vehicleClass -> {
            if (loads.incrementAndGet() == 1) {
                return new FeedSnapshot(vehicleClass, List.of(
                    new VehiclePosition("B1", vehicleClass, "R1", 33.80, -84.40, null, null, newer)),
                    clock.instant(), Provenance.LIVE);
            }
            return new FeedSnapshot(vehicleClass, List.of(
                new VehiclePosition("B1", vehicleClass, "R1", 33.70, -84.30, null, null, START)),
                clock.instant(), Provenance.LIVE);
        };
        PositionCache cache = new PositionCache(loader, new FeedFallbackPolicy(TTL.multipliedBy(5), clock),
            Runnable::run, clock, TTL, Duration.ofSeconds(2));

        cache.getOrFetch(VehicleClass.BUS);
        clock.advance(TTL.plusSeconds(1));
        cache.getOrFetch(VehicleClass.BUS);

        VehiclePosition held = cache.getOrFetch(VehicleClass.BUS).positions().get(0);
        assertThat(held.observedAt()).isEqualTo(newer);
        assertThat(held.latitude()).isEqualTo(33.80);
    }

    @Test
    void shouldReportStatsPerFeed() {
        PositionCache cache = new PositionCache(vehicleClass -> liveSnapshot(vehicleClass, "B1"),
            new FeedFallbackPolicy(TTL.multipliedBy(5), clock), Runnable::run, clock, TTL, Duration.ofSeconds(2));

        cache.getOrFetch(VehicleClass.BUS);
        List<PositionCache.FeedCacheStats> stats = cache.stats();

        assertThat(stats).hasSize(2);
        assertThat(stats.get(0).vehicleClass()).isEqualTo(VehicleClass.BUS);
        assertThat(stats.get(0).vehicleCount()).isEqualTo(1);
        assertThat(stats.get(1).provenance()).isNull();
    }

    private static void awaitCondition(BooleanSupplier condition) {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean() && System.currentTimeMillis() < deadline) {
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }
}
