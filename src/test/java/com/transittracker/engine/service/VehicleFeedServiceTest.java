package com.transittracker.engine.service;

import com.transittracker.engine.config.TransitProperties;
import com.transittracker.engine.dto.FeedSnapshot;
import com.transittracker.engine.dto.Provenance;
import com.transittracker.engine.dto.VehicleClass;
import com.transittracker.engine.dto.VehicleFeedResponse;
import com.transittracker.engine.dto.VehiclePosition;
import com.transittracker.engine.service.feed.FeedLoader;
import com.transittracker.engine.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class VehicleFeedServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private final MutableClock clock = new MutableClock(NOW);
    private final ExecutorService executor = Executors.newFixedThreadPool(4);
    private final CountDownLatch stuckTrainFeed = new CountDownLatch(1);

    @AfterEach
    void tearDown() {
        stuckTrainFeed.countDown();
        executor.shutdownNow();
    }

    private TransitProperties properties() {
        TransitProperties properties = new TransitProperties();
        properties.getCache().setFetchTimeout(Duration.ofMillis(300));
        return properties;
    }

    private FeedSnapshot busSnapshot() {
        return new FeedSnapshot(VehicleClass.BUS, List.of(
            new VehiclePosition("2412", VehicleClass.BUS, "110", 33.75, -84.39, 90.0, null, NOW)),
            NOW, Provenance.LIVE);
    }

    @Test
    void shouldServeBusesWhenTrainFeedTimesOut() {
        FeedLoader loader = vehicleClass -> {
            if (vehicleClass == VehicleClass.TRAIN) {
                try {
                    stuckTrainFeed.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return busSnapshot();
        };
        VehicleFeedService service = new VehicleFeedService(loader, properties(), executor, clock);

        long started = System.currentTimeMillis();
        VehicleFeedResponse response = service.getVehicles();

        assertThat(response.source()).isEqualTo(Provenance.PARTIAL);
        assertThat(response.buses()).isNotEmpty();
        assertThat(response.trains()).isEmpty();
        assertThat(System.currentTimeMillis() - started).isLessThan(5000);
    }

    @Test
    void shouldFetchEachFeedOnceAcrossRepeatedPolls() {
        AtomicInteger loads = new AtomicInteger();
        FeedLoader loader = vehicleClass -> {
            loads.incrementAndGet();
            return new FeedSnapshot(vehicleClass, List.of(), NOW, Provenance.LIVE);
        };
        VehicleFeedService service = new VehicleFeedService(loader, properties(), executor, clock);

        for (int i = 0; i < 5; i++) {
            assertThat(service.getVehicles().source()).isEqualTo(Provenance.LIVE);
        }

        assertThat(loads).hasValue(2);
    }

    @Test
    void shouldReportErrorWhenBothFeedsFail() {
        FeedLoader loader = vehicleClass -> {
            throw new IllegalStateException("upstream down");
        };
        VehicleFeedService service = new VehicleFeedService(loader, properties(), executor, clock);

        VehicleFeedResponse response = service.getVehicles();

        assertThat(response.source()).isEqualTo(Provenance.ERROR);
        assertThat(response.buses()).isEmpty();
        assertThat(response.trains()).isEmpty();
    }

    @Test
    void shouldRefetchAfterInvalidation() {
        AtomicInteger loads = new AtomicInteger();
        FeedLoader loader = vehicleClass -> {
            loads.incrementAndGet();
            return new FeedSnapshot(vehicleClass, List.of(), NOW, Provenance.LIVE);
        };
        VehicleFeedService service = new VehicleFeedService(loader, properties(), Runnable::run, clock);

        service.getSnapshot(VehicleClass.BUS);
        service.invalidateAll();
        service.getSnapshot(VehicleClass.BUS);

        assertThat(loads).hasValue(2);
    }
}
