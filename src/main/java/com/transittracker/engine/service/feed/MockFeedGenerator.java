package com.transittracker.engine.service.feed;

import com.transittracker.engine.dto.FeedSnapshot;
import com.transittracker.engine.dto.Provenance;
import com.transittracker.engine.dto.ServiceArea;
import com.transittracker.engine.dto.VehicleClass;
import com.transittracker.engine.dto.VehiclePosition;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Produces reproducible fake snapshots for mock mode.
 *
 * The same seed always yields the same vehicles at the same coordinates,
 * placed inside the service area (with a 5% margin), so tests and demos
 * are stable without any network access.
 */
public class MockFeedGenerator {

    private static final String[] TRAIN_LINES = {"RED", "GOLD", "BLUE", "GREEN"};
    private static final int BUS_ROUTE_COUNT = 6;
    private static final double MARGIN = 0.05;

    private final ServiceArea serviceArea;
    private final long seed;
    private final int busCount;
    private final int trainCount;

    public MockFeedGenerator(ServiceArea serviceArea, long seed, int busCount, int trainCount) {
        this.serviceArea = serviceArea;
        this.seed = seed;
        this.busCount = busCount;
        this.trainCount = trainCount;
    }

    public FeedSnapshot generate(VehicleClass vehicleClass, Instant capturedAt) {
        Random random = new Random(seed * 31 + vehicleClass.ordinal());
        int count = vehicleClass == VehicleClass.BUS ? busCount : trainCount;

        double latSpan = serviceArea.latitudeSpan() * (1 - 2 * MARGIN);
        double lngSpan = serviceArea.longitudeSpan() * (1 - 2 * MARGIN);
        double latBase = serviceArea.minLatitude() + serviceArea.latitudeSpan() * MARGIN;
        double lngBase = serviceArea.minLongitude() + serviceArea.longitudeSpan() * MARGIN;

        List<VehiclePosition> positions = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String routeId = vehicleClass == VehicleClass.BUS
                ? String.valueOf(100 + random.nextInt(BUS_ROUTE_COUNT))
                : TRAIN_LINES[random.nextInt(TRAIN_LINES.length)];

            positions.add(new VehiclePosition(
                String.format("MOCK-%s-%03d", vehicleClass.name().charAt(0), i + 1),
                vehicleClass,
                routeId,
                latBase + random.nextDouble() * latSpan,
                lngBase + random.nextDouble() * lngSpan,
                (double) random.nextInt(360),
                random.nextDouble() * 15.0,
                capturedAt
            ));
        }

        return new FeedSnapshot(vehicleClass, positions, capturedAt, Provenance.MOCK);
    }
}
