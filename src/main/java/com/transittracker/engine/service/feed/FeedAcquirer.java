package com.transittracker.engine.service.feed;

import com.transittracker.engine.dto.FeedSnapshot;
import com.transittracker.engine.dto.Provenance;
import com.transittracker.engine.dto.VehicleClass;
import com.transittracker.engine.dto.VehiclePosition;
import com.transittracker.engine.exception.FeedDecodeException;
import com.transittracker.engine.exception.FeedFetchException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Fetches and decodes one feed per call.
 *
 * Transports are fixed at construction (see FeedClientConfig). Errors are
 * thrown as-is; turning them into degraded snapshots is the cache's job.
 * In mock mode the network is never touched.
 */
@Slf4j
public class FeedAcquirer implements FeedLoader {

    private final Map<VehicleClass, FeedTransport> transports;
    private final Map<VehicleClass, String> feedUrls;
    private final VehicleFeedDecoder decoder;
    private final MockFeedGenerator mockFeedGenerator;
    private final boolean mockMode;
    private final Clock clock;

    public FeedAcquirer(
        Map<VehicleClass, FeedTransport> transports,
        Map<VehicleClass, String> feedUrls,
        VehicleFeedDecoder decoder,
        MockFeedGenerator mockFeedGenerator,
        boolean mockMode,
        Clock clock
    ) {
        this.transports = new EnumMap<>(VehicleClass.class);
        this.transports.putAll(transports);
        this.feedUrls = new EnumMap<>(VehicleClass.class);
        this.feedUrls.putAll(feedUrls);
        this.decoder = decoder;
        this.mockFeedGenerator = mockFeedGenerator;
        this.mockMode = mockMode;
        this.clock = clock;

        if (!mockMode) {
            for (VehicleClass vehicleClass : VehicleClass.values()) {
                if (!this.transports.containsKey(vehicleClass) || !this.feedUrls.containsKey(vehicleClass)) {
                    throw new IllegalArgumentException("No transport or URL configured for " + vehicleClass);
                }
            }
        }
    }

    /**
     * Fetches the current snapshot of one feed.
     *
     * @return snapshot tagged LIVE, or MOCK in mock mode
     */
    public FeedSnapshot acquire(VehicleClass vehicleClass) throws FeedFetchException, FeedDecodeException {
        Instant capturedAt = clock.instant();

        if (mockMode) {
            return mockFeedGenerator.generate(vehicleClass, capturedAt);
        }

        FeedTransport transport = transports.get(vehicleClass);
        String url = feedUrls.get(vehicleClass);
        log.debug("Acquiring {} feed from {} via {} transport", vehicleClass, url, transport.name());

        byte[] raw = transport.fetch(url);
        List<VehiclePosition> positions = decoder.decode(raw, vehicleClass);

        FeedSnapshot snapshot = new FeedSnapshot(vehicleClass, positions, capturedAt, Provenance.LIVE);
        log.debug("Acquired {}", snapshot.toLogString());
        return snapshot;
    }

    @Override
    public FeedSnapshot load(VehicleClass vehicleClass) throws FeedFetchException, FeedDecodeException {
        return acquire(vehicleClass);
    }

    public boolean isMockMode() {
        return mockMode;
    }

    public String transportName(VehicleClass vehicleClass) {
        if (mockMode) {
            return "mock";
        }
        return transports.get(vehicleClass).name();
    }
}
