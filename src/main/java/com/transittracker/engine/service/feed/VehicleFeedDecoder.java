package com.transittracker.engine.service.feed;

import com.transittracker.engine.dto.ServiceArea;
import com.transittracker.engine.dto.VehicleClass;
import com.transittracker.engine.dto.VehiclePosition;
import com.transittracker.engine.exception.FeedDecodeException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point of the decoding stage: picks the wire format for the feed,
 * then enforces the position invariants every consumer relies on.
 *
 * Guarantees on the returned list:
 * - every coordinate lies inside the service area (others are dropped as noise)
 * - vehicle ids are unique; for duplicates the newest observation wins
 * - size never exceeds the number of entities in the payload
 */
@Component
@Slf4j
public class VehicleFeedDecoder {

    private final BusFeedJsonDecoder busDecoder;
    private final TrainFeedProtobufDecoder trainDecoder;
    private final ServiceArea serviceArea;
    private final Clock clock;

    public VehicleFeedDecoder(
        BusFeedJsonDecoder busDecoder,
        TrainFeedProtobufDecoder trainDecoder,
        ServiceArea serviceArea,
        Clock clock
    ) {
        this.busDecoder = busDecoder;
        this.trainDecoder = trainDecoder;
        this.serviceArea = serviceArea;
        this.clock = clock;
    }

    public List<VehiclePosition> decode(byte[] raw, VehicleClass vehicleClass) throws FeedDecodeException {
        FeedFormatDecoder decoder = switch (vehicleClass) {
            case BUS -> busDecoder;
            case TRAIN -> trainDecoder;
        };

        List<VehiclePosition> decoded = decoder.decode(raw, vehicleClass, clock.instant());

        Map<String, VehiclePosition> newestById = new LinkedHashMap<>();
        int outsideArea = 0;
        for (VehiclePosition position : decoded) {
            if (!serviceArea.contains(position.latitude(), position.longitude())) {
                outsideArea++;
                continue;
            }
            newestById.merge(position.id(), position,
                (held, candidate) -> candidate.isNewerThan(held) ? candidate : held);
        }

        if (outsideArea > 0) {
            log.debug("Dropped {} {} positions outside the service area", outsideArea, vehicleClass);
        }
        return List.copyOf(newestById.values());
    }
}
