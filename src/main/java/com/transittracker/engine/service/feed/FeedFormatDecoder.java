package com.transittracker.engine.service.feed;

import com.transittracker.engine.dto.VehicleClass;
import com.transittracker.engine.dto.VehiclePosition;
import com.transittracker.engine.exception.FeedDecodeException;

import java.time.Instant;
import java.util.List;

/**
 * Turns one wire format into positions. Implementations skip bad entities
 * and throw only when the payload as a whole is unusable. Service-area
 * filtering and de-duplication happen in {@link VehicleFeedDecoder}.
 */
public interface FeedFormatDecoder {

    /**
     * @param raw          payload as received
     * @param vehicleClass class stamped onto every decoded position
     * @param capturedAt   fallback observation time for entities without one
     */
    List<VehiclePosition> decode(byte[] raw, VehicleClass vehicleClass, Instant capturedAt)
        throws FeedDecodeException;
}
