package com.transittracker.engine.service.feed;

import com.transittracker.engine.dto.FeedSnapshot;
import com.transittracker.engine.dto.VehicleClass;
import com.transittracker.engine.exception.FeedDecodeException;
import com.transittracker.engine.exception.FeedFetchException;

/**
 * Source the position cache refreshes from.
 */
@FunctionalInterface
public interface FeedLoader {

    FeedSnapshot load(VehicleClass vehicleClass) throws FeedFetchException, FeedDecodeException;
}
