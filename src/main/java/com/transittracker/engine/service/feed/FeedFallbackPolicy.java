package com.transittracker.engine.service.feed;

import com.transittracker.engine.dto.FeedSnapshot;
import com.transittracker.engine.dto.Provenance;
import com.transittracker.engine.dto.VehicleClass;
import com.transittracker.engine.exception.FeedDecodeException;
import com.transittracker.engine.exception.FeedFetchException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Decides what a caller sees when a live fetch fails.
 *
 * Order of preference:
 * 1. the last live snapshot, if captured within the grace window, tagged CACHED
 * 2. an empty snapshot tagged ERROR
 *
 * Never throws: a failing upstream shows up only as a provenance tag.
 */
@Slf4j
public class FeedFallbackPolicy {

    private final Duration graceWindow;
    private final Clock clock;

    public FeedFallbackPolicy(Duration graceWindow, Clock clock) {
        this.graceWindow = graceWindow;
        this.clock = clock;
    }

    /**
     * @param lastLive last snapshot obtained live for this feed, or null
     * @param cause    why the live fetch failed
     */
    public FeedSnapshot degrade(VehicleClass vehicleClass, FeedSnapshot lastLive, Throwable cause) {
        Instant now = clock.instant();
        String reason = describe(cause);

        if (lastLive != null && !lastLive.capturedAt().plus(graceWindow).isBefore(now)) {
            log.warn("{} feed unavailable ({}), serving cached snapshot from {}",
                vehicleClass, reason, lastLive.capturedAt());
            return lastLive.withProvenance(Provenance.CACHED);
        }

        log.warn("{} feed unavailable ({}) and no snapshot within {}s grace window",
            vehicleClass, reason, graceWindow.toSeconds());
        return FeedSnapshot.empty(vehicleClass, now, Provenance.ERROR);
    }

    public Duration getGraceWindow() {
        return graceWindow;
    }

    static String describe(Throwable cause) {
        Throwable error = cause;
        while ((error instanceof CompletionException || error instanceof ExecutionException)
            && error.getCause() != null) {
            error = error.getCause();
        }

        if (error instanceof FeedFetchException fetchError) {
            return fetchError.getReason() == FeedFetchException.Reason.UPSTREAM_STATUS
                ? "UPSTREAM_STATUS " + fetchError.getStatusCode()
                : fetchError.getReason().name();
        }
        if (error instanceof FeedDecodeException decodeError) {
            return decodeError.getReason().name() + ": " + decodeError.getMessage();
        }
        if (error instanceof TimeoutException) {
            return FeedFetchException.Reason.TIMEOUT.name();
        }
        return error == null ? "unknown" : error.getClass().getSimpleName() + ": " + error.getMessage();
    }
}
