package com.transittracker.engine.exception;

import lombok.Getter;

/**
 * Upstream feed could not be fetched.
 *
 * Never reaches the API boundary: the position cache turns it into a
 * degraded snapshot.
 */
@Getter
public class FeedFetchException extends Exception {

    public enum Reason {
        TIMEOUT,
        UNREACHABLE,
        UPSTREAM_STATUS
    }

    private final Reason reason;

    /**
     * HTTP status for {@link Reason#UPSTREAM_STATUS}, otherwise 0.
     */
    private final int statusCode;

    private FeedFetchException(Reason reason, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.statusCode = statusCode;
    }

    public static FeedFetchException timeout(String url, Throwable cause) {
        return new FeedFetchException(Reason.TIMEOUT, 0, "Timed out fetching " + url, cause);
    }

    public static FeedFetchException unreachable(String url, Throwable cause) {
        return new FeedFetchException(Reason.UNREACHABLE, 0, "Unable to reach " + url, cause);
    }

    public static FeedFetchException upstreamStatus(String url, int statusCode) {
        return new FeedFetchException(Reason.UPSTREAM_STATUS, statusCode,
            "Upstream " + url + " answered HTTP " + statusCode, null);
    }
}
