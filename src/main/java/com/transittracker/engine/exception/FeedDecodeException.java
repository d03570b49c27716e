package com.transittracker.engine.exception;

import lombok.Getter;

/**
 * Feed payload could not be decoded as a whole. Fatal for one refresh
 * cycle only; individual bad entities are skipped instead of raising this.
 */
@Getter
public class FeedDecodeException extends Exception {

    public enum Reason {
        /** Envelope, header or version unreadable. */
        MALFORMED,
        /** Structured payload without its vehicle array. */
        SCHEMA_VIOLATION
    }

    private final Reason reason;

    public FeedDecodeException(Reason reason, String message) {
        this(reason, message, null);
    }

    public FeedDecodeException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
