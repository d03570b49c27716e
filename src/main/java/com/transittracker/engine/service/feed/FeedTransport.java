package com.transittracker.engine.service.feed;

import com.transittracker.engine.exception.FeedFetchException;

/**
 * Way of reaching an upstream feed. One implementation is picked per feed
 * at startup from the deployment context; callers never branch on it.
 */
public interface FeedTransport {

    /**
     * Fetches the raw payload of the given upstream URL.
     *
     * @param upstreamUrl the feed's own URL, never the relay's
     * @return response body, empty when the upstream sent none
     * @throws FeedFetchException on timeout, transport failure or non-2xx status
     */
    byte[] fetch(String upstreamUrl) throws FeedFetchException;

    /**
     * Short name for logs and stats ("direct", "relayed").
     */
    String name();
}
