package com.transittracker.engine.service.feed;

import org.springframework.web.client.RestTemplate;

import java.net.URI;

/**
 * Requests the upstream URL as-is.
 */
public class DirectFeedTransport extends HttpFeedTransport {

    public DirectFeedTransport(RestTemplate restTemplate) {
        super(restTemplate);
    }

    @Override
    protected URI resolve(String upstreamUrl) {
        return URI.create(upstreamUrl);
    }

    @Override
    public String name() {
        return "direct";
    }
}
