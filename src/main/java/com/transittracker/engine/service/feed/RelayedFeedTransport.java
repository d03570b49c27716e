package com.transittracker.engine.service.feed;

import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Reaches the upstream through an HTTP relay on a standard port.
 *
 * Some hosting environments block outbound traffic to the train feed's
 * non-standard port. The relay takes the original URL, percent-encoded, as
 * a query parameter:
 * {@code https://relay.example.com/proxy?url=http%3A%2F%2Ffeed.example.com%3A8443%2Fvehicles}
 */
public class RelayedFeedTransport extends HttpFeedTransport {

    private final String relayUrl;
    private final String relayParam;

    public RelayedFeedTransport(RestTemplate restTemplate, String relayUrl, String relayParam) {
        super(restTemplate);
        this.relayUrl = relayUrl;
        this.relayParam = relayParam;
    }

    @Override
    protected URI resolve(String upstreamUrl) {
        return URI.create(relayUrl + (relayUrl.contains("?") ? "&" : "?")
            + relayParam + "=" + percentEncode(upstreamUrl));
    }

    /**
     * RFC 3986 percent-encoding. {@link URLEncoder} produces form encoding,
     * so spaces are re-encoded from '+' to %20.
     */
    static String percentEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
            .replace("+", "%20")
            .replace("%7E", "~");
    }

    @Override
    public String name() {
        return "relayed";
    }
}
