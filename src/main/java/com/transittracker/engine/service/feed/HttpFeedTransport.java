package com.transittracker.engine.service.feed;

import com.transittracker.engine.exception.FeedFetchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.http.HttpTimeoutException;

/**
 * Shared HTTP GET plumbing for the direct and relayed transports.
 *
 * Subclasses only decide which URI is actually requested. Timeouts come
 * from the {@link RestTemplate}'s request factory.
 */
@Slf4j
public abstract class HttpFeedTransport implements FeedTransport {

    private final RestTemplate restTemplate;

    protected HttpFeedTransport(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    /**
     * Maps the upstream URL to the URI that is requested on the wire.
     */
    protected abstract URI resolve(String upstreamUrl);

    @Override
    public byte[] fetch(String upstreamUrl) throws FeedFetchException {
        URI target = resolve(upstreamUrl);
        long startTime = System.currentTimeMillis();

        try {
            ResponseEntity<byte[]> response = restTemplate.getForEntity(target, byte[].class);

            if (!response.getStatusCode().is2xxSuccessful()) {
                throw FeedFetchException.upstreamStatus(upstreamUrl, response.getStatusCode().value());
            }

            byte[] body = response.getBody();
            log.debug("Fetched {} bytes from {} via {} in {}ms",
                body == null ? 0 : body.length, upstreamUrl, name(), System.currentTimeMillis() - startTime);
            return body == null ? new byte[0] : body;

        } catch (RestClientResponseException e) {
            throw FeedFetchException.upstreamStatus(upstreamUrl, e.getStatusCode().value());
        } catch (ResourceAccessException e) {
            if (isTimeout(e)) {
                throw FeedFetchException.timeout(upstreamUrl, e);
            }
            throw FeedFetchException.unreachable(upstreamUrl, e);
        } catch (RestClientException e) {
            throw FeedFetchException.unreachable(upstreamUrl, e);
        }
    }

    private static boolean isTimeout(Throwable error) {
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (cause instanceof SocketTimeoutException || cause instanceof HttpTimeoutException) {
                return true;
            }
        }
        return false;
    }
}
