package com.example.tftlobby.fetch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Blocking GET with bounded exponential backoff on 429.
 *
 * 404 is a normal "not found" result. 401/403 and every other non-2xx status are terminal and never retried.
 */
public class RateLimitedFetcher {

    private static final Logger log = LoggerFactory.getLogger(RateLimitedFetcher.class);

    public static final int MAX_ATTEMPTS = 7;
    public static final double BACKOFF_GROWTH = 1.6;

    private final HttpTransport transport;
    private final Sleeper sleeper;
    private final Map<String, String> headers;
    private final Duration timeout;
    private final long baseDelayMs;

    public RateLimitedFetcher(HttpTransport transport, Sleeper sleeper, Map<String, String> headers,
                              Duration timeout, long baseDelayMs) {
        this.transport = transport;
        this.sleeper = sleeper;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.timeout = timeout;
        this.baseDelayMs = baseDelayMs;
    }

    /**
     * Same transport, sleeper and backoff, different headers/timeout.
     */
    public RateLimitedFetcher withHeadersAndTimeout(Map<String, String> otherHeaders, Duration otherTimeout) {
        return new RateLimitedFetcher(transport, sleeper, otherHeaders, otherTimeout, baseDelayMs);
    }

    public FetchResult fetch(String url) {
        return fetch(url, Collections.emptyMap());
    }

    public FetchResult fetch(String url, Map<String, ?> params) {
        String target = withQuery(url, params);
        URI uri;
        try {
            uri = new URI(target);
        } catch (Exception e) {
            log.warn("Invalid url {}: {}", target, e.getMessage());
            return FetchResult.failure(FailureKind.NETWORK, 0, target);
        }

        double delayMs = baseDelayMs;
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            HttpTransport.Response response;
            try {
                response = transport.get(uri, headers, timeout);
            } catch (HttpTimeoutException e) {
                log.debug("Timeout after {} on {}", timeout, target);
                return FetchResult.failure(FailureKind.TIMEOUT, 0, target);
            } catch (IOException e) {
                log.debug("Network error on {}: {}", target, e.toString());
                return FetchResult.failure(FailureKind.NETWORK, 0, target);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return FetchResult.failure(FailureKind.NETWORK, 0, target);
            }

            int status = response.status;
            if (status >= 200 && status < 300) {
                return FetchResult.ok(status, response.body, target);
            }
            if (status == 404) {
                return FetchResult.notFound(target);
            }
            if (status == 401 || status == 403) {
                return FetchResult.failure(FailureKind.AUTH, status, target);
            }
            if (status != 429) {
                return FetchResult.failure(FailureKind.HTTP_STATUS, status, target);
            }

            if (attempt == MAX_ATTEMPTS) {
                break;
            }
            log.debug("429 on {} (attempt {}/{}), backing off {} ms", target, attempt, MAX_ATTEMPTS, (long) delayMs);
            try {
                sleeper.sleep((long) delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return FetchResult.failure(FailureKind.NETWORK, 429, target);
            }
            delayMs *= BACKOFF_GROWTH;
        }
        log.warn("Rate limited after {} attempts: {}", MAX_ATTEMPTS, target);
        return FetchResult.failure(FailureKind.RATE_LIMITED, 429, target);
    }

    static String withQuery(String url, Map<String, ?> params) {
        if (params == null || params.isEmpty()) {
            return url;
        }
        StringBuilder sb = new StringBuilder(url);
        sb.append(url.indexOf('?') >= 0 ? '&' : '?');
        boolean first = true;
        for (Map.Entry<String, ?> e : params.entrySet()) {
            if (!first) sb.append('&');
            first = false;
            sb.append(encode(e.getKey())).append('=').append(encode(String.valueOf(e.getValue())));
        }
        return sb.toString();
    }

    public static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
