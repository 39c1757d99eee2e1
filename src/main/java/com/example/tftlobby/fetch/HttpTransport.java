package com.example.tftlobby.fetch;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * A single blocking GET. Implementations must not retry; retry policy lives in {@link RateLimitedFetcher}.
 */
public interface HttpTransport {

    Response get(URI uri, Map<String, String> headers, Duration timeout) throws IOException, InterruptedException;

    class Response {
        public final int status;
        public final String body;

        public Response(int status, String body) {
            this.status = status;
            this.body = body;
        }
    }
}
