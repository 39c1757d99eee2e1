package com.example.tftlobby.policy;

import com.example.tftlobby.fetch.FetchResult;
import com.example.tftlobby.fetch.RateLimitedFetcher;
import com.example.tftlobby.fetch.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Crawl-policy check plus per-source pacing for one pipeline run.
 *
 * The robots document is fetched lazily on the first {@link #allowed(String)} call and kept for the lifetime
 * of this instance. Callers are the sequential scraping loop only, so no locking.
 */
public class PolicyGate {

    private static final Logger log = LoggerFactory.getLogger(PolicyGate.class);

    private final RateLimitedFetcher robotsFetcher;
    private final String robotsUrl;
    private final long minIntervalMs;
    private final Sleeper sleeper;
    private final LongSupplier nanoClock;

    private RobotsPolicy policy;
    private final Map<String, Long> lastRequestNanos = new HashMap<>();

    public PolicyGate(RateLimitedFetcher robotsFetcher, String robotsUrl, long minIntervalMs,
                      Sleeper sleeper, LongSupplier nanoClock) {
        this.robotsFetcher = robotsFetcher;
        this.robotsUrl = robotsUrl;
        this.minIntervalMs = minIntervalMs;
        this.sleeper = sleeper;
        this.nanoClock = nanoClock;
    }

    public boolean allowed(String path) {
        return policy().allows(path);
    }

    /**
     * Blocks until at least the minimum interval has passed since the previous paced request for {@code sourceKey}.
     */
    public void pace(String sourceKey) {
        Long last = lastRequestNanos.get(sourceKey);
        if (last != null) {
            long elapsedMs = (nanoClock.getAsLong() - last) / 1_000_000L;
            long waitMs = minIntervalMs - elapsedMs;
            if (waitMs > 0) {
                try {
                    sleeper.sleep(waitMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }
        lastRequestNanos.put(sourceKey, nanoClock.getAsLong());
    }

    RobotsPolicy policy() {
        if (policy == null) {
            policy = load();
        }
        return policy;
    }

    private RobotsPolicy load() {
        FetchResult result;
        try {
            result = robotsFetcher.fetch(robotsUrl);
        } catch (RuntimeException e) {
            log.warn("robots.txt unreadable ({}), allowing with pacing", e.toString());
            return RobotsPolicy.ALLOW_ALL;
        }
        if (!result.isOk() || result.httpStatus != 200) {
            log.info("robots.txt unavailable ({}), allowing with pacing", result);
            return RobotsPolicy.ALLOW_ALL;
        }
        RobotsPolicy parsed = RobotsPolicy.parse(result.body);
        log.debug("robots.txt loaded, {} disallowed prefixes for *", parsed.disallowedPrefixes().size());
        return parsed;
    }
}
