package com.example.tftlobby.policy;

import com.example.tftlobby.fetch.FakeTransport;
import com.example.tftlobby.fetch.RateLimitedFetcher;
import com.example.tftlobby.fetch.RecordingSleeper;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Collections;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class PolicyGateTest {

    private static final String ROBOTS = "https://tactics.tools/robots.txt";

    private final FakeTransport transport = new FakeTransport();
    private final RecordingSleeper sleeper = new RecordingSleeper();
    private final AtomicLong nanos = new AtomicLong(0);

    private PolicyGate gate() {
        RateLimitedFetcher fetcher = new RateLimitedFetcher(transport, sleeper, Collections.emptyMap(), Duration.ofSeconds(6), 10L);
        return new PolicyGate(fetcher, ROBOTS, 1000L, sleeper, nanos::get);
    }

    @Test
    void robotsIsFetchedOnceAndHonoured() {
        transport.on("/robots.txt", 200, "User-agent: *\nDisallow: /player/\n");
        PolicyGate gate = gate();

        assertThat(gate.allowed("/player/na/Foo")).isFalse();
        assertThat(gate.allowed("/comps")).isTrue();
        assertThat(gate.allowed("/player/euw/Bar")).isFalse();
        assertThat(transport.count("/robots.txt")).isEqualTo(1);
    }

    @Test
    void unreachableRobotsAllowsButStillPaces() {
        transport.on("/robots.txt", 500, "oops");
        PolicyGate gate = gate();

        assertThat(gate.allowed("/player/na/Foo")).isTrue();
        gate.pace("tactics.tools");
        gate.pace("tactics.tools");

        assertThat(sleeper.sleeps).containsExactly(1000L);
    }

    @Test
    void missingRobotsAllows() {
        assertThat(gate().allowed("/player/na/Foo")).isTrue();
    }

    @Test
    void paceSleepsOnlyForTheRemainderOfTheInterval() {
        PolicyGate gate = gate();

        gate.pace("tactics.tools");          // first request, no wait
        nanos.addAndGet(400_000_000L);       // 400 ms later
        gate.pace("tactics.tools");
        nanos.addAndGet(1_500_000_000L);     // well past the interval
        gate.pace("tactics.tools");
        gate.pace("other-source");           // separate key

        assertThat(sleeper.sleeps).containsExactly(600L);
    }
}
