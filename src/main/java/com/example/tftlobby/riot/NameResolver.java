package com.example.tftlobby.riot;

import com.example.tftlobby.PlayerIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Resolves display names for a lobby on a small fixed pool. Every task writes only its own key; the call returns
 * after all tasks finished (or timed out) and the pool is shut down.
 */
public class NameResolver {

    private static final Logger log = LoggerFactory.getLogger(NameResolver.class);

    private final RiotApiClient riot;
    private final int maxWorkers;
    private final long perPlayerTimeoutMs;

    public NameResolver(RiotApiClient riot, int maxWorkers, long perPlayerTimeoutMs) {
        this.riot = riot;
        this.maxWorkers = maxWorkers;
        this.perPlayerTimeoutMs = perPlayerTimeoutMs;
    }

    /**
     * @return the players in input order, each with a display name when one could be resolved
     */
    public List<PlayerIdentity> resolve(String region, List<PlayerIdentity> players) {
        if (players.isEmpty()) {
            return new ArrayList<>();
        }
        Map<String, RiotId> names = new ConcurrentHashMap<>();
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(maxWorkers, players.size()));
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (PlayerIdentity p : players) {
                futures.add(pool.submit(() -> {
                    Optional<RiotId> id = riot.accountByPuuid(region, p.getPuuid());
                    id.ifPresent(riotId -> names.put(p.getPuuid(), riotId));
                }));
            }
            for (int i = 0; i < futures.size(); i++) {
                Future<?> f = futures.get(i);
                try {
                    f.get(perPlayerTimeoutMs, TimeUnit.MILLISECONDS);
                } catch (ExecutionException e) {
                    log.debug("Name lookup failed for {}: {}", players.get(i), e.getCause().toString());
                } catch (TimeoutException e) {
                    f.cancel(true);
                    log.debug("Name lookup timed out for {}", players.get(i));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        } finally {
            pool.shutdownNow();
        }

        List<PlayerIdentity> out = new ArrayList<>(players.size());
        for (PlayerIdentity p : players) {
            RiotId id = names.get(p.getPuuid());
            out.add(id == null ? p : p.withDisplayName(id.gameName, id.tagLine));
        }
        log.info("Resolved {}/{} display names", names.size(), players.size());
        return out;
    }
}
