package com.example.tftlobby.riot;

import com.example.tftlobby.JsonFields;
import com.example.tftlobby.PlayerIdentity;
import com.example.tftlobby.fetch.FailureKind;
import com.example.tftlobby.fetch.FetchResult;
import com.example.tftlobby.fetch.RateLimitedFetcher;
import com.example.tftlobby.fetch.Sleeper;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Riot Games endpoints used by the lobby tool. Platform-routed calls go to {@code {platform}.api.riotgames.com},
 * account and match calls to the regional host.
 */
public class RiotApiClient {

    private static final Logger log = LoggerFactory.getLogger(RiotApiClient.class);

    static final String STATUS_PATH = "/tft/status/v1/platform-data";
    static final String ACCOUNT_BY_RIOT_ID_PATH = "/riot/account/v1/accounts/by-riot-id/";
    static final String ACCOUNT_BY_PUUID_PATH = "/riot/account/v1/accounts/by-puuid/";
    static final String SUMMONER_BY_PUUID_PATH = "/tft/summoner/v1/summoners/by-puuid/";
    static final String SPECTATOR_PATH = "/lol/spectator/tft/v5/active-games/by-puuid/";
    static final String MATCH_IDS_PATH = "/tft/match/v1/matches/by-puuid/%s/ids";
    static final String MATCH_PATH = "/tft/match/v1/matches/";

    private static final String[] ACCOUNT_REGIONS = {"americas", "europe", "asia"};
    private static final long PROBE_BACKOFF_MS = 500L;

    private final RateLimitedFetcher fetcher;
    private final Sleeper sleeper;
    private final String hostTemplate;

    public RiotApiClient(RateLimitedFetcher fetcher, Sleeper sleeper, String hostTemplate) {
        this.fetcher = fetcher;
        this.sleeper = sleeper;
        this.hostTemplate = hostTemplate;
    }

    public String host(String routing) {
        return String.format(hostTemplate, routing);
    }

    /**
     * Cheap status call that surfaces a missing or expired key before any real work.
     */
    public void checkCredentials(Platform platform) {
        FetchResult r = fetcher.fetch(host(platform.id()) + STATUS_PATH);
        if (r.isFailure() && r.failureKind == FailureKind.AUTH) {
            if (r.httpStatus == 401) {
                throw new AuthException(401, "401 on " + STATUS_PATH + ": key missing or expired");
            }
            throw new AuthException(r.httpStatus, r.httpStatus + " on " + STATUS_PATH + ": key not authorized for TFT");
        }
        if (r.isFailure()) {
            log.warn("Status check inconclusive: {}", r);
        }
    }

    /**
     * Riot id to PUUID, trying each account region in turn. 403/404 on one region moves on to the next.
     */
    public Optional<String> findPuuid(RiotId riotId) {
        String path = ACCOUNT_BY_RIOT_ID_PATH + RateLimitedFetcher.encode(riotId.gameName) + "/" + RateLimitedFetcher.encode(riotId.tagLine);
        for (String region : ACCOUNT_REGIONS) {
            FetchResult r = fetcher.fetch(host(region) + path);
            if (r.isNotFound()) continue;
            if (r.isFailure()) {
                if (r.failureKind == FailureKind.AUTH && r.httpStatus == 403) continue;
                if (r.failureKind == FailureKind.AUTH) {
                    throw new AuthException(r.httpStatus, "account lookup rejected the key");
                }
                log.warn("Account lookup failed on {}: {}", region, r);
                continue;
            }
            String puuid = JsonFields.str(parseObject(r.body), "puuid");
            if (puuid != null) {
                log.debug("Riot id {} found on {}", riotId, region);
                return Optional.of(puuid);
            }
        }
        return Optional.empty();
    }

    /**
     * Finds the platform hosting the PUUID's TFT profile; the guess is tried first.
     */
    public Optional<Platform> resolvePlatform(String puuid, Platform guess) {
        List<Platform> order = new ArrayList<>();
        if (guess != null) order.add(guess);
        for (Platform p : Platform.values()) {
            if (p != guess) order.add(p);
        }
        for (Platform p : order) {
            FetchResult r = fetcher.fetch(host(p.id()) + SUMMONER_BY_PUUID_PATH + puuid);
            if (r.isOk()) {
                return Optional.of(p);
            }
            if (r.isFailure() && (r.httpStatus == 401 || r.failureKind == FailureKind.RATE_LIMITED)) {
                pause(PROBE_BACKOFF_MS);
            }
        }
        return Optional.empty();
    }

    /**
     * Participants of the PUUID's active game, in spectator order, without duplicates. Empty when not in a game.
     *
     * @throws AuthException when the key is rejected
     * @throws RiotApiException on any other failed lookup
     */
    public Optional<List<PlayerIdentity>> activeGame(Platform platform, String puuid) {
        FetchResult r = fetcher.fetch(host(platform.id()) + SPECTATOR_PATH + puuid);
        if (r.isNotFound()) {
            return Optional.empty();
        }
        if (r.isFailure()) {
            if (r.failureKind == FailureKind.AUTH) {
                throw new AuthException(r.httpStatus, "spectator " + r.httpStatus + ": key not TFT-enabled or unauthorized");
            }
            throw new RiotApiException("spectator lookup failed", r);
        }
        JsonArray participants = JsonFields.arr(parseObject(r.body), "participants");
        if (participants == null) {
            return Optional.of(Collections.emptyList());
        }
        Map<String, PlayerIdentity> byPuuid = new LinkedHashMap<>();
        for (JsonElement e : participants) {
            JsonObject p = JsonFields.obj(e);
            String id = JsonFields.str(p, "puuid");
            if (id == null) continue;
            String label = JsonFields.str(p, "riotId");
            if (label == null) label = JsonFields.str(p, "summonerName");
            byPuuid.putIfAbsent(id, new PlayerIdentity(id, null, null, label));
        }
        return Optional.of(new ArrayList<>(byPuuid.values()));
    }

    /**
     * Current gameName/tagLine for a PUUID. Empty on any non-OK response.
     */
    public Optional<RiotId> accountByPuuid(String region, String puuid) {
        FetchResult r = fetcher.fetch(host(region) + ACCOUNT_BY_PUUID_PATH + puuid);
        if (!r.isOk()) {
            return Optional.empty();
        }
        JsonObject js = parseObject(r.body);
        String name = JsonFields.str(js, "gameName");
        String tag = JsonFields.str(js, "tagLine");
        if (name == null) {
            return Optional.empty();
        }
        return Optional.of(new RiotId(name.trim(), tag == null ? "" : tag.trim()));
    }

    public FetchResult matchIds(String region, String puuid, int count) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("count", count);
        return fetcher.fetch(host(region) + String.format(MATCH_IDS_PATH, puuid), params);
    }

    public FetchResult match(String region, String matchId) {
        return fetcher.fetch(host(region) + MATCH_PATH + matchId);
    }

    static JsonObject parseObject(String body) {
        if (body == null || body.isBlank()) return null;
        try {
            return JsonFields.obj(JsonParser.parseString(body));
        } catch (JsonParseException e) {
            log.debug("Unparsable JSON body: {}", e.getMessage());
            return null;
        }
    }

    private void pause(long ms) {
        try {
            sleeper.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
