package com.example.tftlobby;

import com.example.tftlobby.riot.Platform;
import com.example.tftlobby.riot.RiotId;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Run settings: classpath defaults from {@code tft-lobby.properties}, then the environment
 * ({@code RIOT_API_KEY}, {@code RIOT_ID}, {@code RIOT_PLATFORM}) on top.
 */
public final class LobbyConfig {

    public static final String DEFAULTS_RESOURCE = "tft-lobby.properties";
    static final String KEY_PREFIX = "RGAPI-";

    public final String apiKey;
    public final RiotId riotId;
    public final Platform platformGuess;   // may be null: probe every platform

    public final String userAgent;
    public final String scrapeBaseUrl;
    public final long scrapeDelayMs;
    public final long retryBaseDelayMs;
    public final Duration apiTimeout;
    public final Duration scrapeTimeout;
    public final Duration robotsTimeout;
    public final int scrapeMaxCandidates;
    public final int fallbackMatchCount;
    public final int nameResolverWorkers;
    public final int reportPredictions;
    public final int reportTraits;

    private LobbyConfig(Properties p) {
        String key = stripQuotes(p.getProperty("riot.api-key", ""));
        if (!key.startsWith(KEY_PREFIX)) {
            throw new IllegalStateException("RIOT_API_KEY is not set (expected a key starting with " + KEY_PREFIX + ")");
        }
        this.apiKey = key;
        this.riotId = RiotId.parse(p.getProperty("riot.id", ""));
        this.platformGuess = Platform.fromId(p.getProperty("riot.platform", "")).orElse(null);

        this.userAgent = p.getProperty("scrape.user-agent", "tft-assistant/1.0");
        this.scrapeBaseUrl = p.getProperty("scrape.base-url", "https://tactics.tools");
        this.scrapeDelayMs = longOf(p, "scrape.delay-ms", 1000L);
        this.retryBaseDelayMs = longOf(p, "fetch.retry-base-delay-ms", 1000L);
        this.apiTimeout = Duration.ofMillis(longOf(p, "fetch.api-timeout-ms", 10_000L));
        this.scrapeTimeout = Duration.ofMillis(longOf(p, "fetch.scrape-timeout-ms", 12_000L));
        this.robotsTimeout = Duration.ofMillis(longOf(p, "fetch.robots-timeout-ms", 6_000L));
        this.scrapeMaxCandidates = (int) longOf(p, "scrape.max-candidates", 50L);
        this.fallbackMatchCount = (int) longOf(p, "fallback.match-count", 4L);
        this.nameResolverWorkers = (int) longOf(p, "names.max-workers", 6L);
        this.reportPredictions = (int) longOf(p, "report.predictions-per-player", 3L);
        this.reportTraits = (int) longOf(p, "report.traits-per-view", 8L);
    }

    public static LobbyConfig load() {
        return load(System.getenv());
    }

    public static LobbyConfig load(Map<String, String> env) {
        Properties p = new Properties();
        try (InputStream is = LobbyConfig.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (is != null) {
                p.load(is);
            }
        } catch (IOException e) {
            throw new IllegalStateException("cannot read " + DEFAULTS_RESOURCE, e);
        }
        override(p, "riot.api-key", env.get("RIOT_API_KEY"));
        override(p, "riot.id", env.get("RIOT_ID"));
        override(p, "riot.platform", env.get("RIOT_PLATFORM"));
        return new LobbyConfig(p);
    }

    public Optional<Platform> platformGuess() {
        return Optional.ofNullable(platformGuess);
    }

    public String maskedKey() {
        return mask(apiKey);
    }

    static String mask(String k) {
        if (k == null) return "";
        return k.length() < 12 ? k : k.substring(0, 8) + "..." + k.substring(k.length() - 4);
    }

    private static void override(Properties p, String key, String value) {
        if (value != null && !value.isBlank()) {
            p.setProperty(key, value.trim());
        }
    }

    private static String stripQuotes(String s) {
        String t = s.trim();
        while (t.startsWith("\"") || t.startsWith("'")) t = t.substring(1);
        while (t.endsWith("\"") || t.endsWith("'")) t = t.substring(0, t.length() - 1);
        return t.trim();
    }

    private static long longOf(Properties p, String key, long fallback) {
        String v = p.getProperty(key);
        if (v == null || v.isBlank()) return fallback;
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException(key + " must be a number: " + v);
        }
    }
}
