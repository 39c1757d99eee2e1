package com.example.tftlobby;

import com.example.tftlobby.evidence.MatchHistoryExtractor;
import com.example.tftlobby.evidence.ProfileScrapeExtractor;
import com.example.tftlobby.fetch.HttpTransport;
import com.example.tftlobby.fetch.JdkHttpTransport;
import com.example.tftlobby.fetch.RateLimitedFetcher;
import com.example.tftlobby.fetch.Sleeper;
import com.example.tftlobby.lobby.FallbackPredictor;
import com.example.tftlobby.lobby.LobbyAggregator;
import com.example.tftlobby.lobby.LobbyPipeline;
import com.example.tftlobby.lobby.LobbyReport;
import com.example.tftlobby.lobby.LobbyReportPrinter;
import com.example.tftlobby.policy.PolicyGate;
import com.example.tftlobby.riot.AuthException;
import com.example.tftlobby.riot.NameResolver;
import com.example.tftlobby.riot.Platform;
import com.example.tftlobby.riot.RiotApiClient;
import com.example.tftlobby.riot.RiotApiException;
import com.example.tftlobby.scoring.ScoringEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class TftLobbyApp {

    private static final Logger log = LoggerFactory.getLogger(TftLobbyApp.class);

    private final LobbyConfig config;
    private final HttpTransport transport;
    private final Sleeper sleeper;
    private final PrintStream out;

    public TftLobbyApp(LobbyConfig config, HttpTransport transport, Sleeper sleeper, PrintStream out) {
        this.config = config;
        this.transport = transport;
        this.sleeper = sleeper;
        this.out = out;
    }

    public static void main(String[] args) {
        LobbyConfig config = LobbyConfig.load();
        log.info("Using RIOT_API_KEY={}", config.maskedKey());
        int code;
        try {
            code = new TftLobbyApp(config, new JdkHttpTransport(), Sleeper.SYSTEM, System.out).run();
        } catch (AuthException e) {
            log.error("Authentication failed ({}): {}", e.getStatus(), e.getMessage());
            System.out.println(e.getMessage());
            code = 2;
        }
        System.exit(code);
    }

    /**
     * @return process exit code: 0 when a report was printed, 1 when the lobby could not be located
     */
    public int run() {
        Map<String, String> apiHeaders = new LinkedHashMap<>();
        apiHeaders.put("X-Riot-Token", config.apiKey);
        RateLimitedFetcher apiFetcher = new RateLimitedFetcher(transport, sleeper, apiHeaders,
                config.apiTimeout, config.retryBaseDelayMs);
        RiotApiClient riot = new RiotApiClient(apiFetcher, sleeper, "https://%s.api.riotgames.com");

        riot.checkCredentials(config.platformGuess().orElse(Platform.NA1));

        Optional<String> puuid = riot.findPuuid(config.riotId);
        if (puuid.isEmpty()) {
            out.println("Account not found for " + config.riotId + ". Double-check spelling/case.");
            return 1;
        }
        log.info("account -> puuid resolved ({}…)", puuid.get().substring(0, Math.min(8, puuid.get().length())));

        Optional<Platform> platform = riot.resolvePlatform(puuid.get(), config.platformGuess);
        if (platform.isEmpty()) {
            out.println("Couldn't resolve platform via /tft/summoner.");
            return 1;
        }
        String region = platform.get().region();
        log.info("platform resolved: {} (region {}, tactics.tools {})", platform.get().id(), region, platform.get().tacticsSlug());

        Optional<List<PlayerIdentity>> lobby;
        try {
            lobby = riot.activeGame(platform.get(), puuid.get());
        } catch (RiotApiException e) {
            log.warn("Live game lookup failed: {}", e.getMessage());
            out.println("Couldn't read the live game (" + e.getResult().failureKind + "). Try again in a moment.");
            return 1;
        }
        if (lobby.isEmpty()) {
            out.println("Not in an active TFT game. Try during champ select/loading/in-game.");
            return 1;
        }
        log.info("live game: {} players", lobby.get().size());

        LobbyReport report = buildPipeline(riot, apiFetcher, platform.get()).run(region, lobby.get());
        new LobbyReportPrinter(out, config.reportPredictions, config.reportTraits).print(report);
        return 0;
    }

    LobbyPipeline buildPipeline(RiotApiClient riot, RateLimitedFetcher apiFetcher, Platform platform) {
        Map<String, String> scrapeHeaders = new LinkedHashMap<>();
        scrapeHeaders.put("User-Agent", config.userAgent);
        scrapeHeaders.put("Accept", "text/html,application/xhtml+xml");
        RateLimitedFetcher pageFetcher = apiFetcher.withHeadersAndTimeout(scrapeHeaders, config.scrapeTimeout);
        RateLimitedFetcher robotsFetcher = apiFetcher.withHeadersAndTimeout(scrapeHeaders, config.robotsTimeout);

        PolicyGate gate = new PolicyGate(robotsFetcher, config.scrapeBaseUrl + "/robots.txt", config.scrapeDelayMs,
                sleeper, System::nanoTime);
        ProfileScrapeExtractor scraped = new ProfileScrapeExtractor(pageFetcher, gate, config.scrapeBaseUrl, platform.tacticsSlug());
        MatchHistoryExtractor history = new MatchHistoryExtractor(riot, platform.region());

        FallbackPredictor predictor = new FallbackPredictor(scraped, history, new ScoringEngine(),
                config.scrapeMaxCandidates, config.fallbackMatchCount);
        NameResolver names = new NameResolver(riot, config.nameResolverWorkers, config.apiTimeout.toMillis() * 2);
        return new LobbyPipeline(names, predictor, new LobbyAggregator());
    }
}
