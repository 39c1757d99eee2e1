package com.example.tftlobby.evidence;

import com.example.tftlobby.JsonFields;
import com.example.tftlobby.PlayerIdentity;
import com.example.tftlobby.fetch.FailureKind;
import com.example.tftlobby.fetch.FetchResult;
import com.example.tftlobby.fetch.RateLimitedFetcher;
import com.example.tftlobby.policy.PolicyGate;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Evidence from a tactics.tools player page: the Next.js {@code __NEXT_DATA__} payload is searched for
 * composition summaries, each weighted by the statistics the page shows for it.
 */
public class ProfileScrapeExtractor implements EvidenceExtractor {

    private static final Logger log = LoggerFactory.getLogger(ProfileScrapeExtractor.class);

    public static final String SOURCE_KEY = "tactics.tools";
    static final String NEXT_DATA_SELECTOR = "script#__NEXT_DATA__";

    private final RateLimitedFetcher pageFetcher;
    private final PolicyGate gate;
    private final String baseUrl;
    private final String regionSlug;
    private final CandidateSearch search;

    public ProfileScrapeExtractor(RateLimitedFetcher pageFetcher, PolicyGate gate, String baseUrl, String regionSlug) {
        this(pageFetcher, gate, baseUrl, regionSlug, new CandidateSearch());
    }

    public ProfileScrapeExtractor(RateLimitedFetcher pageFetcher, PolicyGate gate, String baseUrl, String regionSlug,
                                  CandidateSearch search) {
        this.pageFetcher = pageFetcher;
        this.gate = gate;
        this.baseUrl = baseUrl;
        this.regionSlug = regionSlug;
        this.search = search;
    }

    @Override
    public String sourceName() {
        return SOURCE_KEY;
    }

    @Override
    public ExtractionResult extract(PlayerIdentity player, int maxSamples) {
        if (!player.hasGameName()) {
            return ExtractionResult.empty("no display name");
        }
        String path = profilePath(player);
        if (!gate.allowed(path)) {
            log.info("[robots] skipping {}", path);
            return ExtractionResult.empty("disallowed by robots.txt");
        }

        gate.pace(SOURCE_KEY);
        FetchResult page = pageFetcher.fetch(baseUrl + path);
        if (page.isNotFound()) {
            return ExtractionResult.empty("profile not found");
        }
        if (page.isFailure()) {
            return ExtractionResult.failure(page.failureKind, page.toString());
        }
        if (page.httpStatus != 200) {
            return ExtractionResult.empty("unexpected status " + page.httpStatus);
        }

        Document doc = Jsoup.parse(page.body);
        Element script = doc.selectFirst(NEXT_DATA_SELECTOR);
        if (script == null) {
            return ExtractionResult.empty("no embedded data");
        }

        JsonElement data;
        try {
            data = JsonParser.parseString(Parser.unescapeEntities(script.data(), false));
        } catch (JsonParseException e) {
            return ExtractionResult.failure(FailureKind.PARSE, "embedded data: " + e.getMessage());
        }

        List<CompositionCandidate> candidates = search.find(searchRoot(data));
        List<EvidenceRecord> records = new ArrayList<>();
        for (CompositionCandidate c : candidates) {
            if (records.size() >= maxSamples) break;
            if (c.traits.isEmpty()) continue;
            records.add(EvidenceRecord.weighted(c.traits, records.size(), c.weight()));
        }
        log.debug("{}: {} candidates, {} usable", path, candidates.size(), records.size());
        return ExtractionResult.evidence(records);
    }

    String profilePath(PlayerIdentity player) {
        String path = "/player/" + regionSlug + "/" + RateLimitedFetcher.encode(player.getGameName());
        if (player.getTagLine() != null) {
            path += "/" + RateLimitedFetcher.encode(player.getTagLine());
        }
        return path;
    }

    // props.pageProps, else pageProps, else the whole document
    private static JsonElement searchRoot(JsonElement data) {
        JsonObject obj = JsonFields.obj(data);
        if (obj == null) return data;
        JsonObject pageProps = JsonFields.obj(JsonFields.obj(obj, "props"), "pageProps");
        if (pageProps == null) pageProps = JsonFields.obj(obj, "pageProps");
        return pageProps != null ? pageProps : data;
    }
}
