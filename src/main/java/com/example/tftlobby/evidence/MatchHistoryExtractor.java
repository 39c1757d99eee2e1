package com.example.tftlobby.evidence;

import com.example.tftlobby.JsonFields;
import com.example.tftlobby.PlayerIdentity;
import com.example.tftlobby.fetch.FailureKind;
import com.example.tftlobby.fetch.FetchResult;
import com.example.tftlobby.riot.RiotApiClient;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Evidence from the player's recent TFT match records (match-v1).
 */
public class MatchHistoryExtractor implements EvidenceExtractor {

    private static final Logger log = LoggerFactory.getLogger(MatchHistoryExtractor.class);

    private final RiotApiClient riot;
    private final String region;

    public MatchHistoryExtractor(RiotApiClient riot, String region) {
        this.riot = riot;
        this.region = region;
    }

    @Override
    public String sourceName() {
        return "riot-match-history";
    }

    @Override
    public ExtractionResult extract(PlayerIdentity player, int maxSamples) {
        String puuid = player.getPuuid();
        FetchResult idsResult = riot.matchIds(region, puuid, maxSamples);
        if (idsResult.isNotFound()) {
            return ExtractionResult.empty("no match history");
        }
        if (idsResult.isFailure()) {
            return ExtractionResult.failure(idsResult.failureKind, idsResult.toString());
        }

        List<String> matchIds = new ArrayList<>();
        try {
            JsonElement parsed = JsonParser.parseString(idsResult.body);
            if (parsed.isJsonArray()) {
                for (JsonElement e : parsed.getAsJsonArray()) {
                    if (e.isJsonPrimitive()) matchIds.add(e.getAsString());
                }
            }
        } catch (JsonParseException e) {
            return ExtractionResult.failure(FailureKind.PARSE, "match id list: " + e.getMessage());
        }

        List<EvidenceRecord> records = new ArrayList<>();
        int limit = Math.min(maxSamples, matchIds.size());
        for (int i = 0; i < limit; i++) {
            String matchId = matchIds.get(i);
            FetchResult matchResult = riot.match(region, matchId);
            if (!matchResult.isOk()) {
                log.debug("Skipping match {}: {}", matchId, matchResult);
                continue;
            }
            JsonObject me = findParticipant(matchResult.body, puuid);
            if (me == null) {
                continue;
            }
            List<Trait> active = activeTraits(me);
            if (active.isEmpty()) {
                continue;
            }
            int placement = JsonFields.intOr(me, "placement", EvidenceRecord.UNKNOWN_PLACEMENT);
            records.add(EvidenceRecord.fromMatch(active, placement, i));
        }
        return ExtractionResult.evidence(records);
    }

    private static JsonObject findParticipant(String body, String puuid) {
        JsonObject root;
        try {
            root = JsonFields.obj(JsonParser.parseString(body));
        } catch (JsonParseException e) {
            log.debug("Unparsable match payload: {}", e.getMessage());
            return null;
        }
        JsonArray participants = JsonFields.arr(JsonFields.obj(root, "info"), "participants");
        if (participants == null) return null;
        for (JsonElement e : participants) {
            JsonObject p = JsonFields.obj(e);
            if (puuid.equals(JsonFields.str(p, "puuid"))) {
                return p;
            }
        }
        return null;
    }

    private static List<Trait> activeTraits(JsonObject participant) {
        List<Trait> out = new ArrayList<>();
        JsonArray traits = JsonFields.arr(participant, "traits");
        if (traits == null) return out;
        for (JsonElement e : traits) {
            JsonObject t = JsonFields.obj(e);
            String name = JsonFields.str(t, "name");
            int tier = JsonFields.intOr(t, "tier_current", 0);
            if (name == null || tier <= 0) continue;
            out.add(new Trait(name, tier, JsonFields.intOr(t, "num_units", 0)));
        }
        return out;
    }
}
