package com.example.tftlobby.evidence;

import com.example.tftlobby.JsonFields;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A composition summary found somewhere in a scraped page payload.
 *
 * Required: the trait list. Optional: sample counts, play rate and win rate, collected from every field
 * spelling the site has used, and only when the value is a JSON number.
 */
public final class CompositionCandidate {

    static final String[] SAMPLE_FIELDS = {"games", "matches", "count"};
    static final String[] PLAY_RATE_FIELDS = {"playRate", "playrate", "rate", "pr"};
    static final String[] WIN_RATE_FIELDS = {"winRate", "wr"};

    public final List<Trait> traits;
    public final List<Double> sampleCounts;
    public final List<Double> playRates;
    public final List<Double> winRates;

    private CompositionCandidate(List<Trait> traits, List<Double> sampleCounts, List<Double> playRates, List<Double> winRates) {
        this.traits = Collections.unmodifiableList(traits);
        this.sampleCounts = Collections.unmodifiableList(sampleCounts);
        this.playRates = Collections.unmodifiableList(playRates);
        this.winRates = Collections.unmodifiableList(winRates);
    }

    public static boolean matches(JsonObject obj) {
        return obj != null && JsonFields.arr(obj, "traits") != null;
    }

    /**
     * @return the candidate, or null when {@code obj} has no trait array
     */
    public static CompositionCandidate from(JsonObject obj) {
        JsonArray rawTraits = JsonFields.arr(obj, "traits");
        if (rawTraits == null) {
            return null;
        }
        List<Trait> traits = new ArrayList<>();
        for (JsonElement e : rawTraits) {
            Trait t = parseTrait(e);
            if (t != null) {
                traits.add(t);
            }
        }
        return new CompositionCandidate(traits,
                numbers(obj, SAMPLE_FIELDS), numbers(obj, PLAY_RATE_FIELDS), numbers(obj, WIN_RATE_FIELDS));
    }

    /**
     * Weight heuristic: max(1, sample counts, play rates x 100), then + win rates x 10.
     */
    public double weight() {
        double w = 1.0;
        for (Double v : sampleCounts) {
            w = Math.max(w, v);
        }
        for (Double v : playRates) {
            w = Math.max(w, v * 100.0);
        }
        for (Double v : winRates) {
            w += v * 10.0;
        }
        return w;
    }

    private static Trait parseTrait(JsonElement e) {
        if (e == null || e.isJsonNull()) return null;
        if (e.isJsonPrimitive()) {
            String name = e.getAsString();
            return name.isEmpty() ? null : Trait.unranked(name);
        }
        JsonObject o = JsonFields.obj(e);
        if (o == null) return null;
        String name = JsonFields.str(o, "name");
        if (name == null) name = JsonFields.str(o, "slug");
        if (name == null) name = JsonFields.str(o, "key");
        if (name == null) return null;

        Double tier = JsonFields.num(o, "tier_current");
        if (tier == null) tier = JsonFields.num(o, "tier");
        Double units = JsonFields.num(o, "num_units");
        if (units == null) units = JsonFields.num(o, "units");
        return new Trait(name, tier == null ? Trait.UNKNOWN_TIER : tier.intValue(), units == null ? 0 : units.intValue());
    }

    private static List<Double> numbers(JsonObject obj, String[] keys) {
        List<Double> out = new ArrayList<>();
        for (String k : keys) {
            Double v = JsonFields.num(obj, k);
            if (v != null) out.add(v);
        }
        return out;
    }
}
