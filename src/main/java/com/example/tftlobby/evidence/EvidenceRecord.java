package com.example.tftlobby.evidence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One observation of what a player played: traits, finishing placement and position in a newest-first history.
 */
public final class EvidenceRecord {

    public static final int UNKNOWN_PLACEMENT = 9;

    public final List<Trait> traits;
    public final int placement;
    public final int recencyIndex;
    // Set when the source supplies its own weight (scraped summaries); null means recency/placement weighting.
    public final Double baseWeight;

    public EvidenceRecord(List<Trait> traits, int placement, int recencyIndex, Double baseWeight) {
        this.traits = Collections.unmodifiableList(new ArrayList<>(traits));
        this.placement = placement;
        this.recencyIndex = recencyIndex;
        this.baseWeight = baseWeight;
    }

    public static EvidenceRecord fromMatch(List<Trait> traits, int placement, int recencyIndex) {
        return new EvidenceRecord(traits, placement, recencyIndex, null);
    }

    public static EvidenceRecord weighted(List<Trait> traits, int recencyIndex, double weight) {
        return new EvidenceRecord(traits, UNKNOWN_PLACEMENT, recencyIndex, weight);
    }

    public Core core() {
        return CoreSelector.select(traits);
    }

    @Override
    public String toString() {
        return "EvidenceRecord{" + traits + ", placement=" + placement + ", i=" + recencyIndex
                + (baseWeight != null ? ", w=" + baseWeight : "") + "}";
    }
}
