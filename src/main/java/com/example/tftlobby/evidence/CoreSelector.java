package com.example.tftlobby.evidence;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class CoreSelector {

    private static final int CORE_SIZE = 2;
    private static final int DEFINITIVE_TIER = 2;

    private static final Comparator<Trait> STRONGEST_FIRST =
            Comparator.comparingInt((Trait t) -> t.tier).thenComparingInt(t -> t.units).reversed();

    /**
     * Top two traits by (tier, units). A weak (tier below 2) runner-up gives way to the third trait when there is one.
     * Unknown-tier traits keep their listed order and are never treated as weak.
     */
    public static Core select(List<Trait> traits) {
        if (traits == null || traits.isEmpty()) {
            return Core.EMPTY;
        }
        // one entry per name, first occurrence wins
        Map<String, Trait> byName = new LinkedHashMap<>();
        for (Trait t : traits) {
            if (t != null && t.name != null && !t.name.isEmpty()) {
                byName.putIfAbsent(t.name, t);
            }
        }
        List<Trait> ranked = new ArrayList<>(byName.values());
        ranked.sort(STRONGEST_FIRST); // List.sort is stable

        if (ranked.size() < CORE_SIZE) {
            return ranked.isEmpty() ? Core.EMPTY : Core.of(ranked.get(0).name);
        }
        Trait first = ranked.get(0);
        Trait second = ranked.get(1);
        if (second.hasKnownTier() && second.tier < DEFINITIVE_TIER && ranked.size() >= 3) {
            second = ranked.get(2);
        }
        return Core.of(first.name, second.name);
    }

    private CoreSelector() {}
}
