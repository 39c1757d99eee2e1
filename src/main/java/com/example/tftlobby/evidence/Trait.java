package com.example.tftlobby.evidence;

public final class Trait {

    public static final int UNKNOWN_TIER = -1;

    public final String name;
    public final int tier;   // tier_current, or UNKNOWN_TIER when the source does not say
    public final int units;  // num_units

    public Trait(String name, int tier, int units) {
        this.name = name;
        this.tier = tier;
        this.units = units;
    }

    public static Trait unranked(String name) {
        return new Trait(name, UNKNOWN_TIER, 0);
    }

    public boolean hasKnownTier() {
        return tier != UNKNOWN_TIER;
    }

    @Override
    public String toString() {
        return hasKnownTier() ? name + "(t" + tier + "/" + units + ")" : name;
    }
}
