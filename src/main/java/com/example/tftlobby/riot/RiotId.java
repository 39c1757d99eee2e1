package com.example.tftlobby.riot;

public final class RiotId {

    public final String gameName;
    public final String tagLine;

    public RiotId(String gameName, String tagLine) {
        this.gameName = gameName;
        this.tagLine = tagLine;
    }

    /**
     * Parses {@code Name#Tag}; the split is on the first '#'.
     */
    public static RiotId parse(String raw) {
        if (raw == null || raw.indexOf('#') < 0) {
            throw new IllegalArgumentException("Riot id must look like \"Name#Tag\": " + raw);
        }
        int hash = raw.indexOf('#');
        String name = raw.substring(0, hash).trim();
        String tag = raw.substring(hash + 1).trim();
        if (name.isEmpty() || tag.isEmpty()) {
            throw new IllegalArgumentException("Riot id must look like \"Name#Tag\": " + raw);
        }
        return new RiotId(name, tag);
    }

    @Override
    public String toString() {
        return gameName + "#" + tagLine;
    }
}
