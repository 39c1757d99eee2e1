package com.example.tftlobby;

import java.util.Objects;

public final class PlayerIdentity {

    private final String puuid;          // stable key
    private final String gameName;       // account-v1 gameName, may be null until resolved
    private final String tagLine;        // account-v1 tagLine, may be null
    private final String fallbackLabel;  // spectator summonerName / riotId, may be null

    public PlayerIdentity(String puuid, String gameName, String tagLine, String fallbackLabel) {
        if (puuid == null || puuid.isBlank()) {
            throw new IllegalArgumentException("puuid is required");
        }
        this.puuid = puuid;
        this.gameName = blankToNull(gameName);
        this.tagLine = blankToNull(tagLine);
        this.fallbackLabel = blankToNull(fallbackLabel);
    }

    public static PlayerIdentity of(String puuid) {
        return new PlayerIdentity(puuid, null, null, null);
    }

    public PlayerIdentity withDisplayName(String newGameName, String newTagLine) {
        return new PlayerIdentity(puuid, newGameName, newTagLine, fallbackLabel);
    }

    public String getPuuid() {
        return puuid;
    }

    public String getGameName() {
        return gameName;
    }

    public String getTagLine() {
        return tagLine;
    }

    public boolean hasGameName() {
        return gameName != null;
    }

    public String displayLabel() {
        if (gameName != null && tagLine != null) return gameName + "#" + tagLine;
        if (fallbackLabel != null) return fallbackLabel;
        if (gameName != null) return gameName;
        return "?";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PlayerIdentity)) return false;
        return puuid.equals(((PlayerIdentity) o).puuid);
    }

    @Override
    public int hashCode() {
        return Objects.hash(puuid);
    }

    @Override
    public String toString() {
        return displayLabel() + " (" + (puuid.length() > 8 ? puuid.substring(0, 8) + "…" : puuid) + ")";
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
