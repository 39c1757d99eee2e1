package com.example.tftlobby.riot;

import java.util.Locale;
import java.util.Optional;

/**
 * Riot platform id, its regional routing value and the matching tactics.tools region slug.
 */
public enum Platform {
    NA1("na1", "americas", "na"),
    BR1("br1", "americas", "br"),
    LA1("la1", "americas", "lan"),
    LA2("la2", "americas", "las"),
    OC1("oc1", "americas", "oce"),
    EUW1("euw1", "europe", "euw"),
    EUN1("eun1", "europe", "eune"),
    TR1("tr1", "europe", "tr"),
    RU("ru", "europe", "ru"),
    JP1("jp1", "asia", "jp"),
    KR("kr", "asia", "kr"),
    PH2("ph2", "asia", "sea"),
    SG2("sg2", "asia", "sea"),
    TH2("th2", "asia", "sea"),
    TW2("tw2", "asia", "tw"),
    VN2("vn2", "asia", "vn");

    private final String id;
    private final String region;
    private final String tacticsSlug;

    Platform(String id, String region, String tacticsSlug) {
        this.id = id;
        this.region = region;
        this.tacticsSlug = tacticsSlug;
    }

    public String id() {
        return id;
    }

    public String region() {
        return region;
    }

    public String tacticsSlug() {
        return tacticsSlug;
    }

    public static Optional<Platform> fromId(String id) {
        if (id == null) return Optional.empty();
        String p = id.trim().toLowerCase(Locale.ROOT);
        for (Platform platform : values()) {
            if (platform.id.equals(p)) return Optional.of(platform);
        }
        return Optional.empty();
    }
}
