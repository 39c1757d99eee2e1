package com.example.tftlobby.evidence;

import com.example.tftlobby.PlayerIdentity;

public interface EvidenceExtractor {

    /**
     * Gathers at most {@code maxSamples} observations for one player. Expected conditions (nothing found,
     * source unreachable, unparsable payload) come back as a result variant, not as an exception.
     */
    ExtractionResult extract(PlayerIdentity player, int maxSamples);

    String sourceName();
}
