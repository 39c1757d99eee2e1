package com.example.tftlobby.lobby;

import com.example.tftlobby.PlayerIdentity;
import com.example.tftlobby.evidence.EvidenceExtractor;
import com.example.tftlobby.evidence.ExtractionResult;
import com.example.tftlobby.scoring.Prediction;
import com.example.tftlobby.scoring.ScoringEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Scraped profile first, match history second. Whatever goes wrong for one player ends as an empty
 * prediction for that player only.
 */
public class FallbackPredictor {

	private static final Logger log = LoggerFactory.getLogger(FallbackPredictor.class);

	private final EvidenceExtractor primary;
	private final EvidenceExtractor fallback;
	private final ScoringEngine scoring;
	private final int primaryMaxSamples;
	private final int fallbackMaxSamples;

	public FallbackPredictor(EvidenceExtractor primary, EvidenceExtractor fallback, ScoringEngine scoring,
							 int primaryMaxSamples, int fallbackMaxSamples) {
		this.primary = primary;
		this.fallback = fallback;
		this.scoring = scoring;
		this.primaryMaxSamples = primaryMaxSamples;
		this.fallbackMaxSamples = fallbackMaxSamples;
	}

	public List<Prediction> predict(PlayerIdentity player) {
		List<Prediction> preds = attempt(primary, player, primaryMaxSamples);
		if (!preds.isEmpty()) {
			return preds;
		}
		log.info("{}: nothing usable from {}, falling back to {}", player.displayLabel(), primary.sourceName(), fallback.sourceName());
		preds = attempt(fallback, player, fallbackMaxSamples);
		if (preds.isEmpty()) {
			log.info("{}: still no signal", player.displayLabel());
		}
		return preds;
	}

	private List<Prediction> attempt(EvidenceExtractor extractor, PlayerIdentity player, int maxSamples) {
		ExtractionResult result;
		try {
			result = extractor.extract(player, maxSamples);
		} catch (RuntimeException e) {
			log.warn("{}: {} failed: {}", player.displayLabel(), extractor.sourceName(), e.toString());
			return new ArrayList<>();
		}
		if (result == null || !result.hasEvidence()) {
			log.debug("{}: {} -> {}", player.displayLabel(), extractor.sourceName(), result);
			return new ArrayList<>();
		}
		return scoring.score(result.records);
	}
}
