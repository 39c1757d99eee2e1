package com.example.tftlobby.lobby;

import com.example.tftlobby.scoring.Prediction;

import java.util.List;
import java.util.Map;

public final class LobbyAggregator {

	/**
	 * Adds each player's leading prediction probability to every trait of that core.
	 * Players without predictions contribute nothing.
	 */
	public ContentionTally aggregate(Map<String, List<Prediction>> predictionsByPlayer) {
		ContentionTally tally = new ContentionTally();
		for (List<Prediction> preds : predictionsByPlayer.values()) {
			if (preds == null || preds.isEmpty()) continue;
			Prediction top = preds.get(0);
			for (String trait : top.core.traits()) {
				tally.add(trait, top.probability);
			}
		}
		return tally;
	}
}
