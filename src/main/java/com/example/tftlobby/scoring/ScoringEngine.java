package com.example.tftlobby.scoring;

import com.example.tftlobby.evidence.Core;
import com.example.tftlobby.evidence.EvidenceRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a player's evidence into ranked core predictions.
 *
 * - record weight: its own base weight when the source supplied one, otherwise 0.85^recencyIndex,
 *   x1.3 for a top-4 placement
 * - weights summed per distinct core, normalised by the total over every core
 * - descending by weight, ties in first-seen order, top 5 returned
 */
public final class ScoringEngine {

	public static final double RECENCY_DECAY = 0.85;
	public static final double TOP4_BONUS = 1.3;
	public static final int TOP4_CUTOFF = 4;
	public static final int MAX_PREDICTIONS = 5;

	public List<Prediction> score(List<EvidenceRecord> records) {
		List<Prediction> all = distribution(records);
		return all.size() > MAX_PREDICTIONS ? new ArrayList<>(all.subList(0, MAX_PREDICTIONS)) : all;
	}

	/**
	 * Every distinct core with its normalised probability, ranked. Sums to 1.0 for non-empty input.
	 */
	public List<Prediction> distribution(List<EvidenceRecord> records) {
		List<Prediction> out = new ArrayList<>();
		if (records == null || records.isEmpty()) {
			return out;
		}

		Map<Core, Double> tally = new LinkedHashMap<>();
		double total = 0.0;
		for (EvidenceRecord r : records) {
			Core core = r.core();
			if (core.isEmpty()) continue;
			double w = weight(r);
			if (!Double.isFinite(w) || w < 0.0) continue;
			tally.merge(core, w, Double::sum);
			total += w;
		}
		if (tally.isEmpty()) {
			return out;
		}
		if (total <= 0.0) total = 1.0;

		List<Map.Entry<Core, Double>> ranked = new ArrayList<>(tally.entrySet());
		// stable: equal weights stay in first-seen order
		ranked.sort((a, b) -> Double.compare(b.getValue(), a.getValue()));
		for (Map.Entry<Core, Double> e : ranked) {
			out.add(new Prediction(e.getKey(), e.getValue() / total));
		}
		return out;
	}

	public static double weight(EvidenceRecord r) {
		if (r.baseWeight != null) {
			return r.baseWeight;
		}
		return recencyWeight(r.recencyIndex) * placementBonus(r.placement);
	}

	public static double recencyWeight(int recencyIndex) {
		return Math.pow(RECENCY_DECAY, recencyIndex);
	}

	public static double placementBonus(int placement) {
		return placement <= TOP4_CUTOFF ? TOP4_BONUS : 1.0;
	}
}
