package com.example.tftlobby.lobby;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Trait name to summed leading-prediction probability, in first-seen order.
 */
public final class ContentionTally {

	public static class Entry {
		public final String trait;
		public final double score;

		Entry(String trait, double score) {
			this.trait = trait;
			this.score = score;
		}

		@Override
		public String toString() {
			return trait + "=" + score;
		}
	}

	private final Map<String, Double> scores = new LinkedHashMap<>();

	void add(String trait, double amount) {
		scores.merge(trait, amount, Double::sum);
	}

	public boolean isEmpty() {
		return scores.isEmpty();
	}

	public int size() {
		return scores.size();
	}

	public Double scoreOf(String trait) {
		return scores.get(trait);
	}

	public List<Entry> mostContested(int limit) {
		List<Entry> all = entries();
		all.sort((a, b) -> Double.compare(b.score, a.score));
		return head(all, limit);
	}

	public List<Entry> leastContested(int limit) {
		List<Entry> all = entries();
		all.sort((a, b) -> Double.compare(a.score, b.score));
		return head(all, limit);
	}

	private List<Entry> entries() {
		List<Entry> out = new ArrayList<>(scores.size());
		for (Map.Entry<String, Double> e : scores.entrySet()) {
			out.add(new Entry(e.getKey(), e.getValue()));
		}
		return out;
	}

	private static List<Entry> head(List<Entry> sorted, int limit) {
		return sorted.size() > limit ? new ArrayList<>(sorted.subList(0, limit)) : sorted;
	}
}
