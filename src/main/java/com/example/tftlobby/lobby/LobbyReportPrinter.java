package com.example.tftlobby.lobby;

import com.example.tftlobby.scoring.Prediction;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class LobbyReportPrinter {

	private final PrintStream out;
	private final int predictionsPerPlayer;
	private final int traitsPerView;

	public LobbyReportPrinter(PrintStream out, int predictionsPerPlayer, int traitsPerView) {
		this.out = out;
		this.predictionsPerPlayer = predictionsPerPlayer;
		this.traitsPerView = traitsPerView;
	}

	public void print(LobbyReport report) {
		out.println();
		out.println("=== Likely cores per player (top " + predictionsPerPlayer + ") ===");
		for (LobbyReport.PlayerLine line : report.players) {
			out.println("- " + line.player.displayLabel() + ": " + formatPredictions(line.predictions));
		}

		out.println();
		out.println("=== Trait contestedness ===");
		if (report.contention.isEmpty()) {
			out.println("(no signal)");
			return;
		}
		out.println("Most contested:");
		for (ContentionTally.Entry e : report.contention.mostContested(traitsPerView)) {
			out.println(formatTrait(e));
		}
		out.println("Least contested:");
		for (ContentionTally.Entry e : report.contention.leastContested(traitsPerView)) {
			out.println(formatTrait(e));
		}
	}

	String formatPredictions(List<Prediction> preds) {
		if (preds.isEmpty()) {
			return "(not enough data)";
		}
		List<String> parts = new ArrayList<>();
		for (int i = 0; i < Math.min(predictionsPerPlayer, preds.size()); i++) {
			Prediction p = preds.get(i);
			parts.add(p.core.displayName() + " (" + p.percentLabel() + ")");
		}
		return String.join(",  ", parts);
	}

	private static String formatTrait(ContentionTally.Entry e) {
		return String.format(Locale.ROOT, "  • %s: %.2f players-likely", e.trait, e.score);
	}
}
