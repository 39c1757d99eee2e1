package com.example.tftlobby.lobby;

import com.example.tftlobby.PlayerIdentity;
import com.example.tftlobby.evidence.Core;
import com.example.tftlobby.scoring.Prediction;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LobbyReportPrinterTest {

	private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
	private final LobbyReportPrinter printer =
			new LobbyReportPrinter(new PrintStream(buffer, true, StandardCharsets.UTF_8), 3, 8);

	private String printed() {
		return buffer.toString(StandardCharsets.UTF_8);
	}

	@Test
	void printsPlayersInOrderWithStrippedSetPrefixes() {
		PlayerIdentity me = new PlayerIdentity("p1", "Me", "NA1", null);
		PlayerIdentity other = new PlayerIdentity("p2", null, null, "Other");
		List<Prediction> mine = Arrays.asList(
				new Prediction(Core.of("TFT13_Rebel", "TFT13_Sniper"), 0.6),
				new Prediction(Core.of("TFT13_Academy"), 0.4));

		Map<String, List<Prediction>> byPlayer = new LinkedHashMap<>();
		byPlayer.put("p1", mine);
		byPlayer.put("p2", Collections.emptyList());
		LobbyReport report = new LobbyReport(Arrays.asList(
				new LobbyReport.PlayerLine(me, mine),
				new LobbyReport.PlayerLine(other, Collections.emptyList())),
				new LobbyAggregator().aggregate(byPlayer));

		printer.print(report);

		String out = printed();
		assertThat(out).contains("=== Likely cores per player (top 3) ===");
		assertThat(out).contains("- Me#NA1: Rebel + Sniper (60%),  Academy (40%)");
		assertThat(out).contains("- Other: (not enough data)");
		assertThat(out.indexOf("Me#NA1")).isLessThan(out.indexOf("Other"));
		assertThat(out).contains("Most contested:");
		assertThat(out).contains("  • TFT13_Rebel: 0.60 players-likely");
		assertThat(out).contains("Least contested:");
	}

	@Test
	void lobbyWithoutAnyPredictionShowsNoSignal() {
		PlayerIdentity solo = PlayerIdentity.of("p1");
		LobbyReport report = new LobbyReport(
				Collections.singletonList(new LobbyReport.PlayerLine(solo, Collections.emptyList())),
				new ContentionTally());

		printer.print(report);

		assertThat(printed()).contains("- ?: (not enough data)").contains("(no signal)").doesNotContain("Most contested:");
	}

	@Test
	void onlyTheConfiguredNumberOfPredictionsIsShown() {
		List<Prediction> preds = Arrays.asList(
				new Prediction(Core.of("A", "B"), 0.4),
				new Prediction(Core.of("C", "D"), 0.3),
				new Prediction(Core.of("E", "F"), 0.2),
				new Prediction(Core.of("G", "H"), 0.1));

		assertThat(printer.formatPredictions(preds)).isEqualTo("A + B (40%),  C + D (30%),  E + F (20%)");
	}
}
