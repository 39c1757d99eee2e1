package com.example.tftlobby.lobby;

import com.example.tftlobby.evidence.Core;
import com.example.tftlobby.scoring.Prediction;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class LobbyAggregatorTest {

	private final LobbyAggregator aggregator = new LobbyAggregator();

	@Test
	void onlyLeadingPredictionsCount() {
		Map<String, List<Prediction>> lobby = new LinkedHashMap<>();
		lobby.put("P1", Arrays.asList(new Prediction(Core.of("A", "B"), 0.6), new Prediction(Core.of("D", "E"), 0.4)));
		lobby.put("P2", Collections.singletonList(new Prediction(Core.of("A", "C"), 0.5)));
		lobby.put("P3", Collections.emptyList());

		ContentionTally tally = aggregator.aggregate(lobby);

		assertThat(tally.size()).isEqualTo(3);
		assertThat(tally.scoreOf("A")).isCloseTo(1.1, within(1e-9));
		assertThat(tally.scoreOf("B")).isCloseTo(0.6, within(1e-9));
		assertThat(tally.scoreOf("C")).isCloseTo(0.5, within(1e-9));
		assertThat(tally.scoreOf("D")).isNull();
		assertThat(tally.mostContested(8).get(0).trait).isEqualTo("A");
	}

	@Test
	void rankingViewsSortOppositeWaysAndMayOverlap() {
		Map<String, List<Prediction>> lobby = new LinkedHashMap<>();
		lobby.put("P1", Collections.singletonList(new Prediction(Core.of("A", "B"), 0.6)));
		lobby.put("P2", Collections.singletonList(new Prediction(Core.of("A", "C"), 0.5)));

		ContentionTally tally = aggregator.aggregate(lobby);

		assertThat(tally.mostContested(8)).extracting(e -> e.trait).containsExactly("A", "B", "C");
		assertThat(tally.leastContested(8)).extracting(e -> e.trait).containsExactly("C", "B", "A");
		assertThat(tally.mostContested(2)).extracting(e -> e.trait).containsExactly("A", "B");
		assertThat(tally.leastContested(1)).extracting(e -> e.trait).containsExactly("C");
	}

	@Test
	void lobbyWithoutPredictionsHasNoSignal() {
		Map<String, List<Prediction>> lobby = new LinkedHashMap<>();
		lobby.put("P1", Collections.emptyList());

		assertThat(aggregator.aggregate(lobby).isEmpty()).isTrue();
	}

	@Test
	void equalScoresKeepFirstSeenOrder() {
		Map<String, List<Prediction>> lobby = new LinkedHashMap<>();
		lobby.put("P1", Collections.singletonList(new Prediction(Core.of("Z", "Y"), 0.5)));

		ContentionTally tally = aggregator.aggregate(lobby);

		assertThat(tally.mostContested(8)).extracting(e -> e.trait).containsExactly("Z", "Y");
		assertThat(tally.leastContested(8)).extracting(e -> e.trait).containsExactly("Z", "Y");
	}
}
