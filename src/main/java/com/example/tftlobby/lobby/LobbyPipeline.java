package com.example.tftlobby.lobby;

import com.example.tftlobby.PlayerIdentity;
import com.example.tftlobby.riot.NameResolver;
import com.example.tftlobby.scoring.Prediction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One run over one lobby: names in parallel, then predictions one player at a time in participant order,
 * then aggregation.
 */
public class LobbyPipeline {

	private static final Logger log = LoggerFactory.getLogger(LobbyPipeline.class);

	private final NameResolver names;
	private final FallbackPredictor predictor;
	private final LobbyAggregator aggregator;

	public LobbyPipeline(NameResolver names, FallbackPredictor predictor, LobbyAggregator aggregator) {
		this.names = names;
		this.predictor = predictor;
		this.aggregator = aggregator;
	}

	public LobbyReport run(String region, List<PlayerIdentity> participants) {
		List<PlayerIdentity> players = names.resolve(region, dedupe(participants));

		Map<String, List<Prediction>> byPuuid = new LinkedHashMap<>();
		List<LobbyReport.PlayerLine> lines = new ArrayList<>();
		for (int i = 0; i < players.size(); i++) {
			PlayerIdentity p = players.get(i);
			log.info("[{}/{}] {}", i + 1, players.size(), p.displayLabel());
			List<Prediction> preds;
			try {
				preds = predictor.predict(p);
			} catch (RuntimeException e) {
				log.warn("{}: prediction failed: {}", p.displayLabel(), e.toString());
				preds = new ArrayList<>();
			}
			byPuuid.put(p.getPuuid(), preds);
			lines.add(new LobbyReport.PlayerLine(p, preds));
		}
		return new LobbyReport(lines, aggregator.aggregate(byPuuid));
	}

	private static List<PlayerIdentity> dedupe(List<PlayerIdentity> participants) {
		Map<String, PlayerIdentity> unique = new LinkedHashMap<>();
		for (PlayerIdentity p : participants) {
			unique.putIfAbsent(p.getPuuid(), p);
		}
		return new ArrayList<>(unique.values());
	}
}
