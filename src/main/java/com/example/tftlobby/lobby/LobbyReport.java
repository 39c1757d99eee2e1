package com.example.tftlobby.lobby;

import com.example.tftlobby.PlayerIdentity;
import com.example.tftlobby.scoring.Prediction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class LobbyReport {

	public static class PlayerLine {
		public final PlayerIdentity player;
		public final List<Prediction> predictions;

		public PlayerLine(PlayerIdentity player, List<Prediction> predictions) {
			this.player = player;
			this.predictions = Collections.unmodifiableList(new ArrayList<>(predictions));
		}
	}

	public final List<PlayerLine> players; // participant order
	public final ContentionTally contention;

	public LobbyReport(List<PlayerLine> players, ContentionTally contention) {
		this.players = Collections.unmodifiableList(new ArrayList<>(players));
		this.contention = contention;
	}
}
