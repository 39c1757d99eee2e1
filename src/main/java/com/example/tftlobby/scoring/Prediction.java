package com.example.tftlobby.scoring;

import com.example.tftlobby.evidence.Core;

import java.util.Locale;

public final class Prediction {

	public final Core core;
	public final double probability; // in [0, 1]

	public Prediction(Core core, double probability) {
		if (core == null || core.isEmpty()) {
			throw new IllegalArgumentException("prediction needs a non-empty core");
		}
		if (!Double.isFinite(probability) || probability < 0.0) {
			throw new IllegalArgumentException("probability must be finite and >= 0: " + probability);
		}
		this.core = core;
		this.probability = probability;
	}

	public String percentLabel() {
		return String.format(Locale.ROOT, "%.0f%%", probability * 100.0);
	}

	@Override
	public String toString() {
		return core + " " + percentLabel();
	}
}
