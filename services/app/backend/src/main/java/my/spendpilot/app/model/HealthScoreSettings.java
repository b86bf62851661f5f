package my.spendpilot.app.model;

/**
 * Weights and thresholds of the health score. Costs are ratios, CTR is in percent.
 */
public record HealthScoreSettings(
		int costGapWeight,
		int smallCostGapBonus,
		int trendWeight,
		int ctrPenalty,
		int cpmPenalty,
		int frequencyPenalty,
		double ctrFloorPct,
		double cpmPeerMultiplier,
		double frequencyCeiling,
		long fullConfidenceImpressions,
		long lowConfidenceImpressions,
		double minConfidenceFactor,
		long todayMinImpressions,
		int qualityMinResults,
		int veryGoodThreshold,
		int goodThreshold,
		int neutralThreshold,
		int slightlyBadThreshold,
		int scoreLimit
) {
	public static HealthScoreSettings defaults() {
		return new HealthScoreSettings(
				45, 10, 15, 8, 12, 10,
				1.0, 1.3, 2.0,
				1000, 100, 0.6,
				300, 3,
				25, 5, -5, -25,
				100
		);
	}

	public HealthClass classify(int score) {
		if (score >= veryGoodThreshold) {
			return HealthClass.VERY_GOOD;
		}
		if (score >= goodThreshold) {
			return HealthClass.GOOD;
		}
		if (score >= neutralThreshold) {
			return HealthClass.NEUTRAL;
		}
		if (score >= slightlyBadThreshold) {
			return HealthClass.SLIGHTLY_BAD;
		}
		return HealthClass.BAD;
	}
}
