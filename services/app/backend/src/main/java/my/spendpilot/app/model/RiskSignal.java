package my.spendpilot.app.model;

import java.util.List;

/**
 * Risk metadata for one unit produced by the analytics service.
 */
public record RiskSignal(
		String unitId,
		int riskScore,
		boolean valid,
		String invalidReason,
		TrendDelta day1,
		TrendDelta day3,
		TrendDelta day7,
		Ranking qualityRanking,
		Ranking engagementRanking,
		Ranking conversionRanking,
		double frequency7d,
		Double predictedCostChangePct
) {
	public RiskSignal {
		day1 = day1 == null ? TrendDelta.flat() : day1;
		day3 = day3 == null ? TrendDelta.flat() : day3;
		day7 = day7 == null ? TrendDelta.flat() : day7;
		qualityRanking = qualityRanking == null ? Ranking.UNKNOWN : qualityRanking;
		engagementRanking = engagementRanking == null ? Ranking.UNKNOWN : engagementRanking;
		conversionRanking = conversionRanking == null ? Ranking.UNKNOWN : conversionRanking;
	}

	public List<Ranking> rankings() {
		return List.of(qualityRanking, engagementRanking, conversionRanking);
	}
}
