package my.spendpilot.app.model;

import java.util.List;

/**
 * Sub-scores behind a health score, before the volume factor is applied.
 */
public record HealthDiagnostics(
		double effectiveCostYesterday,
		Double costRatio,
		int costGap,
		double trend,
		int diagnosticPenalty,
		int todayCompensation,
		double volumeFactor,
		List<String> notes
) {
	public HealthDiagnostics {
		notes = notes == null ? List.of() : List.copyOf(notes);
	}
}
