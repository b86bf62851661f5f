package my.spendpilot.app.model;

public record UnifiedAssessment(
		String unitId,
		UnifiedLevel level,
		AlertSeverity alert,
		ActionHint hint,
		String reasoning,
		boolean scoringAvailable,
		FusionBranch branch,
		HealthAssessment health
) {
}
