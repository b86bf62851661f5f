package my.spendpilot.app.model;

public record HealthAssessment(
		String unitId,
		int score,
		HealthClass healthClass,
		HealthDiagnostics diagnostics
) {
}
