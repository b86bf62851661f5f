package my.spendpilot.app.domain;

public enum PlanSource {
	DETERMINISTIC,
	REASONING,
	DETERMINISTIC_FALLBACK
}
