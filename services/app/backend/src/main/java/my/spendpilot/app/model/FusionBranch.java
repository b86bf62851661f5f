package my.spendpilot.app.model;

public enum FusionBranch {
	CRITICAL_OVERRIDE,
	MEDIUM_SIGNAL,
	POSITIVE_CONFIRMATION,
	DEFAULT,
	PASS_THROUGH
}
