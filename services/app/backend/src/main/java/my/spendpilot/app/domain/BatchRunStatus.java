package my.spendpilot.app.domain;

public enum BatchRunStatus {
	COMPLETED,
	SKIPPED_LOCKED,
	NO_TENANTS
}
