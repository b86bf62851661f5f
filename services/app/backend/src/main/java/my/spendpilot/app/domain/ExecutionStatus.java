package my.spendpilot.app.domain;

public enum ExecutionStatus {
	RUNNING,
	COMPLETED,
	FAILED,
	PENDING_APPROVAL,
	REPORT_ONLY,
	NO_SPEND,
	DRY_RUN,
	SKIPPED
}
