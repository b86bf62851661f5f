package my.spendpilot.app.dto;

public enum RunJobStatus {
	PENDING,
	RUNNING,
	DONE,
	FAILED
}
