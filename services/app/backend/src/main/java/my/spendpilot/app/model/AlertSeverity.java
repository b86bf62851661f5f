package my.spendpilot.app.model;

public enum AlertSeverity {
	NONE,
	INFO,
	WARNING,
	CRITICAL
}
