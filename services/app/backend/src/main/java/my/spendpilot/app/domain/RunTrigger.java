package my.spendpilot.app.domain;

public enum RunTrigger {
	SCHEDULED,
	MANUAL,
	APPROVAL
}
