package my.spendpilot.app.model;

public enum UnitStatus {
	ACTIVE,
	PAUSED
}
