package my.spendpilot.app.domain;

public enum ScheduleMode {
	AUTOPILOT,
	SEMI_AUTO,
	REPORT_ONLY,
	DISABLED;

	public boolean isSchedulable() {
		return this != DISABLED;
	}
}
