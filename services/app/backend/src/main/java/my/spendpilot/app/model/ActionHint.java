package my.spendpilot.app.model;

public enum ActionHint {
	NONE,
	SCALE_UP_30,
	FREEZE_GROWTH,
	REDUCE_BUDGET_30,
	REDUCE_BUDGET_50
}
