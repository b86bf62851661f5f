package my.spendpilot.app.model;

public enum DecisionKind {
	HOLD,
	INCREASE,
	DECREASE,
	PAUSE,
	TOP_UP,
	TRIM
}
