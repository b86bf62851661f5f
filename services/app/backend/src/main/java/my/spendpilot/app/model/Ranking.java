package my.spendpilot.app.model;

public enum Ranking {
	ABOVE_AVERAGE,
	AVERAGE,
	BELOW_AVERAGE_35,
	BELOW_AVERAGE_20,
	BELOW_AVERAGE_10,
	UNKNOWN;

	public boolean isBottomDecile() {
		return this == BELOW_AVERAGE_10;
	}

	public boolean isBelowAverage() {
		return this == BELOW_AVERAGE_35 || this == BELOW_AVERAGE_20 || this == BELOW_AVERAGE_10;
	}

	public boolean isAverageOrBetter() {
		return this == ABOVE_AVERAGE || this == AVERAGE;
	}
}
