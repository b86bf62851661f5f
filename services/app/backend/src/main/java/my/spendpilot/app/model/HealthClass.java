package my.spendpilot.app.model;

/**
 * Five-level ordinal health class, ordered from worst to best.
 */
public enum HealthClass {
	BAD,
	SLIGHTLY_BAD,
	NEUTRAL,
	GOOD,
	VERY_GOOD;

	public boolean isGoodOrBetter() {
		return this == GOOD || this == VERY_GOOD;
	}
}
