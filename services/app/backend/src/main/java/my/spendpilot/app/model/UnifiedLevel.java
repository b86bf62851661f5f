package my.spendpilot.app.model;

public enum UnifiedLevel {
	EXCELLENT,
	VERY_GOOD,
	GOOD,
	NEUTRAL,
	MEDIUM_RISK,
	SLIGHTLY_BAD,
	PREVENTIVE_HIGH_RISK,
	BAD,
	CRITICAL;

	public static UnifiedLevel of(HealthClass healthClass) {
		return switch (healthClass) {
			case VERY_GOOD -> VERY_GOOD;
			case GOOD -> GOOD;
			case NEUTRAL -> NEUTRAL;
			case SLIGHTLY_BAD -> SLIGHTLY_BAD;
			case BAD -> BAD;
		};
	}

	/**
	 * Higher is stronger. Used to order units for trimming and top-ups.
	 */
	public int strength() {
		return switch (this) {
			case EXCELLENT -> 8;
			case VERY_GOOD -> 7;
			case GOOD -> 6;
			case NEUTRAL -> 5;
			case MEDIUM_RISK -> 4;
			case SLIGHTLY_BAD -> 3;
			case PREVENTIVE_HIGH_RISK -> 2;
			case BAD -> 1;
			case CRITICAL -> 0;
		};
	}
}
