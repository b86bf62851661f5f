package my.spendpilot.app.model;

/**
 * Yesterday's spend of one creative/ad inside a unit.
 */
public record SubComponentSpend(
		String subComponentId,
		String name,
		long spendCents,
		long impressions,
		long results
) {
}
