package my.spendpilot.app.model;

/**
 * Relative change in percent over a window. Positive CPM change is a deterioration, negative CTR change is one too.
 */
public record TrendDelta(double cpmChangePct, double ctrChangePct) {
	public static TrendDelta flat() {
		return new TrendDelta(0.0, 0.0);
	}
}
