package my.spendpilot.app.model;

/**
 * Aggregate for one unit over one window. Spend and CPM are in minor currency units, CTR in percent.
 */
public record MetricsWindow(
		long spendCents,
		long impressions,
		double ctrPct,
		double cpmCents,
		double frequency,
		ConversionCounts conversions
) {
	public MetricsWindow {
		if (conversions == null) {
			conversions = ConversionCounts.none();
		}
	}

	public static MetricsWindow empty() {
		return new MetricsWindow(0, 0, 0.0, 0.0, 0.0, ConversionCounts.none());
	}

	public boolean hasDelivery() {
		return spendCents > 0 || impressions > 0;
	}
}
