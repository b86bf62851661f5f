package my.spendpilot.app.model;

/**
 * Budget limits for action synthesis. Amounts are daily budgets in minor currency units.
 */
public record RebalanceSettings(
		long minBudgetCents,
		long maxBudgetCents,
		double maxStepUp,
		double maxStepDown,
		double corridorLow,
		double corridorHigh,
		long newUnitMinCents,
		long newUnitMaxCents,
		int maxAssetsPerNewUnit,
		int maxNewUnitsPerDirection,
		double readyAssetMaxCostRatio,
		double eaterSpendShare,
		double eaterCostRatio,
		double underspendIncrease,
		double pauseCostRatio,
		int maxActions
) {
	public static RebalanceSettings defaults() {
		return new RebalanceSettings(
				300, 10_000,
				0.30, 0.50,
				0.95, 1.05,
				1_000, 2_000,
				3, 3,
				1.3,
				0.5, 1.3,
				0.10,
				3.0,
				50
		);
	}

	public long clamp(long budgetCents) {
		return Math.max(minBudgetCents, Math.min(maxBudgetCents, budgetCents));
	}
}
