package my.spendpilot.app.model;

/**
 * Outcome of rebalancing for one existing unit. A paused unit proposes 0.
 */
public record UnitDecision(
		String unitId,
		String campaignId,
		UnifiedLevel level,
		int score,
		long currentBudgetCents,
		long proposedBudgetCents,
		DecisionKind kind,
		String reason
) {
}
