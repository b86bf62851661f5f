package my.spendpilot.app.model;

/**
 * Sum of active budgets of a direction before and after the run.
 */
public record DirectionBudget(
		String directionId,
		long envelopeCents,
		long currentTotalCents,
		long proposedTotalCents,
		long freedCents,
		long reanimationCents,
		boolean withinCorridor
) {
}
