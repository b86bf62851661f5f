package my.spendpilot.app.model;

/**
 * A budget-bearing ad set. The target cost falls back to the parent direction's when not set here.
 */
public record AdServingUnit(
		String unitId,
		String campaignId,
		String directionId,
		String name,
		long dailyBudgetCents,
		UnitStatus status,
		Objective objective,
		Long targetCostCents
) {
	public AdServingUnit {
		if (status == null) {
			status = UnitStatus.ACTIVE;
		}
		if (objective == null) {
			objective = Objective.MESSAGING;
		}
	}

	public boolean isActive() {
		return status == UnitStatus.ACTIVE;
	}
}
