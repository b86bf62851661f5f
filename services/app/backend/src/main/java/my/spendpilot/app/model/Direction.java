package my.spendpilot.app.model;

public record Direction(
		String directionId,
		String campaignId,
		String name,
		long envelopeCents,
		long targetCostCents,
		String lookalikeAudienceId
) {
}
