package my.spendpilot.app.model;

/**
 * Creative available for reanimation. {@code historicalCostCents} is only known for assets that already ran.
 */
public record CreativeAsset(
		String assetId,
		String directionId,
		AssetState state,
		Double historicalCostCents
) {
}
