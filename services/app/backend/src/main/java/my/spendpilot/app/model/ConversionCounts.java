package my.spendpilot.app.model;

public record ConversionCounts(
		long messagingStarted,
		long qualityConversations,
		long siteLeads,
		long formLeads,
		long linkClicks
) {
	public static ConversionCounts none() {
		return new ConversionCounts(0, 0, 0, 0, 0);
	}
}
