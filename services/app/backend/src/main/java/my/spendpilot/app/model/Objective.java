package my.spendpilot.app.model;

/**
 * Advertising objective of a unit. Each objective counts results from exactly one conversion channel.
 */
public enum Objective {
	MESSAGING,
	SITE_LEADS,
	LEAD_FORMS,
	TRAFFIC;

	public long results(ConversionCounts counts, int qualityMinResults) {
		if (counts == null) {
			return 0;
		}
		return switch (this) {
			case MESSAGING -> counts.qualityConversations() >= qualityMinResults
					? counts.qualityConversations()
					: counts.messagingStarted();
			case SITE_LEADS -> counts.siteLeads();
			case LEAD_FORMS -> counts.formLeads();
			case TRAFFIC -> counts.linkClicks();
		};
	}
}
