package my.spendpilot.app.action;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Puts a status read of the parent campaign in front of the first mutating action on that campaign.
 */
public final class ActionOrdering {
	private ActionOrdering() {
	}

	public static List<AdAction> withStatusReads(List<AdAction> actions,
												 Map<String, String> campaignByUnit,
												 Map<String, String> campaignByDirection) {
		if (actions == null || actions.isEmpty()) {
			return List.of();
		}
		Set<String> read = new HashSet<>();
		List<AdAction> ordered = new ArrayList<>(actions.size() + 4);
		for (AdAction action : actions) {
			if (action instanceof AdAction.StatusRead statusRead) {
				if (read.add(statusRead.campaignId())) {
					ordered.add(action);
				}
				continue;
			}
			String campaignId = campaignOf(action, campaignByUnit, campaignByDirection);
			if (campaignId != null && read.add(campaignId)) {
				ordered.add(new AdAction.StatusRead(campaignId));
			}
			ordered.add(action);
		}
		return List.copyOf(ordered);
	}

	static String campaignOf(AdAction action, Map<String, String> campaignByUnit, Map<String, String> campaignByDirection) {
		if (action instanceof AdAction.PauseCampaign pauseCampaign) {
			return pauseCampaign.campaignId();
		}
		if (action instanceof AdAction.PauseUnit pauseUnit) {
			return campaignByUnit.get(pauseUnit.unitId());
		}
		if (action instanceof AdAction.UpdateUnitBudget update) {
			return campaignByUnit.get(update.unitId());
		}
		if (action instanceof AdAction.PauseSubComponent pauseSub) {
			return campaignByUnit.get(pauseSub.unitId());
		}
		if (action instanceof AdAction.DuplicateWithAudience duplicate) {
			return campaignByUnit.get(duplicate.sourceUnitId());
		}
		if (action instanceof AdAction.CreateUnitWithAssets create) {
			return campaignByDirection.get(create.directionId());
		}
		return null;
	}
}
