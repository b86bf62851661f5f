package my.spendpilot.app.action;

import java.util.Arrays;
import java.util.Optional;

public enum ActionType {
	STATUS_READ("GetCampaignStatus", false),
	PAUSE_CAMPAIGN("PauseCampaign", true),
	PAUSE_UNIT("PauseUnit", true),
	UPDATE_UNIT_BUDGET("UpdateUnitBudget", true),
	PAUSE_SUB_COMPONENT("PauseSubComponent", true),
	DUPLICATE_WITH_AUDIENCE("DuplicateUnitWithAudience", true),
	CREATE_UNIT_WITH_ASSETS("CreateUnitWithAssets", true);

	private final String wireName;
	private final boolean mutating;

	ActionType(String wireName, boolean mutating) {
		this.wireName = wireName;
		this.mutating = mutating;
	}

	public String wireName() {
		return wireName;
	}

	public boolean isMutating() {
		return mutating;
	}

	public static Optional<ActionType> fromWireName(String value) {
		if (value == null || value.isBlank()) {
			return Optional.empty();
		}
		String trimmed = value.trim();
		return Arrays.stream(values())
				.filter(type -> type.wireName.equals(trimmed))
				.findFirst();
	}
}
