package my.spendpilot.app.action;

import my.spendpilot.app.model.RebalanceSettings;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Closed set of actions the optimizer may ask the executor to perform.
 * Every variant normalizes itself against the budget limits and rejects missing parameters.
 */
public sealed interface AdAction {
	ActionType type();

	Map<String, Object> params();

	AdAction normalize(RebalanceSettings limits);

	default ActionEnvelope toEnvelope() {
		return new ActionEnvelope(type().wireName(), params());
	}

	record StatusRead(String campaignId) implements AdAction {
		@Override
		public ActionType type() {
			return ActionType.STATUS_READ;
		}

		@Override
		public Map<String, Object> params() {
			return Collections.singletonMap("campaign_id", campaignId);
		}

		@Override
		public AdAction normalize(RebalanceSettings limits) {
			return new StatusRead(require(type(), "campaign_id", campaignId));
		}
	}

	record PauseCampaign(String campaignId) implements AdAction {
		@Override
		public ActionType type() {
			return ActionType.PAUSE_CAMPAIGN;
		}

		@Override
		public Map<String, Object> params() {
			return Collections.singletonMap("campaign_id", campaignId);
		}

		@Override
		public AdAction normalize(RebalanceSettings limits) {
			return new PauseCampaign(require(type(), "campaign_id", campaignId));
		}
	}

	record PauseUnit(String unitId) implements AdAction {
		@Override
		public ActionType type() {
			return ActionType.PAUSE_UNIT;
		}

		@Override
		public Map<String, Object> params() {
			return Collections.singletonMap("unit_id", unitId);
		}

		@Override
		public AdAction normalize(RebalanceSettings limits) {
			return new PauseUnit(require(type(), "unit_id", unitId));
		}
	}

	record UpdateUnitBudget(String unitId, Long dailyBudgetCents) implements AdAction {
		@Override
		public ActionType type() {
			return ActionType.UPDATE_UNIT_BUDGET;
		}

		@Override
		public Map<String, Object> params() {
			Map<String, Object> params = new LinkedHashMap<>();
			params.put("unit_id", unitId);
			params.put("daily_budget_cents", dailyBudgetCents);
			return params;
		}

		@Override
		public AdAction normalize(RebalanceSettings limits) {
			String id = require(type(), "unit_id", unitId);
			if (dailyBudgetCents == null) {
				throw new ActionValidationException(type().wireName(), "daily_budget_cents is required");
			}
			return new UpdateUnitBudget(id, limits.clamp(dailyBudgetCents));
		}
	}

	record PauseSubComponent(String unitId, String subComponentId) implements AdAction {
		@Override
		public ActionType type() {
			return ActionType.PAUSE_SUB_COMPONENT;
		}

		@Override
		public Map<String, Object> params() {
			Map<String, Object> params = new LinkedHashMap<>();
			params.put("unit_id", unitId);
			params.put("sub_component_id", subComponentId);
			return params;
		}

		@Override
		public AdAction normalize(RebalanceSettings limits) {
			return new PauseSubComponent(
					require(type(), "unit_id", unitId),
					require(type(), "sub_component_id", subComponentId)
			);
		}
	}

	record DuplicateWithAudience(String sourceUnitId, String audienceId, Long dailyBudgetCents, String nameSuffix)
			implements AdAction {
		@Override
		public ActionType type() {
			return ActionType.DUPLICATE_WITH_AUDIENCE;
		}

		@Override
		public Map<String, Object> params() {
			Map<String, Object> params = new LinkedHashMap<>();
			params.put("source_unit_id", sourceUnitId);
			params.put("audience_id", audienceId);
			if (dailyBudgetCents != null) {
				params.put("daily_budget_cents", dailyBudgetCents);
			}
			if (nameSuffix != null) {
				params.put("name_suffix", nameSuffix);
			}
			return params;
		}

		@Override
		public AdAction normalize(RebalanceSettings limits) {
			return new DuplicateWithAudience(
					require(type(), "source_unit_id", sourceUnitId),
					require(type(), "audience_id", audienceId),
					dailyBudgetCents == null ? null : limits.clamp(dailyBudgetCents),
					nameSuffix
			);
		}
	}

	record CreateUnitWithAssets(String directionId, List<String> assetIds, Long dailyBudgetCents, String unitName,
								boolean autoActivate) implements AdAction {
		public CreateUnitWithAssets {
			assetIds = assetIds == null ? List.of() : List.copyOf(assetIds);
		}

		@Override
		public ActionType type() {
			return ActionType.CREATE_UNIT_WITH_ASSETS;
		}

		@Override
		public Map<String, Object> params() {
			Map<String, Object> params = new LinkedHashMap<>();
			params.put("direction_id", directionId);
			params.put("asset_ids", assetIds);
			if (dailyBudgetCents != null) {
				params.put("daily_budget_cents", dailyBudgetCents);
			}
			if (unitName != null) {
				params.put("unit_name", unitName);
			}
			params.put("auto_activate", autoActivate);
			return params;
		}

		@Override
		public AdAction normalize(RebalanceSettings limits) {
			String direction = require(type(), "direction_id", directionId);
			if (assetIds.isEmpty() || assetIds.stream().anyMatch(id -> id == null || id.isBlank())) {
				throw new ActionValidationException(type().wireName(), "asset_ids must be a non-empty list of ids");
			}
			return new CreateUnitWithAssets(
					direction,
					assetIds,
					dailyBudgetCents == null ? null : limits.clamp(dailyBudgetCents),
					unitName,
					autoActivate
			);
		}
	}

	private static String require(ActionType type, String name, String value) {
		if (value == null || value.isBlank()) {
			throw new ActionValidationException(type.wireName(), name + " is required");
		}
		return value.trim();
	}
}
