package my.spendpilot.app.action;

import my.spendpilot.app.model.RebalanceSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns candidate actions into a validated batch. Unknown types are dropped, a missing
 * parameter fails the whole batch, budgets are clamped and rounded to integer minor units.
 */
@Component
public class ActionValidator {
	private static final Logger logger = LoggerFactory.getLogger(ActionValidator.class);

	public List<AdAction> validateEnvelopes(List<ActionEnvelope> candidates, RebalanceSettings limits) {
		if (candidates == null || candidates.isEmpty()) {
			return List.of();
		}
		List<AdAction> parsed = new ArrayList<>();
		for (ActionEnvelope candidate : candidates) {
			if (candidate == null) {
				continue;
			}
			Optional<ActionType> type = ActionType.fromWireName(candidate.type());
			if (type.isEmpty()) {
				logger.debug("Dropping action with unsupported type {}", candidate.type());
				continue;
			}
			parsed.add(parse(type.get(), candidate.params()));
		}
		return normalize(parsed, limits);
	}

	public List<AdAction> normalize(List<AdAction> actions, RebalanceSettings limits) {
		if (actions == null || actions.isEmpty()) {
			return List.of();
		}
		RebalanceSettings effective = limits == null ? RebalanceSettings.defaults() : limits;
		List<AdAction> validated = new ArrayList<>(actions.size());
		for (AdAction action : actions) {
			if (action == null) {
				continue;
			}
			validated.add(action.normalize(effective));
		}
		return List.copyOf(validated);
	}

	private AdAction parse(ActionType type, Map<String, Object> params) {
		return switch (type) {
			case STATUS_READ -> new AdAction.StatusRead(text(params, "campaign_id"));
			case PAUSE_CAMPAIGN -> new AdAction.PauseCampaign(text(params, "campaign_id"));
			case PAUSE_UNIT -> new AdAction.PauseUnit(text(params, "unit_id"));
			case UPDATE_UNIT_BUDGET -> new AdAction.UpdateUnitBudget(
					text(params, "unit_id"),
					budget(type, params, "daily_budget_cents"));
			case PAUSE_SUB_COMPONENT -> new AdAction.PauseSubComponent(
					text(params, "unit_id"),
					text(params, "sub_component_id"));
			case DUPLICATE_WITH_AUDIENCE -> new AdAction.DuplicateWithAudience(
					text(params, "source_unit_id"),
					text(params, "audience_id"),
					budget(type, params, "daily_budget_cents"),
					text(params, "name_suffix"));
			case CREATE_UNIT_WITH_ASSETS -> new AdAction.CreateUnitWithAssets(
					text(params, "direction_id"),
					textList(type, params, "asset_ids"),
					budget(type, params, "daily_budget_cents"),
					text(params, "unit_name"),
					flag(params, "auto_activate"));
		};
	}

	private String text(Map<String, Object> params, String key) {
		Object value = params.get(key);
		if (value == null) {
			return null;
		}
		String text = value.toString();
		return text.isBlank() ? null : text.trim();
	}

	private List<String> textList(ActionType type, Map<String, Object> params, String key) {
		Object value = params.get(key);
		if (value == null) {
			return List.of();
		}
		if (!(value instanceof List<?> list)) {
			throw new ActionValidationException(type.wireName(), key + " must be a list");
		}
		List<String> values = new ArrayList<>(list.size());
		for (Object item : list) {
			values.add(item == null ? null : item.toString());
		}
		return values;
	}

	private Long budget(ActionType type, Map<String, Object> params, String key) {
		Object value = params.get(key);
		if (value == null) {
			return null;
		}
		try {
			BigDecimal amount = value instanceof Number number
					? new BigDecimal(number.toString())
					: new BigDecimal(value.toString().trim());
			return amount.setScale(0, RoundingMode.HALF_UP).longValueExact();
		} catch (NumberFormatException | ArithmeticException ex) {
			throw new ActionValidationException(type.wireName(), key + " must be numeric but was " + value);
		}
	}

	private boolean flag(Map<String, Object> params, String key) {
		Object value = params.get(key);
		if (value instanceof Boolean bool) {
			return bool;
		}
		return value != null && Boolean.parseBoolean(value.toString());
	}
}
