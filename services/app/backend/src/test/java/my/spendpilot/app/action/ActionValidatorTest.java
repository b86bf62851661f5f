package my.spendpilot.app.action;

import my.spendpilot.app.model.RebalanceSettings;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActionValidatorTest {
	private final ActionValidator validator = new ActionValidator();
	private final RebalanceSettings limits = RebalanceSettings.defaults();

	@Test
	void dropsUnknownTypesAndKeepsOrder() {
		List<AdAction> result = validator.validateEnvelopes(List.of(
				new ActionEnvelope("GetCampaignStatus", Map.of("campaign_id", "c1")),
				new ActionEnvelope("DeleteEverything", Map.of("campaign_id", "c1")),
				new ActionEnvelope("PauseUnit", Map.of("unit_id", " u1 "))
		), limits);

		assertThat(result).containsExactly(
				new AdAction.StatusRead("c1"),
				new AdAction.PauseUnit("u1")
		);
	}

	@Test
	void clampsAndRoundsBudgets() {
		List<AdAction> result = validator.validateEnvelopes(List.of(
				new ActionEnvelope("UpdateUnitBudget", Map.of("unit_id", "u1", "daily_budget_cents", 12.5)),
				new ActionEnvelope("UpdateUnitBudget", Map.of("unit_id", "u2", "daily_budget_cents", 2_500.5)),
				new ActionEnvelope("UpdateUnitBudget", Map.of("unit_id", "u3", "daily_budget_cents", "999999"))
		), limits);

		assertThat(result).containsExactly(
				new AdAction.UpdateUnitBudget("u1", 300L),
				new AdAction.UpdateUnitBudget("u2", 2_501L),
				new AdAction.UpdateUnitBudget("u3", 10_000L)
		);
	}

	@Test
	void missingRequiredParameterFailsWholeBatch() {
		assertThatThrownBy(() -> validator.validateEnvelopes(List.of(
				new ActionEnvelope("PauseUnit", Map.of("unit_id", "u1")),
				new ActionEnvelope("UpdateUnitBudget", Map.of("unit_id", "u2"))
		), limits))
				.isInstanceOf(ActionValidationException.class)
				.hasMessageContaining("daily_budget_cents is required")
				.extracting(ex -> ((ActionValidationException) ex).getActionType())
				.isEqualTo("UpdateUnitBudget");
	}

	@Test
	void rejectsNonNumericBudget() {
		assertThatThrownBy(() -> validator.validateEnvelopes(List.of(
				new ActionEnvelope("UpdateUnitBudget", Map.of("unit_id", "u2", "daily_budget_cents", "lots"))
		), limits))
				.isInstanceOf(ActionValidationException.class)
				.hasMessageContaining("must be numeric");
	}

	@Test
	void parsesCreateUnitWithAssets() {
		Map<String, Object> params = new LinkedHashMap<>();
		params.put("direction_id", "d1");
		params.put("asset_ids", List.of("a1", "a2"));
		params.put("daily_budget_cents", 1500);
		params.put("unit_name", "Reanimation");
		params.put("auto_activate", "true");

		List<AdAction> result = validator.validateEnvelopes(List.of(new ActionEnvelope("CreateUnitWithAssets", params)), limits);

		assertThat(result).containsExactly(
				new AdAction.CreateUnitWithAssets("d1", List.of("a1", "a2"), 1_500L, "Reanimation", true));
	}

	@Test
	void rejectsCreateWithoutAssets() {
		assertThatThrownBy(() -> validator.validateEnvelopes(List.of(
				new ActionEnvelope("CreateUnitWithAssets", Map.of("direction_id", "d1", "asset_ids", List.of()))
		), limits))
				.isInstanceOf(ActionValidationException.class)
				.hasMessageContaining("asset_ids");
	}

	@Test
	void rejectsAssetIdsThatAreNotAList() {
		assertThatThrownBy(() -> validator.validateEnvelopes(List.of(
				new ActionEnvelope("CreateUnitWithAssets", Map.of("direction_id", "d1", "asset_ids", "a1"))
		), limits))
				.isInstanceOf(ActionValidationException.class)
				.hasMessageContaining("must be a list");
	}

	@Test
	void normalizeClampsTypedActions() {
		List<AdAction> result = validator.normalize(List.of(
				new AdAction.DuplicateWithAudience("u1", "lal", 50L, null),
				new AdAction.DuplicateWithAudience("u1", "lal", null, "LAL")
		), limits);

		assertThat(result).containsExactly(
				new AdAction.DuplicateWithAudience("u1", "lal", 300L, null),
				new AdAction.DuplicateWithAudience("u1", "lal", null, "LAL")
		);
	}

	@Test
	void emptyInputYieldsEmptyBatch() {
		assertThat(validator.validateEnvelopes(null, limits)).isEmpty();
		assertThat(validator.normalize(List.of(), limits)).isEmpty();
	}

	@Test
	void envelopeUsesWireNames() {
		ActionEnvelope envelope = new AdAction.UpdateUnitBudget("u1", 500L).toEnvelope();

		assertThat(envelope.type()).isEqualTo("UpdateUnitBudget");
		assertThat(envelope.params()).containsEntry("unit_id", "u1").containsEntry("daily_budget_cents", 500L);
	}
}
