package my.spendpilot.app.llm;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReasoningPlanParserTest {
	private final ReasoningPlanParser parser = new ReasoningPlanParser();

	@Test
	void parsesPlanWithNote() {
		ReasoningPlan plan = parser.parse("""
				{"note": "shift budget to u2", "actions": [
				  {"type": "GetCampaignStatus", "params": {"campaign_id": "c1"}},
				  {"type": "UpdateUnitBudget", "params": {"unit_id": "u2", "daily_budget_cents": 2400}}
				]}
				""");

		assertThat(plan.note()).isEqualTo("shift budget to u2");
		assertThat(plan.actions()).hasSize(2);
		assertThat(plan.actions().get(1).type()).isEqualTo("UpdateUnitBudget");
		assertThat(plan.actions().get(1).params()).containsEntry("daily_budget_cents", 2400);
	}

	@Test
	void stripsMarkdownFences() {
		ReasoningPlan plan = parser.parse("""
				```json
				{"actions": []}
				```
				""");

		assertThat(plan.note()).isNull();
		assertThat(plan.actions()).isEmpty();
	}

	@Test
	void rejectsOutputWithoutActions() {
		assertThatThrownBy(() -> parser.parse("{\"note\": \"nothing\"}"))
				.isInstanceOf(ReasoningOutputException.class)
				.hasMessageContaining("schema");
	}

	@Test
	void rejectsActionWithoutParamsObject() {
		assertThatThrownBy(() -> parser.parse("{\"actions\": [{\"type\": \"PauseUnit\", \"params\": \"u1\"}]}"))
				.isInstanceOf(ReasoningOutputException.class);
	}

	@Test
	void rejectsInvalidJson() {
		assertThatThrownBy(() -> parser.parse("I would pause unit u1"))
				.isInstanceOf(ReasoningOutputException.class)
				.hasMessageContaining("not valid JSON");
	}

	@Test
	void rejectsBlankOutput() {
		assertThatThrownBy(() -> parser.parse("  "))
				.isInstanceOf(ReasoningOutputException.class);
	}
}
