package my.spendpilot.app.llm;

import my.spendpilot.app.action.ActionEnvelope;

import java.util.List;

public record ReasoningPlan(String note, List<ActionEnvelope> actions) {
	public ReasoningPlan {
		actions = actions == null ? List.of() : List.copyOf(actions);
	}
}
