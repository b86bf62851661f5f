package my.spendpilot.app.dispatch;

import my.spendpilot.app.action.ActionEnvelope;

import java.util.List;

public record ExecutionRequest(
		String idempotencyKey,
		String source,
		Account account,
		List<ActionEnvelope> actions
) {
	public record Account(String tenantId, String adAccountId) {
	}
}
