package my.spendpilot.app.dispatch;

import java.util.Map;

/**
 * Executes a validated batch against the advertising platform. The executor deduplicates by idempotency key.
 */
public interface ActionExecutorClient {
	Map<String, Object> execute(ExecutionRequest request);
}
