package my.spendpilot.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import my.spendpilot.app.domain.ExecutionStatus;
import my.spendpilot.app.domain.PlanSource;

public record RunOutcomeDto(
		@JsonProperty("execution_id") Long executionId,
		@JsonProperty("tenant_id") String tenantId,
		@JsonProperty("idempotency_key") String idempotencyKey,
		@JsonProperty("status") ExecutionStatus status,
		@JsonProperty("plan_source") PlanSource planSource,
		@JsonProperty("actions_count") int actionsCount,
		@JsonProperty("proposal_id") Long proposalId,
		@JsonProperty("error") String error,
		@JsonProperty("replayed") boolean replayed
) {
}
