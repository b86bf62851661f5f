package my.spendpilot.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import my.spendpilot.app.action.ActionEnvelope;
import my.spendpilot.app.domain.ProposalStatus;

import java.time.LocalDateTime;
import java.util.List;

public record ProposalDto(
		@JsonProperty("id") Long id,
		@JsonProperty("tenant_id") String tenantId,
		@JsonProperty("execution_id") Long executionId,
		@JsonProperty("idempotency_key") String idempotencyKey,
		@JsonProperty("status") ProposalStatus status,
		@JsonProperty("actions") List<ActionEnvelope> actions,
		@JsonProperty("created_at") LocalDateTime createdAt,
		@JsonProperty("expires_at") LocalDateTime expiresAt,
		@JsonProperty("decided_at") LocalDateTime decidedAt,
		@JsonProperty("decided_by") String decidedBy,
		@JsonProperty("approved_execution_id") Long approvedExecutionId
) {
}
