package my.spendpilot.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import my.spendpilot.app.domain.ExecutionStatus;
import my.spendpilot.app.domain.PlanSource;
import my.spendpilot.app.domain.RunTrigger;
import my.spendpilot.app.domain.ScheduleMode;

import java.time.LocalDateTime;

public record ExecutionDto(
		@JsonProperty("id") Long id,
		@JsonProperty("tenant_id") String tenantId,
		@JsonProperty("idempotency_key") String idempotencyKey,
		@JsonProperty("trigger") RunTrigger trigger,
		@JsonProperty("mode") ScheduleMode mode,
		@JsonProperty("plan_source") PlanSource planSource,
		@JsonProperty("status") ExecutionStatus status,
		@JsonProperty("actions_count") Integer actionsCount,
		@JsonProperty("dispatch_attempts") Integer dispatchAttempts,
		@JsonProperty("error") String error,
		@JsonProperty("error_reference") String errorReference,
		@JsonProperty("started_at") LocalDateTime startedAt,
		@JsonProperty("finished_at") LocalDateTime finishedAt,
		@JsonProperty("duration_ms") Long durationMs
) {
}
