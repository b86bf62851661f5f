package my.spendpilot.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import my.spendpilot.app.domain.BatchRunStatus;

import java.time.LocalDateTime;

public record BatchRunDto(
		@JsonProperty("id") Long id,
		@JsonProperty("instance_id") String instanceId,
		@JsonProperty("tick_hour_utc") Integer tickHourUtc,
		@JsonProperty("status") BatchRunStatus status,
		@JsonProperty("tenants_selected") Integer tenantsSelected,
		@JsonProperty("tenants_succeeded") Integer tenantsSucceeded,
		@JsonProperty("tenants_failed") Integer tenantsFailed,
		@JsonProperty("started_at") LocalDateTime startedAt,
		@JsonProperty("finished_at") LocalDateTime finishedAt,
		@JsonProperty("duration_ms") Long durationMs
) {
}
