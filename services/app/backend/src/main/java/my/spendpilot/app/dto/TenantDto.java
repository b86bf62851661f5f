package my.spendpilot.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import my.spendpilot.app.domain.ScheduleMode;

import java.time.LocalDateTime;

public record TenantDto(
		@JsonProperty("tenant_id") String tenantId,
		@JsonProperty("name") String name,
		@JsonProperty("ad_account_id") String adAccountId,
		@JsonProperty("mode") ScheduleMode mode,
		@JsonProperty("schedule_hour") Integer scheduleHour,
		@JsonProperty("timezone") String timezone,
		@JsonProperty("active") boolean active,
		@JsonProperty("last_run_at") LocalDateTime lastRunAt
) {
}
