package my.spendpilot.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import my.spendpilot.app.domain.ScheduleMode;

public record TenantRequestDto(
		@NotBlank @JsonProperty("tenant_id") String tenantId,
		@JsonProperty("name") String name,
		@JsonProperty("ad_account_id") String adAccountId,
		@JsonProperty("mode") ScheduleMode mode,
		@Min(0) @Max(23) @JsonProperty("schedule_hour") Integer scheduleHour,
		@JsonProperty("timezone") String timezone
) {
}
