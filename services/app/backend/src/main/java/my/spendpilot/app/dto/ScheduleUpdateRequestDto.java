package my.spendpilot.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import my.spendpilot.app.domain.ScheduleMode;

public record ScheduleUpdateRequestDto(
		@JsonProperty("mode") ScheduleMode mode,
		@Min(0) @Max(23) @JsonProperty("schedule_hour") Integer scheduleHour,
		@JsonProperty("timezone") String timezone
) {
}
