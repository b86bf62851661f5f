package my.spendpilot.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RunJobResponseDto(
		@JsonProperty("job_id") String jobId,
		@JsonProperty("status") RunJobStatus status,
		@JsonProperty("result") RunOutcomeDto result,
		@JsonProperty("error") String error
) {
}
