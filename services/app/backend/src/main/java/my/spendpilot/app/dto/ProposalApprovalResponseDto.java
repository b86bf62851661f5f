package my.spendpilot.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ProposalApprovalResponseDto(
		@JsonProperty("proposal") ProposalDto proposal,
		@JsonProperty("execution") ExecutionDto execution
) {
}
