package my.spendpilot.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Indexes into the proposal's action list; empty approves everything.
 */
public record ProposalApprovalRequestDto(
		@JsonProperty("action_indexes") List<Integer> actionIndexes
) {
}
