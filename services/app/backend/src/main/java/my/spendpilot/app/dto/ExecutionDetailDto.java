package my.spendpilot.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import tools.jackson.databind.JsonNode;

public record ExecutionDetailDto(
		@JsonProperty("execution") ExecutionDto execution,
		@JsonProperty("plan") JsonNode plan,
		@JsonProperty("actions") JsonNode actions,
		@JsonProperty("dispatch_result") JsonNode dispatchResult
) {
}
