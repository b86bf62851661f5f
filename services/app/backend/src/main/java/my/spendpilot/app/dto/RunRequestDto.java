package my.spendpilot.app.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record RunRequestDto(
		@NotBlank @JsonProperty("tenant_id") String tenantId,
		@JsonProperty("idempotency_key") String idempotencyKey,
		@JsonProperty("dispatch") Boolean dispatch
) {
}
