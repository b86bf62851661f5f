package my.spendpilot.app.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		Security security,
		Jwt jwt,
		Engine engine,
		Scheduler scheduler,
		Dispatch dispatch,
		Reasoning reasoning,
		Collaborators collaborators,
		Proposals proposals
) {
	public record Security(
			@NotBlank String adminUser,
			@NotBlank String adminPass
	) {
	}

	public record Jwt(
			String secret,
			@NotBlank String issuer
	) {
	}

	/**
	 * Overrides for the engine thresholds. Anything left empty keeps the built-in default.
	 */
	public record Engine(
			Integer costGapWeight,
			Integer trendWeight,
			Integer ctrPenalty,
			Integer cpmPenalty,
			Integer frequencyPenalty,
			Double ctrFloorPct,
			Double frequencyCeiling,
			Long minBudgetCents,
			Long maxBudgetCents,
			Double maxStepUp,
			Double maxStepDown,
			Long newUnitMinCents,
			Long newUnitMaxCents,
			Integer maxActions
	) {
	}

	public record Scheduler(
			Boolean enabled,
			String instanceId,
			String defaultTimezone,
			Integer concurrency,
			Long chunkPauseMillis,
			Integer lockTtlMinutes,
			Integer dedupWindowMinutes,
			Integer tenantTimeoutSeconds
	) {
	}

	public record Dispatch(
			String baseUrl,
			String apiKey,
			Integer maxAttempts,
			Long initialBackoffMillis,
			Double backoffMultiplier,
			Long maxBackoffMillis,
			Integer connectTimeoutSeconds,
			Integer readTimeoutSeconds
	) {
	}

	public record Reasoning(
			String provider,
			OpenAi openai
	) {
		public record OpenAi(
				String apiKey,
				String baseUrl,
				String model,
				Integer connectTimeoutSeconds,
				Integer readTimeoutSeconds
		) {
		}
	}

	public record Collaborators(
			String metricsBaseUrl,
			String riskBaseUrl,
			String apiKey,
			Integer connectTimeoutSeconds,
			Integer readTimeoutSeconds
	) {
	}

	public record Proposals(
			Integer ttlHours
	) {
	}
}
