package my.spendpilot.app.config;

import my.spendpilot.app.client.MetricsAggregatorClient;
import my.spendpilot.app.client.RestMetricsAggregatorClient;
import my.spendpilot.app.client.RestRiskSignalClient;
import my.spendpilot.app.client.RiskSignalClient;
import my.spendpilot.app.dispatch.ActionExecutorClient;
import my.spendpilot.app.dispatch.BackoffSleeper;
import my.spendpilot.app.dispatch.RestActionExecutorClient;
import my.spendpilot.app.dispatch.RetryPolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * HTTP clients for the metrics aggregator, the risk analytics service and the action executor.
 */
@Configuration
public class CollaboratorConfig {
	@Bean
	public MetricsAggregatorClient metricsAggregatorClient(AppProperties properties) {
		AppProperties.Collaborators collaborators = properties.collaborators();
		return new RestMetricsAggregatorClient(
				collaborators.metricsBaseUrl(),
				collaborators.apiKey(),
				seconds(collaborators.connectTimeoutSeconds()),
				seconds(collaborators.readTimeoutSeconds())
		);
	}

	@Bean
	public RiskSignalClient riskSignalClient(AppProperties properties) {
		AppProperties.Collaborators collaborators = properties.collaborators();
		return new RestRiskSignalClient(
				collaborators.riskBaseUrl(),
				collaborators.apiKey(),
				seconds(collaborators.connectTimeoutSeconds()),
				seconds(collaborators.readTimeoutSeconds())
		);
	}

	@Bean
	public ActionExecutorClient actionExecutorClient(AppProperties properties) {
		AppProperties.Dispatch dispatch = properties.dispatch();
		if (dispatch == null || dispatch.baseUrl() == null || dispatch.baseUrl().isBlank()) {
			throw new IllegalStateException("app.dispatch.base-url is required");
		}
		return new RestActionExecutorClient(
				dispatch.baseUrl(),
				dispatch.apiKey(),
				seconds(dispatch.connectTimeoutSeconds()),
				seconds(dispatch.readTimeoutSeconds())
		);
	}

	@Bean
	public RetryPolicy dispatchRetryPolicy(AppProperties properties) {
		AppProperties.Dispatch dispatch = properties.dispatch();
		RetryPolicy defaults = RetryPolicy.defaults();
		if (dispatch == null) {
			return defaults;
		}
		return new RetryPolicy(
				dispatch.maxAttempts() == null ? defaults.maxAttempts() : dispatch.maxAttempts(),
				dispatch.initialBackoffMillis() == null
						? defaults.initialBackoff()
						: Duration.ofMillis(dispatch.initialBackoffMillis()),
				dispatch.backoffMultiplier() == null ? defaults.multiplier() : dispatch.backoffMultiplier(),
				dispatch.maxBackoffMillis() == null
						? defaults.maxBackoff()
						: Duration.ofMillis(dispatch.maxBackoffMillis()),
				RetryPolicy.DEFAULT_RETRYABLE_STATUSES
		);
	}

	@Bean
	public BackoffSleeper backoffSleeper() {
		return BackoffSleeper.THREAD;
	}

	private static Duration seconds(Integer value) {
		return value == null ? null : Duration.ofSeconds(value);
	}
}
