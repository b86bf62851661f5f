package my.spendpilot.app.config;

import my.spendpilot.app.llm.NoopReasoningClient;
import my.spendpilot.app.llm.OpenAiReasoningClient;
import my.spendpilot.app.llm.ReasoningClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class ReasoningConfig {
	private static final Logger logger = LoggerFactory.getLogger(ReasoningConfig.class);

	@Bean
	@ConditionalOnProperty(name = "app.reasoning.provider", havingValue = "openai")
	public OpenAiReasoningClient openAiReasoningClient(AppProperties properties) {
		AppProperties.Reasoning.OpenAi openai = properties.reasoning() == null ? null : properties.reasoning().openai();
		if (openai == null || openai.apiKey() == null || openai.apiKey().isBlank()) {
			throw new IllegalStateException("app.reasoning.openai.api-key is required for provider=openai");
		}
		String baseUrl = openai.baseUrl() == null || openai.baseUrl().isBlank()
				? "https://api.openai.com/v1"
				: openai.baseUrl();
		String model = openai.model() == null || openai.model().isBlank() ? "gpt-5-mini" : openai.model();
		int connectTimeout = openai.connectTimeoutSeconds() == null ? 30 : openai.connectTimeoutSeconds();
		int readTimeout = openai.readTimeoutSeconds() == null ? 120 : openai.readTimeoutSeconds();
		logger.info("Reasoning override enabled (provider=openai, model={}).", model);
		return new OpenAiReasoningClient(baseUrl, openai.apiKey(), model,
				Duration.ofSeconds(connectTimeout),
				Duration.ofSeconds(readTimeout));
	}

	@Bean
	@ConditionalOnMissingBean(ReasoningClient.class)
	public NoopReasoningClient noopReasoningClient() {
		logger.info("Reasoning override disabled (provider=noop).");
		return new NoopReasoningClient();
	}
}
