package my.spendpilot.app.llm;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chat completions client for any OpenAI-compatible endpoint. The model is asked for a JSON object only.
 */
public class OpenAiReasoningClient implements ReasoningClient {
	private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);
	private static final Duration DEFAULT_READ_TIMEOUT = Duration.ofMinutes(2);
	static final String SYSTEM_PROMPT = """
			You review the daily budget plan of an advertising account.
			The user message is a JSON document with units, their health and risk assessment, directions and the deterministic plan.
			Respond in JSON only, without Markdown fences, as {"note": string, "actions": [{"type": string, "params": object}]}.
			Allowed types: GetCampaignStatus, PauseCampaign, PauseUnit, UpdateUnitBudget, PauseSubComponent,
			DuplicateUnitWithAudience, CreateUnitWithAssets. Budgets are integer minor currency units.
			Return the deterministic plan unchanged when you have no better proposal.
			""";
	private final RestClient restClient;
	private final String model;

	public OpenAiReasoningClient(String baseUrl, String apiKey, String model, Duration connectTimeout, Duration readTimeout) {
		SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
		requestFactory.setConnectTimeout(connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout);
		requestFactory.setReadTimeout(readTimeout == null ? DEFAULT_READ_TIMEOUT : readTimeout);
		this.restClient = RestClient.builder()
				.baseUrl(baseUrl)
				.requestFactory(requestFactory)
				.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
				.defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
				.build();
		this.model = model;
	}

	@Override
	public ReasoningReply proposePlan(String runInputJson) {
		Map<String, Object> request = new LinkedHashMap<>();
		request.put("model", model);
		request.put("messages", List.of(
				Map.of("role", "system", "content", SYSTEM_PROMPT),
				Map.of("role", "user", "content", runInputJson == null ? "{}" : runInputJson)
		));
		request.put("response_format", Map.of("type", "json_object"));
		Map<?, ?> response;
		try {
			response = restClient.post().uri("/chat/completions").body(request).retrieve().body(Map.class);
		} catch (RestClientResponseException ex) {
			throw new ReasoningRequestException(safeMessage(ex), ex.getStatusCode().value(), isRetryable(ex), ex);
		} catch (ResourceAccessException ex) {
			throw new ReasoningRequestException(safeMessage(ex), null, true, ex);
		}
		String content = extractContent(response);
		if (content == null || content.isBlank()) {
			throw new ReasoningRequestException("No message content", null, false, null);
		}
		return new ReasoningReply(content, model);
	}

	private String extractContent(Map<?, ?> response) {
		if (response == null) {
			return null;
		}
		Object choices = response.get("choices");
		if (!(choices instanceof List<?> list) || list.isEmpty()) {
			return null;
		}
		if (!(list.get(0) instanceof Map<?, ?> choice)) {
			return null;
		}
		if (!(choice.get("message") instanceof Map<?, ?> message)) {
			return null;
		}
		Object content = message.get("content");
		return content == null ? null : content.toString();
	}

	private boolean isRetryable(RestClientResponseException ex) {
		int status = ex.getStatusCode().value();
		return status == 408 || status == 429 || status >= 500;
	}

	private String safeMessage(Exception ex) {
		String message = ex.getMessage();
		if (message == null || message.isBlank()) {
			message = ex.getClass().getSimpleName();
		}
		return message;
	}
}
