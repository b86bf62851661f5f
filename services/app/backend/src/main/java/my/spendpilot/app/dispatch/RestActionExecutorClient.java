package my.spendpilot.app.dispatch;

import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;
import java.util.Map;

public class RestActionExecutorClient implements ActionExecutorClient {
	private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
	private static final Duration DEFAULT_READ_TIMEOUT = Duration.ofMinutes(2);
	private static final ParameterizedTypeReference<Map<String, Object>> RESPONSE_TYPE = new ParameterizedTypeReference<>() {
	};
	private final RestClient restClient;

	public RestActionExecutorClient(String baseUrl, String apiKey, Duration connectTimeout, Duration readTimeout) {
		SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
		requestFactory.setConnectTimeout(connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout);
		requestFactory.setReadTimeout(readTimeout == null ? DEFAULT_READ_TIMEOUT : readTimeout);
		RestClient.Builder builder = RestClient.builder()
				.baseUrl(baseUrl)
				.requestFactory(requestFactory)
				.defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
		if (apiKey != null && !apiKey.isBlank()) {
			builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
		}
		this.restClient = builder.build();
	}

	@Override
	public Map<String, Object> execute(ExecutionRequest request) {
		Map<String, Object> response;
		try {
			response = restClient.post()
					.uri("/api/actions")
					.header("Idempotency-Key", request.idempotencyKey())
					.body(request)
					.retrieve()
					.body(RESPONSE_TYPE);
		} catch (RestClientResponseException ex) {
			throw new DispatchException(safeMessage(ex), ex.getStatusCode().value(), ex);
		} catch (ResourceAccessException ex) {
			throw new DispatchException(safeMessage(ex), null, ex);
		}
		return response == null ? Map.of() : response;
	}

	private String safeMessage(Exception ex) {
		String message = ex.getMessage();
		if (message == null || message.isBlank()) {
			message = ex.getClass().getSimpleName();
		}
		return message;
	}
}
