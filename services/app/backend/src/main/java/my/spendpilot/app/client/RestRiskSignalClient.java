package my.spendpilot.app.client;

import my.spendpilot.app.model.RiskSignal;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;
import java.util.List;

public class RestRiskSignalClient implements RiskSignalClient {
	private final RestClient restClient;

	public RestRiskSignalClient(String baseUrl, String apiKey, Duration connectTimeout, Duration readTimeout) {
		this.restClient = CollaboratorRestClients.build(baseUrl, apiKey, connectTimeout, readTimeout);
	}

	@Override
	public List<RiskSignal> fetchSignals(String tenantId) {
		SignalsResponse response;
		try {
			response = restClient.get()
					.uri("/api/risk/tenants/{tenantId}/signals", tenantId)
					.retrieve()
					.body(SignalsResponse.class);
		} catch (RestClientResponseException ex) {
			throw new CollaboratorException("Risk service failed: " + CollaboratorRestClients.safeMessage(ex),
					ex.getStatusCode().value(), ex);
		} catch (ResourceAccessException ex) {
			throw new CollaboratorException("Risk service unreachable: " + CollaboratorRestClients.safeMessage(ex),
					null, ex);
		}
		if (response == null || response.signals() == null) {
			return List.of();
		}
		return response.signals();
	}

	record SignalsResponse(List<RiskSignal> signals) {
	}
}
