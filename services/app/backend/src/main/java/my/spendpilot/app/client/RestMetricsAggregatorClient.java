package my.spendpilot.app.client;

import my.spendpilot.app.model.TenantSnapshot;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;

public class RestMetricsAggregatorClient implements MetricsAggregatorClient {
	private final RestClient restClient;

	public RestMetricsAggregatorClient(String baseUrl, String apiKey, Duration connectTimeout, Duration readTimeout) {
		this.restClient = CollaboratorRestClients.build(baseUrl, apiKey, connectTimeout, readTimeout);
	}

	@Override
	public TenantSnapshot fetchSnapshot(String tenantId) {
		TenantSnapshot snapshot;
		try {
			snapshot = restClient.get()
					.uri("/api/metrics/tenants/{tenantId}/snapshot", tenantId)
					.retrieve()
					.body(TenantSnapshot.class);
		} catch (RestClientResponseException ex) {
			throw new CollaboratorException("Metrics aggregator failed: " + CollaboratorRestClients.safeMessage(ex),
					ex.getStatusCode().value(), ex);
		} catch (ResourceAccessException ex) {
			throw new CollaboratorException("Metrics aggregator unreachable: " + CollaboratorRestClients.safeMessage(ex),
					null, ex);
		}
		if (snapshot == null) {
			return new TenantSnapshot(tenantId, null, null, null, null, null);
		}
		return snapshot;
	}
}
