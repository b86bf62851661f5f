package my.spendpilot.app.client;

import com.sun.net.httpserver.HttpServer;
import my.spendpilot.app.model.Ranking;
import my.spendpilot.app.model.RiskSignal;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RestRiskSignalClientTest {
	private HttpServer server;

	@AfterEach
	void tearDown() {
		if (server != null) {
			server.stop(0);
		}
	}

	@Test
	void readsSignalsForTenant() throws IOException {
		server = HttpServer.create(new InetSocketAddress(0), 0);
		server.createContext("/api/risk/tenants/acme/signals", exchange -> RestMetricsAggregatorClientTest.respond(exchange, 200, """
				{"signals": [
				  {"unitId": "u1", "riskScore": 72, "valid": true, "invalidReason": null,
				   "day1": {"cpmChangePct": 12.0, "ctrChangePct": -8.0},
				   "day3": {"cpmChangePct": 20.0, "ctrChangePct": -15.0},
				   "day7": {"cpmChangePct": 35.0, "ctrChangePct": -22.0},
				   "qualityRanking": "BELOW_AVERAGE_10", "engagementRanking": "AVERAGE",
				   "conversionRanking": "ABOVE_AVERAGE", "frequency7d": 2.4, "predictedCostChangePct": 18.5}
				]}
				"""));
		server.start();

		List<RiskSignal> signals = client().fetchSignals("acme");

		assertThat(signals).singleElement().satisfies(signal -> {
			assertThat(signal.riskScore()).isEqualTo(72);
			assertThat(signal.valid()).isTrue();
			assertThat(signal.day7().cpmChangePct()).isEqualTo(35.0);
			assertThat(signal.qualityRanking()).isEqualTo(Ranking.BELOW_AVERAGE_10);
			assertThat(signal.predictedCostChangePct()).isEqualTo(18.5);
		});
	}

	@Test
	void emptyBodyMeansNoSignals() throws IOException {
		server = HttpServer.create(new InetSocketAddress(0), 0);
		server.createContext("/api/risk", exchange -> RestMetricsAggregatorClientTest.respond(exchange, 200, "{\"signals\": null}"));
		server.start();

		assertThat(client().fetchSignals("acme")).isEmpty();
	}

	@Test
	void mapsErrorStatusToCollaboratorException() throws IOException {
		server = HttpServer.create(new InetSocketAddress(0), 0);
		server.createContext("/api/risk", exchange -> RestMetricsAggregatorClientTest.respond(exchange, 500, "{}"));
		server.start();

		assertThatThrownBy(() -> client().fetchSignals("acme"))
				.isInstanceOf(CollaboratorException.class)
				.extracting(ex -> ((CollaboratorException) ex).getStatusCode())
				.isEqualTo(500);
	}

	private RiskSignalClient client() {
		return new RestRiskSignalClient("http://localhost:" + server.getAddress().getPort(), null,
				Duration.ofSeconds(2), Duration.ofSeconds(5));
	}
}
