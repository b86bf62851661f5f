package my.spendpilot.app.llm;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAiReasoningClientTest {

	@Test
	void noopClientIsDisabled() {
		assertThatThrownBy(() -> new NoopReasoningClient().proposePlan("{}"))
				.isInstanceOf(ReasoningRequestException.class)
				.hasMessageContaining("disabled");
	}

	@Test
	void returnsMessageContentAndRequestsJsonObject() throws IOException {
		ObjectMapper mapper = new ObjectMapper();
		AtomicReference<Map<String, Object>> captured = new AtomicReference<>();
		HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
		server.createContext("/chat/completions", exchange -> {
			byte[] bytes = exchange.getRequestBody().readAllBytes();
			captured.set(mapper.readValue(bytes, Map.class));
			respond(exchange, 200, "{\"choices\":[{\"message\":{\"content\":\"{\\\"actions\\\":[]}\"}}]}");
		});
		server.start();

		try {
			OpenAiReasoningClient client = client(server);
			ReasoningReply reply = client.proposePlan("{\"units\":[]}");

			assertThat(reply.output()).isEqualTo("{\"actions\":[]}");
			assertThat(reply.model()).isEqualTo("gpt-test");
			assertThat(captured.get()).containsEntry("model", "gpt-test");
			assertThat(captured.get().get("response_format")).isEqualTo(Map.of("type", "json_object"));
		} finally {
			server.stop(0);
		}
	}

	@Test
	void missingChoicesIsNotRetryable() throws IOException {
		HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
		server.createContext("/chat/completions", exchange -> respond(exchange, 200, "{\"choices\":[]}"));
		server.start();

		try {
			OpenAiReasoningClient client = client(server);

			assertThatThrownBy(() -> client.proposePlan("{}"))
					.isInstanceOf(ReasoningRequestException.class)
					.satisfies(ex -> assertThat(((ReasoningRequestException) ex).isRetryable()).isFalse());
		} finally {
			server.stop(0);
		}
	}

	@Test
	void rateLimitIsRetryable() throws IOException {
		HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
		server.createContext("/chat/completions", exchange -> respond(exchange, 429, "{\"error\":\"rate\"}"));
		server.start();

		try {
			OpenAiReasoningClient client = client(server);

			assertThatThrownBy(() -> client.proposePlan("{}"))
					.isInstanceOf(ReasoningRequestException.class)
					.satisfies(ex -> {
						ReasoningRequestException error = (ReasoningRequestException) ex;
						assertThat(error.getStatusCode()).isEqualTo(429);
						assertThat(error.isRetryable()).isTrue();
					});
		} finally {
			server.stop(0);
		}
	}

	@Test
	void badRequestIsNotRetryable() throws IOException {
		HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
		server.createContext("/chat/completions", exchange -> respond(exchange, 400, "{\"error\":\"bad\"}"));
		server.start();

		try {
			OpenAiReasoningClient client = client(server);

			assertThatThrownBy(() -> client.proposePlan("{}"))
					.isInstanceOf(ReasoningRequestException.class)
					.satisfies(ex -> assertThat(((ReasoningRequestException) ex).isRetryable()).isFalse());
		} finally {
			server.stop(0);
		}
	}

	private static OpenAiReasoningClient client(HttpServer server) {
		return new OpenAiReasoningClient("http://localhost:" + server.getAddress().getPort(), "test-key", "gpt-test",
				Duration.ofSeconds(2), Duration.ofSeconds(5));
	}

	private static void respond(com.sun.net.httpserver.HttpExchange exchange, int status, String body) throws IOException {
		byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
		exchange.getResponseHeaders().add("Content-Type", "application/json");
		exchange.sendResponseHeaders(status, bytes.length);
		try (OutputStream os = exchange.getResponseBody()) {
			os.write(bytes);
		}
	}
}
