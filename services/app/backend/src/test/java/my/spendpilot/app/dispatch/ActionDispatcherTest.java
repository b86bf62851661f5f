package my.spendpilot.app.dispatch;

import my.spendpilot.app.action.AdAction;
import my.spendpilot.app.domain.DispatchReceipt;
import my.spendpilot.app.repository.DispatchReceiptRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import tools.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ActionDispatcherTest {
	private static final List<AdAction> ACTIONS = List.of(
			new AdAction.StatusRead("c1"),
			new AdAction.UpdateUnitBudget("u1", 1_500L)
	);

	private ActionExecutorClient executorClient;
	private DispatchReceiptRepository receiptRepository;
	private List<Duration> sleeps;
	private ActionDispatcher dispatcher;

	@BeforeEach
	void setUp() {
		executorClient = mock(ActionExecutorClient.class);
		receiptRepository = mock(DispatchReceiptRepository.class);
		when(receiptRepository.findById(any())).thenReturn(Optional.empty());
		sleeps = new ArrayList<>();
		RetryPolicy policy = new RetryPolicy(3, Duration.ofSeconds(2), 2.0, Duration.ofSeconds(30), null);
		dispatcher = new ActionDispatcher(executorClient, receiptRepository, policy, sleeps::add, new ObjectMapper(),
				Clock.fixed(Instant.parse("2026-03-02T08:00:00Z"), ZoneOffset.UTC));
	}

	@Test
	void retriesRateLimitOnceThenSucceeds() {
		when(executorClient.execute(any()))
				.thenThrow(new DispatchException("Too Many Requests", 429, null))
				.thenReturn(Map.of("executed", 2));

		DispatchResult result = dispatcher.dispatch("run-1", "t1", "act_1", ACTIONS);

		assertThat(result.status()).isEqualTo(DispatchStatus.SUCCEEDED);
		assertThat(result.attempts()).isEqualTo(2);
		assertThat(result.responseJson()).contains("\"executed\":2");
		assertThat(sleeps).containsExactly(Duration.ofSeconds(2));
		verify(executorClient, times(2)).execute(any());
		ArgumentCaptor<DispatchReceipt> receipt = ArgumentCaptor.forClass(DispatchReceipt.class);
		verify(receiptRepository).save(receipt.capture());
		assertThat(receipt.getValue().getIdempotencyKey()).isEqualTo("run-1");
		assertThat(receipt.getValue().getAttempts()).isEqualTo(2);
	}

	@Test
	void sendsSameKeyAndBatchOnEveryAttempt() {
		when(executorClient.execute(any()))
				.thenThrow(new DispatchException("unavailable", 503, null))
				.thenReturn(Map.of());

		dispatcher.dispatch("run-2", "t1", "act_1", ACTIONS);

		ArgumentCaptor<ExecutionRequest> requests = ArgumentCaptor.forClass(ExecutionRequest.class);
		verify(executorClient, times(2)).execute(requests.capture());
		assertThat(requests.getAllValues()).allSatisfy(request -> {
			assertThat(request.idempotencyKey()).isEqualTo("run-2");
			assertThat(request.source()).isEqualTo("optimizer");
			assertThat(request.account().adAccountId()).isEqualTo("act_1");
			assertThat(request.actions()).extracting(envelope -> envelope.type())
					.containsExactly("GetCampaignStatus", "UpdateUnitBudget");
		});
	}

	@Test
	void nonRetryableStatusFailsImmediately() {
		when(executorClient.execute(any())).thenThrow(new DispatchException("Bad Request", 400, null));

		DispatchResult result = dispatcher.dispatch("run-3", "t1", "act_1", ACTIONS);

		assertThat(result.status()).isEqualTo(DispatchStatus.FAILED);
		assertThat(result.attempts()).isEqualTo(1);
		assertThat(result.statusCode()).isEqualTo(400);
		assertThat(result.retryable()).isFalse();
		assertThat(sleeps).isEmpty();
		verify(receiptRepository, never()).save(any());
	}

	@Test
	void givesUpAfterMaxAttempts() {
		when(executorClient.execute(any())).thenThrow(new DispatchException("timeout", null, null));

		DispatchResult result = dispatcher.dispatch("run-4", "t1", "act_1", ACTIONS);

		assertThat(result.status()).isEqualTo(DispatchStatus.FAILED);
		assertThat(result.attempts()).isEqualTo(3);
		assertThat(result.retryable()).isTrue();
		assertThat(sleeps).containsExactly(Duration.ofSeconds(2), Duration.ofSeconds(4));
	}

	@Test
	void replaysStoredReceiptWithoutCallingExecutor() {
		DispatchReceipt receipt = new DispatchReceipt();
		receipt.setIdempotencyKey("run-5");
		receipt.setResponseJson("{\"executed\":2}");
		when(receiptRepository.findById("run-5")).thenReturn(Optional.of(receipt));

		DispatchResult result = dispatcher.dispatch("run-5", "t1", "act_1", ACTIONS);

		assertThat(result.status()).isEqualTo(DispatchStatus.REPLAYED);
		assertThat(result.isSuccess()).isTrue();
		assertThat(result.responseJson()).isEqualTo("{\"executed\":2}");
		verify(executorClient, never()).execute(any());
	}

	@Test
	void emptyBatchIsSkipped() {
		DispatchResult result = dispatcher.dispatch("run-6", "t1", "act_1", List.of());

		assertThat(result.status()).isEqualTo(DispatchStatus.SKIPPED);
		verify(executorClient, never()).execute(any());
	}

	@Test
	void requiresIdempotencyKey() {
		assertThatThrownBy(() -> dispatcher.dispatch(" ", "t1", "act_1", ACTIONS))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void interruptedBackoffFailsAndKeepsInterruptFlag() {
		RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(10), 2.0, Duration.ofSeconds(1), null);
		ActionDispatcher interrupted = new ActionDispatcher(executorClient, receiptRepository, policy,
				delay -> {
					throw new InterruptedException("stop");
				},
				new ObjectMapper(), Clock.systemUTC());
		when(executorClient.execute(any())).thenThrow(new DispatchException("busy", 429, null));

		try {
			DispatchResult result = interrupted.dispatch("run-7", "t1", "act_1", ACTIONS);

			assertThat(result.status()).isEqualTo(DispatchStatus.FAILED);
			assertThat(result.attempts()).isEqualTo(1);
			assertThat(Thread.currentThread().isInterrupted()).isTrue();
		} finally {
			Thread.interrupted();
		}
	}
}
