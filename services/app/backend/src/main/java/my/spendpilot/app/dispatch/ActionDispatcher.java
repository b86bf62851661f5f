package my.spendpilot.app.dispatch;

import my.spendpilot.app.action.AdAction;
import my.spendpilot.app.domain.DispatchReceipt;
import my.spendpilot.app.repository.DispatchReceiptRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Sends one validated batch per idempotency key to the action executor. Transient failures are retried
 * according to the {@link RetryPolicy}; a batch that already has a receipt is never sent again.
 */
@Service
public class ActionDispatcher {
	private static final Logger logger = LoggerFactory.getLogger(ActionDispatcher.class);
	static final String SOURCE = "optimizer";

	private final ActionExecutorClient executorClient;
	private final DispatchReceiptRepository receiptRepository;
	private final RetryPolicy retryPolicy;
	private final BackoffSleeper sleeper;
	private final ObjectMapper objectMapper;
	private final Clock clock;

	public ActionDispatcher(ActionExecutorClient executorClient,
							DispatchReceiptRepository receiptRepository,
							RetryPolicy retryPolicy,
							BackoffSleeper sleeper,
							ObjectMapper objectMapper,
							Clock clock) {
		this.executorClient = executorClient;
		this.receiptRepository = receiptRepository;
		this.retryPolicy = retryPolicy;
		this.sleeper = sleeper;
		this.objectMapper = objectMapper;
		this.clock = clock;
	}

	public DispatchResult dispatch(String idempotencyKey, String tenantId, String adAccountId, List<AdAction> actions) {
		if (idempotencyKey == null || idempotencyKey.isBlank()) {
			throw new IllegalArgumentException("Idempotency key is required");
		}
		if (actions == null || actions.isEmpty()) {
			return DispatchResult.skipped();
		}
		Optional<DispatchReceipt> receipt = receiptRepository.findById(idempotencyKey);
		if (receipt.isPresent()) {
			logger.info("Batch {} was already dispatched at {}, replaying stored result",
					idempotencyKey, receipt.get().getCreatedAt());
			return new DispatchResult(DispatchStatus.REPLAYED, 0, null, false, receipt.get().getResponseJson(), null);
		}

		ExecutionRequest request = new ExecutionRequest(
				idempotencyKey,
				SOURCE,
				new ExecutionRequest.Account(tenantId, adAccountId),
				actions.stream().map(AdAction::toEnvelope).toList()
		);
		int attempt = 0;
		while (true) {
			attempt++;
			try {
				Map<String, Object> response = executorClient.execute(request);
				String responseJson = toJson(response);
				saveReceipt(idempotencyKey, tenantId, actions.size(), attempt, responseJson);
				if (attempt > 1) {
					logger.info("Batch {} dispatched on attempt {}", idempotencyKey, attempt);
				}
				return new DispatchResult(DispatchStatus.SUCCEEDED, attempt, null, false, responseJson, null);
			} catch (DispatchException ex) {
				Integer status = ex.getStatusCode();
				boolean retryable = retryPolicy.isRetryable(status);
				if (!retryable || attempt >= retryPolicy.maxAttempts()) {
					logger.error("Dispatch of batch {} failed after {} attempt(s) (status={}, retryable={}): {}",
							idempotencyKey, attempt, status, retryable, ex.getMessage());
					return new DispatchResult(DispatchStatus.FAILED, attempt, status, retryable, null, ex.getMessage());
				}
				Duration delay = retryPolicy.backoffAfter(attempt);
				logger.warn("Dispatch of batch {} failed on attempt {}/{} (status={}), retrying in {} ms",
						idempotencyKey, attempt, retryPolicy.maxAttempts(), status, delay.toMillis());
				try {
					sleeper.sleep(delay);
				} catch (InterruptedException interrupted) {
					Thread.currentThread().interrupt();
					logger.warn("Dispatch of batch {} interrupted during backoff", idempotencyKey);
					return new DispatchResult(DispatchStatus.FAILED, attempt, status, true, null, "Interrupted during backoff");
				}
			}
		}
	}

	private void saveReceipt(String idempotencyKey, String tenantId, int actionsCount, int attempts, String responseJson) {
		DispatchReceipt receipt = new DispatchReceipt();
		receipt.setIdempotencyKey(idempotencyKey);
		receipt.setTenantId(tenantId);
		receipt.setActionsCount(actionsCount);
		receipt.setAttempts(attempts);
		receipt.setResponseJson(responseJson);
		receipt.setCreatedAt(LocalDateTime.now(clock));
		try {
			receiptRepository.save(receipt);
		} catch (DataIntegrityViolationException ex) {
			logger.warn("Receipt for batch {} was written concurrently: {}", idempotencyKey, ex.getMessage());
		}
	}

	private String toJson(Map<String, Object> response) {
		try {
			return objectMapper.writeValueAsString(response == null ? Map.of() : response);
		} catch (JacksonException ex) {
			logger.debug("Failed to serialize executor response: {}", ex.getMessage());
			return null;
		}
	}
}
