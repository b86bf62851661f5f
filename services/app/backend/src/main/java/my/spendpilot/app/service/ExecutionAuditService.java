package my.spendpilot.app.service;

import my.spendpilot.app.action.AdAction;
import my.spendpilot.app.dispatch.DispatchResult;
import my.spendpilot.app.domain.ExecutionRecord;
import my.spendpilot.app.domain.ExecutionStatus;
import my.spendpilot.app.domain.PlanSource;
import my.spendpilot.app.domain.RunTrigger;
import my.spendpilot.app.domain.ScheduleMode;
import my.spendpilot.app.repository.ExecutionRecordRepository;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Writes the per-run audit trail. A record starts RUNNING, may get its plan attached, and is finalized exactly once.
 */
@Service
public class ExecutionAuditService {
	private final ExecutionRecordRepository repository;
	private final ObjectMapper objectMapper;
	private final Clock clock;

	public ExecutionAuditService(ExecutionRecordRepository repository, ObjectMapper objectMapper, Clock clock) {
		this.repository = repository;
		this.objectMapper = objectMapper;
		this.clock = clock;
	}

	public ExecutionRecord begin(String tenantId, String idempotencyKey, RunTrigger trigger, ScheduleMode mode) {
		LocalDateTime now = LocalDateTime.now(clock);
		ExecutionRecord record = new ExecutionRecord();
		record.setTenantId(tenantId);
		record.setIdempotencyKey(idempotencyKey);
		record.setTrigger(trigger);
		record.setMode(mode);
		record.setStatus(ExecutionStatus.RUNNING);
		record.setActionsCount(0);
		record.setExecutionHour(now.getHour());
		record.setStartedAt(now);
		try {
			return repository.saveAndFlush(record);
		} catch (DataIntegrityViolationException ex) {
			throw new IllegalStateException("A run with idempotency key " + idempotencyKey + " already exists", ex);
		}
	}

	/**
	 * Stores the chosen plan before anything is dispatched, so a failed dispatch still leaves the plan behind.
	 */
	public ExecutionRecord recordPlan(ExecutionRecord record, PlanSource source, Object plan, List<AdAction> actions) {
		requireRunning(record);
		record.setPlanSource(source);
		record.setPlanJson(toJson(plan));
		List<AdAction> safeActions = actions == null ? List.of() : actions;
		record.setActionsJson(toJson(safeActions.stream().map(AdAction::toEnvelope).toList()));
		record.setActionsCount(safeActions.size());
		return repository.save(record);
	}

	public ExecutionRecord complete(ExecutionRecord record,
									ExecutionStatus status,
									DispatchResult dispatchResult,
									String error,
									String errorReference) {
		if (status == null || status == ExecutionStatus.RUNNING) {
			throw new IllegalArgumentException("A final status is required");
		}
		requireRunning(record);
		if (record.getId() != null) {
			ExecutionRecord stored = repository.findById(record.getId()).orElse(null);
			if (stored != null && stored.getStatus() != ExecutionStatus.RUNNING) {
				throw new IllegalStateException("Execution " + record.getId() + " is already finalized");
			}
		}
		LocalDateTime now = LocalDateTime.now(clock);
		record.setStatus(status);
		if (dispatchResult != null) {
			record.setDispatchResultJson(toJson(dispatchResult));
			record.setDispatchAttempts(dispatchResult.attempts());
		}
		record.setError(error);
		record.setErrorReference(errorReference);
		record.setFinishedAt(now);
		record.setDurationMs(Duration.between(record.getStartedAt(), now).toMillis());
		return repository.save(record);
	}

	public Optional<ExecutionRecord> findByKey(String idempotencyKey) {
		if (idempotencyKey == null || idempotencyKey.isBlank()) {
			return Optional.empty();
		}
		return repository.findByIdempotencyKey(idempotencyKey);
	}

	public List<ExecutionRecord> list(String tenantId) {
		if (tenantId == null || tenantId.isBlank()) {
			return repository.findTop50ByOrderByStartedAtDesc();
		}
		return repository.findTop50ByTenantIdOrderByStartedAtDesc(tenantId.trim());
	}

	public ExecutionRecord get(Long id) {
		return repository.findById(id)
				.orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Execution not found"));
	}

	private void requireRunning(ExecutionRecord record) {
		if (record == null) {
			throw new IllegalArgumentException("Execution record is required");
		}
		if (record.getStatus() != ExecutionStatus.RUNNING) {
			throw new IllegalStateException("Execution " + record.getIdempotencyKey() + " is already finalized");
		}
	}

	private String toJson(Object value) {
		if (value == null) {
			return null;
		}
		try {
			return objectMapper.writeValueAsString(value);
		} catch (JacksonException ex) {
			throw new IllegalStateException("Failed to serialize audit payload: " + ex.getMessage(), ex);
		}
	}
}
