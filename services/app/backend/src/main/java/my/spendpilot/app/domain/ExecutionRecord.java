package my.spendpilot.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.LocalDateTime;

/**
 * Audit row of one optimization run, keyed by its idempotency key. Finalized exactly once.
 */
@Entity
@Table(name = "execution_records")
public class ExecutionRecord {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "id")
	private Long id;

	@Column(name = "tenant_id", nullable = false)
	private String tenantId;

	@Column(name = "idempotency_key", nullable = false, unique = true)
	private String idempotencyKey;

	@Enumerated(EnumType.STRING)
	@Column(name = "run_trigger", nullable = false)
	private RunTrigger trigger;

	@Enumerated(EnumType.STRING)
	@Column(name = "mode", nullable = false)
	private ScheduleMode mode;

	@Enumerated(EnumType.STRING)
	@Column(name = "plan_source")
	private PlanSource planSource;

	@Enumerated(EnumType.STRING)
	@Column(name = "status", nullable = false)
	private ExecutionStatus status;

	@Column(name = "plan_json", columnDefinition = "TEXT")
	private String planJson;

	@Column(name = "actions_json", columnDefinition = "TEXT")
	private String actionsJson;

	@Column(name = "dispatch_result_json", columnDefinition = "TEXT")
	private String dispatchResultJson;

	@Column(name = "actions_count", nullable = false)
	private Integer actionsCount;

	@Column(name = "dispatch_attempts")
	private Integer dispatchAttempts;

	@Column(name = "error", columnDefinition = "TEXT")
	private String error;

	@Column(name = "error_reference")
	private String errorReference;

	@Column(name = "execution_hour")
	private Integer executionHour;

	@Column(name = "started_at", nullable = false)
	private LocalDateTime startedAt;

	@Column(name = "finished_at")
	private LocalDateTime finishedAt;

	@Column(name = "duration_ms")
	private Long durationMs;

	public Long getId() {
		return id;
	}

	public void setId(Long id) {
		this.id = id;
	}

	public String getTenantId() {
		return tenantId;
	}

	public void setTenantId(String tenantId) {
		this.tenantId = tenantId;
	}

	public String getIdempotencyKey() {
		return idempotencyKey;
	}

	public void setIdempotencyKey(String idempotencyKey) {
		this.idempotencyKey = idempotencyKey;
	}

	public RunTrigger getTrigger() {
		return trigger;
	}

	public void setTrigger(RunTrigger trigger) {
		this.trigger = trigger;
	}

	public ScheduleMode getMode() {
		return mode;
	}

	public void setMode(ScheduleMode mode) {
		this.mode = mode;
	}

	public PlanSource getPlanSource() {
		return planSource;
	}

	public void setPlanSource(PlanSource planSource) {
		this.planSource = planSource;
	}

	public ExecutionStatus getStatus() {
		return status;
	}

	public void setStatus(ExecutionStatus status) {
		this.status = status;
	}

	public String getPlanJson() {
		return planJson;
	}

	public void setPlanJson(String planJson) {
		this.planJson = planJson;
	}

	public String getActionsJson() {
		return actionsJson;
	}

	public void setActionsJson(String actionsJson) {
		this.actionsJson = actionsJson;
	}

	public String getDispatchResultJson() {
		return dispatchResultJson;
	}

	public void setDispatchResultJson(String dispatchResultJson) {
		this.dispatchResultJson = dispatchResultJson;
	}

	public Integer getActionsCount() {
		return actionsCount;
	}

	public void setActionsCount(Integer actionsCount) {
		this.actionsCount = actionsCount;
	}

	public Integer getDispatchAttempts() {
		return dispatchAttempts;
	}

	public void setDispatchAttempts(Integer dispatchAttempts) {
		this.dispatchAttempts = dispatchAttempts;
	}

	public String getError() {
		return error;
	}

	public void setError(String error) {
		this.error = error;
	}

	public String getErrorReference() {
		return errorReference;
	}

	public void setErrorReference(String errorReference) {
		this.errorReference = errorReference;
	}

	public Integer getExecutionHour() {
		return executionHour;
	}

	public void setExecutionHour(Integer executionHour) {
		this.executionHour = executionHour;
	}

	public LocalDateTime getStartedAt() {
		return startedAt;
	}

	public void setStartedAt(LocalDateTime startedAt) {
		this.startedAt = startedAt;
	}

	public LocalDateTime getFinishedAt() {
		return finishedAt;
	}

	public void setFinishedAt(LocalDateTime finishedAt) {
		this.finishedAt = finishedAt;
	}

	public Long getDurationMs() {
		return durationMs;
	}

	public void setDurationMs(Long durationMs) {
		this.durationMs = durationMs;
	}
}
