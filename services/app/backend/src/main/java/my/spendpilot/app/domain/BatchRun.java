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

@Entity
@Table(name = "batch_runs")
public class BatchRun {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "id")
	private Long id;

	@Column(name = "instance_id", nullable = false)
	private String instanceId;

	@Column(name = "tick_hour_utc", nullable = false)
	private Integer tickHourUtc;

	@Enumerated(EnumType.STRING)
	@Column(name = "status", nullable = false)
	private BatchRunStatus status;

	@Column(name = "tenants_selected", nullable = false)
	private Integer tenantsSelected;

	@Column(name = "tenants_succeeded", nullable = false)
	private Integer tenantsSucceeded;

	@Column(name = "tenants_failed", nullable = false)
	private Integer tenantsFailed;

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

	public String getInstanceId() {
		return instanceId;
	}

	public void setInstanceId(String instanceId) {
		this.instanceId = instanceId;
	}

	public Integer getTickHourUtc() {
		return tickHourUtc;
	}

	public void setTickHourUtc(Integer tickHourUtc) {
		this.tickHourUtc = tickHourUtc;
	}

	public BatchRunStatus getStatus() {
		return status;
	}

	public void setStatus(BatchRunStatus status) {
		this.status = status;
	}

	public Integer getTenantsSelected() {
		return tenantsSelected;
	}

	public void setTenantsSelected(Integer tenantsSelected) {
		this.tenantsSelected = tenantsSelected;
	}

	public Integer getTenantsSucceeded() {
		return tenantsSucceeded;
	}

	public void setTenantsSucceeded(Integer tenantsSucceeded) {
		this.tenantsSucceeded = tenantsSucceeded;
	}

	public Integer getTenantsFailed() {
		return tenantsFailed;
	}

	public void setTenantsFailed(Integer tenantsFailed) {
		this.tenantsFailed = tenantsFailed;
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
