package my.spendpilot.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.LocalDateTime;

@Entity
@Table(name = "tenants")
public class Tenant {
	@Id
	@Column(name = "tenant_id")
	private String tenantId;

	@Column(name = "name", nullable = false)
	private String name;

	@Column(name = "ad_account_id")
	private String adAccountId;

	@Enumerated(EnumType.STRING)
	@Column(name = "mode", nullable = false)
	private ScheduleMode mode;

	@Column(name = "schedule_hour", nullable = false)
	private Integer scheduleHour;

	@Column(name = "timezone", nullable = false)
	private String timezone;

	@Column(name = "active", nullable = false)
	private boolean active;

	@Column(name = "last_run_at")
	private LocalDateTime lastRunAt;

	@Column(name = "created_at", nullable = false, updatable = false)
	private LocalDateTime createdAt;

	@Column(name = "updated_at", nullable = false)
	private LocalDateTime updatedAt;

	public String getTenantId() {
		return tenantId;
	}

	public void setTenantId(String tenantId) {
		this.tenantId = tenantId;
	}

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public String getAdAccountId() {
		return adAccountId;
	}

	public void setAdAccountId(String adAccountId) {
		this.adAccountId = adAccountId;
	}

	public ScheduleMode getMode() {
		return mode;
	}

	public void setMode(ScheduleMode mode) {
		this.mode = mode;
	}

	public Integer getScheduleHour() {
		return scheduleHour;
	}

	public void setScheduleHour(Integer scheduleHour) {
		this.scheduleHour = scheduleHour;
	}

	public String getTimezone() {
		return timezone;
	}

	public void setTimezone(String timezone) {
		this.timezone = timezone;
	}

	public boolean isActive() {
		return active;
	}

	public void setActive(boolean active) {
		this.active = active;
	}

	public LocalDateTime getLastRunAt() {
		return lastRunAt;
	}

	public void setLastRunAt(LocalDateTime lastRunAt) {
		this.lastRunAt = lastRunAt;
	}

	public LocalDateTime getCreatedAt() {
		return createdAt;
	}

	public void setCreatedAt(LocalDateTime createdAt) {
		this.createdAt = createdAt;
	}

	public LocalDateTime getUpdatedAt() {
		return updatedAt;
	}

	public void setUpdatedAt(LocalDateTime updatedAt) {
		this.updatedAt = updatedAt;
	}
}
