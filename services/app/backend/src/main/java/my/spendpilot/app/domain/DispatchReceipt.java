package my.spendpilot.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.LocalDateTime;

@Entity
@Table(name = "dispatch_receipts")
public class DispatchReceipt {
	@Id
	@Column(name = "idempotency_key")
	private String idempotencyKey;

	@Column(name = "tenant_id", nullable = false)
	private String tenantId;

	@Column(name = "actions_count", nullable = false)
	private Integer actionsCount;

	@Column(name = "attempts", nullable = false)
	private Integer attempts;

	@Column(name = "response_json", columnDefinition = "TEXT")
	private String responseJson;

	@Column(name = "created_at", nullable = false)
	private LocalDateTime createdAt;

	public String getIdempotencyKey() {
		return idempotencyKey;
	}

	public void setIdempotencyKey(String idempotencyKey) {
		this.idempotencyKey = idempotencyKey;
	}

	public String getTenantId() {
		return tenantId;
	}

	public void setTenantId(String tenantId) {
		this.tenantId = tenantId;
	}

	public Integer getActionsCount() {
		return actionsCount;
	}

	public void setActionsCount(Integer actionsCount) {
		this.actionsCount = actionsCount;
	}

	public Integer getAttempts() {
		return attempts;
	}

	public void setAttempts(Integer attempts) {
		this.attempts = attempts;
	}

	public String getResponseJson() {
		return responseJson;
	}

	public void setResponseJson(String responseJson) {
		this.responseJson = responseJson;
	}

	public LocalDateTime getCreatedAt() {
		return createdAt;
	}

	public void setCreatedAt(LocalDateTime createdAt) {
		this.createdAt = createdAt;
	}
}
