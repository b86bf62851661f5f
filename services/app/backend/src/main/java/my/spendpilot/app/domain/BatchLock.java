package my.spendpilot.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.LocalDateTime;

@Entity
@Table(name = "batch_locks")
public class BatchLock {
	@Id
	@Column(name = "lock_key")
	private String lockKey;

	@Column(name = "owner_id", nullable = false)
	private String ownerId;

	@Column(name = "acquired_at", nullable = false)
	private LocalDateTime acquiredAt;

	@Column(name = "expires_at", nullable = false)
	private LocalDateTime expiresAt;

	public String getLockKey() {
		return lockKey;
	}

	public void setLockKey(String lockKey) {
		this.lockKey = lockKey;
	}

	public String getOwnerId() {
		return ownerId;
	}

	public void setOwnerId(String ownerId) {
		this.ownerId = ownerId;
	}

	public LocalDateTime getAcquiredAt() {
		return acquiredAt;
	}

	public void setAcquiredAt(LocalDateTime acquiredAt) {
		this.acquiredAt = acquiredAt;
	}

	public LocalDateTime getExpiresAt() {
		return expiresAt;
	}

	public void setExpiresAt(LocalDateTime expiresAt) {
		this.expiresAt = expiresAt;
	}
}
