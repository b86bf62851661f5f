package my.spendpilot.app.service;

import my.spendpilot.app.domain.BatchLock;
import my.spendpilot.app.repository.BatchLockRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Cluster-wide lease on a lock row. A lease is acquired with a TTL, renewed while work continues, and released
 * when closed; a crashed holder simply lets the row expire.
 */
@Service
public class BatchLockService {
	private static final Logger logger = LoggerFactory.getLogger(BatchLockService.class);

	private final BatchLockRepository repository;
	private final Clock clock;

	public BatchLockService(BatchLockRepository repository, Clock clock) {
		this.repository = repository;
		this.clock = clock;
	}

	public Optional<BatchLease> tryAcquire(String lockKey, String ownerId, Duration ttl) {
		if (lockKey == null || lockKey.isBlank() || ownerId == null || ownerId.isBlank()) {
			throw new IllegalArgumentException("lockKey and ownerId are required");
		}
		if (ttl == null || ttl.isNegative() || ttl.isZero()) {
			throw new IllegalArgumentException("ttl must be positive");
		}
		cleanupExpired();
		LocalDateTime now = LocalDateTime.now(clock);
		LocalDateTime expiresAt = now.plus(ttl);
		if (repository.takeOver(lockKey, ownerId, now, expiresAt) == 1) {
			return Optional.of(new BatchLease(lockKey, ownerId, ttl));
		}
		try {
			repository.insertLock(lockKey, ownerId, now, expiresAt);
			return Optional.of(new BatchLease(lockKey, ownerId, ttl));
		} catch (DataIntegrityViolationException ex) {
			String holder = repository.findById(lockKey).map(BatchLock::getOwnerId).orElse("unknown");
			logger.info("Lock {} is held by {}, not acquired by {}", lockKey, holder, ownerId);
			return Optional.empty();
		}
	}

	public int cleanupExpired() {
		int removed = repository.deleteExpired(LocalDateTime.now(clock));
		if (removed > 0) {
			logger.info("Removed {} expired lock row(s)", removed);
		}
		return removed;
	}

	/**
	 * Held lease. Closing releases the row only if it is still ours.
	 */
	public final class BatchLease implements AutoCloseable {
		private final String lockKey;
		private final String ownerId;
		private final Duration ttl;
		private boolean released;

		private BatchLease(String lockKey, String ownerId, Duration ttl) {
			this.lockKey = lockKey;
			this.ownerId = ownerId;
			this.ttl = ttl;
		}

		public String lockKey() {
			return lockKey;
		}

		public String ownerId() {
			return ownerId;
		}

		/**
		 * Extends the expiry. Returns false when the lease was lost to another owner.
		 */
		public boolean renew() {
			if (released) {
				return false;
			}
			boolean renewed = repository.renew(lockKey, ownerId, LocalDateTime.now(clock).plus(ttl)) == 1;
			if (!renewed) {
				logger.warn("Lease on {} for {} was lost", lockKey, ownerId);
			}
			return renewed;
		}

		@Override
		public void close() {
			if (released) {
				return;
			}
			released = true;
			int removed = repository.release(lockKey, ownerId);
			if (removed == 0) {
				logger.warn("Lock {} was no longer held by {} at release", lockKey, ownerId);
			}
		}
	}
}
