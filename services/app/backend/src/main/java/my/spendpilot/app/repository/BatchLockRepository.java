package my.spendpilot.app.repository;

import my.spendpilot.app.domain.BatchLock;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

public interface BatchLockRepository extends JpaRepository<BatchLock, String> {
	/**
	 * Takes an expired lock over. A live lock is never re-entered, not even by its own owner.
	 */
	@Modifying
	@Transactional
	@Query("""
		update BatchLock l
		set l.ownerId = :owner, l.acquiredAt = :now, l.expiresAt = :expiresAt
		where l.lockKey = :lockKey
		  and l.expiresAt <= :now
		""")
	int takeOver(@Param("lockKey") String lockKey,
				 @Param("owner") String owner,
				 @Param("now") LocalDateTime now,
				 @Param("expiresAt") LocalDateTime expiresAt);

	/**
	 * Plain insert; a concurrent holder makes this fail with a constraint violation.
	 */
	@Modifying
	@Transactional
	@Query(value = """
		insert into batch_locks (lock_key, owner_id, acquired_at, expires_at)
		values (:lockKey, :owner, :now, :expiresAt)
		""", nativeQuery = true)
	int insertLock(@Param("lockKey") String lockKey,
				   @Param("owner") String owner,
				   @Param("now") LocalDateTime now,
				   @Param("expiresAt") LocalDateTime expiresAt);

	@Modifying
	@Transactional
	@Query("""
		update BatchLock l set l.expiresAt = :expiresAt
		where l.lockKey = :lockKey and l.ownerId = :owner
		""")
	int renew(@Param("lockKey") String lockKey,
			  @Param("owner") String owner,
			  @Param("expiresAt") LocalDateTime expiresAt);

	@Modifying
	@Transactional
	@Query("delete from BatchLock l where l.lockKey = :lockKey and l.ownerId = :owner")
	int release(@Param("lockKey") String lockKey, @Param("owner") String owner);

	@Modifying
	@Transactional
	@Query("delete from BatchLock l where l.expiresAt <= :now")
	int deleteExpired(@Param("now") LocalDateTime now);
}
