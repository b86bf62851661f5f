package my.spendpilot.app.repository;

import my.spendpilot.app.domain.ExecutionRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ExecutionRecordRepository extends JpaRepository<ExecutionRecord, Long> {
	Optional<ExecutionRecord> findByIdempotencyKey(String idempotencyKey);

	List<ExecutionRecord> findTop50ByTenantIdOrderByStartedAtDesc(String tenantId);

	List<ExecutionRecord> findTop50ByOrderByStartedAtDesc();
}
