package my.spendpilot.app.repository;

import my.spendpilot.app.domain.BatchRun;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface BatchRunRepository extends JpaRepository<BatchRun, Long> {
	List<BatchRun> findTop50ByOrderByStartedAtDesc();
}
