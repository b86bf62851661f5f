package my.spendpilot.app.repository;

import my.spendpilot.app.domain.MonitoringEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface MonitoringEventRepository extends JpaRepository<MonitoringEvent, Long> {
	Optional<MonitoringEvent> findFirstByReference(String reference);

	List<MonitoringEvent> findTop50ByOrderByCreatedAtDesc();
}
