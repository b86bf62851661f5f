package my.spendpilot.app.repository;

import my.spendpilot.app.domain.ScheduleMode;
import my.spendpilot.app.domain.Tenant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface TenantRepository extends JpaRepository<Tenant, String> {
	@Query("""
		select t from Tenant t
		where t.active = true and t.mode <> :excluded
		order by t.tenantId
		""")
	List<Tenant> findSchedulable(@Param("excluded") ScheduleMode excluded);

	List<Tenant> findAllByOrderByTenantIdAsc();
}
