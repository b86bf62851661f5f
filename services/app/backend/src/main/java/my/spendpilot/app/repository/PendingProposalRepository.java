package my.spendpilot.app.repository;

import my.spendpilot.app.domain.PendingProposal;
import my.spendpilot.app.domain.ProposalStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

public interface PendingProposalRepository extends JpaRepository<PendingProposal, Long> {
	@Query("""
		select p from PendingProposal p
		where (:tenantId is null or p.tenantId = :tenantId)
		  and p.status = :status
		order by p.createdAt desc
		""")
	List<PendingProposal> search(@Param("tenantId") String tenantId,
								 @Param("status") ProposalStatus status);

	@Modifying
	@Transactional
	@Query("""
		update PendingProposal p
		set p.status = my.spendpilot.app.domain.ProposalStatus.EXPIRED, p.decidedAt = :now
		where p.status = my.spendpilot.app.domain.ProposalStatus.PENDING
		  and p.expiresAt <= :now
		""")
	int expirePending(@Param("now") LocalDateTime now);
}
