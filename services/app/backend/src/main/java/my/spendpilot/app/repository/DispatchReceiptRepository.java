package my.spendpilot.app.repository;

import my.spendpilot.app.domain.DispatchReceipt;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DispatchReceiptRepository extends JpaRepository<DispatchReceipt, String> {
}
