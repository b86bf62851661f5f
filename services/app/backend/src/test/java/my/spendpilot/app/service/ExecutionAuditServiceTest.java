package my.spendpilot.app.service;

import my.spendpilot.app.AppApplication;
import my.spendpilot.app.action.AdAction;
import my.spendpilot.app.dispatch.DispatchResult;
import my.spendpilot.app.dispatch.DispatchStatus;
import my.spendpilot.app.domain.ExecutionRecord;
import my.spendpilot.app.domain.ExecutionStatus;
import my.spendpilot.app.domain.PlanSource;
import my.spendpilot.app.domain.RunTrigger;
import my.spendpilot.app.domain.ScheduleMode;
import my.spendpilot.app.support.TestDatabaseCleaner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(classes = AppApplication.class)
@ActiveProfiles("test")
class ExecutionAuditServiceTest {
	private static final String JWT_SECRET = UUID.randomUUID().toString();

	@Autowired
	private ExecutionAuditService auditService;

	@Autowired
	private TestDatabaseCleaner databaseCleaner;

	@DynamicPropertySource
	static void registerProperties(DynamicPropertyRegistry registry) {
		registry.add("app.security.admin-user", () -> "admin");
		registry.add("app.security.admin-pass", () -> "admin");
		registry.add("app.jwt.secret", () -> JWT_SECRET);
		registry.add("app.jwt.issuer", () -> "test-issuer");
	}

	@BeforeEach
	void setUp() {
		databaseCleaner.clean();
	}

	@AfterEach
	void tearDown() {
		databaseCleaner.clean();
	}

	@Test
	void recordsPlanAndFinalizesOnce() {
		ExecutionRecord record = auditService.begin("acme", "run-1", RunTrigger.MANUAL, ScheduleMode.AUTOPILOT);
		assertThat(record.getId()).isNotNull();
		assertThat(record.getStatus()).isEqualTo(ExecutionStatus.RUNNING);

		record = auditService.recordPlan(record, PlanSource.DETERMINISTIC, Map.of("note", "test"), List.of(
				new AdAction.StatusRead("c1"),
				new AdAction.UpdateUnitBudget("u1", 1_500L)
		));
		DispatchResult result = new DispatchResult(DispatchStatus.SUCCEEDED, 2, null, false, "{\"ok\":true}", null);
		ExecutionRecord completed = auditService.complete(record, ExecutionStatus.COMPLETED, result, null, null);

		ExecutionRecord stored = auditService.findByKey("run-1").orElseThrow();
		assertThat(stored.getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
		assertThat(stored.getPlanSource()).isEqualTo(PlanSource.DETERMINISTIC);
		assertThat(stored.getActionsCount()).isEqualTo(2);
		assertThat(stored.getActionsJson()).contains("\"UpdateUnitBudget\"").contains("1500");
		assertThat(stored.getDispatchAttempts()).isEqualTo(2);
		assertThat(stored.getFinishedAt()).isNotNull();
		assertThat(stored.getDurationMs()).isNotNegative();

		assertThatThrownBy(() -> auditService.complete(completed, ExecutionStatus.FAILED, null, "late", null))
				.isInstanceOf(IllegalStateException.class);
	}

	@Test
	void staleCopyCannotFinalizeAgain() {
		ExecutionRecord record = auditService.begin("acme", "run-2", RunTrigger.SCHEDULED, ScheduleMode.AUTOPILOT);
		ExecutionRecord stale = auditService.findByKey("run-2").orElseThrow();
		auditService.complete(record, ExecutionStatus.NO_SPEND, null, null, null);

		assertThatThrownBy(() -> auditService.complete(stale, ExecutionStatus.FAILED, null, "boom", "OPT-1"))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("already finalized");
		assertThat(auditService.findByKey("run-2").orElseThrow().getStatus()).isEqualTo(ExecutionStatus.NO_SPEND);
	}

	@Test
	void runningIsNotAFinalStatus() {
		ExecutionRecord record = auditService.begin("acme", "run-3", RunTrigger.MANUAL, ScheduleMode.AUTOPILOT);

		assertThatThrownBy(() -> auditService.complete(record, ExecutionStatus.RUNNING, null, null, null))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void duplicateKeyIsRejected() {
		auditService.begin("acme", "run-4", RunTrigger.MANUAL, ScheduleMode.AUTOPILOT);

		assertThatThrownBy(() -> auditService.begin("acme", "run-4", RunTrigger.MANUAL, ScheduleMode.AUTOPILOT))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("run-4");
	}

	@Test
	void listsByTenantAndReportsMissingRecords() {
		auditService.begin("acme", "run-5", RunTrigger.MANUAL, ScheduleMode.AUTOPILOT);
		auditService.begin("globex", "run-6", RunTrigger.MANUAL, ScheduleMode.AUTOPILOT);

		assertThat(auditService.list("acme")).extracting(ExecutionRecord::getIdempotencyKey).containsExactly("run-5");
		assertThat(auditService.list(null)).hasSize(2);
		assertThat(auditService.findByKey(" ")).isEmpty();
		assertThatThrownBy(() -> auditService.get(-1L)).isInstanceOf(ResponseStatusException.class);
	}
}
