package my.spendpilot.app.service;

import my.spendpilot.app.config.AppProperties;
import my.spendpilot.app.dispatch.BackoffSleeper;
import my.spendpilot.app.domain.BatchRun;
import my.spendpilot.app.domain.BatchRunStatus;
import my.spendpilot.app.domain.ExecutionStatus;
import my.spendpilot.app.domain.ScheduleMode;
import my.spendpilot.app.domain.Tenant;
import my.spendpilot.app.repository.BatchRunRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BatchRunServiceTest {
	private static final Instant NOW = Instant.parse("2026-01-15T07:00:30Z");

	@Mock
	private BatchLockService lockService;
	@Mock
	private TenantScheduleService scheduleService;
	@Mock
	private OptimizationRunService runService;
	@Mock
	private ProposalService proposalService;
	@Mock
	private MonitoringService monitoringService;
	@Mock
	private BatchRunRepository batchRunRepository;

	private final List<Duration> pauses = new ArrayList<>();
	private BatchRunService service;

	@BeforeEach
	void setUp() {
		lenient().when(batchRunRepository.save(any(BatchRun.class))).thenAnswer(invocation -> invocation.getArgument(0));
	}

	@AfterEach
	void tearDown() {
		if (service != null) {
			service.shutdown();
		}
		Thread.interrupted();
	}

	@Test
	void tickIsSkippedWhenAnotherInstanceHoldsTheLock() {
		service = service(2, pauses::add);
		when(lockService.tryAcquire(eq("daily_batch_lock"), eq("instance-a"), any())).thenReturn(Optional.empty());

		BatchRun run = service.runTick();

		assertThat(run.getStatus()).isEqualTo(BatchRunStatus.SKIPPED_LOCKED);
		assertThat(run.getTickHourUtc()).isEqualTo(7);
		assertThat(run.getInstanceId()).isEqualTo("instance-a");
		verifyNoInteractions(scheduleService, runService);
		verify(proposalService).expireDue();
	}

	@Test
	void tickWithoutDueTenantsReleasesTheLock() {
		service = service(2, pauses::add);
		BatchLockService.BatchLease lease = mock(BatchLockService.BatchLease.class);
		when(lockService.tryAcquire(any(), any(), any())).thenReturn(Optional.of(lease));
		when(scheduleService.dueTenants(NOW)).thenReturn(List.of());

		BatchRun run = service.runTick();

		assertThat(run.getStatus()).isEqualTo(BatchRunStatus.NO_TENANTS);
		assertThat(run.getTenantsSelected()).isZero();
		verify(lease).close();
		verifyNoInteractions(runService);
	}

	@Test
	void dueTenantsRunInChunksWithPausesAndFailuresAreCounted() {
		service = service(2, pauses::add);
		BatchLockService.BatchLease lease = mock(BatchLockService.BatchLease.class);
		when(lockService.tryAcquire(any(), any(), any())).thenReturn(Optional.of(lease));
		Tenant ok = tenant("ok");
		Tenant failing = tenant("failing");
		Tenant crashing = tenant("crashing");
		when(scheduleService.dueTenants(NOW)).thenReturn(List.of(ok, failing, crashing));
		when(lease.renew()).thenReturn(true);
		when(runService.runScheduled(ok)).thenReturn(outcome("ok", ExecutionStatus.COMPLETED));
		when(runService.runScheduled(failing)).thenReturn(outcome("failing", ExecutionStatus.FAILED));
		when(runService.runScheduled(crashing)).thenThrow(new IllegalStateException("boom"));

		BatchRun run = service.runTick();

		assertThat(run.getStatus()).isEqualTo(BatchRunStatus.COMPLETED);
		assertThat(run.getTenantsSelected()).isEqualTo(3);
		assertThat(run.getTenantsSucceeded()).isEqualTo(1);
		assertThat(run.getTenantsFailed()).isEqualTo(2);
		assertThat(pauses).containsExactly(Duration.ofMillis(5));
		verify(lease, times(1)).renew();
		verify(lease).close();
		verify(monitoringService).reportFailure(eq("crashing"), eq("batch"), eq("boom"), any(IllegalStateException.class), anyMap());
	}

	@Test
	void interruptedPauseCountsRemainingTenantsAsFailed() {
		service = service(1, delay -> {
			throw new InterruptedException("shutdown");
		});
		BatchLockService.BatchLease lease = mock(BatchLockService.BatchLease.class);
		when(lockService.tryAcquire(any(), any(), any())).thenReturn(Optional.of(lease));
		Tenant first = tenant("first");
		Tenant second = tenant("second");
		when(scheduleService.dueTenants(NOW)).thenReturn(List.of(first, second));
		when(lease.renew()).thenReturn(true);
		when(runService.runScheduled(first)).thenReturn(outcome("first", ExecutionStatus.COMPLETED));

		BatchRun run = service.runTick();

		assertThat(run.getTenantsSucceeded()).isEqualTo(1);
		assertThat(run.getTenantsFailed()).isEqualTo(1);
		assertThat(Thread.interrupted()).isTrue();
		verify(runService, times(1)).runScheduled(any());
	}

	@Test
	void lostLeaseStopsTheBatchBeforeTheNextChunk() {
		service = service(1, pauses::add);
		BatchLockService.BatchLease lease = mock(BatchLockService.BatchLease.class);
		when(lockService.tryAcquire(any(), any(), any())).thenReturn(Optional.of(lease));
		Tenant first = tenant("first");
		Tenant second = tenant("second");
		Tenant third = tenant("third");
		when(scheduleService.dueTenants(NOW)).thenReturn(List.of(first, second, third));
		when(runService.runScheduled(first)).thenReturn(outcome("first", ExecutionStatus.COMPLETED));
		when(lease.renew()).thenReturn(false);

		BatchRun run = service.runTick();

		assertThat(run.getStatus()).isEqualTo(BatchRunStatus.COMPLETED);
		assertThat(run.getTenantsSelected()).isEqualTo(3);
		assertThat(run.getTenantsSucceeded()).isEqualTo(1);
		assertThat(run.getTenantsFailed()).isEqualTo(2);
		assertThat(pauses).isEmpty();
		verify(runService, times(1)).runScheduled(any());
		verify(lease).close();
	}

	@Test
	void chunkSplitsPreservingOrder() {
		assertThat(BatchRunService.chunk(List.of(1, 2, 3, 4, 5), 2))
				.containsExactly(List.of(1, 2), List.of(3, 4), List.of(5));
		assertThat(BatchRunService.chunk(List.of(), 3)).isEmpty();
	}

	private BatchRunService service(int concurrency, BackoffSleeper sleeper) {
		AppProperties.Scheduler scheduler = new AppProperties.Scheduler(true, "instance-a", "UTC", concurrency,
				5L, 10, 50, 30);
		AppProperties properties = new AppProperties(null, null, null, scheduler, null, null, null, null);
		return new BatchRunService(lockService, scheduleService, runService, proposalService, monitoringService,
				batchRunRepository, sleeper, Clock.fixed(NOW, ZoneOffset.UTC), properties);
	}

	private static Tenant tenant(String id) {
		Tenant tenant = new Tenant();
		tenant.setTenantId(id);
		tenant.setMode(ScheduleMode.AUTOPILOT);
		tenant.setScheduleHour(7);
		tenant.setTimezone("UTC");
		tenant.setActive(true);
		return tenant;
	}

	private static OptimizationRunService.RunOutcome outcome(String tenantId, ExecutionStatus status) {
		return new OptimizationRunService.RunOutcome(1L, tenantId, "run-" + tenantId, status, null, 0, null, null, false);
	}
}
