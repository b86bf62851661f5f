package my.spendpilot.app.service;

import my.spendpilot.app.domain.ExecutionStatus;
import my.spendpilot.app.domain.ScheduleMode;
import my.spendpilot.app.domain.Tenant;
import my.spendpilot.app.dto.RunJobResponseDto;
import my.spendpilot.app.dto.RunJobStatus;
import my.spendpilot.app.dto.RunRequestDto;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OptimizationJobServiceTest {
	private static final Instant START = Instant.parse("2026-01-15T09:00:00Z");

	@Mock
	private OptimizationRunService runService;
	@Mock
	private TenantService tenantService;

	private final AtomicReference<Instant> now = new AtomicReference<>(START);
	private final CountDownLatch release = new CountDownLatch(1);
	private OptimizationJobService service;

	@BeforeEach
	void setUp() {
		Clock clock = mock(Clock.class);
		lenient().when(clock.instant()).thenAnswer(invocation -> now.get());
		Tenant tenant = new Tenant();
		tenant.setTenantId("acme");
		tenant.setMode(ScheduleMode.AUTOPILOT);
		tenant.setActive(true);
		lenient().when(tenantService.get("acme")).thenReturn(tenant);
		service = new OptimizationJobService(runService, tenantService, clock);
	}

	@AfterEach
	void tearDown() {
		release.countDown();
		service.shutdown();
	}

	@Test
	void longRunningJobStaysPollableAndFinishedJobExpires() throws Exception {
		CountDownLatch started = new CountDownLatch(1);
		when(runService.run(any())).thenAnswer(invocation -> {
			started.countDown();
			release.await(10, TimeUnit.SECONDS);
			return new OptimizationRunService.RunOutcome(7L, "acme", "run-1", ExecutionStatus.COMPLETED, null, 0, null,
					null, false);
		});

		String jobId = service.start(new RunRequestDto("acme", null, null)).jobId();
		assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

		now.set(START.plus(Duration.ofHours(2)));
		assertThat(service.get(jobId).status()).isEqualTo(RunJobStatus.RUNNING);

		release.countDown();
		RunJobResponseDto done = awaitFinished(jobId);
		assertThat(done.status()).isEqualTo(RunJobStatus.DONE);
		assertThat(done.result().executionId()).isEqualTo(7L);

		now.set(now.get().plus(Duration.ofMinutes(31)));
		assertThatThrownBy(() -> service.get(jobId))
				.isInstanceOfSatisfying(ResponseStatusException.class,
						ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND));
	}

	@Test
	void rejectsDisabledTenant() {
		Tenant disabled = new Tenant();
		disabled.setTenantId("off");
		disabled.setMode(ScheduleMode.DISABLED);
		disabled.setActive(true);
		when(tenantService.get("off")).thenReturn(disabled);

		assertThatThrownBy(() -> service.start(new RunRequestDto("off", null, null)))
				.isInstanceOf(IllegalStateException.class);
	}

	private RunJobResponseDto awaitFinished(String jobId) throws InterruptedException {
		for (int i = 0; i < 100; i++) {
			RunJobResponseDto job = service.get(jobId);
			if (job.status() == RunJobStatus.DONE || job.status() == RunJobStatus.FAILED) {
				return job;
			}
			Thread.sleep(50);
		}
		return service.get(jobId);
	}
}
