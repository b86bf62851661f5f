package my.spendpilot.app.service;

import jakarta.annotation.PreDestroy;
import my.spendpilot.app.domain.ScheduleMode;
import my.spendpilot.app.domain.Tenant;
import my.spendpilot.app.dto.RunJobResponseDto;
import my.spendpilot.app.dto.RunJobStatus;
import my.spendpilot.app.dto.RunOutcomeDto;
import my.spendpilot.app.dto.RunRequestDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;

/**
 * Manual runs started over the API. Jobs are kept in memory and polled by id.
 */
@Service
public class OptimizationJobService {
	private static final Logger logger = LoggerFactory.getLogger(OptimizationJobService.class);
	private static final Duration JOB_TTL = Duration.ofMinutes(30);
	private static final int MAX_CONCURRENT_JOBS = 2;

	private final OptimizationRunService runService;
	private final TenantService tenantService;
	private final Clock clock;
	private final Map<String, JobState> jobs = new ConcurrentHashMap<>();
	private final ExecutorService executor = Executors.newFixedThreadPool(MAX_CONCURRENT_JOBS);
	private final Semaphore concurrency = new Semaphore(MAX_CONCURRENT_JOBS);

	public OptimizationJobService(OptimizationRunService runService, TenantService tenantService, Clock clock) {
		this.runService = runService;
		this.tenantService = tenantService;
		this.clock = clock;
	}

	public RunJobResponseDto start(RunRequestDto request) {
		if (request == null || request.tenantId() == null || request.tenantId().isBlank()) {
			throw new IllegalArgumentException("tenantId is required");
		}
		Tenant tenant = tenantService.get(request.tenantId());
		if (tenant.getMode() == ScheduleMode.DISABLED || !tenant.isActive()) {
			throw new IllegalStateException("Tenant " + tenant.getTenantId() + " is disabled");
		}
		cleanupExpired();
		String jobId = UUID.randomUUID().toString();
		JobState job = new JobState(jobId, request);
		jobs.put(jobId, job);
		executor.submit(() -> runJob(jobId));
		return toDto(job);
	}

	public RunJobResponseDto get(String jobId) {
		cleanupExpired();
		JobState job = jobs.get(jobId);
		if (job == null) {
			throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Run job not found");
		}
		return toDto(job);
	}

	@PreDestroy
	public void shutdown() {
		executor.shutdownNow();
	}

	private void runJob(String jobId) {
		JobState job = jobs.get(jobId);
		if (job == null) {
			return;
		}
		try {
			concurrency.acquire();
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			job.error = failWithReference(job, ex);
			job.finishedAt = clock.instant();
			job.status = RunJobStatus.FAILED;
			return;
		}
		RunJobStatus finalStatus = RunJobStatus.FAILED;
		try {
			job.status = RunJobStatus.RUNNING;
			job.result = runService.run(new OptimizationRunService.RunRequest(
					job.request.tenantId(),
					job.request.idempotencyKey(),
					!Boolean.FALSE.equals(job.request.dispatch()),
					null
			));
			finalStatus = RunJobStatus.DONE;
		} catch (Exception ex) {
			job.error = failWithReference(job, ex);
		} finally {
			// finishedAt first: a poller that sees the final status also sees when it finished
			job.finishedAt = clock.instant();
			job.status = finalStatus;
			concurrency.release();
		}
	}

	private RunJobResponseDto toDto(JobState job) {
		return new RunJobResponseDto(job.jobId, job.status, toDto(job.result), job.error);
	}

	static RunOutcomeDto toDto(OptimizationRunService.RunOutcome outcome) {
		if (outcome == null) {
			return null;
		}
		return new RunOutcomeDto(
				outcome.executionId(),
				outcome.tenantId(),
				outcome.idempotencyKey(),
				outcome.status(),
				outcome.planSource(),
				outcome.actionsCount(),
				outcome.proposalId(),
				outcome.error(),
				outcome.replayed()
		);
	}

	/**
	 * Drops finished jobs after the TTL. Queued and running jobs stay pollable however long they wait.
	 */
	private void cleanupExpired() {
		Instant now = clock.instant();
		jobs.entrySet().removeIf(entry -> {
			Instant finishedAt = entry.getValue().finishedAt;
			return finishedAt != null && finishedAt.plus(JOB_TTL).isBefore(now);
		});
	}

	private String failWithReference(JobState job, Exception ex) {
		String message = ex == null ? null : ex.getMessage();
		String reference = "RUN-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
		logger.error("Run job failed (ref={}, jobId={}, tenant={}, error={})",
				reference, job.jobId, job.request.tenantId(), message, ex);
		return "Error ref " + reference;
	}

	private static final class JobState {
		private final String jobId;
		private final RunRequestDto request;

		private volatile Instant finishedAt;
		private volatile RunJobStatus status;
		private volatile OptimizationRunService.RunOutcome result;
		private volatile String error;

		private JobState(String jobId, RunRequestDto request) {
			this.jobId = jobId;
			this.request = request;
			this.status = RunJobStatus.PENDING;
		}
	}
}
