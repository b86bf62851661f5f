package my.spendpilot.app.service;

import jakarta.annotation.PreDestroy;
import my.spendpilot.app.config.AppProperties;
import my.spendpilot.app.dispatch.BackoffSleeper;
import my.spendpilot.app.domain.BatchRun;
import my.spendpilot.app.domain.BatchRunStatus;
import my.spendpilot.app.domain.Tenant;
import my.spendpilot.app.repository.BatchRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One scheduler tick: take the cluster lock, pick the tenants due this hour, run them in bounded chunks.
 */
@Service
public class BatchRunService {
	private static final Logger logger = LoggerFactory.getLogger(BatchRunService.class);
	static final String LOCK_KEY = "daily_batch_lock";
	private static final int DEFAULT_CONCURRENCY = 5;
	private static final long DEFAULT_CHUNK_PAUSE_MILLIS = 2000;
	private static final int DEFAULT_LOCK_TTL_MINUTES = 10;
	private static final int DEFAULT_TENANT_TIMEOUT_SECONDS = 300;

	private final BatchLockService lockService;
	private final TenantScheduleService scheduleService;
	private final OptimizationRunService runService;
	private final ProposalService proposalService;
	private final MonitoringService monitoringService;
	private final BatchRunRepository batchRunRepository;
	private final BackoffSleeper sleeper;
	private final Clock clock;
	private final String instanceId;
	private final int concurrency;
	private final Duration chunkPause;
	private final Duration lockTtl;
	private final Duration tenantTimeout;
	private final ExecutorService executor;

	public BatchRunService(BatchLockService lockService,
						   TenantScheduleService scheduleService,
						   OptimizationRunService runService,
						   ProposalService proposalService,
						   MonitoringService monitoringService,
						   BatchRunRepository batchRunRepository,
						   BackoffSleeper sleeper,
						   Clock clock,
						   AppProperties properties) {
		this.lockService = lockService;
		this.scheduleService = scheduleService;
		this.runService = runService;
		this.proposalService = proposalService;
		this.monitoringService = monitoringService;
		this.batchRunRepository = batchRunRepository;
		this.sleeper = sleeper;
		this.clock = clock;
		AppProperties.Scheduler scheduler = properties.scheduler();
		this.instanceId = scheduler == null || scheduler.instanceId() == null || scheduler.instanceId().isBlank()
				? "instance-" + UUID.randomUUID().toString().substring(0, 8).toLowerCase(Locale.ROOT)
				: scheduler.instanceId().trim();
		this.concurrency = scheduler == null || scheduler.concurrency() == null
				? DEFAULT_CONCURRENCY
				: Math.max(1, scheduler.concurrency());
		this.chunkPause = Duration.ofMillis(scheduler == null || scheduler.chunkPauseMillis() == null
				? DEFAULT_CHUNK_PAUSE_MILLIS
				: Math.max(0, scheduler.chunkPauseMillis()));
		this.lockTtl = Duration.ofMinutes(scheduler == null || scheduler.lockTtlMinutes() == null
				? DEFAULT_LOCK_TTL_MINUTES
				: Math.max(1, scheduler.lockTtlMinutes()));
		this.tenantTimeout = Duration.ofSeconds(scheduler == null || scheduler.tenantTimeoutSeconds() == null
				? DEFAULT_TENANT_TIMEOUT_SECONDS
				: Math.max(1, scheduler.tenantTimeoutSeconds()));
		this.executor = Executors.newFixedThreadPool(concurrency);
	}

	public String instanceId() {
		return instanceId;
	}

	public BatchRun runTick() {
		Instant now = clock.instant();
		LocalDateTime startedAt = LocalDateTime.ofInstant(now, ZoneOffset.UTC);
		int tickHour = startedAt.getHour();
		expireProposals();

		Optional<BatchLockService.BatchLease> acquired = lockService.tryAcquire(LOCK_KEY, instanceId, lockTtl);
		if (acquired.isEmpty()) {
			logger.info("Tick {}:00 UTC skipped, another instance holds {}", tickHour, LOCK_KEY);
			return save(newRun(tickHour, startedAt), BatchRunStatus.SKIPPED_LOCKED, 0, 0, 0);
		}
		try (BatchLockService.BatchLease lease = acquired.get()) {
			BatchRun run = newRun(tickHour, startedAt);
			List<Tenant> tenants = scheduleService.dueTenants(now);
			if (tenants.isEmpty()) {
				logger.debug("Tick {}:00 UTC: no tenants due", tickHour);
				return save(run, BatchRunStatus.NO_TENANTS, 0, 0, 0);
			}
			logger.info("Tick {}:00 UTC: {} tenant(s) due, concurrency {}", tickHour, tenants.size(), concurrency);
			AtomicInteger succeeded = new AtomicInteger();
			AtomicInteger failed = new AtomicInteger();
			List<List<Tenant>> chunks = chunk(tenants, concurrency);
			for (int i = 0; i < chunks.size(); i++) {
				runChunk(chunks.get(i), succeeded, failed);
				if (i < chunks.size() - 1) {
					if (!lease.renew()) {
						int skipped = remaining(chunks, i + 1);
						logger.warn("Lease on {} lost after chunk {}, {} tenant(s) left unprocessed",
								LOCK_KEY, i + 1, skipped);
						failed.addAndGet(skipped);
						break;
					}
					if (!pauseBetweenChunks()) {
						failed.addAndGet(remaining(chunks, i + 1));
						break;
					}
				}
			}
			return save(run, BatchRunStatus.COMPLETED, tenants.size(), succeeded.get(), failed.get());
		}
	}

	public List<BatchRun> recentRuns() {
		return batchRunRepository.findTop50ByOrderByStartedAtDesc();
	}

	@PreDestroy
	public void shutdown() {
		executor.shutdownNow();
	}

	private void runChunk(List<Tenant> chunk, AtomicInteger succeeded, AtomicInteger failed) {
		List<Future<OptimizationRunService.RunOutcome>> futures = new ArrayList<>(chunk.size());
		for (Tenant tenant : chunk) {
			futures.add(executor.submit(() -> runService.runScheduled(tenant)));
		}
		for (int i = 0; i < chunk.size(); i++) {
			Tenant tenant = chunk.get(i);
			Future<OptimizationRunService.RunOutcome> future = futures.get(i);
			try {
				OptimizationRunService.RunOutcome outcome = future.get(tenantTimeout.toMillis(), TimeUnit.MILLISECONDS);
				if (outcome.isFailure()) {
					failed.incrementAndGet();
				} else {
					succeeded.incrementAndGet();
				}
			} catch (TimeoutException ex) {
				future.cancel(true);
				failed.incrementAndGet();
				monitoringService.reportFailure(tenant.getTenantId(), "batch", "Tenant run timed out", ex,
						Map.of("timeoutSeconds", tenantTimeout.toSeconds()));
			} catch (ExecutionException ex) {
				failed.incrementAndGet();
				Throwable cause = ex.getCause() == null ? ex : ex.getCause();
				monitoringService.reportFailure(tenant.getTenantId(), "batch", cause.getMessage(), cause, Map.of());
			} catch (InterruptedException ex) {
				Thread.currentThread().interrupt();
				future.cancel(true);
				failed.incrementAndGet();
				logger.warn("Batch interrupted while waiting for tenant {}", tenant.getTenantId());
			}
		}
	}

	private boolean pauseBetweenChunks() {
		if (chunkPause.isZero()) {
			return true;
		}
		try {
			sleeper.sleep(chunkPause);
			return true;
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			logger.warn("Batch interrupted between chunks");
			return false;
		}
	}

	static <T> List<List<T>> chunk(List<T> items, int size) {
		List<List<T>> chunks = new ArrayList<>();
		for (int start = 0; start < items.size(); start += size) {
			chunks.add(List.copyOf(items.subList(start, Math.min(items.size(), start + size))));
		}
		return chunks;
	}

	private int remaining(List<List<Tenant>> chunks, int fromIndex) {
		int count = 0;
		for (int i = fromIndex; i < chunks.size(); i++) {
			count += chunks.get(i).size();
		}
		return count;
	}

	private void expireProposals() {
		try {
			proposalService.expireDue();
		} catch (RuntimeException ex) {
			logger.warn("Failed to expire pending proposals: {}", ex.getMessage());
		}
	}

	private BatchRun newRun(int tickHour, LocalDateTime startedAt) {
		BatchRun run = new BatchRun();
		run.setInstanceId(instanceId);
		run.setTickHourUtc(tickHour);
		run.setStartedAt(startedAt);
		return run;
	}

	private BatchRun save(BatchRun run, BatchRunStatus status, int selected, int succeeded, int failed) {
		LocalDateTime finishedAt = LocalDateTime.now(clock);
		run.setStatus(status);
		run.setTenantsSelected(selected);
		run.setTenantsSucceeded(succeeded);
		run.setTenantsFailed(failed);
		run.setFinishedAt(finishedAt);
		run.setDurationMs(Duration.between(run.getStartedAt(), finishedAt).toMillis());
		return batchRunRepository.save(run);
	}
}
