package my.spendpilot.app.service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Fires a batch tick shortly after every full UTC hour.
 */
@Service
@ConditionalOnProperty(name = "app.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class BatchScheduler {
	private static final Logger logger = LoggerFactory.getLogger(BatchScheduler.class);
	private static final Duration TICK_OFFSET = Duration.ofSeconds(30);

	private final BatchRunService batchRunService;
	private final Clock clock;
	private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor();

	public BatchScheduler(BatchRunService batchRunService, Clock clock) {
		this.batchRunService = batchRunService;
		this.clock = clock;
	}

	@PostConstruct
	public void schedule() {
		logger.info("Batch scheduler started (instance={})", batchRunService.instanceId());
		scheduleNext();
	}

	@PreDestroy
	public void shutdown() {
		executor.shutdownNow();
	}

	static long secondsUntilNextTick(Instant now) {
		Instant next = now.truncatedTo(ChronoUnit.HOURS).plus(Duration.ofHours(1)).plus(TICK_OFFSET);
		return Math.max(1, Duration.between(now, next).getSeconds());
	}

	private void scheduleNext() {
		executor.schedule(this::runOnce, secondsUntilNextTick(clock.instant()), TimeUnit.SECONDS);
	}

	private void runOnce() {
		try {
			batchRunService.runTick();
		} catch (Exception ex) {
			logger.warn("Batch tick failed: {}", ex.getMessage());
		} finally {
			scheduleNext();
		}
	}
}
