package my.spendpilot.app.service;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class BatchSchedulerTest {
	@Test
	void nextTickIsThirtySecondsPastTheNextFullHour() {
		assertThat(BatchScheduler.secondsUntilNextTick(Instant.parse("2026-01-15T07:00:30Z"))).isEqualTo(3_600);
		assertThat(BatchScheduler.secondsUntilNextTick(Instant.parse("2026-01-15T07:59:00Z"))).isEqualTo(90);
	}

	@Test
	void delayIsNeverZero() {
		assertThat(BatchScheduler.secondsUntilNextTick(Instant.parse("2026-01-15T07:59:59.900Z"))).isPositive();
	}
}
