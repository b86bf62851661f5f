package my.spendpilot.app.service;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class IdempotencyKeysTest {
	private final IdempotencyKeys keys = new IdempotencyKeys(Clock.fixed(Instant.parse("2026-03-02T08:05:00Z"), ZoneOffset.UTC));

	@Test
	void runKeysCarryUtcStampAndRandomSuffix() {
		String first = keys.next();
		String second = keys.next();

		assertThat(first).matches("run-20260302-0805-[a-z0-9]{6}");
		assertThat(second).startsWith("run-20260302-0805-").isNotEqualTo(first);
	}

	@Test
	void approvalKeyIsDerivedFromRunKey() {
		assertThat(IdempotencyKeys.approvalKey("run-20260302-0805-abc123")).isEqualTo("run-20260302-0805-abc123-approved");
	}
}
