package my.spendpilot.app.service;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Generates run keys of the form {@code run-yyyyMMdd-HHmm-xxxxxx} (UTC).
 */
@Component
public class IdempotencyKeys {
	private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmm").withZone(ZoneOffset.UTC);
	private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
	private static final int SUFFIX_LENGTH = 6;

	private final Clock clock;
	private final SecureRandom random = new SecureRandom();

	public IdempotencyKeys(Clock clock) {
		this.clock = clock;
	}

	public String next() {
		StringBuilder key = new StringBuilder("run-").append(STAMP.format(clock.instant())).append('-');
		for (int i = 0; i < SUFFIX_LENGTH; i++) {
			key.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
		}
		return key.toString();
	}

	public static String approvalKey(String runKey) {
		return runKey + "-approved";
	}
}
