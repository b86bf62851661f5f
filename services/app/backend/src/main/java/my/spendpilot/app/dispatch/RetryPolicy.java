package my.spendpilot.app.dispatch;

import java.time.Duration;
import java.util.Set;

/**
 * Bounded exponential backoff. A missing status code means the request never got an answer and is retried.
 */
public record RetryPolicy(
		int maxAttempts,
		Duration initialBackoff,
		double multiplier,
		Duration maxBackoff,
		Set<Integer> retryableStatuses
) {
	public static final Set<Integer> DEFAULT_RETRYABLE_STATUSES = Set.of(429, 500, 502, 503);

	public RetryPolicy {
		if (maxAttempts < 1) {
			throw new IllegalArgumentException("maxAttempts must be at least 1");
		}
		initialBackoff = initialBackoff == null ? Duration.ofSeconds(2) : initialBackoff;
		maxBackoff = maxBackoff == null ? Duration.ofSeconds(30) : maxBackoff;
		multiplier = multiplier < 1.0 ? 1.0 : multiplier;
		retryableStatuses = retryableStatuses == null ? DEFAULT_RETRYABLE_STATUSES : Set.copyOf(retryableStatuses);
	}

	public static RetryPolicy defaults() {
		return new RetryPolicy(3, Duration.ofSeconds(2), 2.0, Duration.ofSeconds(30), DEFAULT_RETRYABLE_STATUSES);
	}

	public boolean isRetryable(Integer statusCode) {
		return statusCode == null || retryableStatuses.contains(statusCode);
	}

	/**
	 * Delay before the attempt that follows {@code failedAttempt} (1-based).
	 */
	public Duration backoffAfter(int failedAttempt) {
		int exponent = Math.max(0, failedAttempt - 1);
		double millis = initialBackoff.toMillis() * Math.pow(multiplier, exponent);
		long capped = (long) Math.min(millis, (double) maxBackoff.toMillis());
		return Duration.ofMillis(capped);
	}
}
