package my.spendpilot.app.dispatch;

import java.time.Duration;

@FunctionalInterface
public interface BackoffSleeper {
	BackoffSleeper THREAD = delay -> Thread.sleep(delay.toMillis());

	void sleep(Duration delay) throws InterruptedException;
}
