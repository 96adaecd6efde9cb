package dev.sidebarscraper.session;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Starts sessions with a bounded number of attempts */
public final class SessionRetry {
	private static final Logger logger = LoggerFactory.getLogger(SessionRetry.class);

	private SessionRetry() {}

	/**
	 * Open a session, retrying failed starts with exponential backoff.
	 *
	 * @param attempts total number of tries, at least one is always made
	 * @param backoff wait after the first failure, doubled after every further one
	 * @param purpose what the session is for, used in log messages
	 * @throws SessionStartException the last failure once all attempts are used up
	 */
	public static AutomationSession open(SessionFactory factory, int attempts, Duration backoff, String purpose)
			throws SessionStartException, InterruptedException {
		int maxAttempts = Math.max(1, attempts);
		for (int attempt = 0; ; attempt++) {
			try {
				return factory.open();
			} catch (SessionStartException e) {
				logger.warn(
						"Session start failed for {} (attempt {}/{}): {}",
						purpose,
						attempt + 1,
						maxAttempts,
						e.getMessage());
				if (attempt >= maxAttempts - 1) {
					throw e;
				}
				// Exponential backoff: 2s, 4s, 8s, ...
				Thread.sleep(backoff.toMillis() * (1L << attempt));
			}
		}
	}
}
