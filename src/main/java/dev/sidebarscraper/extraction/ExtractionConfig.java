package dev.sidebarscraper.extraction;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration for the extraction phase. Encapsulates where output goes, how many sessions may run
 * at once, when to fall back to sequential processing and all time limits.
 */
public record ExtractionConfig(
		String sourceUrl,
		Path outputRoot,
		boolean force,
		boolean concurrencyEnabled,
		int maxConcurrentTasks,
		int minItemsForParallel,
		int batchSize,
		Duration taskStartDelay,
		int failureWindow,
		double failureThreshold,
		Duration runTimeout,
		Duration shutdownGrace,
		int sessionStartAttempts,
		Duration sessionStartBackoff,
		int maxConsecutiveResourceErrors,
		Duration navigationTimeout,
		Duration sidebarTimeout,
		Duration contentTimeout) {

	public ExtractionConfig {
		if (maxConcurrentTasks < 1) {
			throw new IllegalArgumentException("maxConcurrentTasks must be at least 1");
		}
		if (sessionStartAttempts < 1) {
			throw new IllegalArgumentException("sessionStartAttempts must be at least 1");
		}
	}

	public static ExtractionConfig defaults(String sourceUrl, Path outputRoot) {
		return new ExtractionConfig(
				sourceUrl,
				outputRoot,
				false,
				true,
				3,
				5,
				0,
				Duration.ofMillis(500),
				10,
				0.5,
				null,
				Duration.ofSeconds(10),
				3,
				Duration.ofSeconds(2),
				3,
				Duration.ofSeconds(15),
				Duration.ofSeconds(45),
				Duration.ofSeconds(15));
	}

	/** Tasks submitted per parallel batch; defaults to twice the concurrency limit */
	public int effectiveBatchSize() {
		return batchSize > 0 ? batchSize : maxConcurrentTasks * 2;
	}

	public ExtractionConfig withConcurrency(boolean enabled, int maxConcurrentTasks) {
		return new ExtractionConfig(
				sourceUrl,
				outputRoot,
				force,
				enabled,
				maxConcurrentTasks,
				minItemsForParallel,
				batchSize,
				taskStartDelay,
				failureWindow,
				failureThreshold,
				runTimeout,
				shutdownGrace,
				sessionStartAttempts,
				sessionStartBackoff,
				maxConsecutiveResourceErrors,
				navigationTimeout,
				sidebarTimeout,
				contentTimeout);
	}

	public ExtractionConfig withTiming(
			Duration taskStartDelay, Duration sessionStartBackoff, Duration runTimeout, Duration shutdownGrace) {
		return new ExtractionConfig(
				sourceUrl,
				outputRoot,
				force,
				concurrencyEnabled,
				maxConcurrentTasks,
				minItemsForParallel,
				batchSize,
				taskStartDelay,
				failureWindow,
				failureThreshold,
				runTimeout,
				shutdownGrace,
				sessionStartAttempts,
				sessionStartBackoff,
				maxConsecutiveResourceErrors,
				navigationTimeout,
				sidebarTimeout,
				contentTimeout);
	}

	public ExtractionConfig withForce(boolean force) {
		return new ExtractionConfig(
				sourceUrl,
				outputRoot,
				force,
				concurrencyEnabled,
				maxConcurrentTasks,
				minItemsForParallel,
				batchSize,
				taskStartDelay,
				failureWindow,
				failureThreshold,
				runTimeout,
				shutdownGrace,
				sessionStartAttempts,
				sessionStartBackoff,
				maxConsecutiveResourceErrors,
				navigationTimeout,
				sidebarTimeout,
				contentTimeout);
	}

	public ExtractionConfig withFailurePolicy(int failureWindow, double failureThreshold, int batchSize) {
		return new ExtractionConfig(
				sourceUrl,
				outputRoot,
				force,
				concurrencyEnabled,
				maxConcurrentTasks,
				minItemsForParallel,
				batchSize,
				taskStartDelay,
				failureWindow,
				failureThreshold,
				runTimeout,
				shutdownGrace,
				sessionStartAttempts,
				sessionStartBackoff,
				maxConsecutiveResourceErrors,
				navigationTimeout,
				sidebarTimeout,
				contentTimeout);
	}
}
