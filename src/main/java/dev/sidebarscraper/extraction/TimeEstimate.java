package dev.sidebarscraper.extraction;

import java.time.Duration;

/** Rough sequential and parallel durations of an extraction run */
public record TimeEstimate(Duration sequential, Duration parallel) {
	static final double MIN_SPEEDUP = 1.3;
	private static final double PER_ITEM_FACTOR = 1.2;
	private static final double PARALLEL_EFFICIENCY = 0.75;

	public static TimeEstimate of(int items, ExtractionConfig config) {
		long perItem = (long) (config.navigationTimeout().toMillis() * PER_ITEM_FACTOR);
		Duration sequential = Duration.ofMillis(perItem * items);
		if (items == 0) {
			return new TimeEstimate(sequential, sequential);
		}
		int workers = Math.min(config.maxConcurrentTasks(), items);
		long parallel = (long) ((double) items / workers * perItem / PARALLEL_EFFICIENCY);
		return new TimeEstimate(sequential, Duration.ofMillis(parallel));
	}

	public double speedup() {
		return parallel.isZero() ? 1.0 : (double) sequential.toMillis() / parallel.toMillis();
	}

	/** Parallel execution only pays off above a minimum speed-up */
	public boolean isParallelWorthwhile() {
		return speedup() >= MIN_SPEEDUP;
	}

	public static String format(Duration duration) {
		long seconds = duration.toSeconds();
		if (seconds < 60) {
			return seconds + "s";
		}
		if (seconds < 3600) {
			return "%dm %ds".formatted(seconds / 60, seconds % 60);
		}
		return "%dh %dm".formatted(seconds / 3600, (seconds % 3600) / 60);
	}

	@Override
	public String toString() {
		return "sequential ~%s, parallel ~%s (%.1fx)".formatted(format(sequential), format(parallel), speedup());
	}
}
