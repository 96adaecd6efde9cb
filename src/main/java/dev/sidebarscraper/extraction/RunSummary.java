package dev.sidebarscraper.extraction;

import dev.sidebarscraper.model.TaskResult;
import dev.sidebarscraper.model.TaskStatus;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Aggregated results of one extraction run, in submission order */
public record RunSummary(
		ExecutionMode mode, List<TaskResult> results, Duration elapsed, boolean aborted, String abortReason) {

	public RunSummary {
		results = List.copyOf(results);
	}

	public long count(TaskStatus status) {
		return results.stream().filter(r -> r.status() == status).count();
	}

	public long successful() {
		return count(TaskStatus.SUCCESS);
	}

	public long failed() {
		return results.stream().filter(r -> r.status().isFailure()).count();
	}

	public Map<TaskStatus, Long> countsByStatus() {
		Map<TaskStatus, Long> counts = new EnumMap<>(TaskStatus.class);
		for (TaskResult result : results) {
			counts.merge(result.status(), 1L, Long::sum);
		}
		return counts;
	}

	/** Process exit code for a run with this summary */
	public int exitCode() {
		return aborted || failed() > 0 ? 1 : 0;
	}

	@Override
	public String toString() {
		String base = "%s run: %d tasks, %d succeeded, %d failed, %d skipped in %.1f seconds"
				.formatted(
						mode,
						results.size(),
						successful(),
						failed(),
						count(TaskStatus.SKIPPED),
						elapsed.toMillis() / 1000.0);
		return aborted ? base + " (ABORTED - %s)".formatted(abortReason) : base;
	}
}
