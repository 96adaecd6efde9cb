package dev.sidebarscraper.extraction;

import dev.sidebarscraper.model.TaskResult;
import dev.sidebarscraper.model.TaskStatus;
import java.util.ArrayDeque;
import java.util.Deque;

/** Failure rate over the most recent results. Only touched by the aggregating thread. */
class FailureRateWindow {
	private final int size;
	private final double threshold;
	private final Deque<Boolean> recent = new ArrayDeque<>();

	FailureRateWindow(int size, double threshold) {
		this.size = Math.max(1, size);
		this.threshold = threshold;
	}

	void record(TaskResult result) {
		if (result.status() == TaskStatus.SKIPPED) {
			return;
		}
		recent.addLast(result.status().isFailure());
		if (recent.size() > size) {
			recent.removeFirst();
		}
	}

	double rate() {
		if (recent.isEmpty()) {
			return 0.0;
		}
		long failures = recent.stream().filter(Boolean::booleanValue).count();
		return (double) failures / recent.size();
	}

	/** True once the window is full and its failure rate has reached the threshold */
	boolean exceeded() {
		return recent.size() >= size && rate() >= threshold;
	}
}
