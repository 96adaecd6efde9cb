package dev.sidebarscraper.resume;

import java.util.List;

/** Read-only view of resume progress for reporting */
public record ResumeReport(int total, int done, int pending, List<PendingItem> pendingItems) {

	public record PendingItem(String title, String id) {
		@Override
		public String toString() {
			return "%s (ID: %s)".formatted(title, id);
		}
	}

	public ResumeReport {
		pendingItems = List.copyOf(pendingItems);
	}

	public double percentDone() {
		return total == 0 ? 100.0 : done * 100.0 / total;
	}

	@Override
	public String toString() {
		return "%d total, %d done, %d pending (%.1f%% complete)".formatted(total, done, pending, percentDone());
	}
}
