package dev.sidebarscraper.resume;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Narrows the pending items of a run, mostly for trying the scraper on a handful of pages.
 *
 * @param itemId only this item is extracted, null for no restriction
 * @param maxItems at most this many items in structure order, 0 or less for no limit
 */
public record ItemSelection(String itemId, int maxItems) {
	private static final Logger logger = LoggerFactory.getLogger(ItemSelection.class);

	public static ItemSelection all() {
		return new ItemSelection(null, 0);
	}

	public boolean isAll() {
		return (itemId == null || itemId.isBlank()) && maxItems <= 0;
	}

	/** Apply the selection to the pending items; items already done are kept as they are */
	public ResumeState apply(ResumeState state) {
		if (isAll()) {
			return state;
		}
		List<String> pending = state.pending();
		if (itemId != null && !itemId.isBlank()) {
			pending = pending.stream().filter(itemId::equals).toList();
			if (pending.isEmpty()) {
				logger.warn("No pending item with id {}", itemId);
			}
		}
		if (maxItems > 0 && pending.size() > maxItems) {
			pending = pending.subList(0, maxItems);
			logger.info("Limited to the first {} pending items", maxItems);
		}
		return new ResumeState(state.done(), pending);
	}
}
