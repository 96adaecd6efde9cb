package dev.sidebarscraper.cache;

import dev.sidebarscraper.model.SidebarStructure;
import java.util.ArrayList;
import java.util.List;

/** Thresholds a structure has to meet before it is trusted from, or written to, the cache */
public final class CacheValidation {
	public static final int MIN_VALID_ITEMS = 10;
	public static final double MIN_VALID_RATIO = 0.10;

	private CacheValidation() {}

	/** @return reasons the structure cannot be trusted, empty if it can */
	public static List<String> problems(SidebarStructure structure) {
		List<String> problems = new ArrayList<>(structure.validate());
		int total = structure.totalItemCount();
		int valid = structure.validItemCount();
		if (total < MIN_VALID_ITEMS) {
			problems.add("only %d items, need at least %d".formatted(total, MIN_VALID_ITEMS));
		} else if ((double) valid / total <= MIN_VALID_RATIO) {
			problems.add("only %d of %d items are valid".formatted(valid, total));
		}
		return problems;
	}

	public static boolean isTrustworthy(SidebarStructure structure) {
		return problems(structure).isEmpty();
	}
}
