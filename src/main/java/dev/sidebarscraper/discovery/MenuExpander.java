package dev.sidebarscraper.discovery;

import dev.sidebarscraper.session.AutomationSession;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands every collapsed node of the sidebar in rounds. The number of rounds is capped, so the
 * loop terminates even on a tree that keeps revealing new collapsed nodes.
 */
public class MenuExpander {
	private static final Logger logger = LoggerFactory.getLogger(MenuExpander.class);

	private final int maxAttempts;
	private final Duration expandDelay;
	private final Duration postExpandSettle;

	public MenuExpander(int maxAttempts, Duration expandDelay, Duration postExpandSettle) {
		if (maxAttempts < 1) {
			throw new IllegalArgumentException("maxAttempts must be at least 1");
		}
		this.maxAttempts = maxAttempts;
		this.expandDelay = expandDelay;
		this.postExpandSettle = postExpandSettle;
	}

	public ExpansionOutcome expandAll(AutomationSession session) {
		Set<String> attempted = new HashSet<>();
		int expanded = 0;
		for (int round = 1; round <= maxAttempts; round++) {
			List<String> fresh = unseen(session.findCollapsedToggles(), attempted);
			if (fresh.isEmpty()) {
				logger.info("Sidebar fully expanded after {} rounds ({} nodes expanded)", round - 1, expanded);
				settle(session, expanded);
				return new ExpansionOutcome(round - 1, expanded, true, null);
			}
			logger.debug("Expansion round {}: {} collapsed nodes", round, fresh.size());
			int clicked = 0;
			for (String ref : fresh) {
				attempted.add(ref);
				if (session.expand(ref)) {
					clicked++;
					session.settle(expandDelay);
				}
			}
			expanded += clicked;
			if (clicked == 0) {
				logger.warn("None of {} collapsed nodes could be expanded in round {}, giving up", fresh.size(), round);
				settle(session, expanded);
				return new ExpansionOutcome(round, expanded, false, new PartialExpansionWarning(round, fresh.size()));
			}
		}

		int remaining = unseen(session.findCollapsedToggles(), attempted).size();
		settle(session, expanded);
		if (remaining == 0) {
			return new ExpansionOutcome(maxAttempts, expanded, true, null);
		}
		PartialExpansionWarning warning = new PartialExpansionWarning(maxAttempts, remaining);
		logger.warn("{}", warning);
		return new ExpansionOutcome(maxAttempts, expanded, false, warning);
	}

	private void settle(AutomationSession session, int expanded) {
		if (expanded > 0) {
			session.settle(postExpandSettle);
		}
	}

	private static List<String> unseen(List<String> refs, Set<String> attempted) {
		List<String> fresh = new ArrayList<>();
		for (String ref : refs) {
			if (!attempted.contains(ref)) {
				fresh.add(ref);
			}
		}
		return fresh;
	}
}
