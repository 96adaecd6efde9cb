package dev.sidebarscraper.discovery;

import dev.sidebarscraper.cache.CacheStore;
import dev.sidebarscraper.cache.CacheValidation;
import dev.sidebarscraper.extraction.NavigationException;
import dev.sidebarscraper.model.SidebarStructure;
import dev.sidebarscraper.session.AutomationSession;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces the sidebar structure for a run, either from the cache or by expanding and parsing the
 * live page.
 */
public class StructureDiscoverer {
	private static final Logger logger = LoggerFactory.getLogger(StructureDiscoverer.class);

	private final CacheStore cacheStore;
	private final SidebarParser parser;
	private final MenuExpander expander;
	private final Clock clock;

	public StructureDiscoverer(CacheStore cacheStore, SidebarParser parser, MenuExpander expander) {
		this(cacheStore, parser, expander, Clock.systemUTC());
	}

	public StructureDiscoverer(CacheStore cacheStore, SidebarParser parser, MenuExpander expander, Clock clock) {
		this.cacheStore = cacheStore;
		this.parser = parser;
		this.expander = expander;
		this.clock = clock;
	}

	/**
	 * Discover the structure.
	 *
	 * @param session session used for any live interaction, owned by the caller
	 * @param options what to discover and how
	 * @param state expansion state of the current process session
	 * @throws SidebarNotFoundException if the page never shows a sidebar
	 * @throws StructureParseException if the sidebar matches no known layout; the cache is untouched
	 */
	public DiscoveryResult discover(AutomationSession session, DiscoveryOptions options, ExpansionState state)
			throws DiscoveryException {
		Optional<SidebarStructure> cached = options.useCache() ? cacheStore.load() : Optional.empty();
		if (cached.isPresent()) {
			return fromCache(session, options, state, cached.get());
		}
		return live(session, options);
	}

	private DiscoveryResult fromCache(
			AutomationSession session, DiscoveryOptions options, ExpansionState state, SidebarStructure cached)
			throws DiscoveryException {
		ExpansionGate.Decision decision = ExpansionGate.evaluate(true, options.overrides(), state);
		if (!decision.expand()) {
			logger.info("Using cached structure without expansion ({})", decision.reason());
			return new DiscoveryResult(cached, true, false, decision.next(), null, null);
		}

		logger.info("Expanding sidebar for cached structure ({})", decision.reason());
		openSidebar(session, options);
		ExpansionOutcome outcome = expander.expandAll(session);
		if (!options.overrides().validateCache()) {
			return new DiscoveryResult(cached, true, true, decision.next(), outcome.warning(), null);
		}

		String html = session.readSidebarHtml();
		SidebarStructure live = parser.parse(html, options.sourceUrl(), clock.instant());
		if (live.items().keySet().equals(cached.items().keySet())) {
			logger.info("Cached structure matches the live sidebar");
			return new DiscoveryResult(cached, true, true, decision.next(), outcome.warning(), html);
		}
		logger.warn(
				"Cached structure is stale ({} cached items, {} live), replacing it",
				cached.totalItemCount(),
				live.totalItemCount());
		store(live, outcome);
		return new DiscoveryResult(live, false, true, decision.next(), outcome.warning(), html);
	}

	private DiscoveryResult live(AutomationSession session, DiscoveryOptions options) throws DiscoveryException {
		ExpansionGate.Decision decision = ExpansionGate.evaluate(false, options.overrides(), ExpansionState.PENDING);
		openSidebar(session, options);

		Instant capturedAt = clock.instant();
		StructureVariant variant = parser.detectVariant(session.readSidebarHtml());
		ExpansionOutcome outcome = ExpansionOutcome.skipped();
		if (variant == StructureVariant.HIERARCHICAL) {
			outcome = expander.expandAll(session);
		} else {
			logger.info("Sidebar is flat, no expansion needed");
		}

		String html = session.readSidebarHtml();
		SidebarStructure structure = parser.parse(html, options.sourceUrl(), capturedAt);
		store(structure, outcome);
		return new DiscoveryResult(
				structure, false, variant == StructureVariant.HIERARCHICAL, decision.next(), outcome.warning(), html);
	}

	private void openSidebar(AutomationSession session, DiscoveryOptions options) throws DiscoveryException {
		try {
			session.navigate(options.sourceUrl(), options.navigationTimeout());
		} catch (NavigationException e) {
			throw new SidebarNotFoundException("Could not load " + options.sourceUrl() + ": " + e.getMessage(), e);
		}
		if (!session.waitForSidebar(options.sidebarTimeout())) {
			throw new SidebarNotFoundException(
					"Sidebar did not appear on " + options.sourceUrl() + " within " + options.sidebarTimeout());
		}
	}

	private void store(SidebarStructure structure, ExpansionOutcome outcome) {
		if (outcome.partial().isPresent()) {
			logger.warn("Not caching a partially expanded structure");
			return;
		}
		List<String> problems = CacheValidation.problems(structure);
		if (!problems.isEmpty()) {
			logger.warn("Not caching structure: {}", String.join("; ", problems));
			return;
		}
		try {
			cacheStore.save(structure);
		} catch (IOException e) {
			logger.warn("Failed to cache structure: {}", e.getMessage());
		}
	}
}
