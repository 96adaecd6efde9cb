package dev.sidebarscraper;

import dev.sidebarscraper.cache.JsonCacheStore;
import dev.sidebarscraper.discovery.CssSelectorEngine;
import dev.sidebarscraper.discovery.MenuExpander;
import dev.sidebarscraper.discovery.SidebarParser;
import dev.sidebarscraper.discovery.SidebarSelectors;
import dev.sidebarscraper.discovery.StructureDiscoverer;
import dev.sidebarscraper.extraction.ContentSelectors;
import dev.sidebarscraper.extraction.ExtractionConfig;
import dev.sidebarscraper.extraction.ExtractionOrchestrator;
import dev.sidebarscraper.extraction.PageContentExtractor;
import dev.sidebarscraper.reporting.ProgressReporter;
import dev.sidebarscraper.resume.ResumeTracker;
import dev.sidebarscraper.session.PlaywrightSessionFactory;
import dev.sidebarscraper.session.SessionFactory;

/** Wires the pipeline for one command invocation */
public record ScrapeComponents(
		JsonCacheStore cacheStore, ExtractionOrchestrator orchestrator, ScrapeRunner runner) {

	public static ScrapeComponents create(ScrapeConfig config, ProgressReporter reporter) {
		SidebarSelectors sidebarSelectors = SidebarSelectors.defaults();
		ContentSelectors contentSelectors = ContentSelectors.defaults();
		SessionFactory sessionFactory = new PlaywrightSessionFactory(
				config.headless(), sidebarSelectors, contentSelectors, config.loaderTimeout());
		return create(config, reporter, sessionFactory, sidebarSelectors, contentSelectors);
	}

	public static ScrapeComponents create(
			ScrapeConfig config,
			ProgressReporter reporter,
			SessionFactory sessionFactory,
			SidebarSelectors sidebarSelectors,
			ContentSelectors contentSelectors) {
		JsonCacheStore cacheStore = new JsonCacheStore(config.effectiveCacheFile(), config.sourceUrl());
		SidebarParser parser =
				new SidebarParser(new CssSelectorEngine(sidebarSelectors), sidebarSelectors.skipTitles());
		MenuExpander expander =
				new MenuExpander(config.maxExpandAttempts(), config.expandDelay(), config.postExpandSettle());
		StructureDiscoverer discoverer = new StructureDiscoverer(cacheStore, parser, expander);
		ExtractionOrchestrator orchestrator =
				new ExtractionOrchestrator(sessionFactory, new PageContentExtractor(contentSelectors), reporter);
		ExtractionConfig extraction = config.extractionConfig();
		ScrapeRunner runner = new ScrapeRunner(
				sessionFactory,
				discoverer,
				new ResumeTracker(),
				orchestrator,
				extraction.sessionStartAttempts(),
				extraction.sessionStartBackoff());
		return new ScrapeComponents(cacheStore, orchestrator, runner);
	}
}
