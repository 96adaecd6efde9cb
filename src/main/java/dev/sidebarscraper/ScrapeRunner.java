package dev.sidebarscraper;

import dev.sidebarscraper.discovery.DiscoveryException;
import dev.sidebarscraper.discovery.DiscoveryOptions;
import dev.sidebarscraper.discovery.DiscoveryResult;
import dev.sidebarscraper.discovery.ExpansionState;
import dev.sidebarscraper.discovery.StructureDiscoverer;
import dev.sidebarscraper.extraction.ExtractionConfig;
import dev.sidebarscraper.extraction.ExtractionOrchestrator;
import dev.sidebarscraper.extraction.RunSummary;
import dev.sidebarscraper.extraction.TimeEstimate;
import dev.sidebarscraper.resume.ItemSelection;
import dev.sidebarscraper.resume.ResumeReport;
import dev.sidebarscraper.resume.ResumeState;
import dev.sidebarscraper.resume.ResumeTracker;
import dev.sidebarscraper.session.AutomationSession;
import dev.sidebarscraper.session.SessionFactory;
import dev.sidebarscraper.session.SessionRetry;
import dev.sidebarscraper.session.SessionStartException;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the whole pipeline: discover the sidebar in a dedicated session, work out what is still
 * missing on disk and hand that to the orchestrator. The expansion state lives as long as the runner.
 */
public class ScrapeRunner {
	private static final Logger logger = LoggerFactory.getLogger(ScrapeRunner.class);

	private final SessionFactory sessionFactory;
	private final StructureDiscoverer discoverer;
	private final ResumeTracker resumeTracker;
	private final ExtractionOrchestrator orchestrator;
	private final int sessionStartAttempts;
	private final Duration sessionStartBackoff;
	private ExpansionState expansionState = ExpansionState.PENDING;

	/**
	 * @param sessionStartAttempts tries for the discovery session before giving up
	 * @param sessionStartBackoff wait after the first failed try, doubled after each further one
	 */
	public ScrapeRunner(
			SessionFactory sessionFactory,
			StructureDiscoverer discoverer,
			ResumeTracker resumeTracker,
			ExtractionOrchestrator orchestrator,
			int sessionStartAttempts,
			Duration sessionStartBackoff) {
		this.sessionFactory = sessionFactory;
		this.discoverer = discoverer;
		this.resumeTracker = resumeTracker;
		this.orchestrator = orchestrator;
		this.sessionStartAttempts = sessionStartAttempts;
		this.sessionStartBackoff = sessionStartBackoff;
	}

	public synchronized DiscoveryResult discover(DiscoveryOptions options)
			throws DiscoveryException, SessionStartException {
		try (AutomationSession session = openDiscoverySession()) {
			DiscoveryResult result = discoverer.discover(session, options, expansionState);
			expansionState = result.nextState();
			result.partialExpansion()
					.ifPresent(warning -> logger.warn("Structure may be incomplete: {}", warning));
			logger.info(
					"Discovered {} items ({}), {} leaves",
					result.structure().totalItemCount(),
					result.fromCache() ? "cached" : "live",
					result.structure().leaves().size());
			return result;
		}
	}

	public RunSummary scrape(DiscoveryOptions options, ExtractionConfig config)
			throws DiscoveryException, SessionStartException {
		return scrape(options, config, ItemSelection.all());
	}

	public RunSummary scrape(DiscoveryOptions options, ExtractionConfig config, ItemSelection selection)
			throws DiscoveryException, SessionStartException {
		DiscoveryResult discovery = discover(options);

		ResumeState partition = resumeTracker.partition(discovery.structure(), config.outputRoot(), config.force());
		logger.info(
				"Resume: {} of {} items already extracted, {} pending",
				partition.done().size(),
				partition.total(),
				partition.pending().size());
		ResumeState resume = selection.apply(partition);
		if (resume.isComplete()) {
			logger.info("Nothing to extract, all items are up to date");
			return new RunSummary(orchestrator.selectMode(0, config), List.of(), Duration.ZERO, false, null);
		}

		TimeEstimate estimate = TimeEstimate.of(resume.pending().size(), config);
		logger.info("Estimated duration: {}", estimate);
		return orchestrator.run(discovery.structure(), resume, config);
	}

	public ResumeReport resumeReport(DiscoveryOptions options, ExtractionConfig config)
			throws DiscoveryException, SessionStartException {
		DiscoveryResult discovery = discover(options);
		return resumeTracker.report(discovery.structure(), config.outputRoot());
	}

	private AutomationSession openDiscoverySession() throws SessionStartException {
		try {
			return SessionRetry.open(sessionFactory, sessionStartAttempts, sessionStartBackoff, "discovery");
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new SessionStartException("Interrupted while starting the discovery session", e);
		}
	}

	public ExpansionState expansionState() {
		return expansionState;
	}
}
