package dev.sidebarscraper;

import dev.sidebarscraper.discovery.DiscoveryException;
import dev.sidebarscraper.discovery.ExpansionOverrides;
import dev.sidebarscraper.extraction.ExtractionConfig;
import dev.sidebarscraper.extraction.ExtractionOrchestrator;
import dev.sidebarscraper.extraction.RunSummary;
import dev.sidebarscraper.model.TaskResult;
import dev.sidebarscraper.model.TaskStatus;
import dev.sidebarscraper.reporting.ProgressReporter;
import dev.sidebarscraper.resume.ItemSelection;
import dev.sidebarscraper.session.SessionStartException;
import dev.sidebarscraper.util.FileUtils;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

/** Full run: discover the structure, then extract every item not yet on disk */
@Command(
		name = "scrape",
		description = "Discover the sidebar and extract every documentation page",
		mixinStandardHelpOptions = true)
public class ScrapeCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Mixin
	SiteOptions site;

	@Option(
			names = {"-f", "--force"},
			description = "Re-extract items that already have an output file")
	private boolean force;

	@Option(
			names = {"--force-full-expansion"},
			description = "Expand the whole sidebar even when a cached structure is used")
	private boolean forceFullExpansion;

	@Option(
			names = {"--validate-cache"},
			description = "Compare the cached structure with the live sidebar and replace it when it differs")
	private boolean validateCache;

	@Option(
			names = {"--clear-cache"},
			description = "Delete the structure cache before starting")
	private boolean clearCache;

	@Option(
			names = {"-c", "--max-concurrent"},
			description = "Maximum number of concurrent browser sessions (default: 3)",
			defaultValue = "3")
	private int maxConcurrent;

	@Option(
			names = {"--no-concurrency"},
			description = "Extract items one at a time")
	private boolean noConcurrency;

	@Option(
			names = {"--run-timeout"},
			description = "Abort the extraction after this many seconds (default: unlimited)",
			defaultValue = "-1")
	private long runTimeout;

	@Option(
			names = {"--max-items"},
			description = "Extract at most this many pending items (default: all)",
			defaultValue = "0")
	private int maxItems;

	@Option(
			names = {"--item-id"},
			description = "Extract only the item with this id")
	private String itemId;

	@Override
	public Integer call() throws Exception {
		ScrapeConfig config = site.toConfig(new ExpansionOverrides(force, forceFullExpansion, validateCache));
		ExtractionConfig base = config.extractionConfig();
		ExtractionConfig extraction = base.withConcurrency(!noConcurrency, maxConcurrent)
				.withTiming(
						base.taskStartDelay(),
						base.sessionStartBackoff(),
						runTimeout > 0 ? Duration.ofSeconds(runTimeout) : null,
						base.shutdownGrace());

		logger.info("Sidebar Scraper");
		logger.info("===============");
		logger.info("Source URL: {}", config.sourceUrl());
		logger.info("Output directory: {}", config.outputDir().toAbsolutePath());
		logger.info("Cache file: {}", config.useCache() ? config.effectiveCacheFile() : "disabled");
		logger.info(
				"Concurrency: {}",
				extraction.concurrencyEnabled() ? "up to " + extraction.maxConcurrentTasks() + " sessions" : "off");
		logger.info("");

		try (ProgressReporter reporter = new ProgressReporter(0)) {
			reporter.start();
			FileUtils.ensureDirectory(config.outputDir());
			ScrapeComponents components = ScrapeComponents.create(config, reporter);
			if (clearCache) {
				components.cacheStore().invalidate();
				logger.info("Cleared structure cache {}", components.cacheStore().cacheFile());
			}

			Thread hook = shutdownHook(components.orchestrator(), extraction.shutdownGrace());
			Runtime.getRuntime().addShutdownHook(hook);
			RunSummary summary;
			try {
				summary = components.runner()
						.scrape(config.discoveryOptions(), extraction, new ItemSelection(itemId, maxItems));
			} finally {
				removeShutdownHook(hook);
			}
			printSummary(summary);
			return summary.exitCode();
		} catch (DiscoveryException | SessionStartException e) {
			logger.error("Could not discover the sidebar structure: {}", e.getMessage(), e);
			return 2;
		} catch (IOException e) {
			logger.error("I/O error: {}", e.getMessage(), e);
			return 1;
		}
	}

	private static Thread shutdownHook(ExtractionOrchestrator orchestrator, Duration grace) {
		return new Thread(
				() -> {
					orchestrator.requestAbort("shutdown requested");
					try {
						if (!orchestrator.awaitCompletion(grace.plusSeconds(5))) {
							logger.warn("Extraction did not stop within {}", grace.plusSeconds(5));
						}
					} catch (InterruptedException e) {
						Thread.currentThread().interrupt();
					}
				},
				"scrape-shutdown");
	}

	private static void removeShutdownHook(Thread hook) {
		try {
			Runtime.getRuntime().removeShutdownHook(hook);
		} catch (IllegalStateException e) {
			logger.debug("JVM is shutting down, shutdown hook stays registered");
		}
	}

	private static void printSummary(RunSummary summary) {
		System.out.println();
		System.out.println("Execution Summary");
		System.out.println("=================");
		for (TaskResult result : summary.results()) {
			if (result.status() != TaskStatus.SUCCESS) {
				System.out.println(result);
			}
		}
		System.out.println();
		for (Map.Entry<TaskStatus, Long> entry : summary.countsByStatus().entrySet()) {
			System.out.println(entry.getKey() + ": " + entry.getValue());
		}
		System.out.println();
		System.out.println(summary);
	}
}
