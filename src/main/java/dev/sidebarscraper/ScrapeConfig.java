package dev.sidebarscraper;

import dev.sidebarscraper.discovery.DiscoveryOptions;
import dev.sidebarscraper.discovery.ExpansionOverrides;
import dev.sidebarscraper.extraction.ExtractionConfig;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Settings shared by all commands. A null {@code cacheFile} means the default location below the
 * output directory.
 */
public record ScrapeConfig(
		String sourceUrl,
		Path outputDir,
		Path cacheFile,
		boolean useCache,
		boolean headless,
		ExpansionOverrides overrides,
		int maxExpandAttempts,
		Duration expandDelay,
		Duration postExpandSettle,
		Duration loaderTimeout,
		Duration navigationTimeout,
		Duration sidebarTimeout,
		Duration contentTimeout) {

	public static final String DEFAULT_URL = "https://developer.dell.com/apis/4008/versions/3.6/docs/";

	public static ScrapeConfig defaults(String sourceUrl, Path outputDir) {
		return new ScrapeConfig(
				sourceUrl,
				outputDir,
				null,
				true,
				true,
				ExpansionOverrides.none(),
				15,
				Duration.ofMillis(500),
				Duration.ofSeconds(2),
				Duration.ofSeconds(10),
				Duration.ofSeconds(15),
				Duration.ofSeconds(45),
				Duration.ofSeconds(15));
	}

	public Path effectiveCacheFile() {
		return cacheFile != null ? cacheFile : outputDir.resolve(".cache").resolve("sidebar_structure.json");
	}

	public DiscoveryOptions discoveryOptions() {
		return new DiscoveryOptions(sourceUrl, useCache, overrides, navigationTimeout, sidebarTimeout);
	}

	/** Extraction defaults with this configuration's target, output and timeouts applied */
	public ExtractionConfig extractionConfig() {
		ExtractionConfig defaults = ExtractionConfig.defaults(sourceUrl, outputDir);
		return new ExtractionConfig(
				sourceUrl,
				outputDir,
				overrides.force(),
				defaults.concurrencyEnabled(),
				defaults.maxConcurrentTasks(),
				defaults.minItemsForParallel(),
				defaults.batchSize(),
				defaults.taskStartDelay(),
				defaults.failureWindow(),
				defaults.failureThreshold(),
				defaults.runTimeout(),
				defaults.shutdownGrace(),
				defaults.sessionStartAttempts(),
				defaults.sessionStartBackoff(),
				defaults.maxConsecutiveResourceErrors(),
				navigationTimeout,
				sidebarTimeout,
				contentTimeout);
	}
}
