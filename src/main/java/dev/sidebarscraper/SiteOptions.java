package dev.sidebarscraper;

import dev.sidebarscraper.discovery.ExpansionOverrides;
import java.nio.file.Path;
import java.time.Duration;
import picocli.CommandLine.Option;

/** Options shared by every command, mixed in with {@code @Mixin} */
public class SiteOptions {

	@Option(
			names = {"-u", "--url"},
			description = "Documentation page hosting the sidebar (default: ${DEFAULT-VALUE})",
			defaultValue = ScrapeConfig.DEFAULT_URL)
	String url;

	@Option(
			names = {"-o", "--output-dir"},
			description = "Directory to store extracted documents (default: output)",
			defaultValue = "output")
	Path outputDir;

	@Option(
			names = {"--cache-file"},
			description = "Structure cache file (default: <output-dir>/.cache/sidebar_structure.json)")
	Path cacheFile;

	@Option(
			names = {"--no-cache"},
			description = "Ignore the structure cache and always discover the sidebar live")
	boolean noCache;

	@Option(
			names = {"--headed"},
			description = "Show the browser window instead of running headless")
	boolean headed;

	@Option(
			names = {"--max-expand-attempts"},
			description = "Maximum number of sidebar expansion rounds (default: 15)",
			defaultValue = "15")
	int maxExpandAttempts;

	@Option(
			names = {"--navigation-timeout"},
			description = "Seconds to wait for page navigation (default: 15)",
			defaultValue = "15")
	long navigationTimeout;

	@Option(
			names = {"--sidebar-timeout"},
			description = "Seconds to wait for the sidebar to appear (default: 45)",
			defaultValue = "45")
	long sidebarTimeout;

	@Option(
			names = {"--content-timeout"},
			description = "Seconds to wait for an item's content to render (default: 15)",
			defaultValue = "15")
	long contentTimeout;

	ScrapeConfig toConfig(ExpansionOverrides overrides) {
		ScrapeConfig defaults = ScrapeConfig.defaults(url, outputDir);
		return new ScrapeConfig(
				url,
				outputDir,
				cacheFile,
				!noCache,
				!headed,
				overrides,
				maxExpandAttempts,
				defaults.expandDelay(),
				defaults.postExpandSettle(),
				defaults.loaderTimeout(),
				Duration.ofSeconds(navigationTimeout),
				Duration.ofSeconds(sidebarTimeout),
				Duration.ofSeconds(contentTimeout));
	}
}
