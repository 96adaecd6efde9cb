package dev.sidebarscraper;

import dev.sidebarscraper.discovery.DiscoveryException;
import dev.sidebarscraper.discovery.ExpansionOverrides;
import dev.sidebarscraper.reporting.ProgressReporter;
import dev.sidebarscraper.resume.ResumeReport;
import dev.sidebarscraper.session.SessionStartException;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

/** Print which items are already extracted and which are still pending */
@Command(
		name = "resume-info",
		description = "Show extraction progress for the output directory",
		mixinStandardHelpOptions = true)
public class ResumeInfoCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Mixin
	SiteOptions site;

	@Option(
			names = {"--show-pending"},
			description = "Number of pending items to list (default: 10)",
			defaultValue = "10")
	private int showPending;

	@Override
	public Integer call() throws Exception {
		ScrapeConfig config = site.toConfig(ExpansionOverrides.none());
		try (ProgressReporter reporter = new ProgressReporter(0)) {
			ScrapeComponents components = ScrapeComponents.create(config, reporter);
			ResumeReport report =
					components.runner().resumeReport(config.discoveryOptions(), config.extractionConfig());

			System.out.println("Resume Information");
			System.out.println("==================");
			System.out.println("Output directory: " + config.outputDir().toAbsolutePath());
			System.out.println("Total items: " + report.total());
			System.out.println("Already extracted: " + report.done());
			System.out.println("Pending: " + report.pending());
			System.out.println("Progress: %.1f%%".formatted(report.percentDone()));
			if (!report.pendingItems().isEmpty() && showPending > 0) {
				System.out.println();
				System.out.println("Pending items:");
				report.pendingItems().stream().limit(showPending).forEach(item -> System.out.println("  " + item));
				if (report.pendingItems().size() > showPending) {
					System.out.println("  ... and " + (report.pendingItems().size() - showPending) + " more");
				}
			}
			return 0;
		} catch (DiscoveryException | SessionStartException e) {
			logger.error("Could not discover the sidebar structure: {}", e.getMessage(), e);
			return 2;
		}
	}
}
