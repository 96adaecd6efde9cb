package dev.sidebarscraper;

import dev.sidebarscraper.discovery.DiscoveryException;
import dev.sidebarscraper.discovery.DiscoveryResult;
import dev.sidebarscraper.discovery.ExpansionOverrides;
import dev.sidebarscraper.model.SidebarItem;
import dev.sidebarscraper.model.SidebarStructure;
import dev.sidebarscraper.reporting.ProgressReporter;
import dev.sidebarscraper.session.SessionStartException;
import dev.sidebarscraper.util.FileUtils;
import dev.sidebarscraper.util.JsonUtils;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

/** Discover and cache the sidebar structure without extracting anything */
@Command(
		name = "discover",
		description = "Discover the sidebar structure, cache it and print it as a tree",
		mixinStandardHelpOptions = true)
public class DiscoverCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Mixin
	SiteOptions site;

	@Option(
			names = {"--validate-cache"},
			description = "Compare the cached structure with the live sidebar and replace it when it differs")
	private boolean validateCache;

	@Option(
			names = {"--clear-cache"},
			description = "Delete the structure cache before discovering")
	private boolean clearCache;

	@Option(
			names = {"--max-depth"},
			description = "Deepest level printed in the tree (default: 1)",
			defaultValue = "1")
	private int maxDepth;

	@Option(
			names = {"--save-structure"},
			paramLabel = "FILE",
			description = "Also write the parsed structure as JSON to this file")
	private Path saveStructure;

	@Option(
			names = {"--save-html"},
			paramLabel = "FILE",
			description = "Also write the sidebar HTML the structure was parsed from to this file")
	private Path saveHtml;

	@Override
	public Integer call() throws Exception {
		ScrapeConfig config = site.toConfig(new ExpansionOverrides(false, false, validateCache));
		logger.info("Sidebar Scraper - Discover");
		logger.info("==========================");
		logger.info("Source URL: {}", config.sourceUrl());

		try (ProgressReporter reporter = new ProgressReporter(0)) {
			ScrapeComponents components = ScrapeComponents.create(config, reporter);
			if (clearCache) {
				components.cacheStore().invalidate();
			}
			DiscoveryResult result = components.runner().discover(config.discoveryOptions());
			saveDebugFiles(result);
			printTree(result.structure());
			System.out.println();
			System.out.println("Source: " + (result.fromCache() ? "cache" : "live sidebar"));
			System.out.println("Total items: " + result.structure().totalItemCount());
			System.out.println("Leaf items: " + result.structure().leaves().size());
			result.partialExpansion().ifPresent(w -> System.out.println("Warning: " + w));
			return 0;
		} catch (DiscoveryException | SessionStartException e) {
			logger.error("Could not discover the sidebar structure: {}", e.getMessage(), e);
			return 2;
		} catch (IOException e) {
			logger.error("I/O error: {}", e.getMessage(), e);
			return 1;
		}
	}

	private void saveDebugFiles(DiscoveryResult result) throws IOException {
		if (saveStructure != null) {
			FileUtils.writeAtomically(saveStructure, JsonUtils.toPrettyJson(result.structure()));
			logger.info("Saved structure to {}", saveStructure);
		}
		if (saveHtml != null) {
			Optional<String> html = result.sidebarSnapshot();
			if (html.isPresent()) {
				FileUtils.writeAtomically(saveHtml, html.get());
				logger.info("Saved sidebar HTML to {}", saveHtml);
			} else {
				logger.warn("Structure came from the cache, no sidebar HTML to save (use --clear-cache or --validate-cache)");
			}
		}
	}

	private void printTree(SidebarStructure structure) {
		for (String rootId : structure.roots()) {
			structure.item(rootId).ifPresent(root -> printItem(structure, root));
		}
	}

	private void printItem(SidebarStructure structure, SidebarItem item) {
		if (item.level() > maxDepth) {
			return;
		}
		String marker = item.isLeaf() ? "-" : "+";
		System.out.println("%s%s %s (%d)".formatted("  ".repeat(item.level()), marker, item.title(), item.children().size()));
		for (String childId : item.children()) {
			structure.item(childId).ifPresent(child -> printItem(structure, child));
		}
	}
}
