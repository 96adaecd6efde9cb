package dev.sidebarscraper.extraction;

import dev.sidebarscraper.model.SidebarItem;
import dev.sidebarscraper.model.SidebarStructure;
import dev.sidebarscraper.resume.ResumeTracker;
import java.nio.file.Path;
import java.util.List;

/**
 * Everything a worker needs to extract one page: the item, its ancestors outermost first and the
 * output location. Workers never see the whole structure.
 */
public record ExtractionTask(SidebarItem item, List<SidebarItem> ancestors, Path outputPath) {

	public ExtractionTask {
		ancestors = List.copyOf(ancestors);
	}

	public static ExtractionTask of(SidebarStructure structure, String itemId, Path outputRoot) {
		SidebarItem item = structure.item(itemId)
				.orElseThrow(() -> new IllegalArgumentException("Unknown item " + itemId));
		return new ExtractionTask(
				item, structure.ancestors(itemId), ResumeTracker.outputPath(structure, outputRoot, item));
	}

	public List<String> breadcrumb() {
		return ancestors.stream().map(SidebarItem::title).toList();
	}
}
