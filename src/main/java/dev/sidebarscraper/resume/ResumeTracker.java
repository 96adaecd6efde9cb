package dev.sidebarscraper.resume;

import dev.sidebarscraper.model.SidebarItem;
import dev.sidebarscraper.model.SidebarStructure;
import dev.sidebarscraper.util.JsonUtils;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Works out which pages still need extracting by looking at what is already on disk */
public class ResumeTracker {
	private static final Logger logger = LoggerFactory.getLogger(ResumeTracker.class);

	/**
	 * Partition the structure's leaf items. Reads the file system but never changes it.
	 *
	 * @param force treat every leaf as pending regardless of existing output
	 */
	public ResumeState partition(SidebarStructure structure, Path outputRoot, boolean force) {
		Set<String> done = new LinkedHashSet<>();
		List<String> pending = new ArrayList<>();
		for (SidebarItem leaf : structure.leaves()) {
			if (!force && isMaterialized(outputPath(structure, outputRoot, leaf))) {
				done.add(leaf.id());
			} else {
				pending.add(leaf.id());
			}
		}
		logger.debug("Resume partition: {} done, {} pending (force: {})", done.size(), pending.size(), force);
		return new ResumeState(done, pending);
	}

	public ResumeReport report(SidebarStructure structure, Path outputRoot) {
		ResumeState state = partition(structure, outputRoot, false);
		List<ResumeReport.PendingItem> pendingItems = new ArrayList<>();
		for (String id : state.pending()) {
			SidebarItem item = structure.items().get(id);
			pendingItems.add(new ResumeReport.PendingItem(item.title(), id));
		}
		return new ResumeReport(state.total(), state.done().size(), state.pending().size(), pendingItems);
	}

	public static Path outputPath(SidebarStructure structure, Path outputRoot, SidebarItem item) {
		return OutputPaths.pathFor(outputRoot, structure, item);
	}

	/** An output file counts as done only if it exists and holds a readable document */
	public static boolean isMaterialized(Path outputFile) {
		return JsonUtils.isValidDocument(outputFile);
	}
}
