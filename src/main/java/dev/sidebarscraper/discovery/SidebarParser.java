package dev.sidebarscraper.discovery;

import dev.sidebarscraper.model.SidebarStructure;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a sidebar HTML snapshot into a {@link SidebarStructure}. Both the hierarchical layout and the
 * flat layout with trailing headers are understood.
 */
public class SidebarParser {
	private static final Logger logger = LoggerFactory.getLogger(SidebarParser.class);

	static final String DEFAULT_HEADER = "API Documentation";

	private final SelectorEngine engine;
	private final Set<String> skipTitles;

	public SidebarParser(SelectorEngine engine, List<String> skipTitles) {
		this.engine = engine;
		this.skipTitles = Set.copyOf(skipTitles);
	}

	public SidebarStructure parse(String html, String sourceUrl, Instant capturedAt) throws StructureParseException {
		Element rootList = rootList(html);
		StructureVariant variant = detectVariant(rootList);
		logger.debug("Detected sidebar variant {}", variant);

		StructureBuilder builder = new StructureBuilder();
		switch (variant) {
			case HIERARCHICAL -> parseHierarchical(rootList, builder);
			case FLAT_WITH_TRAILING_HEADER -> parseFlat(rootList, builder);
		}
		if (builder.size() == 0) {
			throw new StructureParseException("Sidebar contained no usable entries");
		}
		SidebarStructure structure = builder.build(sourceUrl, capturedAt);
		logger.info(
				"Parsed {} sidebar items ({} valid, {} pages) using {} layout",
				structure.totalItemCount(),
				structure.validItemCount(),
				structure.leaves().size(),
				variant);
		return structure;
	}

	/** Detect the layout of a snapshot without building a structure */
	public StructureVariant detectVariant(String html) throws StructureParseException {
		return detectVariant(rootList(html));
	}

	StructureVariant detectVariant(Element rootList) throws StructureParseException {
		List<Element> entries = relevantEntries(rootList);
		if (entries.isEmpty()) {
			throw new StructureParseException("Sidebar list has neither headers nor items");
		}
		if (engine.isHeader(entries.get(0))) {
			return StructureVariant.HIERARCHICAL;
		}
		for (Element entry : entries) {
			if (engine.childList(entry).map(list -> !engine.entries(list).isEmpty()).orElse(false)) {
				return StructureVariant.HIERARCHICAL;
			}
		}
		return StructureVariant.FLAT_WITH_TRAILING_HEADER;
	}

	private Element rootList(String html) throws StructureParseException {
		if (html == null || html.isBlank()) {
			throw new StructureParseException("Sidebar snapshot is empty");
		}
		Document document = Jsoup.parseBodyFragment(html);
		Element container = engine.findContainer(document.body())
				.orElseThrow(() -> new StructureParseException("Sidebar container not present in snapshot"));
		return engine.findRootList(container)
				.orElseThrow(() -> new StructureParseException("Sidebar container has no list"));
	}

	private List<Element> relevantEntries(Element list) {
		List<Element> relevant = new ArrayList<>();
		for (Element entry : engine.entries(list)) {
			if (engine.isHeader(entry) || engine.isClickable(entry)) {
				relevant.add(entry);
			}
		}
		return relevant;
	}

	private void parseHierarchical(Element rootList, StructureBuilder builder) {
		String currentHeader = null;
		for (Element entry : relevantEntries(rootList)) {
			if (engine.isHeader(entry)) {
				currentHeader = builder.addHeader(titleOr(entry, "Unknown Header"));
			} else {
				if (currentHeader == null) {
					logger.warn("Found sidebar item before the first header, grouping under '{}'", DEFAULT_HEADER);
					currentHeader = builder.addHeader(DEFAULT_HEADER);
				}
				addItem(builder, currentHeader, entry);
			}
		}
	}

	private void parseFlat(Element rootList, StructureBuilder builder) {
		List<Element> pending = new ArrayList<>();
		String lastHeader = null;
		for (Element entry : relevantEntries(rootList)) {
			if (engine.isHeader(entry)) {
				lastHeader = builder.addHeader(titleOr(entry, "Unknown Header"));
				for (Element item : pending) {
					addItem(builder, lastHeader, item);
				}
				pending.clear();
			} else {
				pending.add(entry);
			}
		}
		if (!pending.isEmpty()) {
			if (lastHeader == null) {
				lastHeader = builder.addHeader(DEFAULT_HEADER);
			}
			logger.debug("Assigning {} trailing items to the last header", pending.size());
			for (Element item : pending) {
				addItem(builder, lastHeader, item);
			}
		}
	}

	private void addItem(StructureBuilder builder, String parentId, Element entry) {
		String title = engine.text(entry);
		if (title.isEmpty()) {
			logger.warn("Skipping sidebar entry without text: {}", engine.declaredId(entry).orElse("<no id>"));
			return;
		}
		if (skipTitles.contains(title)) {
			logger.debug("Skipping '{}'", title);
			return;
		}
		boolean expandable = engine.isExpandable(entry);
		String id = builder.addItem(parentId, title, expandable, engine.declaredId(entry).orElse(null));
		Optional<Element> children = engine.childList(entry);
		if (children.isPresent()) {
			for (Element child : engine.entries(children.get())) {
				if (engine.isClickable(child)) {
					addItem(builder, id, child);
				}
			}
		}
	}

	private String titleOr(Element entry, String fallback) {
		String title = engine.text(entry);
		return title.isEmpty() ? fallback : title;
	}
}
