package dev.sidebarscraper.discovery;

import java.util.List;

/**
 * CSS selectors describing the sidebar of one documentation site. The defaults match the Dell
 * developer portal's Angular sidebar.
 */
public record SidebarSelectors(
		String container,
		String rootWrapper,
		String itemWrapper,
		String header,
		String headerText,
		String clickable,
		String itemText,
		String menuText,
		String collapsedToggle,
		String expandedToggle,
		String loaderOverlay,
		List<String> skipTitles) {

	public SidebarSelectors {
		skipTitles = skipTitles == null ? List.of() : List.copyOf(skipTitles);
	}

	public static SidebarSelectors defaults() {
		return new SidebarSelectors(
				"div.filter-api-sidebar-wrapper",
				"app-api-doc-sidebar",
				"app-api-doc-item",
				"li.toc-item-divider",
				"a",
				"li.toc-item-highlight.clickable",
				"span[id$='-sp']",
				"div.align-middle.dds__text-truncate.dds__position-relative",
				"i.dds__icon--chevron-right",
				"i.dds__icon--chevron-down",
				"#loaderActive",
				List.of("Overview"));
	}
}
