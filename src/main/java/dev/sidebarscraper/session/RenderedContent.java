package dev.sidebarscraper.session;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshot of the content region. Response panels that are only rendered when their tab is active
 * are captured separately, keyed by tab label.
 */
public record RenderedContent(String url, String html, Map<String, String> responsePanels) {

	public RenderedContent {
		responsePanels = responsePanels == null ? Map.of() : new LinkedHashMap<>(responsePanels);
	}

	public static RenderedContent of(String url, String html) {
		return new RenderedContent(url, html, Map.of());
	}
}
