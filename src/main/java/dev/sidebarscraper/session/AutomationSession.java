package dev.sidebarscraper.session;

import dev.sidebarscraper.extraction.NavigationException;
import java.time.Duration;
import java.util.List;

/**
 * An exclusively owned connection to a rendered page. Implementations are not thread-safe and a
 * session must never be shared between concurrently running tasks.
 *
 * <p>Nodes are addressed through opaque refs: toggle refs come from {@link #findCollapsedToggles()},
 * target refs from a parsed {@link dev.sidebarscraper.model.SidebarItem}.
 */
public interface AutomationSession extends AutoCloseable {

	void navigate(String url, Duration timeout) throws NavigationException;

	/** Wait until the navigation container is observable */
	boolean waitForSidebar(Duration timeout);

	/** Refs of all toggles inside the sidebar that are currently collapsed */
	List<String> findCollapsedToggles();

	/**
	 * Trigger expansion of a collapsed toggle and wait, bounded, for the page to finish loading.
	 *
	 * @return false if the toggle could not be clicked
	 */
	boolean expand(String toggleRef);

	/** Give the page time to render newly revealed nodes */
	void settle(Duration duration);

	/** Snapshot of the navigation container's HTML */
	String readSidebarHtml();

	/** Expand the container behind a target ref unless it is already expanded */
	boolean revealChildren(String targetRef);

	void click(String targetRef, Duration timeout) throws NavigationException;

	/** Wait until the content region is present and no loader is showing */
	boolean waitForContent(Duration timeout);

	RenderedContent readContent();

	@Override
	void close();
}
