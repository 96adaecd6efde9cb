package dev.sidebarscraper.session;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.LoadState;
import com.microsoft.playwright.options.WaitForSelectorState;
import com.microsoft.playwright.options.WaitUntilState;
import dev.sidebarscraper.discovery.SidebarSelectors;
import dev.sidebarscraper.extraction.ContentSelectors;
import dev.sidebarscraper.extraction.NavigationException;
import dev.sidebarscraper.model.TargetRef;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link AutomationSession} backed by its own Playwright instance, browser and page */
public class PlaywrightSession implements AutomationSession {
	private static final Logger logger = LoggerFactory.getLogger(PlaywrightSession.class);

	private static final String REF_ATTRIBUTE = "data-scraper-ref";

	// Tags every matching toggle with a stable ref so it can be found again after re-renders
	private static final String TAG_TOGGLES_SCRIPT =
			"""
			(selector) => {
				window.__scraperRefSeq = window.__scraperRefSeq || 0;
				return Array.from(document.querySelectorAll(selector)).map(node => {
					let ref = node.getAttribute('data-scraper-ref');
					if (!ref) {
						ref = 'toggle-' + (++window.__scraperRefSeq);
						node.setAttribute('data-scraper-ref', ref);
					}
					return ref;
				});
			}""";

	private static final Duration TAB_SETTLE = Duration.ofMillis(500);
	private static final Duration NETWORK_IDLE_WAIT = Duration.ofSeconds(5);

	private final Playwright playwright;
	private final Browser browser;
	private final BrowserContext context;
	private final Page page;
	private final SidebarSelectors sidebar;
	private final ContentSelectors content;
	private final Duration loaderTimeout;

	PlaywrightSession(
			Playwright playwright,
			Browser browser,
			SidebarSelectors sidebar,
			ContentSelectors content,
			Duration loaderTimeout) {
		this.playwright = playwright;
		this.browser = browser;
		this.sidebar = sidebar;
		this.content = content;
		this.loaderTimeout = loaderTimeout;
		this.context = browser.newContext(new Browser.NewContextOptions().setViewportSize(1920, 1080));
		this.page = context.newPage();
	}

	@Override
	public void navigate(String url, Duration timeout) throws NavigationException {
		try {
			Response response = page.navigate(
					url,
					new Page.NavigateOptions()
							.setTimeout(timeout.toMillis())
							.setWaitUntil(WaitUntilState.DOMCONTENTLOADED));
			if (response != null && !response.ok()) {
				throw new NavigationException("HTTP status " + response.status() + " for " + url);
			}
		} catch (PlaywrightException e) {
			throw new NavigationException("Failed to navigate to " + url + ": " + e.getMessage(), e);
		}
	}

	@Override
	public boolean waitForSidebar(Duration timeout) {
		try {
			page.locator(sidebar.container())
					.first()
					.waitFor(new Locator.WaitForOptions()
							.setState(WaitForSelectorState.VISIBLE)
							.setTimeout(timeout.toMillis()));
			return true;
		} catch (TimeoutError e) {
			logger.debug("Sidebar {} not visible after {}", sidebar.container(), timeout);
			return false;
		}
	}

	@Override
	public List<String> findCollapsedToggles() {
		Object result = page.evaluate(TAG_TOGGLES_SCRIPT, sidebar.container() + " " + sidebar.collapsedToggle());
		List<String> refs = new ArrayList<>();
		if (result instanceof List<?> list) {
			for (Object ref : list) {
				refs.add(String.valueOf(ref));
			}
		}
		return refs;
	}

	@Override
	public boolean expand(String toggleRef) {
		Locator toggle = page.locator("[" + REF_ATTRIBUTE + "='" + toggleRef + "']");
		try {
			if (toggle.count() == 0) {
				return false;
			}
			toggle.first().scrollIntoViewIfNeeded();
			toggle.first().click();
			waitForLoader();
			return true;
		} catch (PlaywrightException e) {
			logger.debug("Could not expand {}: {}", toggleRef, e.getMessage());
			return false;
		}
	}

	@Override
	public void settle(Duration duration) {
		if (!duration.isZero() && !duration.isNegative()) {
			page.waitForTimeout(duration.toMillis());
		}
	}

	@Override
	public String readSidebarHtml() {
		Locator container = page.locator(sidebar.container()).first();
		if (container.count() == 0) {
			return "";
		}
		return (String) container.evaluate("el => el.outerHTML");
	}

	@Override
	public boolean revealChildren(String targetRef) {
		try {
			Locator item = resolve(targetRef).first();
			if (item.count() == 0) {
				return false;
			}
			Locator collapsed = item.locator(sidebar.collapsedToggle());
			if (collapsed.count() == 0) {
				return true;
			}
			collapsed.first().scrollIntoViewIfNeeded();
			collapsed.first().click();
			waitForLoader();
			return true;
		} catch (PlaywrightException e) {
			logger.debug("Could not reveal children of {}: {}", targetRef, e.getMessage());
			return false;
		}
	}

	@Override
	public void click(String targetRef, Duration timeout) throws NavigationException {
		try {
			Locator target = resolve(targetRef).first();
			target.waitFor(new Locator.WaitForOptions()
					.setState(WaitForSelectorState.ATTACHED)
					.setTimeout(timeout.toMillis()));
			target.scrollIntoViewIfNeeded();
			target.click(new Locator.ClickOptions().setTimeout(timeout.toMillis()));
		} catch (PlaywrightException e) {
			throw new NavigationException("Could not click " + targetRef + ": " + e.getMessage(), e);
		}
	}

	@Override
	public boolean waitForContent(Duration timeout) {
		try {
			page.locator(content.contentPane())
					.first()
					.waitFor(new Locator.WaitForOptions()
							.setState(WaitForSelectorState.VISIBLE)
							.setTimeout(timeout.toMillis()));
		} catch (TimeoutError e) {
			return false;
		}
		waitForLoader();
		try {
			page.waitForLoadState(
					LoadState.NETWORKIDLE,
					new Page.WaitForLoadStateOptions().setTimeout(NETWORK_IDLE_WAIT.toMillis()));
		} catch (TimeoutError e) {
			// long-polling pages never go idle
			logger.debug("Network not idle after {}, reading content anyway", NETWORK_IDLE_WAIT);
		}
		return true;
	}

	@Override
	public RenderedContent readContent() {
		Locator pane = page.locator(content.contentPane()).first();
		String html = pane.count() > 0 ? pane.innerHTML() : page.content();
		Map<String, String> panels = new LinkedHashMap<>();
		Locator tabs = pane.locator(content.response() + " " + content.responseTab());
		int tabCount = tabs.count();
		if (tabCount > 1) {
			for (int i = 0; i < tabCount; i++) {
				Locator tab = tabs.nth(i);
				String label = tab.innerText().trim();
				try {
					tab.click();
					page.waitForTimeout(TAB_SETTLE.toMillis());
					Locator panel = pane.locator(content.response() + " " + content.activeTabPanel())
							.first();
					if (panel.count() > 0) {
						panels.put(label, panel.innerHTML());
					}
				} catch (PlaywrightException e) {
					logger.warn("Failed to read response tab {}: {}", label, e.getMessage());
				}
			}
		}
		return new RenderedContent(page.url(), html, panels);
	}

	@Override
	public void close() {
		try {
			context.close();
		} finally {
			try {
				browser.close();
			} finally {
				playwright.close();
			}
		}
	}

	private Locator resolve(String targetRef) {
		TargetRef ref = TargetRef.parse(targetRef);
		return switch (ref.kind()) {
			case ID -> page.locator("[id='" + ref.value().replace("'", "\\'") + "']");
			case TEXT -> resolveTitlePath(ref.titlePath());
		};
	}

	/**
	 * Narrow the search to the item wrapper of each ancestor menu in turn. Headers are not DOM
	 * ancestors of their items and are passed over.
	 */
	private Locator resolveTitlePath(List<String> titlePath) {
		Locator scope = page.locator(sidebar.container()).first();
		for (String ancestor : titlePath.subList(0, titlePath.size() - 1)) {
			Locator menu = clickableTitled(scope, ancestor);
			if (menu.count() == 0) {
				continue;
			}
			// wrappers come in document order, the innermost one holding the menu is last
			scope = scope.locator(sidebar.itemWrapper())
					.filter(new Locator.FilterOptions().setHas(page.locator(sidebar.clickable())
							.filter(new Locator.FilterOptions()
									.setHasText(TextPatterns.exactText(ancestor)))))
					.last();
		}
		return clickableTitled(scope, titlePath.get(titlePath.size() - 1));
	}

	private Locator clickableTitled(Locator scope, String title) {
		return scope.locator(sidebar.clickable())
				.filter(new Locator.FilterOptions().setHasText(TextPatterns.exactText(title)));
	}

	private void waitForLoader() {
		try {
			page.locator(sidebar.loaderOverlay())
					.first()
					.waitFor(new Locator.WaitForOptions()
							.setState(WaitForSelectorState.HIDDEN)
							.setTimeout(loaderTimeout.toMillis()));
		} catch (TimeoutError e) {
			logger.warn("Loader {} still visible after {}", sidebar.loaderOverlay(), loaderTimeout);
		}
	}
}
