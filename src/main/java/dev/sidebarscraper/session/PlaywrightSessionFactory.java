package dev.sidebarscraper.session;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import dev.sidebarscraper.discovery.SidebarSelectors;
import dev.sidebarscraper.extraction.ContentSelectors;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts one Chromium per session. A Playwright instance is bound to the thread that created it, so
 * nothing is shared between sessions.
 */
public class PlaywrightSessionFactory implements SessionFactory {
	private static final Logger logger = LoggerFactory.getLogger(PlaywrightSessionFactory.class);

	private final boolean headless;
	private final SidebarSelectors sidebarSelectors;
	private final ContentSelectors contentSelectors;
	private final Duration loaderTimeout;

	public PlaywrightSessionFactory(
			boolean headless,
			SidebarSelectors sidebarSelectors,
			ContentSelectors contentSelectors,
			Duration loaderTimeout) {
		this.headless = headless;
		this.sidebarSelectors = sidebarSelectors;
		this.contentSelectors = contentSelectors;
		this.loaderTimeout = loaderTimeout;
	}

	@Override
	public AutomationSession open() throws SessionStartException {
		Playwright playwright = null;
		try {
			playwright = Playwright.create();
			Browser browser = playwright.chromium().launch(new BrowserType.LaunchOptions().setHeadless(headless));
			logger.debug("Started Chromium {} (headless: {})", browser.version(), headless);
			return new PlaywrightSession(playwright, browser, sidebarSelectors, contentSelectors, loaderTimeout);
		} catch (PlaywrightException e) {
			if (playwright != null) {
				playwright.close();
			}
			throw new SessionStartException("Failed to start browser: " + e.getMessage(), e);
		}
	}
}
