package dev.sidebarscraper.discovery;

import java.time.Duration;

/** Settings for one structure discovery */
public record DiscoveryOptions(
		String sourceUrl,
		boolean useCache,
		ExpansionOverrides overrides,
		Duration navigationTimeout,
		Duration sidebarTimeout) {

	public static DiscoveryOptions defaults(String sourceUrl) {
		return new DiscoveryOptions(
				sourceUrl, true, ExpansionOverrides.none(), Duration.ofSeconds(15), Duration.ofSeconds(45));
	}

	public DiscoveryOptions withOverrides(ExpansionOverrides overrides) {
		return new DiscoveryOptions(sourceUrl, useCache, overrides, navigationTimeout, sidebarTimeout);
	}

	public DiscoveryOptions withUseCache(boolean useCache) {
		return new DiscoveryOptions(sourceUrl, useCache, overrides, navigationTimeout, sidebarTimeout);
	}
}
