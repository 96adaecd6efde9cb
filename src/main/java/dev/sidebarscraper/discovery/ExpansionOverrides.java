package dev.sidebarscraper.discovery;

/** User overrides that force expansion of a cached structure */
public record ExpansionOverrides(boolean force, boolean forceFullExpansion, boolean validateCache) {

	public static ExpansionOverrides none() {
		return new ExpansionOverrides(false, false, false);
	}

	public boolean any() {
		return force || forceFullExpansion || validateCache;
	}
}
