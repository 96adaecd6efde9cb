package dev.sidebarscraper.discovery;

/** Non-fatal: the expansion loop hit its round limit while collapsed nodes were still appearing */
public record PartialExpansionWarning(int rounds, int remainingCollapsed) {

	@Override
	public String toString() {
		return "Sidebar expansion stopped after %d rounds with %d collapsed nodes left; structure may be incomplete"
				.formatted(rounds, remainingCollapsed);
	}
}
