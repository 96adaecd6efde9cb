package dev.sidebarscraper.discovery;

import dev.sidebarscraper.model.SidebarStructure;
import java.util.Optional;

/**
 * Outcome of {@link StructureDiscoverer#discover}. {@code nextState} must be passed to the next
 * discovery within the same session.
 */
public record DiscoveryResult(
		SidebarStructure structure,
		boolean fromCache,
		boolean expanded,
		ExpansionState nextState,
		PartialExpansionWarning warning,
		String html) {

	public Optional<PartialExpansionWarning> partialExpansion() {
		return Optional.ofNullable(warning);
	}

	/** Sidebar HTML the structure was parsed from; empty when nothing was parsed live */
	public Optional<String> sidebarSnapshot() {
		return Optional.ofNullable(html);
	}
}
