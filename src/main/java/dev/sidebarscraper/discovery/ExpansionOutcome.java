package dev.sidebarscraper.discovery;

import java.util.Optional;

/** What a run of the expansion loop achieved */
public record ExpansionOutcome(int rounds, int expanded, boolean converged, PartialExpansionWarning warning) {

	public static ExpansionOutcome skipped() {
		return new ExpansionOutcome(0, 0, true, null);
	}

	public Optional<PartialExpansionWarning> partial() {
		return Optional.ofNullable(warning);
	}
}
