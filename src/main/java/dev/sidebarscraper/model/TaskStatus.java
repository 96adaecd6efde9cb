package dev.sidebarscraper.model;

/** Outcome class of a single extraction task */
public enum TaskStatus {
	SUCCESS,
	EXTRACTION_ERROR,
	NAVIGATION_ERROR,
	TIMEOUT,
	RESOURCE_ERROR,
	SKIPPED;

	public boolean isFailure() {
		return this != SUCCESS && this != SKIPPED;
	}
}
