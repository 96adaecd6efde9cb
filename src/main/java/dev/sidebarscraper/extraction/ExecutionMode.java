package dev.sidebarscraper.extraction;

/** How a run's tasks were scheduled */
public enum ExecutionMode {
	SEQUENTIAL,
	PARALLEL,
	/** Started in parallel, finished sequentially after too many failures */
	HYBRID
}
