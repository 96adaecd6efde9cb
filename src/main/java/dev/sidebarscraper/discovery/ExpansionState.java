package dev.sidebarscraper.discovery;

/** Whether the sidebar has been fully expanded during the current process session */
public enum ExpansionState {
	PENDING,
	DONE
}
