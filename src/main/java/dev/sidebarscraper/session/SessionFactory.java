package dev.sidebarscraper.session;

/** Opens new, independent automation sessions */
public interface SessionFactory {

	/**
	 * Start a fresh session. The caller owns it and must close it.
	 *
	 * @throws SessionStartException if the underlying browser could not be started
	 */
	AutomationSession open() throws SessionStartException;
}
