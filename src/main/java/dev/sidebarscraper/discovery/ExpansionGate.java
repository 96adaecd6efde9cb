package dev.sidebarscraper.discovery;

/**
 * Decides whether the expansion loop has to run for a structure. The session state is passed in
 * and handed back instead of being kept in a global flag.
 *
 * <p>Note that a {@link ExpansionState#DONE} state suppresses expansion for every later cached
 * structure in the same session, even one loaded from a different cache file.
 */
public final class ExpansionGate {

	private ExpansionGate() {}

	public record Decision(boolean expand, ExpansionState next, String reason) {}

	public static Decision evaluate(boolean fromCache, ExpansionOverrides overrides, ExpansionState state) {
		if (!fromCache) {
			// a freshly loaded page always starts collapsed
			return new Decision(true, ExpansionState.DONE, "live parse");
		}
		if (state == ExpansionState.DONE) {
			return new Decision(false, ExpansionState.DONE, "already expanded this session");
		}
		if (overrides.any()) {
			return new Decision(true, ExpansionState.DONE, "override on cached structure");
		}
		return new Decision(false, state, "cached structure, no override");
	}
}
