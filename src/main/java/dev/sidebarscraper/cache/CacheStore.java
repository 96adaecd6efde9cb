package dev.sidebarscraper.cache;

import dev.sidebarscraper.model.SidebarStructure;
import java.io.IOException;
import java.util.Optional;

/** Persists a discovered sidebar structure between runs */
public interface CacheStore {

	/**
	 * Load the cached structure. Anything that fails validation is reported as a miss, never as a
	 * partially trusted structure.
	 */
	Optional<SidebarStructure> load();

	void save(SidebarStructure structure) throws IOException;

	/** Remove the cached structure, if any */
	void invalidate() throws IOException;
}
