package dev.sidebarscraper.cache;

import dev.sidebarscraper.model.CacheRecord;
import dev.sidebarscraper.model.SidebarItem;
import dev.sidebarscraper.model.SidebarStructure;
import dev.sidebarscraper.util.FileUtils;
import dev.sidebarscraper.util.HashUtils;
import dev.sidebarscraper.util.JsonUtils;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Stores the structure as a human-readable JSON file */
public class JsonCacheStore implements CacheStore {
	private static final Logger logger = LoggerFactory.getLogger(JsonCacheStore.class);

	private final Path cacheFile;
	private final String expectedSourceUrl;

	/**
	 * @param cacheFile location of the cache file
	 * @param expectedSourceUrl records captured from another URL are treated as a miss, null accepts
	 *     any
	 */
	public JsonCacheStore(Path cacheFile, String expectedSourceUrl) {
		this.cacheFile = cacheFile;
		this.expectedSourceUrl = expectedSourceUrl;
	}

	public Path cacheFile() {
		return cacheFile;
	}

	@Override
	public Optional<SidebarStructure> load() {
		if (!Files.isRegularFile(cacheFile)) {
			logger.debug("No cached structure at {}", cacheFile);
			return Optional.empty();
		}
		CacheRecord record;
		try {
			record = JsonUtils.read(cacheFile, CacheRecord.class);
		} catch (IOException e) {
			logger.warn("Ignoring unreadable cache {}: {}", cacheFile, e.getMessage());
			return Optional.empty();
		}
		if (record == null) {
			logger.warn("Ignoring empty cache {}", cacheFile);
			return Optional.empty();
		}
		if (record.schemaVersion() > CacheRecord.CURRENT_SCHEMA_VERSION || record.schemaVersion() < 1) {
			logger.warn(
					"Ignoring cache {} with unsupported schema version {}", cacheFile, record.schemaVersion());
			return Optional.empty();
		}
		if (expectedSourceUrl != null && !expectedSourceUrl.equals(record.sourceUrl())) {
			logger.warn("Ignoring cache {} captured from {}", cacheFile, record.sourceUrl());
			return Optional.empty();
		}
		if (hasNullEntries(record)) {
			logger.warn("Ignoring cache {}: null roots or items", cacheFile);
			return Optional.empty();
		}
		SidebarStructure structure;
		try {
			structure = record.toStructure();
			String checksum = checksum(structure);
			if (!checksum.equals(record.checksum())) {
				logger.warn("Ignoring cache {}: checksum mismatch", cacheFile);
				return Optional.empty();
			}
			if (record.totalItemCount() != structure.totalItemCount()
					|| record.validItemCount() != structure.validItemCount()) {
				logger.warn("Ignoring cache {}: recorded item counts do not match its items", cacheFile);
				return Optional.empty();
			}
			List<String> problems = CacheValidation.problems(structure);
			if (!problems.isEmpty()) {
				logger.warn("Ignoring cache {}: {}", cacheFile, String.join("; ", problems));
				return Optional.empty();
			}
		} catch (NullPointerException | IllegalArgumentException e) {
			logger.warn("Ignoring malformed cache {}: {}", cacheFile, e.toString());
			return Optional.empty();
		}
		logger.info(
				"Loaded cached structure from {} ({} items, captured {})",
				cacheFile,
				structure.totalItemCount(),
				structure.capturedAt());
		return Optional.of(structure);
	}

	@Override
	public void save(SidebarStructure structure) throws IOException {
		CacheRecord record = CacheRecord.of(structure, checksum(structure));
		FileUtils.writeAtomically(cacheFile, JsonUtils.toPrettyJson(record));
		logger.info("Cached structure with {} items to {}", structure.totalItemCount(), cacheFile);
	}

	@Override
	public void invalidate() throws IOException {
		if (Files.deleteIfExists(cacheFile)) {
			logger.info("Removed cached structure {}", cacheFile);
		}
	}

	private static boolean hasNullEntries(CacheRecord record) {
		if (record.roots() != null && record.roots().stream().anyMatch(Objects::isNull)) {
			return true;
		}
		return record.items() != null
				&& record.items().entrySet().stream().anyMatch(e -> e.getKey() == null || e.getValue() == null);
	}

	static String checksum(SidebarStructure structure) {
		try {
			return HashUtils.sha256(JsonUtils.toCanonicalJson(new Checksummed(structure.roots(), structure.items())));
		} catch (IOException e) {
			throw new IllegalStateException("Structure cannot be serialized", e);
		}
	}

	record Checksummed(List<String> roots, Map<String, SidebarItem> items) {}
}
