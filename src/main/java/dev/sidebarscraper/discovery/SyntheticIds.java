package dev.sidebarscraper.discovery;

import dev.sidebarscraper.util.HashUtils;
import java.util.List;

/**
 * Deterministic ids for items the page does not identify itself. The same ancestor titles, title and
 * level always give the same id, across runs and machines.
 */
public final class SyntheticIds {
	public static final String PREFIX = "sid-";
	private static final int HASH_LENGTH = 16;
	private static final char SEPARATOR = '\u001f';

	private SyntheticIds() {}

	public static String of(List<String> ancestorTitles, String title, int level) {
		StringBuilder key = new StringBuilder();
		for (String ancestor : ancestorTitles) {
			key.append(ancestor).append(SEPARATOR);
		}
		key.append(title).append('|').append(level);
		return PREFIX + HashUtils.sha256(key.toString()).substring(0, HASH_LENGTH);
	}
}
