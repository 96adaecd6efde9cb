package dev.sidebarscraper.resume;

import dev.sidebarscraper.model.SidebarItem;
import dev.sidebarscraper.model.SidebarStructure;
import java.nio.file.Path;
import java.text.Normalizer;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/** Maps sidebar items to the location of their output document */
public final class OutputPaths {
	public static final String EXTENSION = ".json";

	private static final int MAX_SLUG_LENGTH = 100;
	private static final Pattern NON_ASCII = Pattern.compile("[^\\p{ASCII}]");
	private static final Pattern SEPARATORS = Pattern.compile("[-\\s_/\\\\]+");
	private static final Pattern DISALLOWED = Pattern.compile("[^\\w\\-.]");
	private static final Pattern EDGES = Pattern.compile("^[-_.]+|[-_.]+$");

	private OutputPaths() {}

	/**
	 * outputRoot/slug(ancestor)/.../slug(title).json. Siblings whose slugs collide get a numeric
	 * suffix in declared order, so the first keeps the plain name and later ones get -2, -3 and so on.
	 */
	public static Path pathFor(Path outputRoot, SidebarStructure structure, SidebarItem item) {
		Path path = outputRoot;
		for (SidebarItem ancestor : structure.ancestors(item.id())) {
			path = path.resolve(segment(structure, ancestor));
		}
		return path.resolve(segment(structure, item) + EXTENSION);
	}

	/** Path element of one item, unique among its siblings of the same kind */
	static String segment(SidebarStructure structure, SidebarItem item) {
		List<String> siblings = item.parentId() == null
				? structure.roots()
				: structure.item(item.parentId()).map(SidebarItem::children).orElse(List.of());
		// directories and .json files never clash with each other
		Set<String> taken = new HashSet<>();
		for (String siblingId : siblings) {
			SidebarItem sibling = structure.items().get(siblingId);
			if (sibling == null || sibling.isLeaf() != item.isLeaf()) {
				continue;
			}
			String slug = slugify(sibling.title());
			String candidate = slug;
			for (int n = 2; !taken.add(candidate); n++) {
				candidate = slug + "-" + n;
			}
			if (siblingId.equals(item.id())) {
				return candidate;
			}
		}
		return slugify(item.title());
	}

	/** File-system safe, lowercase version of a title; never empty */
	public static String slugify(String text) {
		if (text == null) {
			return "untitled";
		}
		String slug = Normalizer.normalize(text, Normalizer.Form.NFKD);
		slug = NON_ASCII.matcher(slug).replaceAll("");
		slug = SEPARATORS.matcher(slug).replaceAll("-");
		slug = DISALLOWED.matcher(slug).replaceAll("");
		slug = slug.toLowerCase(Locale.ROOT);
		slug = EDGES.matcher(slug).replaceAll("");
		if (slug.length() > MAX_SLUG_LENGTH) {
			slug = EDGES.matcher(slug.substring(0, MAX_SLUG_LENGTH)).replaceAll("");
		}
		return slug.isEmpty() ? "untitled" : slug;
	}
}
