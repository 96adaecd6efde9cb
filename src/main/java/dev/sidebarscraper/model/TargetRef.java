package dev.sidebarscraper.model;

import java.util.Arrays;
import java.util.List;

/**
 * Opaque locator stored on a {@link SidebarItem}. A ref is either {@code id:<dom id>} when the page
 * declares an id, or {@code text:<title path>} otherwise. The title path lists the titles from the
 * root header down to the item, joined by {@value #PATH_SEPARATOR}.
 */
public record TargetRef(Kind kind, String value) {
	public enum Kind {
		ID,
		TEXT
	}

	public static final String PATH_SEPARATOR = " > ";

	private static final String ID_PREFIX = "id:";
	private static final String TEXT_PREFIX = "text:";

	public static String ofId(String id) {
		return ID_PREFIX + id;
	}

	public static String ofText(List<String> titlePath) {
		if (titlePath == null || titlePath.isEmpty()) {
			throw new IllegalArgumentException("Title path is empty");
		}
		return TEXT_PREFIX + String.join(PATH_SEPARATOR, titlePath);
	}

	public static TargetRef parse(String ref) {
		if (ref == null) {
			throw new IllegalArgumentException("Target ref is null");
		}
		if (ref.startsWith(ID_PREFIX)) {
			return new TargetRef(Kind.ID, ref.substring(ID_PREFIX.length()));
		}
		if (ref.startsWith(TEXT_PREFIX)) {
			return new TargetRef(Kind.TEXT, ref.substring(TEXT_PREFIX.length()));
		}
		throw new IllegalArgumentException("Unknown target ref: " + ref);
	}

	/** Titles from the outermost ancestor to the item; a single element for id refs */
	public List<String> titlePath() {
		if (kind == Kind.ID) {
			return List.of(value);
		}
		return Arrays.asList(value.split(PATH_SEPARATOR, -1));
	}

	/** The item's own title for text refs */
	public String title() {
		List<String> path = titlePath();
		return path.get(path.size() - 1);
	}
}
