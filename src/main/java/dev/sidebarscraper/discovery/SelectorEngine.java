package dev.sidebarscraper.discovery;

import java.util.List;
import java.util.Optional;
import org.jsoup.nodes.Element;

/**
 * Answers questions about nodes of a sidebar snapshot. The parser only talks to this interface, so
 * the concrete selector syntax of a site stays out of the parsing logic.
 */
public interface SelectorEngine {

	Optional<Element> findContainer(Element snapshot);

	Optional<Element> findRootList(Element container);

	/** Entries of a list in declared order. Nested child lists are not entries. */
	List<Element> entries(Element list);

	boolean isHeader(Element entry);

	boolean isClickable(Element entry);

	/** True if the entry carries a toggle, collapsed or expanded */
	boolean isExpandable(Element entry);

	/** Visible text of the entry, empty if there is none */
	String text(Element entry);

	Optional<String> declaredId(Element entry);

	/** The list holding the entry's children, if any */
	Optional<Element> childList(Element entry);
}
