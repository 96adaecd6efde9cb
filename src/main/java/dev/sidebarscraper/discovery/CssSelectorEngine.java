package dev.sidebarscraper.discovery;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jsoup.nodes.Element;

/** {@link SelectorEngine} driven by the CSS selectors of {@link SidebarSelectors} */
public class CssSelectorEngine implements SelectorEngine {
	private static final String LIST_TAG = "ul";
	private static final String COMMENT_ARTIFACT = "<!---->";

	private final SidebarSelectors selectors;

	public CssSelectorEngine(SidebarSelectors selectors) {
		this.selectors = selectors;
	}

	@Override
	public Optional<Element> findContainer(Element snapshot) {
		if (snapshot.is(selectors.container())) {
			return Optional.of(snapshot);
		}
		return Optional.ofNullable(snapshot.selectFirst(selectors.container()));
	}

	@Override
	public Optional<Element> findRootList(Element container) {
		for (Element child : container.children()) {
			if (child.is(selectors.rootWrapper())) {
				for (Element nested : child.children()) {
					if (LIST_TAG.equals(nested.normalName())) {
						return Optional.of(nested);
					}
				}
			} else if (LIST_TAG.equals(child.normalName())) {
				return Optional.of(child);
			}
		}
		return Optional.ofNullable(container.selectFirst(LIST_TAG));
	}

	@Override
	public List<Element> entries(Element list) {
		List<Element> entries = new ArrayList<>();
		for (Element child : list.children()) {
			if (child.is(selectors.itemWrapper()) || "li".equals(child.normalName())) {
				entries.add(child);
			}
		}
		return entries;
	}

	@Override
	public boolean isHeader(Element entry) {
		return own(entry, selectors.header()).isPresent();
	}

	@Override
	public boolean isClickable(Element entry) {
		return !isHeader(entry) && own(entry, selectors.clickable()).isPresent();
	}

	@Override
	public boolean isExpandable(Element entry) {
		return own(entry, selectors.collapsedToggle()).isPresent()
				|| own(entry, selectors.expandedToggle()).isPresent();
	}

	@Override
	public String text(Element entry) {
		Optional<Element> header = own(entry, selectors.header());
		if (header.isPresent()) {
			return clean(own(header.get(), selectors.headerText()).orElse(header.get()).text());
		}
		Optional<Element> clickable = own(entry, selectors.clickable());
		if (clickable.isEmpty()) {
			return "";
		}
		String selector = isExpandable(entry) ? selectors.menuText() : selectors.itemText();
		return clean(own(clickable.get(), selector).orElse(clickable.get()).text());
	}

	@Override
	public Optional<String> declaredId(Element entry) {
		return own(entry, selectors.clickable()).map(Element::id).filter(id -> !id.isBlank());
	}

	@Override
	public Optional<Element> childList(Element entry) {
		Element sibling = entry.nextElementSibling();
		if (sibling != null && LIST_TAG.equals(sibling.normalName())) {
			return Optional.of(sibling);
		}
		for (Element candidate : entry.select(LIST_TAG)) {
			if (candidate != entry && !insideNestedList(candidate, entry)) {
				return Optional.of(candidate);
			}
		}
		return Optional.empty();
	}

	/** First match in the entry itself or below it, ignoring anything inside a nested list */
	private Optional<Element> own(Element entry, String selector) {
		if (entry.is(selector)) {
			return Optional.of(entry);
		}
		for (Element candidate : entry.select(selector)) {
			if (!insideNestedList(candidate, entry)) {
				return Optional.of(candidate);
			}
		}
		return Optional.empty();
	}

	private static boolean insideNestedList(Element element, Element entry) {
		for (Element p = element.parent(); p != null && p != entry; p = p.parent()) {
			if (LIST_TAG.equals(p.normalName())) {
				return true;
			}
		}
		return false;
	}

	private static String clean(String text) {
		return text.replace(COMMENT_ARTIFACT, "").replaceAll("\\s+", " ").trim();
	}
}
