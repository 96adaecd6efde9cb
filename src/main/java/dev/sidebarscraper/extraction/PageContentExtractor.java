package dev.sidebarscraper.extraction;

import dev.sidebarscraper.model.PageDocument;
import dev.sidebarscraper.session.RenderedContent;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

/** Builds a {@link PageDocument} from the rendered HTML of a documentation page */
public class PageContentExtractor {
	private static final String DEFAULT_STATUS = "default";

	private final ContentSelectors selectors;

	public PageContentExtractor(ContentSelectors selectors) {
		this.selectors = selectors;
	}

	public PageDocument extract(ExtractionTask task, RenderedContent content, Instant extractedAt)
			throws ExtractionException {
		if (content.html() == null || content.html().isBlank()) {
			throw new ExtractionException("Content pane is empty for " + task.item().title());
		}
		Element body = Jsoup.parseBodyFragment(content.html()).body();
		Element root = body.selectFirst(selectors.contentPane());
		if (root == null) {
			root = body;
		}

		String title = task.item().title();
		String method = null;
		String path = null;
		String description = null;
		String security = null;
		String server = null;
		String requestBody = null;
		List<PageDocument.Parameter> parameters = List.of();
		List<PageDocument.Response> responses = List.of();

		Element endpoint = root.selectFirst(selectors.endpoint());
		if (endpoint != null) {
			method = text(endpoint, selectors.method());
			String heading = text(endpoint, selectors.title());
			if (heading != null) {
				title = heading;
			}
			path = text(endpoint, selectors.path());
			description = text(endpoint, selectors.description());
			security = text(endpoint, selectors.security());
			server = text(endpoint, selectors.server());
			requestBody = text(endpoint, selectors.requestBody());
			parameters = parameters(endpoint);
			responses = responses(endpoint, content.responsePanels());
		} else {
			description = markdown(root);
		}

		Element model = root.selectFirst(selectors.model());
		List<PageDocument.SchemaField> schemaFields = model != null ? schemaFields(model) : List.of();

		if (endpoint == null && model == null && description == null) {
			String fallback = root.text().trim();
			if (fallback.isEmpty()) {
				throw new ExtractionException("No recognizable content for " + task.item().title());
			}
			description = fallback;
		}

		return new PageDocument(
				task.item().id(),
				title,
				task.breadcrumb(),
				method,
				path,
				description,
				security,
				server,
				parameters,
				requestBody,
				responses,
				schemaFields,
				content.url(),
				extractedAt);
	}

	private List<PageDocument.Parameter> parameters(Element endpoint) {
		List<PageDocument.Parameter> parameters = new ArrayList<>();
		for (Element section : endpoint.select(selectors.parameters())) {
			String location = location(section);
			for (Row row : rows(section)) {
				String name = row.get("name", 0);
				if (name == null || name.isBlank()) {
					continue;
				}
				String requiredCell = row.get("required", -1);
				boolean required = requiredCell != null
						? isTruthy(requiredCell)
						: name.toLowerCase(Locale.ROOT).contains("required") || name.endsWith("*");
				String cleanName =
						name.replaceAll("(?i)\\brequired\\b", "").replace("*", "").trim();
				parameters.add(new PageDocument.Parameter(
						cleanName, location, row.get("type", 1), required, row.get("description", row.size() - 1)));
			}
		}
		return parameters;
	}

	private List<PageDocument.Response> responses(Element endpoint, Map<String, String> panels) {
		List<PageDocument.Response> responses = new ArrayList<>();
		if (!panels.isEmpty()) {
			for (Map.Entry<String, String> panel : panels.entrySet()) {
				Element panelBody = Jsoup.parseBodyFragment(panel.getValue()).body();
				responses.add(response(panel.getKey(), panelBody));
			}
			return responses;
		}
		Element response = endpoint.selectFirst(selectors.response());
		if (response == null) {
			return responses;
		}
		Elements tabs = response.select(selectors.responseTab());
		String status = tabs.size() == 1 ? tabs.first().text().trim() : DEFAULT_STATUS;
		responses.add(response(status, response));
		return responses;
	}

	private PageDocument.Response response(String status, Element panel) {
		String description = text(panel, "p, " + selectors.markdown());
		String body = panel.select("pre").stream()
				.map(Element::wholeText)
				.map(String::trim)
				.filter(s -> !s.isEmpty())
				.collect(Collectors.joining("\n\n"));
		if (body.isEmpty()) {
			body = panel.text().trim();
		}
		return new PageDocument.Response(status.isBlank() ? DEFAULT_STATUS : status, description, blankToNull(body));
	}

	private List<PageDocument.SchemaField> schemaFields(Element model) {
		List<PageDocument.SchemaField> fields = new ArrayList<>();
		for (Row row : rows(model)) {
			String name = row.get("name", 0);
			if (name != null && !name.isBlank()) {
				fields.add(new PageDocument.SchemaField(name, row.get("type", 1), row.get("description", row.size() - 1)));
			}
		}
		return fields;
	}

	private String markdown(Element root) {
		String joined = root.select(selectors.markdown()).stream()
				.map(Element::text)
				.map(String::trim)
				.filter(s -> !s.isEmpty())
				.collect(Collectors.joining("\n\n"));
		return blankToNull(joined);
	}

	private static String location(Element section) {
		Element heading = section.selectFirst("h1, h2, h3, h4, h5, h6, strong");
		if (heading == null) {
			return null;
		}
		String text = heading.text().trim().toLowerCase(Locale.ROOT);
		for (String known : List.of("path", "query", "header", "cookie")) {
			if (text.startsWith(known)) {
				return known;
			}
		}
		return text.isEmpty() ? null : text;
	}

	private static List<Row> rows(Element scope) {
		List<Row> rows = new ArrayList<>();
		for (Element table : scope.select("table")) {
			List<String> headers = table.select("tr:has(th)").stream()
					.findFirst()
					.map(tr -> tr.select("th").stream()
							.map(th -> th.text().trim().toLowerCase(Locale.ROOT))
							.toList())
					.orElse(List.of());
			for (Element tr : table.select("tr")) {
				List<String> cells =
						tr.select("td").stream().map(td -> td.text().trim()).toList();
				if (!cells.isEmpty() && cells.stream().anyMatch(c -> !c.isEmpty())) {
					rows.add(new Row(headers, cells));
				}
			}
		}
		return rows;
	}

	private static String text(Element scope, String selector) {
		Element element = scope.selectFirst(selector);
		return element == null ? null : blankToNull(element.text().trim());
	}

	private static boolean isTruthy(String value) {
		String v = value.trim().toLowerCase(Locale.ROOT);
		return v.equals("yes") || v.equals("true") || v.equals("required") || v.equals("y");
	}

	private static String blankToNull(String value) {
		return value == null || value.isBlank() ? null : value;
	}

	/** Table row whose cells can be looked up by header name, falling back to position */
	private record Row(List<String> headers, List<String> cells) {
		int size() {
			return cells.size();
		}

		String get(String header, int fallbackIndex) {
			for (int i = 0; i < headers.size() && i < cells.size(); i++) {
				if (headers.get(i).contains(header)) {
					return blankToNull(cells.get(i));
				}
			}
			return fallbackIndex >= 0 && fallbackIndex < cells.size() ? blankToNull(cells.get(fallbackIndex)) : null;
		}
	}
}
