package dev.sidebarscraper.extraction;

import static org.assertj.core.api.Assertions.*;

import dev.sidebarscraper.Fixtures;
import dev.sidebarscraper.model.PageDocument;
import dev.sidebarscraper.model.SidebarStructure;
import dev.sidebarscraper.model.Structures;
import dev.sidebarscraper.model.TaskStatus;
import dev.sidebarscraper.session.RenderedContent;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PageContentExtractorTest {
	private static final Instant NOW = Instant.parse("2026-02-01T08:00:00Z");

	private final PageContentExtractor extractor = new PageContentExtractor(ContentSelectors.defaults());
	private final SidebarStructure structure = Structures.nested();
	private final ExtractionTask task = ExtractionTask.of(structure, "list-users", Path.of("out"));

	@Test
	void testExtract_Endpoint() throws Exception {
		// Given
		RenderedContent content = RenderedContent.of(Fixtures.SOURCE_URL + "#list-users", Fixtures.endpointPage());

		// When
		PageDocument document = extractor.extract(task, content, NOW);

		// Then
		assertThat(document.itemId()).isEqualTo("list-users");
		assertThat(document.title()).isEqualTo("List Users");
		assertThat(document.breadcrumb()).containsExactly("Endpoints", "Users");
		assertThat(document.method()).isEqualTo("GET");
		assertThat(document.path()).isEqualTo("/api/v1/users");
		assertThat(document.description()).isEqualTo("Returns all users visible to the caller.");
		assertThat(document.security()).isEqualTo("Bearer token");
		assertThat(document.server()).isEqualTo("https://api.example.com");
		assertThat(document.sourceUrl()).isEqualTo(Fixtures.SOURCE_URL + "#list-users");
		assertThat(document.extractedAt()).isEqualTo(NOW);
	}

	@Test
	void testExtract_Parameters() throws Exception {
		// Given
		RenderedContent content = RenderedContent.of(Fixtures.SOURCE_URL, Fixtures.endpointPage());

		// When
		PageDocument document = extractor.extract(task, content, NOW);

		// Then
		assertThat(document.parameters())
				.containsExactly(
						new PageDocument.Parameter("limit", "query", "integer", false, "Maximum number of results"),
						new PageDocument.Parameter("filter", "query", "string", true, "Filter expression"));
	}

	@Test
	void testExtract_SingleResponseTab() throws Exception {
		// Given
		RenderedContent content = RenderedContent.of(Fixtures.SOURCE_URL, Fixtures.endpointPage());

		// When
		PageDocument document = extractor.extract(task, content, NOW);

		// Then
		assertThat(document.responses()).singleElement().satisfies(response -> {
			assertThat(response.status()).isEqualTo("200");
			assertThat(response.description()).isEqualTo("OK");
			assertThat(response.body()).isEqualTo("{\"users\": []}");
		});
	}

	@Test
	void testExtract_CapturedResponsePanels() throws Exception {
		// Given
		Map<String, String> panels = new LinkedHashMap<>();
		panels.put("200", "<p>Created</p><pre>{\"id\": 1}</pre>");
		panels.put("400", "<p>Bad request</p>");
		RenderedContent content = new RenderedContent(Fixtures.SOURCE_URL, Fixtures.endpointPage(), panels);

		// When
		PageDocument document = extractor.extract(task, content, NOW);

		// Then
		assertThat(document.responses())
				.containsExactly(
						new PageDocument.Response("200", "Created", "{\"id\": 1}"),
						new PageDocument.Response("400", "Bad request", "Bad request"));
	}

	@Test
	void testExtract_Model() throws Exception {
		// Given
		ExtractionTask modelTask = ExtractionTask.of(structure, "user", Path.of("out"));
		RenderedContent content = RenderedContent.of(Fixtures.SOURCE_URL, Fixtures.load("model-page.html"));

		// When
		PageDocument document = extractor.extract(modelTask, content, NOW);

		// Then
		assertThat(document.title()).isEqualTo("User");
		assertThat(document.method()).isNull();
		assertThat(document.schemaFields())
				.extracting(PageDocument.SchemaField::name)
				.containsExactly("id", "email");
		assertThat(document.schemaFields().get(1).description()).isEqualTo("Primary e-mail address");
	}

	@Test
	void testExtract_MarkdownOnly() throws Exception {
		// Given
		RenderedContent content = RenderedContent.of(
				Fixtures.SOURCE_URL,
				"<div id=\"documentation\"><markdown><p>First</p></markdown><markdown><p>Second</p></markdown></div>");

		// When
		PageDocument document = extractor.extract(task, content, NOW);

		// Then
		assertThat(document.description()).isEqualTo("First\n\nSecond");
		assertThat(document.parameters()).isEmpty();
	}

	@Test
	void testExtract_EmptyContent() {
		// When/Then
		assertThatThrownBy(() -> extractor.extract(task, RenderedContent.of(Fixtures.SOURCE_URL, " "), NOW))
				.isInstanceOf(ExtractionException.class);
		assertThatThrownBy(() -> extractor.extract(
						task, RenderedContent.of(Fixtures.SOURCE_URL, "<div id=\"documentation\"> </div>"), NOW))
				.isInstanceOf(ExtractionException.class)
				.extracting(e -> ((ExtractionException) e).status())
				.isEqualTo(TaskStatus.EXTRACTION_ERROR);
	}
}
