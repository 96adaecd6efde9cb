package dev.sidebarscraper.resume;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

class OutputPathsTest {

	@Test
	void testSlugify_Basic() {
		// When/Then
		assertThat(OutputPaths.slugify("List Users")).isEqualTo("list-users");
		assertThat(OutputPaths.slugify("GET /api/v1/users")).isEqualTo("get-api-v1-users");
		assertThat(OutputPaths.slugify("snake_case  and\\slashes")).isEqualTo("snake-case-and-slashes");
	}

	@Test
	void testSlugify_Accents() {
		// When/Then
		assertThat(OutputPaths.slugify("Café Überblick")).isEqualTo("cafe-uberblick");
	}

	@Test
	void testSlugify_StripsPunctuationAndEdges() {
		// When/Then
		assertThat(OutputPaths.slugify("  (Beta) Orders!  ")).isEqualTo("beta-orders");
		assertThat(OutputPaths.slugify("...v2.0...")).isEqualTo("v2.0");
	}

	@Test
	void testSlugify_Empty() {
		// When/Then
		assertThat(OutputPaths.slugify("")).isEqualTo("untitled");
		assertThat(OutputPaths.slugify("!!!")).isEqualTo("untitled");
		assertThat(OutputPaths.slugify(null)).isEqualTo("untitled");
	}

	@Test
	void testSlugify_Capped() {
		// When
		String slug = OutputPaths.slugify("a".repeat(150));

		// Then
		assertThat(slug).hasSize(100);
	}
}
