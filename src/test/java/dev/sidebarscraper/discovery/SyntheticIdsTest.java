package dev.sidebarscraper.discovery;

import static org.assertj.core.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class SyntheticIdsTest {

	@Test
	void testDeterministic() {
		// When
		String first = SyntheticIds.of(List.of("Endpoints", "Users"), "Delete User", 2);
		String second = SyntheticIds.of(List.of("Endpoints", "Users"), "Delete User", 2);

		// Then
		assertThat(first).isEqualTo(second);
		assertThat(first).startsWith("sid-").hasSize(4 + 16);
		assertThat(first.substring(4)).matches("[0-9a-f]{16}");
	}

	@Test
	void testDependsOnPathAndLevel() {
		// When
		String base = SyntheticIds.of(List.of("A"), "Item", 1);

		// Then
		assertThat(SyntheticIds.of(List.of("B"), "Item", 1)).isNotEqualTo(base);
		assertThat(SyntheticIds.of(List.of("A"), "Item", 2)).isNotEqualTo(base);
		assertThat(SyntheticIds.of(List.of("A"), "Other", 1)).isNotEqualTo(base);
		assertThat(SyntheticIds.of(List.of("A", "B"), "C", 2)).isNotEqualTo(SyntheticIds.of(List.of("A"), "B C", 2));
	}
}
