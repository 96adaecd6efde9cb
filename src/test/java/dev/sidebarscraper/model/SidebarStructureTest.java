package dev.sidebarscraper.model;

import static org.assertj.core.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SidebarStructureTest {

	@Test
	void testLeavesAndAncestors() {
		// Given
		SidebarStructure structure = Structures.nested();

		// When/Then
		assertThat(structure.leaves())
				.extracting(SidebarItem::id)
				.containsExactly("list-users", "create-user", "user");
		assertThat(structure.ancestors("create-user"))
				.extracting(SidebarItem::id)
				.containsExactly("endpoints", "users");
		assertThat(structure.ancestors("endpoints")).isEmpty();
		assertThat(structure.ancestors("missing")).isEmpty();
	}

	@Test
	void testCounts() {
		// Given
		SidebarStructure structure = Structures.nested();

		// When/Then
		assertThat(structure.totalItemCount()).isEqualTo(6);
		assertThat(structure.validItemCount()).isEqualTo(4);
		assertThat(structure.isWellFormed()).isTrue();
		assertThat(structure.validate()).isEmpty();
	}

	@Test
	void testValidate_DanglingChild() {
		// Given
		Map<String, SidebarItem> items = new LinkedHashMap<>(Structures.nested().items());
		items.remove("user");
		SidebarStructure structure =
				new SidebarStructure(Structures.SOURCE_URL, Structures.CAPTURED_AT, List.of("endpoints", "models"), items);

		// When
		List<String> problems = structure.validate();

		// Then
		assertThat(problems).isNotEmpty();
		assertThat(problems).anyMatch(p -> p.contains("user"));
		assertThat(structure.isWellFormed()).isFalse();
	}

	@Test
	void testValidate_WrongParent() {
		// Given
		Map<String, SidebarItem> items = new LinkedHashMap<>(Structures.nested().items());
		items.put("user", new SidebarItem("user", "User", 1, "endpoints", List.of(), false, "id:user"));
		SidebarStructure structure =
				new SidebarStructure(Structures.SOURCE_URL, Structures.CAPTURED_AT, List.of("endpoints", "models"), items);

		// When/Then
		assertThat(structure.isWellFormed()).isFalse();
	}

	@Test
	void testItemIsLeaf() {
		// Given
		SidebarItem page = new SidebarItem("p", "Page", 1, "h", List.of(), false, "id:p");
		SidebarItem emptyMenu = new SidebarItem("m", "Menu", 1, "h", List.of(), true, "id:m");
		SidebarItem header = new SidebarItem("h", "Header", 0, null, List.of(), false, null);

		// When/Then
		assertThat(page.isLeaf()).isTrue();
		assertThat(emptyMenu.isLeaf()).isFalse();
		assertThat(header.isLeaf()).isFalse();
		assertThat(header.isRoot()).isTrue();
		assertThat(header.isValid()).isFalse();
	}

	@Test
	void testTargetRefParse() {
		// When/Then
		assertThat(TargetRef.parse("id:abc")).isEqualTo(new TargetRef(TargetRef.Kind.ID, "abc"));
		assertThat(TargetRef.parse(TargetRef.ofText(List.of("List: Users"))))
				.isEqualTo(new TargetRef(TargetRef.Kind.TEXT, "List: Users"));
		assertThatThrownBy(() -> TargetRef.parse("css:.x")).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void testTargetRef_TitlePath() {
		// Given
		String ref = TargetRef.ofText(List.of("Endpoints", "Users", "Get"));

		// When
		TargetRef parsed = TargetRef.parse(ref);

		// Then
		assertThat(ref).isEqualTo("text:Endpoints > Users > Get");
		assertThat(parsed.titlePath()).containsExactly("Endpoints", "Users", "Get");
		assertThat(parsed.title()).isEqualTo("Get");
		assertThatThrownBy(() -> TargetRef.ofText(List.of())).isInstanceOf(IllegalArgumentException.class);
	}
}
