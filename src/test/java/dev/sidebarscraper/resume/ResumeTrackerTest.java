package dev.sidebarscraper.resume;

import static org.assertj.core.api.Assertions.*;

import dev.sidebarscraper.model.SidebarItem;
import dev.sidebarscraper.model.SidebarStructure;
import dev.sidebarscraper.model.Structures;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ResumeTrackerTest {

	@TempDir
	Path tempDir;

	private final ResumeTracker tracker = new ResumeTracker();

	@Test
	void testPartition_NothingOnDisk() {
		// Given
		SidebarStructure structure = Structures.nested();

		// When
		ResumeState state = tracker.partition(structure, tempDir, false);

		// Then
		assertThat(state.done()).isEmpty();
		assertThat(state.pending()).containsExactly("list-users", "create-user", "user");
		assertThat(state.total()).isEqualTo(3);
		assertThat(state.isComplete()).isFalse();
	}

	@Test
	void testPartition_ExistingDocumentsAreDone() throws Exception {
		// Given
		SidebarStructure structure = Structures.nested();
		writeDocument(tempDir.resolve("endpoints/users/list-users.json"), "List Users");

		// When
		ResumeState state = tracker.partition(structure, tempDir, false);

		// Then
		assertThat(state.done()).containsExactly("list-users");
		assertThat(state.pending()).containsExactly("create-user", "user");
	}

	@Test
	void testPartition_ForceIgnoresExistingDocuments() throws Exception {
		// Given
		SidebarStructure structure = Structures.nested();
		writeDocument(tempDir.resolve("endpoints/users/list-users.json"), "List Users");

		// When
		ResumeState state = tracker.partition(structure, tempDir, true);

		// Then
		assertThat(state.done()).isEmpty();
		assertThat(state.pending()).hasSize(3);
	}

	@Test
	void testPartition_InvalidDocumentsArePending() throws Exception {
		// Given
		SidebarStructure structure = Structures.nested();
		Path empty = tempDir.resolve("endpoints/users/list-users.json");
		Files.createDirectories(empty.getParent());
		Files.writeString(empty, "");
		Files.writeString(tempDir.resolve("endpoints/users/create-user.json"), "{ truncated");
		Files.createDirectories(tempDir.resolve("models"));
		Files.writeString(tempDir.resolve("models/user.json"), "{\"title\": \"\"}");

		// When
		ResumeState state = tracker.partition(structure, tempDir, false);

		// Then
		assertThat(state.done()).isEmpty();
		assertThat(state.pending()).containsExactly("list-users", "create-user", "user");
	}

	@Test
	void testPartition_DoesNotTouchFileSystem() throws Exception {
		// Given
		SidebarStructure structure = Structures.nested();

		// When
		tracker.partition(structure, tempDir, false);

		// Then
		try (var files = Files.list(tempDir)) {
			assertThat(files).isEmpty();
		}
	}

	@Test
	void testReport() throws Exception {
		// Given
		SidebarStructure structure = Structures.nested();
		writeDocument(tempDir.resolve("models/user.json"), "User");

		// When
		ResumeReport report = tracker.report(structure, tempDir);

		// Then
		assertThat(report.total()).isEqualTo(3);
		assertThat(report.done()).isEqualTo(1);
		assertThat(report.pending()).isEqualTo(2);
		assertThat(report.pendingItems())
				.extracting(ResumeReport.PendingItem::toString)
				.containsExactly("List Users (ID: list-users)", "Create User (ID: create-user)");
		assertThat(report.percentDone()).isCloseTo(33.3, within(0.1));
	}

	@Test
	void testOutputPath() {
		// Given
		SidebarStructure structure = Structures.nested();

		// When
		Path path = ResumeTracker.outputPath(structure, tempDir, structure.item("create-user").orElseThrow());

		// Then
		assertThat(path).isEqualTo(tempDir.resolve("endpoints").resolve("users").resolve("create-user.json"));
	}

	@Test
	void testPartition_SiblingsWithSameTitleKeepSeparateOutputs() throws IOException {
		// Given
		SidebarStructure structure = sameTitleSiblings();
		writeDocument(tempDir.resolve("reference/get.json"), "Get");

		// When
		ResumeState state = tracker.partition(structure, tempDir, false);
		Path first = ResumeTracker.outputPath(structure, tempDir, structure.item("get-a").orElseThrow());
		Path second = ResumeTracker.outputPath(structure, tempDir, structure.item("get-b").orElseThrow());

		// Then
		assertThat(first).isEqualTo(tempDir.resolve("reference").resolve("get.json"));
		assertThat(second).isEqualTo(tempDir.resolve("reference").resolve("get-2.json"));
		assertThat(state.done()).containsExactly("get-a");
		assertThat(state.pending()).containsExactly("get-b");
	}

	@Test
	void testOutputPath_MenuAndPageWithSameTitle() {
		// Given
		SidebarStructure structure = sameTitleSiblings();

		// When
		Path page = ResumeTracker.outputPath(structure, tempDir, structure.item("get-a").orElseThrow());
		Path nested = ResumeTracker.outputPath(structure, tempDir, structure.item("get-c").orElseThrow());

		// Then
		assertThat(page).isEqualTo(tempDir.resolve("reference").resolve("get.json"));
		assertThat(nested).isEqualTo(tempDir.resolve("reference").resolve("get").resolve("get.json"));
	}

	/** Header "Reference" with pages "Get", "Get" and a menu "Get" holding another page "Get" */
	private static SidebarStructure sameTitleSiblings() {
		Map<String, SidebarItem> items = new LinkedHashMap<>();
		items.put(
				"reference",
				new SidebarItem("reference", "Reference", 0, null, List.of("get-a", "get-b", "get-menu"), false, null));
		items.put("get-a", new SidebarItem("get-a", "Get", 1, "reference", List.of(), false, "id:get-a"));
		items.put("get-b", new SidebarItem("get-b", "Get", 1, "reference", List.of(), false, "id:get-b"));
		items.put(
				"get-menu",
				new SidebarItem("get-menu", "Get", 1, "reference", List.of("get-c"), true, "id:get-menu"));
		items.put("get-c", new SidebarItem("get-c", "Get", 2, "get-menu", List.of(), false, "id:get-c"));
		return new SidebarStructure(Structures.SOURCE_URL, Structures.CAPTURED_AT, List.of("reference"), items);
	}

	private static void writeDocument(Path file, String title) throws IOException {
		Files.createDirectories(file.getParent());
		Files.writeString(file, "{\"item_id\": \"x\", \"title\": \"" + title + "\"}");
	}
}
