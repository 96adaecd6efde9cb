package dev.sidebarscraper.util;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.sidebarscraper.model.PageDocument;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Shared Jackson mappers for cache records and page documents */
public class JsonUtils {

	private static final ObjectMapper readMapper = JsonMapper.builder()
			.addModule(new JavaTimeModule())
			.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
			.build();

	private static final ObjectMapper writeMapper = JsonMapper.builder()
			.addModule(new JavaTimeModule())
			.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false)
			.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
			.enable(SerializationFeature.INDENT_OUTPUT)
			.build();

	// Key order and property order are fixed so equal content always hashes the same
	private static final ObjectMapper canonicalMapper = JsonMapper.builder()
			.addModule(new JavaTimeModule())
			.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
			.enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
			.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
			.build();

	private JsonUtils() {}

	public static ObjectMapper reader() {
		return readMapper;
	}

	public static String toPrettyJson(Object value) throws IOException {
		return writeMapper.writeValueAsString(value) + "\n";
	}

	public static String toCanonicalJson(Object value) throws IOException {
		return canonicalMapper.writeValueAsString(value);
	}

	public static <T> T read(Path file, Class<T> type) throws IOException {
		return readMapper.readValue(file.toFile(), type);
	}

	/** Write a page document to its output file, replacing any previous version atomically */
	public static void saveDocument(Path file, PageDocument document) throws IOException {
		FileUtils.writeAtomically(file, toPrettyJson(document));
	}

	/**
	 * Minimal sanity check for an extracted document: the file is non-empty, parses as a JSON object
	 * and carries a title.
	 */
	public static boolean isValidDocument(Path file) {
		try {
			if (!Files.isRegularFile(file) || Files.size(file) == 0) {
				return false;
			}
			JsonNode node = readMapper.readTree(file.toFile());
			if (node == null || !node.isObject()) {
				return false;
			}
			JsonNode title = node.get("title");
			return title != null && title.isTextual() && !title.asText().isBlank();
		} catch (IOException e) {
			return false;
		}
	}
}
