package dev.sidebarscraper.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/** On-disk form of a cached {@link SidebarStructure} */
@JsonPropertyOrder({
	"schema_version",
	"source_url",
	"captured_at",
	"total_item_count",
	"valid_item_count",
	"checksum",
	"roots",
	"items"
})
public record CacheRecord(
		@JsonProperty("schema_version") int schemaVersion,
		@JsonProperty("source_url") String sourceUrl,
		@JsonProperty("captured_at") Instant capturedAt,
		@JsonProperty("total_item_count") int totalItemCount,
		@JsonProperty("valid_item_count") int validItemCount,
		@JsonProperty("checksum") String checksum,
		@JsonProperty("roots") List<String> roots,
		@JsonProperty("items") Map<String, SidebarItem> items) {

	public static final int CURRENT_SCHEMA_VERSION = 1;

	public static CacheRecord of(SidebarStructure structure, String checksum) {
		return new CacheRecord(
				CURRENT_SCHEMA_VERSION,
				structure.sourceUrl(),
				structure.capturedAt(),
				structure.totalItemCount(),
				structure.validItemCount(),
				checksum,
				structure.roots(),
				structure.items());
	}

	public SidebarStructure toStructure() {
		return new SidebarStructure(sourceUrl, capturedAt, roots, items);
	}
}
