package dev.sidebarscraper.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import java.util.List;

/** Structured content extracted from one documentation page */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({
	"item_id",
	"title",
	"breadcrumb",
	"method",
	"path",
	"description",
	"security",
	"server",
	"parameters",
	"request_body",
	"responses",
	"schema_fields",
	"source_url",
	"extracted_at"
})
public record PageDocument(
		@JsonProperty("item_id") String itemId,
		@JsonProperty("title") String title,
		@JsonProperty("breadcrumb") List<String> breadcrumb,
		@JsonProperty("method") String method,
		@JsonProperty("path") String path,
		@JsonProperty("description") String description,
		@JsonProperty("security") String security,
		@JsonProperty("server") String server,
		@JsonProperty("parameters") List<Parameter> parameters,
		@JsonProperty("request_body") String requestBody,
		@JsonProperty("responses") List<Response> responses,
		@JsonProperty("schema_fields") List<SchemaField> schemaFields,
		@JsonProperty("source_url") String sourceUrl,
		@JsonProperty("extracted_at") Instant extractedAt) {

	public PageDocument {
		breadcrumb = breadcrumb == null ? List.of() : List.copyOf(breadcrumb);
		parameters = parameters == null ? List.of() : List.copyOf(parameters);
		responses = responses == null ? List.of() : List.copyOf(responses);
		schemaFields = schemaFields == null ? List.of() : List.copyOf(schemaFields);
	}

	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record Parameter(
			@JsonProperty("name") String name,
			@JsonProperty("location") String location,
			@JsonProperty("type") String type,
			@JsonProperty("required") boolean required,
			@JsonProperty("description") String description) {}

	/** One record per observed response status code */
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record Response(
			@JsonProperty("status") String status,
			@JsonProperty("description") String description,
			@JsonProperty("body") String body) {}

	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record SchemaField(
			@JsonProperty("name") String name,
			@JsonProperty("type") String type,
			@JsonProperty("description") String description) {}
}
