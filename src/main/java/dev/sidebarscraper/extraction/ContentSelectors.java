package dev.sidebarscraper.extraction;

/** CSS selectors for the content pane of an API documentation page */
public record ContentSelectors(
		String contentPane,
		String endpoint,
		String method,
		String title,
		String path,
		String description,
		String security,
		String server,
		String parameters,
		String response,
		String responseTab,
		String activeTabPanel,
		String requestBody,
		String model,
		String markdown) {

	public static ContentSelectors defaults() {
		return new ContentSelectors(
				"#documentation",
				"app-api-doc-endpoint",
				"app-show-http-method span[class*=http-method]",
				"div.dds__mb-4 span.dds__pl-3",
				"markdown pre",
				"div.dds__mt-2 markdown",
				"app-api-doc-security",
				"app-api-doc-server",
				"app-show-parameters",
				"app-api-doc-response",
				"button[role=tab]",
				"[role=tabpanel]:not([hidden])",
				"app-api-doc-request-body",
				"app-api-doc-model",
				"markdown");
	}
}
