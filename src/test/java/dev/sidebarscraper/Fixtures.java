package dev.sidebarscraper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/** Loads HTML fixtures from the test classpath */
public final class Fixtures {
	public static final String SOURCE_URL = "https://docs.example.com/api/";

	private Fixtures() {}

	public static String load(String name) {
		try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
			if (in == null) {
				throw new IllegalArgumentException("Missing fixture " + name);
			}
			return new String(in.readAllBytes(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	public static String hierarchicalSidebar() {
		return load("hierarchical-sidebar.html");
	}

	public static String flatSidebar() {
		return load("flat-sidebar.html");
	}

	public static String endpointPage() {
		return load("endpoint-page.html");
	}
}
