package dev.sidebarscraper.session;

import java.util.regex.Pattern;

/**
 * Regular expressions that are handed to the browser. Playwright forwards {@link Pattern#pattern()}
 * to a JavaScript {@code RegExp}, which knows nothing about {@code \Q...\E}, so literal text is
 * escaped character by character.
 */
final class TextPatterns {
	private static final String METACHARACTERS = "\\^$.|?*+()[]{}/-";

	private TextPatterns() {}

	/** Matches an element whose whole text is the given title; whitespace runs match any whitespace */
	static Pattern exactText(String text) {
		StringBuilder regex = new StringBuilder("^\\s*");
		String[] words = text.strip().split("\\s+");
		for (int i = 0; i < words.length; i++) {
			if (i > 0) {
				regex.append("\\s+");
			}
			regex.append(escape(words[i]));
		}
		return Pattern.compile(regex.append("\\s*$").toString());
	}

	/** Escape a literal so it means the same in Java and JavaScript regular expressions */
	static String escape(String literal) {
		StringBuilder escaped = new StringBuilder(literal.length() + 8);
		for (int i = 0; i < literal.length(); i++) {
			char c = literal.charAt(i);
			if (METACHARACTERS.indexOf(c) >= 0) {
				escaped.append('\\');
			}
			escaped.append(c);
		}
		return escaped.toString();
	}
}
