package org.springaicommunity.corpus.curator;

/**
 * The whitespace set used when cleaning text: ASCII whitespace plus the Unicode space
 * separators, line and paragraph separators, and the byte order mark.
 *
 * <p>
 * {@link String#trim()} and the regex {@code \s} class only cover ASCII, so crawled text
 * padded with no-break spaces would otherwise count as content.
 */
final class Whitespace {

	/** Body of a regex character class matching every whitespace character. */
	static final String CHARACTER_CLASS = "\\s\\u00A0\\u1680\\u2000-\\u200A\\u2028\\u2029\\u202F\\u205F\\u3000\\uFEFF";

	private Whitespace() {
	}

	static boolean isWhitespace(char c) {
		// tab, line feed, vertical tab, form feed, carriage return
		if (c >= '\t' && c <= '\r') {
			return true;
		}
		return c == ' ' || c == '\u00A0' || c == '\u1680' || (c >= '\u2000' && c <= '\u200A') || c == '\u2028'
				|| c == '\u2029' || c == '\u202F' || c == '\u205F' || c == '\u3000' || c == '\uFEFF';
	}

	/**
	 * Remove leading and trailing whitespace.
	 * @param text input text
	 * @return stripped text
	 */
	static String strip(String text) {
		int start = 0;
		int end = text.length();
		while (start < end && isWhitespace(text.charAt(start))) {
			start++;
		}
		while (end > start && isWhitespace(text.charAt(end - 1))) {
			end--;
		}
		return text.substring(start, end);
	}

	static boolean isBlank(String text) {
		for (int i = 0; i < text.length(); i++) {
			if (!isWhitespace(text.charAt(i))) {
				return false;
			}
		}
		return true;
	}

}
