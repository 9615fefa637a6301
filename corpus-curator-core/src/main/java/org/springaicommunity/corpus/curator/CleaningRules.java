package org.springaicommunity.corpus.curator;

import java.util.List;
import java.util.regex.Pattern;

/**
 * The ordered cleaning pipeline applied to {@code content_text}.
 *
 * <p>
 * Rules run in list order, each on the output of the previous one:
 * <ol>
 * <li>{@code spaces} - runs of spaces, tabs and ideographic spaces become one space</li>
 * <li>{@code tags} - {@code <...>} markup spans are removed</li>
 * <li>{@code entities} - named, decimal and hex character references are removed</li>
 * <li>{@code controlChars} - control characters other than tab and newline are
 * removed</li>
 * <li>{@code unicodeReplacement} - U+FFFD is removed</li>
 * <li>{@code markdown} - {@code [text](url)} becomes {@code text}</li>
 * <li>{@code urls} - query strings from {@code ?} up to the next quote, angle bracket or
 * whitespace character (Unicode spaces included) are removed</li>
 * <li>{@code extraLineBreaks} - three or more newlines become two</li>
 * </ol>
 */
public final class CleaningRules {

	public static final String SPACES = "spaces";

	public static final String TAGS = "tags";

	public static final String ENTITIES = "entities";

	public static final String CONTROL_CHARS = "controlChars";

	public static final String UNICODE_REPLACEMENT = "unicodeReplacement";

	public static final String MARKDOWN = "markdown";

	public static final String URLS = "urls";

	public static final String EXTRA_LINE_BREAKS = "extraLineBreaks";

	private static final List<CleaningRule> DEFAULT_RULES = List.of(
			CleaningRule.of(SPACES, "[ \\t\\u3000]+", 0, " "),
			CleaningRule.of(TAGS, "<[^>]+>", 0, ""),
			CleaningRule.of(ENTITIES, "&(?:[a-z0-9]+|#[0-9]{1,6}|#x[0-9a-f]{1,6});", Pattern.CASE_INSENSITIVE, ""),
			CleaningRule.of(CONTROL_CHARS, "[\\x00-\\x08\\x0B-\\x1F\\x7F]", 0, ""),
			CleaningRule.of(UNICODE_REPLACEMENT, "\\uFFFD", 0, ""),
			CleaningRule.of(MARKDOWN, "\\[(.*?)\\]\\((.*?)\\)", 0, "$1"),
			CleaningRule.of(URLS, "\\?[^\"'<>" + Whitespace.CHARACTER_CLASS + "]+", 0, ""),
			CleaningRule.of(EXTRA_LINE_BREAKS, "\\n{3,}", 0, "\n\n"));

	private CleaningRules() {
	}

	/**
	 * Returns the default rule pipeline in application order.
	 * @return immutable list of rules
	 */
	public static List<CleaningRule> defaults() {
		return DEFAULT_RULES;
	}

}
