package org.springaicommunity.corpus.curator;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A named text rewrite applied to a record's body text.
 *
 * @param name rule name used as the statistics key
 * @param pattern compiled matcher
 * @param replacement replacement string, may reference groups such as {@code $1}
 */
public record CleaningRule(String name, Pattern pattern, String replacement) {

	/**
	 * Create a rule from a regular expression.
	 * @param name rule name
	 * @param regex regular expression
	 * @param flags {@link Pattern} flags
	 * @param replacement replacement string
	 * @return compiled rule
	 */
	public static CleaningRule of(String name, String regex, int flags, String replacement) {
		return new CleaningRule(name, Pattern.compile(regex, flags), replacement);
	}

	/**
	 * Replace every match in {@code text}.
	 * @param text input text
	 * @return rewritten text
	 */
	public String apply(String text) {
		Matcher matcher = pattern.matcher(text);
		return matcher.find() ? matcher.replaceAll(replacement) : text;
	}

}
