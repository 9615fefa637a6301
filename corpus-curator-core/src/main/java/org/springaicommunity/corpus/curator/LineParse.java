package org.springaicommunity.corpus.curator;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Classification of one line of a JSONL batch file.
 *
 * <p>
 * Every stage handles all three cases explicitly instead of relying on a catch-all.
 */
public sealed interface LineParse permits LineParse.Parsed, LineParse.PassThrough, LineParse.ParseError {

	/**
	 * The raw line as read from the file.
	 * @return the line without its terminator
	 */
	String rawLine();

	/**
	 * A JSON object record.
	 *
	 * @param rawLine the original line
	 * @param record the parsed object
	 */
	record Parsed(String rawLine, ObjectNode record) implements LineParse {
	}

	/**
	 * Valid JSON that is not a record object; carried through unchanged.
	 *
	 * @param rawLine the original line
	 */
	record PassThrough(String rawLine) implements LineParse {
	}

	/**
	 * A line that is not valid JSON.
	 *
	 * @param rawLine the original line
	 * @param cause the parser failure
	 */
	record ParseError(String rawLine, Exception cause) implements LineParse {

		/**
		 * Returns the first 100 characters of the line, for log messages.
		 * @return truncated line
		 */
		public String preview() {
			return rawLine.length() > 100 ? rawLine.substring(0, 100) + "..." : rawLine;
		}

	}

}
