package org.springaicommunity.corpus.curator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * {@link RecordTransformer} that runs the {@link CleaningRules} pipeline over the
 * {@code content_text} field of every record.
 *
 * <p>
 * Lines are handled according to their {@link LineParse}:
 * <ul>
 * <li>records whose {@code content_text} is a string are cleaned, stripped of
 * {@link Whitespace} at both ends and written
 * unless both the cleaned text and {@code meta_tags} are empty</li>
 * <li>records without a string {@code content_text}, and JSON values that are not objects,
 * are copied unchanged</li>
 * <li>lines that are not JSON are logged and copied unchanged</li>
 * <li>blank lines are not written</li>
 * </ul>
 * Output goes to a temporary sibling first and replaces the target only once the whole
 * file has been written.
 */
public class RegexRecordTransformer implements RecordTransformer {

	private static final Logger logger = LoggerFactory.getLogger(RegexRecordTransformer.class);

	private final ObjectMapper objectMapper;

	private final JsonLineParser lineParser;

	private final List<CleaningRule> rules;

	private final int bufferSize;

	public RegexRecordTransformer(ObjectMapper objectMapper, List<CleaningRule> rules, int bufferSize) {
		this.objectMapper = objectMapper;
		this.lineParser = new JsonLineParser(objectMapper);
		this.rules = List.copyOf(rules);
		this.bufferSize = bufferSize;
	}

	public RegexRecordTransformer(ObjectMapper objectMapper) {
		this(objectMapper, CleaningRules.defaults(), 64 * 1024);
	}

	@Override
	public CleaningStats transform(Path input, Path output) throws IOException {
		CleaningStats.Builder stats = new CleaningStats.Builder();
		String fileName = input.getFileName().toString();
		Path temp = FileReplacement.tempSiblingOf(output);

		// Invalid UTF-8 decodes to U+FFFD, which the unicodeReplacement rule then removes
		try (BufferedReader reader = new BufferedReader(
				new InputStreamReader(Files.newInputStream(input), StandardCharsets.UTF_8), bufferSize);
				Writer writer = new BufferedWriter(
						new OutputStreamWriter(Files.newOutputStream(temp), StandardCharsets.UTF_8), bufferSize)) {
			String line;
			while ((line = reader.readLine()) != null) {
				if (Whitespace.isBlank(line)) {
					continue;
				}
				LineParse parsed = lineParser.parse(line);
				if (parsed instanceof LineParse.Parsed record) {
					String cleaned = cleanRecord(record, stats);
					if (cleaned != null) {
						writeLine(writer, cleaned);
					}
				}
				else if (parsed instanceof LineParse.PassThrough passThrough) {
					writeLine(writer, passThrough.rawLine());
				}
				else if (parsed instanceof LineParse.ParseError error) {
					logger.error("Error processing line in {}: {}\nLine: {}", fileName, error.cause().getMessage(),
							error.preview());
					stats.malformedLine();
					writeLine(writer, error.rawLine());
				}
			}
		}
		catch (IOException | RuntimeException e) {
			FileReplacement.deleteQuietly(temp);
			throw e;
		}

		FileReplacement.replace(temp, output);
		return stats.buildProcessed();
	}

	/**
	 * Clean one record.
	 * @return the line to write, or {@code null} if the record is dropped
	 */
	@Nullable
	private String cleanRecord(LineParse.Parsed parsed, CleaningStats.Builder stats) throws IOException {
		ObjectNode record = parsed.record();
		JsonNode content = record.get(RecordFields.CONTENT_TEXT);
		if (content == null || !content.isTextual()) {
			return parsed.rawLine();
		}

		String text = content.textValue();
		stats.addBefore(text.length());
		String cleaned = Whitespace.strip(clean(text, stats));
		record.put(RecordFields.CONTENT_TEXT, cleaned);

		if (cleaned.isEmpty() && isMetaTagsEmpty(record.get(RecordFields.META_TAGS))) {
			stats.recordDropped();
			return null;
		}

		stats.addAfter(cleaned.length());
		stats.recordWritten();
		return objectMapper.writeValueAsString(record);
	}

	/**
	 * Run every rule over {@code text} in order, recording the characters each one
	 * removed.
	 * @param text input text
	 * @param stats accumulator for per-rule reductions
	 * @return cleaned, untrimmed text
	 */
	String clean(String text, CleaningStats.Builder stats) {
		String current = text;
		for (CleaningRule rule : rules) {
			int before = current.length();
			current = rule.apply(current);
			stats.addReduction(rule.name(), before - current.length());
		}
		return current;
	}

	static boolean isMetaTagsEmpty(@Nullable JsonNode metaTags) {
		if (metaTags == null || metaTags.isNull() || metaTags.isMissingNode()) {
			return true;
		}
		if (metaTags.isTextual()) {
			return Whitespace.isBlank(metaTags.textValue());
		}
		if (metaTags.isArray()) {
			return metaTags.isEmpty();
		}
		return false;
	}

	private static void writeLine(Writer writer, String line) throws IOException {
		writer.write(line);
		writer.write('\n');
	}

}
