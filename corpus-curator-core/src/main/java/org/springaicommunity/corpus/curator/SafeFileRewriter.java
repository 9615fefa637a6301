package org.springaicommunity.corpus.curator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * {@link RecordRewriter} that streams the file into a temporary sibling
 * ({@code <name>.tmp}) and moves it over the original once complete.
 *
 * <p>
 * Kept lines are copied byte for byte; they are never re-serialized or re-encoded. Each
 * line is decoded only to look up its url, with invalid UTF-8 replaced by U+FFFD. Lines
 * that are not valid JSON are logged and kept, so a removal pass can only ever drop
 * records it was asked to drop. If anything fails before the move, the temporary file is
 * deleted and the original is left as it was.
 */
public class SafeFileRewriter implements RecordRewriter {

	private static final Logger logger = LoggerFactory.getLogger(SafeFileRewriter.class);

	private final JsonLineParser lineParser;

	private final int bufferSize;

	public SafeFileRewriter(ObjectMapper objectMapper, int bufferSize) {
		this.lineParser = new JsonLineParser(objectMapper);
		this.bufferSize = bufferSize;
	}

	public SafeFileRewriter(ObjectMapper objectMapper) {
		this(objectMapper, 64 * 1024);
	}

	@Override
	public RewriteResult rewrite(Path file, Set<String> excludedUrls) throws IOException {
		Path temp = FileReplacement.tempSiblingOf(file);
		String fileName = file.getFileName().toString();
		int removed = 0;
		int kept = 0;
		int malformed = 0;

		try (RawLineReader reader = new RawLineReader(Files.newInputStream(file), bufferSize);
				OutputStream out = new BufferedOutputStream(Files.newOutputStream(temp), bufferSize)) {
			byte[] bytes;
			while ((bytes = reader.readLine()) != null) {
				String line = new String(bytes, StandardCharsets.UTF_8);
				LineParse parsed = lineParser.parse(line);
				if (parsed instanceof LineParse.Parsed record && isExcluded(record, excludedUrls)) {
					removed++;
					continue;
				}
				if (parsed instanceof LineParse.ParseError error && !Whitespace.isBlank(line)) {
					logger.error("Error parsing line in {}: {}\nLine: {}", fileName, error.cause().getMessage(),
							error.preview());
					malformed++;
				}
				out.write(bytes);
				out.write('\n');
				kept++;
			}
		}
		catch (IOException | RuntimeException e) {
			FileReplacement.deleteQuietly(temp);
			throw e;
		}

		FileReplacement.replace(temp, file);
		return new RewriteResult(removed, kept, malformed);
	}

	private static boolean isExcluded(LineParse.Parsed record, Set<String> excludedUrls) {
		JsonNode url = record.record().get(RecordFields.URL);
		return url != null && url.isTextual() && excludedUrls.contains(url.textValue());
	}

}
