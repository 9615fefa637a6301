package org.springaicommunity.corpus.curator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Records slated for removal, grouped by the base name of their source batch file.
 *
 * <p>
 * Keys are base names rather than paths because the manifest may be produced on another
 * machine or against another root than the removal run. Two partitions holding batch
 * files with the same base name therefore share one key; {@link RemovalStage} reports such
 * names as ambiguous.
 */
public class RemovalManifest {

	private static final Logger logger = LoggerFactory.getLogger(RemovalManifest.class);

	private final Map<String, Set<String>> urlsByFile;

	private final int entryCount;

	RemovalManifest(Map<String, Set<String>> urlsByFile, int entryCount) {
		this.urlsByFile = urlsByFile;
		this.entryCount = entryCount;
	}

	/**
	 * Load a manifest written by {@link #write(Path, List, ObjectMapper)}.
	 * @param manifestFile the manifest file
	 * @param objectMapper mapper used to parse lines
	 * @return the loaded manifest
	 * @throws IOException if the file cannot be read
	 */
	public static RemovalManifest load(Path manifestFile, ObjectMapper objectMapper) throws IOException {
		JsonLineParser parser = new JsonLineParser(objectMapper);
		Map<String, Set<String>> urlsByFile = new LinkedHashMap<>();
		int entries = 0;
		int lineNumber = 0;

		try (BufferedReader reader = Files.newBufferedReader(manifestFile, StandardCharsets.UTF_8)) {
			String line;
			while ((line = reader.readLine()) != null) {
				lineNumber++;
				if (line.isBlank()) {
					continue;
				}
				LineParse parsed = parser.parse(line);
				if (!(parsed instanceof LineParse.Parsed record)) {
					logger.error("Skipping unreadable manifest line {} in {}", lineNumber, manifestFile);
					continue;
				}
				JsonNode sourceFile = record.record().get(RecordFields.SOURCE_FILE);
				JsonNode url = record.record().get(RecordFields.URL);
				if (sourceFile == null || !sourceFile.isTextual() || url == null || !url.isTextual()) {
					logger.warn("Manifest line {} has no source_file or url, ignoring", lineNumber);
					continue;
				}
				String key = baseName(sourceFile.textValue());
				urlsByFile.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(url.textValue());
				entries++;
			}
		}

		return new RemovalManifest(urlsByFile, entries);
	}

	/**
	 * Write top-K entries as a manifest, one JSON object per line, in the given order.
	 * @param manifestFile destination file
	 * @param entries entries to write
	 * @param objectMapper mapper used to serialize entries
	 * @throws IOException if the file cannot be written
	 */
	public static void write(Path manifestFile, List<TopKEntry> entries, ObjectMapper objectMapper)
			throws IOException {
		Path parent = manifestFile.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		try (BufferedWriter writer = Files.newBufferedWriter(manifestFile, StandardCharsets.UTF_8)) {
			for (TopKEntry entry : entries) {
				writer.write(objectMapper.writeValueAsString(entry));
				writer.write('\n');
			}
		}
	}

	static String baseName(String sourceFile) {
		Path fileName = Paths.get(sourceFile).getFileName();
		return fileName != null ? fileName.toString() : sourceFile;
	}

	public boolean contains(String fileBaseName) {
		return urlsByFile.containsKey(fileBaseName);
	}

	/**
	 * Returns the urls to remove from files with the given base name.
	 * @param fileBaseName batch file base name
	 * @return urls, empty if the file is not in the manifest
	 */
	public Set<String> urlsFor(String fileBaseName) {
		Set<String> urls = urlsByFile.get(fileBaseName);
		return urls != null ? Collections.unmodifiableSet(urls) : Set.of();
	}

	public Set<String> fileNames() {
		return Collections.unmodifiableSet(urlsByFile.keySet());
	}

	/**
	 * Returns the number of usable manifest lines, counting repeated urls.
	 * @return expected removals
	 */
	public int entryCount() {
		return entryCount;
	}

	public boolean isEmpty() {
		return urlsByFile.isEmpty();
	}

}
