package org.springaicommunity.corpus.curator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Finds the records with the longest {@code content_text} across the corpus and writes
 * them to the removal manifest.
 *
 * <p>
 * Files are scheduled in waves of {@link CuratorProperties#getWaveSize()} files. Each file
 * yields its own {@link TopKSelector}; a wave's selectors are merged as they complete and
 * the wave result is merged into the global selector, so at most one wave of partial
 * results is held at a time.
 */
public class TopKStage {

	private static final Logger logger = LoggerFactory.getLogger(TopKStage.class);

	private final PartitionWalker walker;

	private final ObjectMapper objectMapper;

	private final JsonLineParser lineParser;

	private final CuratorProperties properties;

	public TopKStage(PartitionWalker walker, ObjectMapper objectMapper, CuratorProperties properties) {
		this.walker = walker;
		this.objectMapper = objectMapper;
		this.lineParser = new JsonLineParser(objectMapper);
		this.properties = properties;
	}

	/**
	 * Select the top-K records below {@code inputDir} and write them to
	 * {@code manifestFile}, largest first.
	 * @param inputDir root of the corpus
	 * @param manifestFile manifest to write
	 * @return run report
	 * @throws IllegalStateException if the input directory is missing
	 * @throws IOException if the manifest cannot be written
	 */
	public TopKReport run(Path inputDir, Path manifestFile) throws IOException {
		Instant start = Instant.now();
		Path input = InputDirectories.requireDirectory(inputDir);
		int k = properties.getTopK();

		List<Path> files = walker.list(input);
		WorkerPool pool = new WorkerPool(properties.getEffectiveWorkers());
		List<List<Path>> waves = WorkerPool.waves(files, properties.getWaveSize());
		logger.info("Found {} files to process using {} workers", files.size(), pool.concurrency());

		TopKSelector global = new TopKSelector(k);
		List<FileFailure> failures = new ArrayList<>();
		int scanned = 0;
		int done = 0;

		for (int i = 0; i < waves.size(); i++) {
			List<Path> wave = waves.get(i);
			logger.info("Batch {}/{}: processing {} files...", i + 1, waves.size(), wave.size());

			TopKSelector waveSelector = new TopKSelector(k);
			List<WorkOutcome<Path, TopKSelector>> outcomes = pool.run(wave, file -> scanFile(file, k));
			for (WorkOutcome<Path, TopKSelector> outcome : outcomes) {
				if (outcome instanceof WorkOutcome.Completed<Path, TopKSelector> completed) {
					waveSelector.merge(completed.result());
					scanned++;
				}
				else if (outcome instanceof WorkOutcome.Failed<Path, TopKSelector> failed) {
					failures.add(FileFailure.of(failed.item(), failed.cause()));
				}
			}
			global.merge(waveSelector);

			done += wave.size();
			logger.info("Progress: {}%", String.format("%.1f", done * 100.0 / files.size()));
		}

		List<TopKEntry> entries = global.entries();
		RemovalManifest.write(manifestFile, entries, objectMapper);
		return new TopKReport(entries, scanned, failures, manifestFile.toAbsolutePath(),
				Duration.between(start, Instant.now()));
	}

	/**
	 * Stream one file into a fresh selector of size {@code k}. Unparseable lines are
	 * logged and skipped.
	 * @param file batch file
	 * @param k selector capacity
	 * @return the file's top-K
	 * @throws IOException if the file cannot be read
	 */
	TopKSelector scanFile(Path file, int k) throws IOException {
		TopKSelector selector = new TopKSelector(k);
		String sourceFile = file.getFileName().toString();

		// Invalid UTF-8 decodes to U+FFFD rather than failing the whole file
		try (BufferedReader reader = new BufferedReader(
				new InputStreamReader(Files.newInputStream(file), StandardCharsets.UTF_8))) {
			String line;
			while ((line = reader.readLine()) != null) {
				if (Whitespace.isBlank(line)) {
					continue;
				}
				LineParse parsed = lineParser.parse(line);
				if (parsed instanceof LineParse.ParseError error) {
					logger.error("Error in {}: {}", file, error.cause().getMessage());
				}
				else if (parsed instanceof LineParse.Parsed record) {
					JsonNode content = record.record().get(RecordFields.CONTENT_TEXT);
					if (content == null || !content.isTextual()) {
						continue;
					}
					int length = content.textValue().length();
					// Cheap rejection before building an entry
					if (length > selector.threshold()) {
						selector.admit(new TopKEntry(textOrNull(record.record(), RecordFields.URL),
								textOrNull(record.record(), RecordFields.LANGUAGE), length, sourceFile));
					}
				}
			}
		}
		return selector;
	}

	@Nullable
	private static String textOrNull(JsonNode record, String field) {
		JsonNode value = record.get(field);
		return value != null && value.isTextual() ? value.textValue() : null;
	}

}
