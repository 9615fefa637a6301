package org.springaicommunity.corpus.curator;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Removes the records listed in a removal manifest from their batch files in place.
 *
 * <p>
 * Files are matched by base name. Every file below the input directory whose name is a
 * manifest key is rewritten through the {@link RecordRewriter}; running the stage again
 * finds nothing left to remove. A failed rewrite leaves its file untouched and the run
 * continues with the next file.
 */
public class RemovalStage {

	private static final Logger logger = LoggerFactory.getLogger(RemovalStage.class);

	private final PartitionWalker walker;

	private final RecordRewriter rewriter;

	private final ObjectMapper objectMapper;

	public RemovalStage(PartitionWalker walker, RecordRewriter rewriter, ObjectMapper objectMapper) {
		this.walker = walker;
		this.rewriter = rewriter;
		this.objectMapper = objectMapper;
	}

	/**
	 * Apply {@code manifestFile} to the batch files below {@code inputDir}.
	 * @param inputDir root of the corpus
	 * @param manifestFile manifest written by {@link TopKStage}
	 * @return run report
	 * @throws IllegalStateException if the manifest or the input directory is missing
	 * @throws IOException if the manifest cannot be read
	 */
	public RemovalReport run(Path inputDir, Path manifestFile) throws IOException {
		Instant start = Instant.now();
		if (!Files.isRegularFile(manifestFile)) {
			throw new IllegalStateException("Manifest file not found: " + manifestFile.toAbsolutePath()
					+ " (run the top-k stage first)");
		}
		Path input = InputDirectories.requireDirectory(inputDir);

		RemovalManifest manifest = RemovalManifest.load(manifestFile, objectMapper);
		logger.info("Found {} files to process with {} entries to remove...", manifest.fileNames().size(),
				manifest.entryCount());

		Map<String, List<Path>> matches = new LinkedHashMap<>();
		List<RemovalReport.FileRemoval> rewritten = new ArrayList<>();
		List<FileFailure> failures = new ArrayList<>();

		try (Stream<Path> files = walker.walk(input)) {
			Iterator<Path> iterator = files.iterator();
			while (iterator.hasNext()) {
				Path file = iterator.next();
				String name = file.getFileName().toString();
				if (!manifest.contains(name)) {
					continue;
				}
				matches.computeIfAbsent(name, n -> new ArrayList<>()).add(file);
				try {
					RewriteResult result = rewriter.rewrite(file, manifest.urlsFor(name));
					logger.info("Removed {} entries from {}", result.removedCount(), input.relativize(file));
					rewritten.add(new RemovalReport.FileRemoval(file, result));
				}
				catch (IOException | RuntimeException e) {
					logger.error("Error processing {}: {}", file, e.getMessage());
					failures.add(FileFailure.of(file, e));
				}
			}
		}

		List<String> missing = manifest.fileNames().stream().filter(name -> !matches.containsKey(name)).toList();
		Map<String, List<Path>> ambiguous = new LinkedHashMap<>();
		matches.forEach((name, paths) -> {
			if (paths.size() > 1) {
				logger.warn("Manifest file name {} matches {} files; the same urls were removed from each: {}", name,
						paths.size(), paths);
				ambiguous.put(name, List.copyOf(paths));
			}
		});

		return new RemovalReport(rewritten, failures, manifest.entryCount(), missing, ambiguous,
				Duration.between(start, Instant.now()));
	}

}
