package org.springaicommunity.corpus.curator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Cleans every batch file below an input directory into a mirrored output tree.
 *
 * <p>
 * Files whose output is already up to date are skipped (see {@link IncrementalSkipCache}),
 * so running the stage again on unchanged input does no work. The remaining files are
 * cleaned in parallel by the {@link WorkerPool}; per-file statistics are merged on the
 * calling thread only.
 */
public class CleaningStage {

	private static final Logger logger = LoggerFactory.getLogger(CleaningStage.class);

	private static final int SKIPPED_PREVIEW = 5;

	private final PartitionWalker walker;

	private final RecordTransformer transformer;

	private final CuratorProperties properties;

	public CleaningStage(PartitionWalker walker, RecordTransformer transformer, CuratorProperties properties) {
		this.walker = walker;
		this.transformer = transformer;
		this.properties = properties;
	}

	/**
	 * Clean all {@code .jsonl} files below {@code inputDir}.
	 * @param inputDir root of the corpus
	 * @param outputDir root of the cleaned tree; created if missing
	 * @return run report
	 * @throws IllegalStateException if the input directory is missing or holds no batch
	 * files
	 * @throws IllegalArgumentException if the output directory lies inside the input
	 * directory
	 * @throws IOException if output directories cannot be created
	 */
	public CleaningReport run(Path inputDir, Path outputDir) throws IOException {
		Instant start = Instant.now();
		Path input = InputDirectories.requireDirectory(inputDir);
		Path output = outputDir.toAbsolutePath().normalize();
		if (output.startsWith(input)) {
			throw new IllegalArgumentException(
					"Output directory " + output + " must not be inside the input directory " + input);
		}

		List<Path> files = walker.list(input);
		if (files.isEmpty()) {
			throw new IllegalStateException("No .jsonl files found in " + inputDir + " or its subdirectories.");
		}
		logger.info("Found {} .jsonl files.", files.size());
		logger.info("Output directory: {}", output);
		Files.createDirectories(output);

		IncrementalSkipCache skipCache = new IncrementalSkipCache();
		List<FileTask> tasks = new ArrayList<>();
		for (Path file : files) {
			Path target = output.resolve(input.relativize(file));
			Files.createDirectories(target.getParent());
			if (!skipCache.shouldSkip(file, target)) {
				tasks.add(new FileTask(file, target));
			}
		}

		List<Path> skipped = skipCache.skippedFiles();
		logSkipped(input, skipped);

		WorkerPool pool = new WorkerPool(properties.getEffectiveWorkers());
		logger.info("Processing {} files using {} workers.", tasks.size(), Math.min(pool.concurrency(), tasks.size()));

		List<CleaningStats> results = new ArrayList<>();
		results.add(CleaningStats.skipped(skipped.size(), skipCache.skippedInputBytes(),
				skipCache.skippedOutputBytes()));
		List<FileFailure> failures = new ArrayList<>();

		pool.<FileTask, CleaningStats>run(tasks, task -> transformer.transform(task.input(), task.output()),
				outcome -> {
					if (outcome instanceof WorkOutcome.Completed<FileTask, CleaningStats> completed) {
						results.add(completed.result());
						if (properties.isVerbose()) {
							logger.info("Cleaned {}", input.relativize(completed.item().input()));
						}
					}
					else if (outcome instanceof WorkOutcome.Failed<FileTask, CleaningStats> failed) {
						failures.add(FileFailure.of(failed.item().input(), failed.cause()));
					}
				});

		CleaningStats total = CleaningStatsAggregator.sum(results);
		return new CleaningReport(total, skipped, failures, output, Duration.between(start, Instant.now()));
	}

	private void logSkipped(Path input, List<Path> skipped) {
		if (skipped.isEmpty()) {
			return;
		}
		logger.info("Skipping {} potentially processed files (output newer):", skipped.size());
		skipped.stream().limit(SKIPPED_PREVIEW).forEach(file -> logger.info("  - {}", input.relativize(file)));
		if (skipped.size() > SKIPPED_PREVIEW) {
			logger.info("  ...");
		}
	}

	private record FileTask(Path input, Path output) {

		@Override
		public String toString() {
			return input.toString();
		}

	}

}
