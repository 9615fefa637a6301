package org.springaicommunity.corpus.curator;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Outcome of a {@link CleaningStage} run.
 *
 * @param stats aggregated statistics, including skipped files
 * @param skippedFiles inputs whose cleaned output was already up to date
 * @param failedFiles inputs that could not be cleaned
 * @param outputDirectory root of the cleaned tree
 * @param duration wall-clock duration of the run
 */
public record CleaningReport(CleaningStats stats, List<Path> skippedFiles, List<FileFailure> failedFiles,
		Path outputDirectory, Duration duration) {

	public int totalFiles() {
		return stats.processedCount() + stats.skippedCount() + failedFiles.size();
	}

	public boolean hasFailures() {
		return !failedFiles.isEmpty();
	}

}
