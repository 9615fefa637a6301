package org.springaicommunity.corpus.curator;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a {@link RemovalStage} run.
 *
 * @param rewrittenFiles files that were rewritten, with their counts
 * @param failedFiles files whose rewrite failed and were left untouched
 * @param expectedRemovals number of entries listed in the manifest
 * @param missingFiles manifest file names not found below the input directory
 * @param ambiguousFiles manifest file names matched by more than one file
 * @param duration wall-clock duration of the run
 */
public record RemovalReport(List<FileRemoval> rewrittenFiles, List<FileFailure> failedFiles, int expectedRemovals,
		List<String> missingFiles, Map<String, List<Path>> ambiguousFiles, Duration duration) {

	public int totalRemoved() {
		return rewrittenFiles.stream().mapToInt(f -> f.result().removedCount()).sum();
	}

	public boolean hasFailures() {
		return !failedFiles.isEmpty();
	}

	/**
	 * One rewritten batch file.
	 *
	 * @param file the rewritten file
	 * @param result removal counts
	 */
	public record FileRemoval(Path file, RewriteResult result) {
	}

}
