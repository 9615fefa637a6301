package org.springaicommunity.corpus.curator;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Outcome of a {@link TopKStage} run.
 *
 * @param entries the selected entries, largest first
 * @param filesScanned number of batch files read successfully
 * @param failedFiles batch files that could not be read
 * @param manifestFile the manifest that was written
 * @param duration wall-clock duration of the run
 */
public record TopKReport(List<TopKEntry> entries, int filesScanned, List<FileFailure> failedFiles, Path manifestFile,
		Duration duration) {

	public boolean hasFailures() {
		return !failedFiles.isEmpty();
	}

}
