package org.springaicommunity.corpus.curator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decides whether an input batch file needs to be cleaned again.
 *
 * <p>
 * A file is skipped when its output exists, is non-empty and was modified strictly after
 * the input. Any failure to read file attributes falls back to processing the file. The
 * cache is created per run by its caller and remembers every decision it made so the
 * skipped files can be reported afterwards. It never modifies the file system.
 *
 * <p>
 * Not thread-safe; intended for use by the coordinating thread only.
 */
public class IncrementalSkipCache {

	private static final Logger logger = LoggerFactory.getLogger(IncrementalSkipCache.class);

	private final Map<Path, Decision> decisions = new LinkedHashMap<>();

	/**
	 * Decide whether {@code input} can be skipped because {@code output} is up to date.
	 * @param input the input batch file
	 * @param output the cleaned file the input would be written to
	 * @return true if reprocessing is unnecessary
	 */
	public boolean shouldSkip(Path input, Path output) {
		Decision cached = decisions.get(input);
		if (cached != null) {
			return cached.skip();
		}
		Decision decision = decide(input, output);
		decisions.put(input, decision);
		return decision.skip();
	}

	/**
	 * Returns the files that were skipped, in decision order.
	 * @return skipped input files
	 */
	public List<Path> skippedFiles() {
		List<Path> skipped = new ArrayList<>();
		decisions.forEach((input, decision) -> {
			if (decision.skip()) {
				skipped.add(input);
			}
		});
		return skipped;
	}

	/**
	 * Returns the on-disk size of skipped inputs, in bytes.
	 * @return total input size of skipped files
	 */
	public long skippedInputBytes() {
		return decisions.values().stream().filter(Decision::skip).mapToLong(Decision::inputSize).sum();
	}

	/**
	 * Returns the on-disk size of the outputs of skipped inputs, in bytes.
	 * @return total output size of skipped files
	 */
	public long skippedOutputBytes() {
		return decisions.values().stream().filter(Decision::skip).mapToLong(Decision::outputSize).sum();
	}

	private Decision decide(Path input, Path output) {
		if (!Files.exists(output)) {
			return Decision.PROCESS;
		}
		try {
			BasicFileAttributes inputAttributes = Files.readAttributes(input, BasicFileAttributes.class);
			BasicFileAttributes outputAttributes = Files.readAttributes(output, BasicFileAttributes.class);
			boolean outputNewer = outputAttributes.lastModifiedTime().compareTo(inputAttributes.lastModifiedTime()) > 0;
			if (outputNewer && outputAttributes.size() > 0) {
				return new Decision(true, inputAttributes.size(), outputAttributes.size());
			}
			return Decision.PROCESS;
		}
		catch (IOException e) {
			logger.warn("Could not stat {} or {}, will process. Error: {}", input, output, e.getMessage());
			return Decision.PROCESS;
		}
	}

	private record Decision(boolean skip, long inputSize, long outputSize) {

		static final Decision PROCESS = new Decision(false, 0, 0);

	}

}
