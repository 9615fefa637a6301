package org.springaicommunity.corpus.curator;

import java.util.Map;
import java.util.TreeMap;

/**
 * Cleaning statistics for one file or for a whole run.
 *
 * <p>
 * Sizes are measured in characters of {@code content_text}, except for skipped files,
 * which contribute their on-disk input and output sizes. Instances are immutable; use
 * {@link #merge(CleaningStats)} to combine results.
 *
 * @param sizeBefore total length before cleaning
 * @param sizeAfter total length of retained records after cleaning
 * @param ruleReductions characters removed per rule name
 * @param processedCount number of files cleaned
 * @param skippedCount number of files skipped as up to date
 * @param recordsWritten records written to cleaned output
 * @param recordsDropped records dropped because nothing remained after cleaning
 * @param malformedLines lines that were not valid JSON and were copied unchanged
 */
public record CleaningStats(long sizeBefore, long sizeAfter, Map<String, Long> ruleReductions, int processedCount,
		int skippedCount, long recordsWritten, long recordsDropped, long malformedLines) {

	private static final CleaningStats EMPTY = new CleaningStats(0, 0, Map.of(), 0, 0, 0, 0, 0);

	public CleaningStats {
		ruleReductions = Map.copyOf(ruleReductions);
	}

	public static CleaningStats empty() {
		return EMPTY;
	}

	/**
	 * Statistics representing skipped files.
	 * @param skippedCount number of skipped files
	 * @param inputBytes on-disk size of the skipped inputs
	 * @param outputBytes on-disk size of their existing outputs
	 * @return stats carrying only skip information
	 */
	public static CleaningStats skipped(int skippedCount, long inputBytes, long outputBytes) {
		return new CleaningStats(inputBytes, outputBytes, Map.of(), 0, skippedCount, 0, 0, 0);
	}

	/**
	 * Element-wise sum of this and {@code other}.
	 * @param other stats to add
	 * @return new combined stats
	 */
	public CleaningStats merge(CleaningStats other) {
		Map<String, Long> reductions = new TreeMap<>(ruleReductions);
		other.ruleReductions.forEach((rule, reduced) -> reductions.merge(rule, reduced, Long::sum));
		return new CleaningStats(sizeBefore + other.sizeBefore, sizeAfter + other.sizeAfter, reductions,
				processedCount + other.processedCount, skippedCount + other.skippedCount,
				recordsWritten + other.recordsWritten, recordsDropped + other.recordsDropped,
				malformedLines + other.malformedLines);
	}

	/**
	 * Returns the reduction as a percentage of {@link #sizeBefore()}.
	 * @return percentage between 0 and 100
	 */
	public double reductionPercent() {
		return sizeBefore > 0 ? (sizeBefore - sizeAfter) * 100.0 / sizeBefore : 0;
	}

	/**
	 * Mutable accumulator used by a single worker while it streams one file.
	 */
	static final class Builder {

		private long sizeBefore;

		private long sizeAfter;

		private final Map<String, Long> ruleReductions = new TreeMap<>();

		private long recordsWritten;

		private long recordsDropped;

		private long malformedLines;

		void addBefore(long length) {
			sizeBefore += length;
		}

		void addAfter(long length) {
			sizeAfter += length;
		}

		void addReduction(String rule, long reduced) {
			if (reduced > 0) {
				ruleReductions.merge(rule, reduced, Long::sum);
			}
		}

		void recordWritten() {
			recordsWritten++;
		}

		void recordDropped() {
			recordsDropped++;
		}

		void malformedLine() {
			malformedLines++;
		}

		CleaningStats buildProcessed() {
			return new CleaningStats(sizeBefore, sizeAfter, ruleReductions, 1, 0, recordsWritten, recordsDropped,
					malformedLines);
		}

	}

}
