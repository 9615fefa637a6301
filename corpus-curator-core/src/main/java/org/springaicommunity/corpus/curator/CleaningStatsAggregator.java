package org.springaicommunity.corpus.curator;

/**
 * Reduces per-file {@link CleaningStats} into run totals.
 *
 * <p>
 * Addition is associative and commutative, so results may be fed in whatever order the
 * workers finish.
 */
public final class CleaningStatsAggregator {

	private CleaningStatsAggregator() {
	}

	public static CleaningStats sum(Iterable<CleaningStats> stats) {
		CleaningStats total = CleaningStats.empty();
		for (CleaningStats fileStats : stats) {
			total = total.merge(fileStats);
		}
		return total;
	}

}
