package org.springaicommunity.corpus.curator;

/**
 * Result of rewriting one batch file without excluded records.
 *
 * @param removedCount records omitted because their url was excluded
 * @param keptCount lines written back
 * @param malformedLines lines that could not be parsed and were kept unchanged
 */
public record RewriteResult(int removedCount, int keptCount, int malformedLines) {
}
