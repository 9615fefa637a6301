package org.springaicommunity.corpus.curator;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Cleans one JSONL batch file into a new file.
 *
 * <p>
 * Implementations stream the input and must not hold a whole file in memory. They are
 * invoked concurrently for different files and must not share mutable state between
 * calls.
 */
public interface RecordTransformer {

	/**
	 * Clean {@code input} and write the result to {@code output}.
	 * @param input the source batch file
	 * @param output the cleaned file to create or replace
	 * @return statistics for this file
	 * @throws IOException if the input cannot be read or the output cannot be written
	 */
	CleaningStats transform(Path input, Path output) throws IOException;

}
