package org.springaicommunity.corpus.curator;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;

/**
 * Rewrites a batch file in place without the records whose url is excluded.
 */
public interface RecordRewriter {

	/**
	 * Remove every record whose {@code url} is in {@code excludedUrls} from {@code file}.
	 * On failure the original file must be left untouched.
	 * @param file batch file to rewrite
	 * @param excludedUrls urls of the records to remove
	 * @return counts of removed and kept records
	 * @throws IOException if the file cannot be read or replaced
	 */
	RewriteResult rewrite(Path file, Set<String> excludedUrls) throws IOException;

}
