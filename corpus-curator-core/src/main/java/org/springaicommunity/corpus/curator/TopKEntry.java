package org.springaicommunity.corpus.curator;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.jspecify.annotations.Nullable;

import java.util.Comparator;

/**
 * One record of the top-K manifest.
 *
 * <p>
 * Serialized as {@code {"content_length", "language", "url", "source_file"}}; absent
 * values are omitted.
 *
 * @param url record url
 * @param language record language, if the crawler detected one
 * @param contentLength length of {@code content_text} in characters
 * @param sourceFile base name of the batch file holding the record
 */
@JsonPropertyOrder({ "content_length", "language", "url", "source_file" })
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TopKEntry(@Nullable String url, @Nullable String language, long contentLength, String sourceFile) {

	/**
	 * Largest first; ties ordered by url, then source file, so snapshots are
	 * deterministic.
	 */
	public static final Comparator<TopKEntry> LARGEST_FIRST = Comparator.comparingLong(TopKEntry::contentLength)
		.reversed()
		.thenComparing(TopKEntry::url, Comparator.nullsLast(Comparator.naturalOrder()))
		.thenComparing(TopKEntry::sourceFile);

}
