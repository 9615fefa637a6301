package org.springaicommunity.corpus.curator;

/**
 * Field names of crawl records and manifest entries.
 */
final class RecordFields {

	static final String URL = "url";

	static final String LANGUAGE = "language";

	static final String CONTENT_TEXT = "content_text";

	static final String META_TAGS = "meta_tags";

	static final String SOURCE_FILE = "source_file";

	private RecordFields() {
	}

}
