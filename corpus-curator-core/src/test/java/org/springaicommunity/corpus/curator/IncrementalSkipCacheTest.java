package org.springaicommunity.corpus.curator;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.*;

@DisplayName("IncrementalSkipCache Tests")
class IncrementalSkipCacheTest {

	@TempDir
	Path tempDir;

	private IncrementalSkipCache cache;

	private Path input;

	private Path output;

	@BeforeEach
	void setUp() throws IOException {
		cache = new IncrementalSkipCache();
		input = Files.writeString(tempDir.resolve("in.jsonl"), "{\"url\":\"a\"}\n");
		output = tempDir.resolve("out.jsonl");
	}

	private static void setModified(Path file, Instant time) throws IOException {
		Files.setLastModifiedTime(file, FileTime.from(time));
	}

	@Test
	@DisplayName("Should process when output is missing")
	void shouldProcessWhenOutputMissing() {
		assertThat(cache.shouldSkip(input, output)).isFalse();
		assertThat(cache.skippedFiles()).isEmpty();
	}

	@Test
	@DisplayName("Should skip when output is newer and non-empty")
	void shouldSkipWhenOutputNewer() throws IOException {
		Files.writeString(output, "{}\n");
		Instant now = Instant.now();
		setModified(input, now.minus(1, ChronoUnit.HOURS));
		setModified(output, now);

		assertThat(cache.shouldSkip(input, output)).isTrue();
		assertThat(cache.skippedFiles()).containsExactly(input);
		assertThat(cache.skippedInputBytes()).isEqualTo(Files.size(input));
		assertThat(cache.skippedOutputBytes()).isEqualTo(3);
	}

	@Test
	@DisplayName("Should process when output is empty")
	void shouldProcessWhenOutputEmpty() throws IOException {
		Files.createFile(output);
		Instant now = Instant.now();
		setModified(input, now.minus(1, ChronoUnit.HOURS));
		setModified(output, now);

		assertThat(cache.shouldSkip(input, output)).isFalse();
	}

	@Test
	@DisplayName("Should process when output is older or equally old")
	void shouldProcessWhenOutputNotNewer() throws IOException {
		Files.writeString(output, "{}\n");
		Instant now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
		setModified(input, now);
		setModified(output, now);

		assertThat(cache.shouldSkip(input, output)).isFalse();

		IncrementalSkipCache fresh = new IncrementalSkipCache();
		setModified(output, now.minus(1, ChronoUnit.HOURS));
		assertThat(fresh.shouldSkip(input, output)).isFalse();
	}

	@Test
	@DisplayName("Should process when the input cannot be read")
	void shouldProcessWhenStatFails() throws IOException {
		Files.writeString(output, "{}\n");

		assertThat(cache.shouldSkip(tempDir.resolve("gone.jsonl"), output)).isFalse();
	}

	@Test
	@DisplayName("Should remember its first decision")
	void shouldRememberDecision() throws IOException {
		assertThat(cache.shouldSkip(input, output)).isFalse();

		Files.writeString(output, "{}\n");
		setModified(input, Instant.now().minus(1, ChronoUnit.HOURS));

		assertThat(cache.shouldSkip(input, output)).isFalse();
		assertThat(new IncrementalSkipCache().shouldSkip(input, output)).isTrue();
	}

}
