package org.springaicommunity.corpus.curator;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link CleaningStage}.
 *
 * Runs the stage over small corpora in a temporary directory to check tree mirroring,
 * incremental skipping, worker-count independence and per-file failure isolation.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("CleaningStage Tests")
class CleaningStageTest {

	@TempDir
	Path tempDir;

	private Path inputDir;

	private Path outputDir;

	private CuratorProperties properties;

	@BeforeEach
	void setUp() {
		inputDir = tempDir.resolve("analyses");
		outputDir = tempDir.resolve("analyses_cleaned");
		properties = new CuratorProperties();
		properties.setWorkers(2);
	}

	private Path writeBatch(String relative, String... lines) throws IOException {
		Path file = inputDir.resolve(relative);
		Files.createDirectories(file.getParent());
		Files.write(file, List.of(lines));
		// Keep inputs clearly older than anything the stage writes
		Files.setLastModifiedTime(file, FileTime.from(Instant.now().minus(1, ChronoUnit.HOURS)));
		return file;
	}

	private void writeSampleCorpus() throws IOException {
		writeBatch("2024/01/batch_1.jsonl", "{\"url\":\"a\",\"content_text\":\"<b>Hi</b>  there\"}",
				"{\"url\":\"b\",\"content_text\":\"\",\"meta_tags\":[]}");
		writeBatch("2024/02/batch_2.jsonl", "{\"url\":\"c\",\"content_text\":\"see [docs](x) &amp; more\"}",
				"{broken");
		writeBatch("batch_3.jsonl", "{\"url\":\"d\",\"content_text\":\"plain\",\"meta_tags\":[\"t\"]}");
	}

	private CleaningStage stage() {
		return CorpusCuratorBuilder.create().properties(properties).buildCleaningStage();
	}

	private static Map<String, String> readTree(Path root) throws IOException {
		Map<String, String> contents = new TreeMap<>();
		for (Path file : new PartitionWalker().list(root)) {
			contents.put(root.relativize(file).toString(), Files.readString(file));
		}
		return contents;
	}

	@Nested
	@DisplayName("Cleaning Run Tests")
	class CleaningRunTest {

		@Test
		@DisplayName("Should mirror the input tree with cleaned records")
		void shouldMirrorInputTree() throws IOException {
			writeSampleCorpus();

			CleaningReport report = stage().run(inputDir, outputDir);

			assertThat(outputDir.resolve("2024/01/batch_1.jsonl")).exists();
			assertThat(outputDir.resolve("2024/02/batch_2.jsonl")).exists();
			assertThat(outputDir.resolve("batch_3.jsonl")).exists();
			assertThat(Files.readAllLines(outputDir.resolve("2024/01/batch_1.jsonl")))
				.containsExactly("{\"url\":\"a\",\"content_text\":\"Hi there\"}");
			assertThat(Files.readAllLines(outputDir.resolve("2024/02/batch_2.jsonl")))
				.containsExactly("{\"url\":\"c\",\"content_text\":\"see docs  more\"}", "{broken");

			CleaningStats stats = report.stats();
			assertThat(stats.processedCount()).isEqualTo(3);
			assertThat(stats.skippedCount()).isZero();
			assertThat(stats.recordsWritten()).isEqualTo(3);
			assertThat(stats.recordsDropped()).isEqualTo(1);
			assertThat(stats.malformedLines()).isEqualTo(1);
			assertThat(stats.sizeBefore()).isGreaterThan(stats.sizeAfter());
			assertThat(report.failedFiles()).isEmpty();
			assertThat(report.totalFiles()).isEqualTo(3);
			assertThat(report.outputDirectory()).isEqualTo(outputDir.toAbsolutePath().normalize());
		}

		@Test
		@DisplayName("Should leave the input tree unchanged")
		void shouldLeaveInputUnchanged() throws IOException {
			writeSampleCorpus();
			Map<String, String> before = readTree(inputDir);

			stage().run(inputDir, outputDir);

			assertThat(readTree(inputDir)).isEqualTo(before);
		}

		@Test
		@DisplayName("Should skip every file on a second run")
		void shouldBeIdempotent() throws IOException {
			writeSampleCorpus();
			stage().run(inputDir, outputDir);
			Map<String, String> firstOutput = readTree(outputDir);

			CleaningReport second = stage().run(inputDir, outputDir);

			assertThat(second.stats().processedCount()).isZero();
			assertThat(second.stats().skippedCount()).isEqualTo(3);
			assertThat(second.skippedFiles()).hasSize(3);
			assertThat(second.stats().sizeBefore()).isGreaterThan(0);
			assertThat(readTree(outputDir)).isEqualTo(firstOutput);
		}

		@Test
		@DisplayName("Should produce identical output with one or many workers")
		void shouldBeIndependentOfWorkerCount() throws IOException {
			for (int i = 0; i < 12; i++) {
				writeBatch("part_" + (i % 3) + "/batch_" + i + ".jsonl",
						"{\"url\":\"u" + i + "\",\"content_text\":\"<p>record " + i + "</p>&nbsp;\\n\\n\\n\\nend\"}",
						"{\"url\":\"v" + i + "\",\"content_text\":\"https://x.org/p?id=" + i + " text\"}");
			}

			properties.setWorkers(1);
			CleaningReport sequential = stage().run(inputDir, tempDir.resolve("out_1"));
			properties.setWorkers(6);
			CleaningReport parallel = stage().run(inputDir, tempDir.resolve("out_6"));

			assertThat(readTree(tempDir.resolve("out_6"))).isEqualTo(readTree(tempDir.resolve("out_1")));
			assertThat(parallel.stats()).isEqualTo(sequential.stats());
		}

	}

	@Nested
	@DisplayName("Precondition Tests")
	class PreconditionTest {

		@Test
		@DisplayName("Should fail when the input directory is missing")
		void shouldFailForMissingInput() {
			assertThatThrownBy(() -> stage().run(inputDir, outputDir)).isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("Input directory not found");
		}

		@Test
		@DisplayName("Should fail when no batch files exist")
		void shouldFailForEmptyCorpus() throws IOException {
			Files.createDirectories(inputDir.resolve("2024"));
			Files.writeString(inputDir.resolve("readme.txt"), "nothing here");

			assertThatThrownBy(() -> stage().run(inputDir, outputDir)).isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("No .jsonl files found");
		}

		@Test
		@DisplayName("Should reject an output directory inside the input")
		void shouldRejectNestedOutput() throws IOException {
			writeSampleCorpus();

			assertThatThrownBy(() -> stage().run(inputDir, inputDir.resolve("cleaned")))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("must not be inside");
		}

	}

	@Nested
	@DisplayName("Failure Isolation Tests")
	class FailureIsolationTest {

		@Mock
		RecordTransformer transformer;

		@Test
		@DisplayName("Should report a failing file and finish the others")
		void shouldIsolateFailingFile() throws IOException {
			writeBatch("a/good_1.jsonl", "{}");
			Path bad = writeBatch("b/bad.jsonl", "{}");
			writeBatch("c/good_2.jsonl", "{}");
			CleaningStats perFile = new CleaningStats(10, 4, Map.of(CleaningRules.TAGS, 6L), 1, 0, 1, 0, 0);
			when(transformer.transform(any(Path.class), any(Path.class))).thenAnswer(invocation -> {
				Path input = invocation.getArgument(0);
				if (input.getFileName().toString().equals("bad.jsonl")) {
					throw new IOException("disk error");
				}
				return perFile;
			});

			CleaningReport report = CorpusCuratorBuilder.create()
				.properties(properties)
				.transformer(transformer)
				.buildCleaningStage()
				.run(inputDir, outputDir);

			assertThat(report.failedFiles()).containsExactly(new FileFailure(bad.toAbsolutePath(), "disk error"));
			assertThat(report.hasFailures()).isTrue();
			assertThat(report.stats().processedCount()).isEqualTo(2);
			assertThat(report.stats().ruleReductions()).containsEntry(CleaningRules.TAGS, 12L);
			assertThat(report.totalFiles()).isEqualTo(3);
			verify(transformer, times(3)).transform(any(Path.class), any(Path.class));
		}

	}

}
