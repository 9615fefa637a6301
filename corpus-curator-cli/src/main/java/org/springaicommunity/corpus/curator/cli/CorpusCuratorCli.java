package org.springaicommunity.corpus.curator.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.corpus.curator.*;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Corpus Curator CLI Application
 *
 * Plain Java command-line application that cleans, ranks and prunes a partitioned JSONL
 * crawl corpus. Uses CorpusCuratorBuilder for service wiring.
 *
 * Usage: java -jar corpus-curator-cli.jar &lt;clean|top-k|remove&gt; [input-dir] [OPTIONS]
 *
 * Environment Variables: CURATOR_WORKERS, CURATOR_TOP_K - defaults for --workers and
 * --top-k
 *
 * Examples: java -jar corpus-curator-cli.jar clean analyses java -jar
 * corpus-curator-cli.jar top-k analyses --top-k 1000 java -jar corpus-curator-cli.jar
 * remove analyses
 */
public class CorpusCuratorCli {

	private static final Logger logger = LoggerFactory.getLogger(CorpusCuratorCli.class);

	private static final double MB = 1024.0 * 1024.0;

	public static void main(String[] args) {
		try {
			int exitCode = run(args);
			if (exitCode != 0) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("Processing failed: {}", e.getMessage());
			System.exit(1);
		}
	}

	/**
	 * Run one stage.
	 * @param args command-line arguments
	 * @return process exit code: 0 on success, 1 on a fatal error or failed files
	 */
	public static int run(String[] args) throws Exception {
		CuratorProperties properties;
		try {
			properties = new CuratorProperties().applyEnvironment();
		}
		catch (IllegalStateException e) {
			logger.error("Error: {}", e.getMessage());
			return 1;
		}
		ArgumentParser argumentParser = new ArgumentParser(properties);

		// Check for help request first
		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return 0;
		}

		ParsedConfiguration config;
		try {
			config = argumentParser.parseAndValidate(args);
		}
		catch (IllegalArgumentException e) {
			logger.error("Error: {}", e.getMessage());
			logger.error("Run with --help for usage.");
			return 1;
		}
		config.applyTo(properties);
		logConfiguration(config, properties);

		CorpusCuratorBuilder builder = CorpusCuratorBuilder.create().properties(properties);
		Path inputDir = Paths.get(config.inputDirectory);
		Path workingDir = Paths.get(System.getProperty("user.dir"));

		try {
			switch (config.command) {
				case ArgumentParser.CLEAN: {
					CleaningReport report = builder.buildCleaningStage()
						.run(inputDir, workingDir.resolve(config.outputDirectory));
					logCleaningReport(report);
					return report.hasFailures() ? 1 : 0;
				}
				case ArgumentParser.TOP_K: {
					TopKReport report = builder.buildTopKStage().run(inputDir, workingDir.resolve(config.manifestFile));
					logTopKReport(report);
					return report.hasFailures() ? 1 : 0;
				}
				case ArgumentParser.REMOVE: {
					RemovalReport report = builder.buildRemovalStage()
						.run(inputDir, workingDir.resolve(config.manifestFile));
					logRemovalReport(report);
					return report.hasFailures() ? 1 : 0;
				}
				default:
					throw new IllegalArgumentException("Unknown command: " + config.command);
			}
		}
		catch (IllegalStateException | IllegalArgumentException e) {
			logger.error("Error: {}", e.getMessage());
			return 1;
		}
	}

	private static void logConfiguration(ParsedConfiguration config, CuratorProperties properties) {
		logger.info("Configuration:");
		logger.info("  Command: {}", config.command);
		logger.info("  Input directory: {}", Paths.get(config.inputDirectory).toAbsolutePath());
		logger.info("  Workers: {}", properties.getEffectiveWorkers());
		if (ArgumentParser.CLEAN.equals(config.command)) {
			logger.info("  Output directory: {}", config.outputDirectory);
		}
		else {
			logger.info("  Manifest: {}", config.manifestFile);
		}
		if (ArgumentParser.TOP_K.equals(config.command)) {
			logger.info("  Top-k: {}", config.topK);
		}
		logger.info("  Verbose: {}", config.verbose);
	}

	private static void logCleaningReport(CleaningReport report) {
		CleaningStats stats = report.stats();
		double mbBefore = stats.sizeBefore() / MB;
		double mbAfter = stats.sizeAfter() / MB;

		logger.info("");
		logger.info("--- Cleanup Analysis ---");
		logger.info("Total size: {}MB -> {}MB", format2(mbBefore), format2(mbAfter));
		logger.info("Reduction: {}% ({}MB)", format1(stats.reductionPercent()), format2(mbBefore - mbAfter));

		long totalReduction = stats.sizeBefore() - stats.sizeAfter();
		List<Map.Entry<String, Long>> byRule = stats.ruleReductions()
			.entrySet()
			.stream()
			.filter(e -> e.getValue() > 0)
			.sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()))
			.toList();
		if (byRule.isEmpty()) {
			logger.info("");
			logger.info("No reduction recorded by specific patterns.");
		}
		else {
			logger.info("");
			logger.info("Reduction by pattern:");
			for (Map.Entry<String, Long> rule : byRule) {
				double share = totalReduction > 0 ? rule.getValue() * 100.0 / totalReduction : 0;
				logger.info("  - {}: {}MB ({}% of total reduction)", rule.getKey(), format2(rule.getValue() / MB),
						format1(share));
			}
		}

		logger.info("");
		logger.info("--- Processing Summary ---");
		logger.info("Files processed: {}", stats.processedCount());
		logger.info("Files skipped: {}", stats.skippedCount());
		logger.info("Files failed: {}", report.failedFiles().size());
		logger.info("Total files found: {}", report.totalFiles());
		logger.info("Records written: {}, dropped: {}, malformed lines: {}", stats.recordsWritten(),
				stats.recordsDropped(), stats.malformedLines());
		logFailures(report.failedFiles());
		logger.info("Processing completed in {}s", seconds(report.duration().toMillis()));
	}

	private static void logTopKReport(TopKReport report) {
		logger.info("");
		logger.info("Top 5 largest entries:");
		List<TopKEntry> entries = report.entries();
		for (int i = 0; i < Math.min(5, entries.size()); i++) {
			TopKEntry entry = entries.get(i);
			logger.info("{}. {}KB - {} ({})", i + 1, format2(entry.contentLength() / 1024.0), entry.url(),
					entry.sourceFile());
		}
		logger.info("");
		logger.info("Saved {} largest entries to {}", entries.size(), report.manifestFile());
		logger.info("Files scanned: {}", report.filesScanned());
		logFailures(report.failedFiles());
		logger.info("Processing completed in {}s", seconds(report.duration().toMillis()));
	}

	private static void logRemovalReport(RemovalReport report) {
		logger.info("");
		logger.info("Summary:");
		logger.info("Total files processed: {}", report.rewrittenFiles().size());
		logger.info("Total entries removed: {}", report.totalRemoved());
		logger.info("Expected removals: {}", report.expectedRemovals());

		if (!report.missingFiles().isEmpty()) {
			logger.warn("Some files from the manifest were not found:");
			for (String missing : report.missingFiles()) {
				logger.warn(" - {}", missing);
			}
		}
		if (!report.ambiguousFiles().isEmpty()) {
			logger.warn("Some manifest file names matched more than one file:");
			report.ambiguousFiles().forEach((name, paths) -> logger.warn(" - {}: {}", name, paths));
		}
		logFailures(report.failedFiles());
		logger.info("Finished removing largest entries from source files in {}s",
				seconds(report.duration().toMillis()));
	}

	private static void logFailures(List<FileFailure> failures) {
		if (failures.isEmpty()) {
			return;
		}
		logger.warn("{} files failed:", failures.size());
		for (FileFailure failure : failures) {
			logger.warn(" - {}: {}", failure.file(), failure.reason());
		}
	}

	private static String format1(double value) {
		return String.format("%.1f", value);
	}

	private static String format2(double value) {
		return String.format("%.2f", value);
	}

	private static String seconds(long millis) {
		return format1(millis / 1000.0);
	}

}
