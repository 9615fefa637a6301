package org.springaicommunity.corpus.curator;

import java.util.ArrayList;
import java.util.List;

/**
 * Command-line argument parser for the corpus curator. Pure Java implementation with no
 * framework dependencies for maximum testability.
 *
 * <p>
 * Syntax: {@code <command> [input-dir] [options]} where command is one of
 * {@value #CLEAN}, {@value #TOP_K} or {@value #REMOVE}.
 */
public class ArgumentParser {

	public static final String CLEAN = "clean";

	public static final String TOP_K = "top-k";

	public static final String REMOVE = "remove";

	private static final List<String> COMMANDS = List.of(CLEAN, TOP_K, REMOVE);

	private final CuratorProperties defaultProperties;

	public ArgumentParser(CuratorProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);
		List<String> positional = new ArrayList<>();

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-w", "--workers":
					config.workers = parsePositive(getRequiredValue(args, i, "workers"), "workers");
					i++; // Skip next argument since we consumed it
					break;

				case "-k", "--top-k":
					config.topK = parsePositive(getRequiredValue(args, i, "top-k"), "top-k");
					i++;
					break;

				case "-o", "--output":
					config.outputDirectory = getRequiredValue(args, i, "output");
					i++;
					break;

				case "-m", "--manifest":
					config.manifestFile = getRequiredValue(args, i, "manifest");
					i++;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					positional.add(arg);
					break;
			}
		}

		if (!positional.isEmpty()) {
			config.command = positional.get(0).toLowerCase();
		}
		if (positional.size() > 1) {
			config.inputDirectory = positional.get(1);
		}
		if (positional.size() > 2) {
			throw new IllegalArgumentException("Unexpected argument: " + positional.get(2));
		}

		validateConfiguration(config);
		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: corpus-curator <command> [input-dir] [OPTIONS]\n");
		help.append("\n");
		help.append("Clean, rank and prune a partitioned JSONL crawl corpus.\n");
		help.append("\n");
		help.append("COMMANDS:\n");
		help.append("    clean                   Strip markup noise from content_text into a mirrored tree\n");
		help.append("    top-k                   Write the largest records to the removal manifest\n");
		help.append("    remove                  Remove the manifest's records from their batch files in place\n");
		help.append("\n");
		help.append("    input-dir               Corpus root (default: ")
			.append(defaultProperties.getDefaultInputDir())
			.append(")\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help              Show this help message\n");
		help.append("    -w, --workers N         Files processed concurrently (default: available processors)\n");
		help.append("    -k, --top-k N           Records kept by top-k (default: ")
			.append(defaultProperties.getTopK())
			.append(")\n");
		help.append("    -o, --output DIR        Cleaned output directory (default: ")
			.append(defaultProperties.getCleanedOutputDir())
			.append(")\n");
		help.append("    -m, --manifest FILE     Removal manifest (default: ")
			.append(defaultProperties.getManifestFile())
			.append(")\n");
		help.append("    -v, --verbose           Log every processed file\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    CURATOR_WORKERS         Default worker count (also read from .env)\n");
		help.append("    CURATOR_TOP_K           Default top-k size (also read from .env)\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    corpus-curator clean analyses\n");
		help.append("    corpus-curator top-k analyses --top-k 500\n");
		help.append("    corpus-curator remove analyses --manifest largest_content.jsonl\n");
		help.append("\n");

		return help.toString();
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private int parsePositive(String value, String optionName) {
		try {
			int parsed = Integer.parseInt(value);
			if (parsed <= 0) {
				throw new IllegalArgumentException(
						"Invalid " + optionName + " '" + value + "': must be a positive integer");
			}
			return parsed;
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + optionName + " '" + value + "': must be a positive integer");
		}
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (config.command == null) {
			errors.add("Command is required (one of " + COMMANDS + ")");
		}
		else if (!COMMANDS.contains(config.command)) {
			errors.add("Invalid command '" + config.command + "' (must be one of " + COMMANDS + ")");
		}

		if (config.inputDirectory == null || config.inputDirectory.trim().isEmpty()) {
			errors.add("Input directory cannot be empty");
		}

		if (config.topK < 0) {
			errors.add("Top-k must not be negative (got: " + config.topK + ")");
		}

		if (config.workers < 0) {
			errors.add("Workers must not be negative (got: " + config.workers + ")");
		}

		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

}
