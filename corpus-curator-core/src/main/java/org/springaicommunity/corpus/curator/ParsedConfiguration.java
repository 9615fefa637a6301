package org.springaicommunity.corpus.curator;

import org.jspecify.annotations.Nullable;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Stage to run: clean, top-k or remove
	@Nullable
	public String command;

	public String inputDirectory;

	// Cleaned output root (clean)
	public String outputDirectory;

	// Manifest written by top-k and read by remove
	public String manifestFile;

	public int workers;

	public int topK;

	public boolean verbose = false;

	public boolean helpRequested = false;

	public ParsedConfiguration(CuratorProperties defaultProperties) {
		this.inputDirectory = defaultProperties.getDefaultInputDir();
		this.outputDirectory = defaultProperties.getCleanedOutputDir();
		this.manifestFile = defaultProperties.getManifestFile();
		this.workers = defaultProperties.getWorkers();
		this.topK = defaultProperties.getTopK();
		this.verbose = defaultProperties.isVerbose();
	}

	/**
	 * Copy the parsed values onto {@code properties}.
	 * @param properties properties to update
	 * @return the updated properties
	 */
	public CuratorProperties applyTo(CuratorProperties properties) {
		properties.setDefaultInputDir(inputDirectory);
		properties.setCleanedOutputDir(outputDirectory);
		properties.setManifestFile(manifestFile);
		properties.setWorkers(workers);
		properties.setTopK(topK);
		properties.setVerbose(verbose);
		return properties;
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "command='" + command + '\'' + ", inputDirectory='" + inputDirectory + '\''
				+ ", outputDirectory='" + outputDirectory + '\'' + ", manifestFile='" + manifestFile + '\''
				+ ", workers=" + workers + ", topK=" + topK + ", verbose=" + verbose + ", helpRequested="
				+ helpRequested + '}';
	}

}
