package org.springaicommunity.corpus.curator;

/**
 * Configuration properties for the curation stages.
 *
 * <p>
 * Properties can be set directly via setters or passed to {@link CorpusCuratorBuilder}.
 * Default values match the layout produced by the crawler: input batches under
 * {@code analyses}, cleaned output under {@code analyses_cleaned} and the removal
 * manifest {@code largest_content.jsonl} in the working directory.
 */
public class CuratorProperties {

	/**
	 * Input directory used when none is given on the command line.
	 */
	private String defaultInputDir = "analyses";

	/**
	 * Directory, relative to the working directory, that receives cleaned files.
	 */
	private String cleanedOutputDir = "analyses_cleaned";

	/**
	 * File written by the top-K stage and read by the removal stage.
	 */
	private String manifestFile = "largest_content.jsonl";

	/**
	 * Number of largest records kept by the top-K stage.
	 */
	private int topK = 1000;

	/**
	 * Maximum number of files processed concurrently (0 = available processors).
	 */
	private int workers = 0;

	/**
	 * Buffer size in bytes for streamed output files (default: 64KB).
	 */
	private int writeBufferSize = 64 * 1024;

	/**
	 * Lower bound on the number of files per top-K wave.
	 */
	private int minWaveSize = 5;

	/**
	 * Enable verbose logging output.
	 */
	private boolean verbose = false;

	public String getDefaultInputDir() {
		return defaultInputDir;
	}

	public void setDefaultInputDir(String defaultInputDir) {
		this.defaultInputDir = defaultInputDir;
	}

	public String getCleanedOutputDir() {
		return cleanedOutputDir;
	}

	public void setCleanedOutputDir(String cleanedOutputDir) {
		this.cleanedOutputDir = cleanedOutputDir;
	}

	public String getManifestFile() {
		return manifestFile;
	}

	public void setManifestFile(String manifestFile) {
		this.manifestFile = manifestFile;
	}

	public int getTopK() {
		return topK;
	}

	public void setTopK(int topK) {
		this.topK = topK;
	}

	public int getWorkers() {
		return workers;
	}

	public void setWorkers(int workers) {
		this.workers = workers;
	}

	/**
	 * Returns the worker count to use, resolving 0 to the number of available
	 * processors.
	 * @return effective concurrency, at least 1
	 */
	public int getEffectiveWorkers() {
		int configured = workers > 0 ? workers : Runtime.getRuntime().availableProcessors();
		return Math.max(1, configured);
	}

	public int getWriteBufferSize() {
		return writeBufferSize;
	}

	public void setWriteBufferSize(int writeBufferSize) {
		this.writeBufferSize = writeBufferSize;
	}

	public int getMinWaveSize() {
		return minWaveSize;
	}

	public void setMinWaveSize(int minWaveSize) {
		this.minWaveSize = minWaveSize;
	}

	/**
	 * Returns the number of files scheduled per top-K wave: {@code max(minWaveSize,
	 * workers / 2)}.
	 * @return wave size
	 */
	public int getWaveSize() {
		return Math.max(minWaveSize, getEffectiveWorkers() / 2);
	}

	public boolean isVerbose() {
		return verbose;
	}

	public void setVerbose(boolean verbose) {
		this.verbose = verbose;
	}

	/**
	 * Apply {@code CURATOR_WORKERS} and {@code CURATOR_TOP_K} from the environment (or a
	 * {@code .env} file) when they are set.
	 * @return this properties instance
	 */
	public CuratorProperties applyEnvironment() {
		Integer envWorkers = EnvironmentSupport.getPositiveInt(EnvironmentSupport.WORKERS_VARIABLE);
		if (envWorkers != null) {
			this.workers = envWorkers;
		}
		Integer envTopK = EnvironmentSupport.getPositiveInt(EnvironmentSupport.TOP_K_VARIABLE);
		if (envTopK != null) {
			this.topK = envTopK;
		}
		return this;
	}

}
