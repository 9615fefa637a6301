package org.springaicommunity.corpus.curator;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

/**
 * Builder for creating the curation stages without a dependency injection container.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Defaults, with CURATOR_WORKERS / CURATOR_TOP_K applied from the environment
 * CleaningStage cleaning = CorpusCuratorBuilder.create()
 *     .properties(new CuratorProperties().applyEnvironment())
 *     .buildCleaningStage();
 *
 * // With custom configuration
 * CuratorProperties props = new CuratorProperties();
 * props.setWorkers(4);
 * props.setTopK(500);
 *
 * TopKStage topK = CorpusCuratorBuilder.create()
 *     .properties(props)
 *     .buildTopKStage();
 *
 * // For testing with a mock rewriter
 * RecordRewriter mockRewriter = mock(RecordRewriter.class);
 * RemovalStage removal = CorpusCuratorBuilder.create()
 *     .rewriter(mockRewriter)
 *     .buildRemovalStage();
 * }
 * </pre>
 */
public class CorpusCuratorBuilder {

	private CuratorProperties properties;

	@Nullable
	private ObjectMapper objectMapper;

	@Nullable
	private RecordTransformer transformer;

	@Nullable
	private RecordRewriter rewriter;

	@Nullable
	private PartitionWalker walker;

	private CorpusCuratorBuilder() {
		this.properties = new CuratorProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new CorpusCuratorBuilder
	 */
	public static CorpusCuratorBuilder create() {
		return new CorpusCuratorBuilder();
	}

	/**
	 * Set curation properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public CorpusCuratorBuilder properties(@Nullable CuratorProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public CorpusCuratorBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom transformer for the cleaning stage.
	 * @param transformer transformer implementation (null to use the regex pipeline)
	 * @return this builder
	 */
	public CorpusCuratorBuilder transformer(@Nullable RecordTransformer transformer) {
		this.transformer = transformer;
		return this;
	}

	/**
	 * Set a custom rewriter for the removal stage.
	 * @param rewriter rewriter implementation (null to use {@link SafeFileRewriter})
	 * @return this builder
	 */
	public CorpusCuratorBuilder rewriter(@Nullable RecordRewriter rewriter) {
		this.rewriter = rewriter;
		return this;
	}

	/**
	 * Set a custom partition walker.
	 * @param walker walker implementation (null to use default)
	 * @return this builder
	 */
	public CorpusCuratorBuilder walker(@Nullable PartitionWalker walker) {
		this.walker = walker;
		return this;
	}

	public CleaningStage buildCleaningStage() {
		RecordTransformer effectiveTransformer = transformer != null ? transformer
				: new RegexRecordTransformer(getObjectMapper(), CleaningRules.defaults(),
						properties.getWriteBufferSize());
		return new CleaningStage(getWalker(), effectiveTransformer, properties);
	}

	public TopKStage buildTopKStage() {
		return new TopKStage(getWalker(), getObjectMapper(), properties);
	}

	public RemovalStage buildRemovalStage() {
		RecordRewriter effectiveRewriter = rewriter != null ? rewriter
				: new SafeFileRewriter(getObjectMapper(), properties.getWriteBufferSize());
		return new RemovalStage(getWalker(), effectiveRewriter, getObjectMapper());
	}

	public CuratorProperties getProperties() {
		return properties;
	}

	private ObjectMapper getObjectMapper() {
		if (objectMapper == null) {
			objectMapper = ObjectMapperFactory.create();
		}
		return objectMapper;
	}

	private PartitionWalker getWalker() {
		if (walker == null) {
			walker = new PartitionWalker();
		}
		return walker;
	}

}
