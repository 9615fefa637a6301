package org.springaicommunity.corpus.curator;

import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * Factory for creating a consistently configured {@link ObjectMapper}.
 *
 * <p>
 * The returned mapper uses {@link PropertyNamingStrategies#SNAKE_CASE} so that Java
 * camelCase record fields are serialized as snake_case JSON keys
 * (e.g.&nbsp;{@code contentLength} &rarr; {@code content_length}).
 *
 * <p>
 * Floating point values are read as exact {@link java.math.BigDecimal} nodes so that
 * fields passed through a rewritten record keep their original textual form. Content
 * after the first JSON value on a line is rejected.
 *
 * <p>
 * String values are not length limited. Jackson caps them at 20,000,000 characters by
 * default, and crawled pages can exceed that.
 */
public final class ObjectMapperFactory {

	private ObjectMapperFactory() {
	}

	/**
	 * Create a new {@link ObjectMapper} with standard configuration.
	 * @return configured ObjectMapper
	 */
	public static ObjectMapper create() {
		ObjectMapper mapper = new ObjectMapper();
		mapper.getFactory()
			.setStreamReadConstraints(StreamReadConstraints.builder().maxStringLength(Integer.MAX_VALUE).build());
		mapper.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
		mapper.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
		mapper.setNodeFactory(JsonNodeFactory.withExactBigDecimals(true));
		mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
		return mapper;
	}

}
