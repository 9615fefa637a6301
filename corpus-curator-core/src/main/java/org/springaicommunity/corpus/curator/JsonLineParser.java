package org.springaicommunity.corpus.curator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Parses JSONL lines into {@link LineParse} values.
 */
public class JsonLineParser {

	private final ObjectMapper objectMapper;

	public JsonLineParser(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	public LineParse parse(String line) {
		try {
			JsonNode node = objectMapper.readTree(line);
			if (node instanceof ObjectNode object) {
				return new LineParse.Parsed(line, object);
			}
			if (node == null || node.isMissingNode()) {
				return new LineParse.ParseError(line, new IllegalArgumentException("No JSON content"));
			}
			return new LineParse.PassThrough(line);
		}
		catch (JsonProcessingException e) {
			return new LineParse.ParseError(line, e);
		}
	}

}
