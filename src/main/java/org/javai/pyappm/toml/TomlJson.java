package org.javai.pyappm.toml;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Debug view of a document as pretty-printed JSON. Strings and bare words both appear as JSON strings.
 */
public final class TomlJson {

	private static final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

	private TomlJson() {
	}

	public static String toReadableJson(TomlDocument document) {
		try {
			return mapper.writeValueAsString(document.toPlainMap());
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to render document as JSON", e);
		}
	}
}
