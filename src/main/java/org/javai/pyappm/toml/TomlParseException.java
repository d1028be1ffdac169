package org.javai.pyappm.toml;

/**
 * Exception thrown when configuration text cannot be reduced by the grammar.
 */
public class TomlParseException extends RuntimeException {

	public TomlParseException(String message) {
		super(message);
	}

	public TomlParseException(String message, Throwable cause) {
		super(message, cause);
	}
}
