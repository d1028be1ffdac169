package org.javai.pyappm.toml;

/**
 * Thrown when a value does not have the shape required at its position,
 * e.g. a non-table at the top level of a document being written.
 */
public class TomlTypeException extends RuntimeException {

	public TomlTypeException(String message) {
		super(message);
	}

	public TomlTypeException(String message, Throwable cause) {
		super(message, cause);
	}
}
