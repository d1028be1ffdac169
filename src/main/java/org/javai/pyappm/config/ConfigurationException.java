package org.javai.pyappm.config;

/**
 * Thrown when the tool configuration file is readable but structurally invalid.
 */
public class ConfigurationException extends RuntimeException {

	public ConfigurationException(String message) {
		super(message);
	}

	public ConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}
