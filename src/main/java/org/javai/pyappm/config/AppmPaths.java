package org.javai.pyappm.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * File locations and names used by the configuration and manifest loaders.
 * Passed explicitly so that loaders can be pointed at any directory.
 *
 * @param configDirectory directory holding the tool configuration file
 * @param configFileName name of the tool configuration file
 * @param settingsSection top-level section reserved for tool settings; every other section is an application
 * @param manifestFileName name of the per-application manifest file
 */
public record AppmPaths(Path configDirectory, String configFileName, String settingsSection, String manifestFileName) {

	public static final String DEFAULT_CONFIG_FILE_NAME = "pyappmconfig.toml";
	public static final String DEFAULT_SETTINGS_SECTION = "pyappm";
	public static final String DEFAULT_MANIFEST_FILE_NAME = "pyapp.toml";

	public AppmPaths {
		Objects.requireNonNull(configDirectory, "configDirectory");
		Objects.requireNonNull(configFileName, "configFileName");
		Objects.requireNonNull(settingsSection, "settingsSection");
		Objects.requireNonNull(manifestFileName, "manifestFileName");
	}

	/**
	 * Standard locations under the user's home directory ({@code ~/.config/pyappm}).
	 */
	public static AppmPaths defaults() {
		return in(Path.of(System.getProperty("user.home"), ".config", "pyappm"));
	}

	/**
	 * Default file names in the given configuration directory.
	 */
	public static AppmPaths in(Path configDirectory) {
		return new AppmPaths(configDirectory, DEFAULT_CONFIG_FILE_NAME, DEFAULT_SETTINGS_SECTION,
				DEFAULT_MANIFEST_FILE_NAME);
	}

	public Path configFile() {
		return configDirectory.resolve(configFileName);
	}

	public Path manifestIn(Path applicationDirectory) {
		return applicationDirectory.resolve(manifestFileName);
	}
}
