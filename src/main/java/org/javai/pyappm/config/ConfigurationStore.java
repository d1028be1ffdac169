package org.javai.pyappm.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import org.javai.pyappm.toml.TomlDocument;
import org.javai.pyappm.toml.TomlReader;
import org.javai.pyappm.toml.TomlTypeException;
import org.javai.pyappm.toml.TomlValue;
import org.javai.pyappm.toml.TomlWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads and saves the tool configuration file.
 *
 * <p>The section named by {@link AppmPaths#settingsSection()} holds the tool settings; every other
 * top-level section describes one tracked application.</p>
 */
public class ConfigurationStore {

	private static final Logger logger = LoggerFactory.getLogger(ConfigurationStore.class);

	private static final TypeReference<LinkedHashMap<String, Object>> PLAIN_MAP = new TypeReference<>() {
	};

	private final AppmPaths paths;
	private final TomlReader reader;
	private final TomlWriter writer;
	private final ObjectMapper mapper = new ObjectMapper();

	public ConfigurationStore(AppmPaths paths) {
		this(paths, new TomlReader(), new TomlWriter());
	}

	public ConfigurationStore(AppmPaths paths, TomlReader reader, TomlWriter writer) {
		if (paths == null) {
			throw new IllegalArgumentException("Paths cannot be null");
		}
		this.paths = paths;
		this.reader = reader;
		this.writer = writer;
	}

	public Path configFile() {
		return paths.configFile();
	}

	/**
	 * Loads the configuration, first writing the defaults if no configuration file exists yet.
	 *
	 * @throws IOException if the file cannot be read or the defaults cannot be written
	 * @throws ConfigurationException if the settings section is missing or a section is malformed
	 */
	public AppmConfiguration load() throws IOException {
		Path file = paths.configFile();
		if (!Files.exists(file)) {
			logger.info("No configuration found at {}, writing defaults", file);
			save(AppmConfiguration.defaults());
		}

		TomlDocument document = reader.read(file);
		String reserved = paths.settingsSection();
		TomlDocument settingsTable = document.getTable(reserved)
				.orElseThrow(() -> new ConfigurationException(
						"Configuration file " + file + " is invalid: missing [" + reserved + "] section"));

		AppmSettings settings;
		try {
			settings = AppmSettings.fromTable(settingsTable);
		}
		catch (TomlTypeException e) {
			throw new ConfigurationException("Invalid [" + reserved + "] section in " + file + ": " + e.getMessage(), e);
		}

		List<AppmApplication> applications = new ArrayList<>();
		for (Map.Entry<String, TomlValue> entry : document.entrySet()) {
			if (entry.getKey().equals(reserved)) {
				continue;
			}
			TomlDocument table = ((TomlValue.Table) entry.getValue()).document();
			applications.add(toApplication(entry.getKey(), table));
		}

		logger.debug("Loaded configuration with {} applications from {}", applications.size(), file);
		return new AppmConfiguration(settings, applications);
	}

	/**
	 * Writes the configuration, settings section first, then one section per application.
	 *
	 * @throws IOException if the file cannot be written
	 * @throws ConfigurationException if an application has no name, uses the reserved section name,
	 *         or holds a name or value the file format cannot represent
	 */
	public void save(AppmConfiguration configuration) throws IOException {
		TomlDocument document = new TomlDocument();
		document.put(paths.settingsSection(), configuration.settings().toTable());
		for (AppmApplication application : configuration.applications()) {
			if (StringUtils.isBlank(application.name())) {
				throw new ConfigurationException("Application without a name cannot be saved");
			}
			if (application.name().equals(paths.settingsSection())) {
				throw new ConfigurationException(
						"Application name '" + application.name() + "' clashes with the settings section");
			}
			document.put(application.name(), toTable(application));
		}

		Files.createDirectories(paths.configDirectory());
		try {
			writer.write(document, paths.configFile());
		}
		catch (TomlTypeException e) {
			throw new ConfigurationException("Configuration cannot be saved: " + e.getMessage(), e);
		}
		logger.debug("Saved configuration with {} applications to {}", configuration.applications().size(),
				paths.configFile());
	}

	private AppmApplication toApplication(String section, TomlDocument table) {
		AppmApplication application;
		try {
			application = mapper.convertValue(table.toPlainMap(), AppmApplication.class);
		}
		catch (IllegalArgumentException e) {
			throw new ConfigurationException("Invalid application section [" + section + "]: " + e.getMessage(), e);
		}
		return StringUtils.isBlank(application.name()) ? application.withName(section) : application;
	}

	private TomlDocument toTable(AppmApplication application) {
		return TomlDocument.fromPlainMap(mapper.convertValue(application, PLAIN_MAP));
	}
}
