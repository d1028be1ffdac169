package org.javai.pyappm.manifest;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;
import org.javai.pyappm.config.AppmSettings;
import org.javai.pyappm.config.Author;
import org.javai.pyappm.toml.TomlDocument;
import org.javai.pyappm.toml.TomlParser;
import org.javai.pyappm.toml.TomlReader;
import org.javai.pyappm.toml.TomlValue;
import org.javai.pyappm.toml.TomlWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An application manifest ({@code pyapp.toml}).
 *
 * <pre>
 * [tools]
 * env_create_tool="python3 -m venv"
 * ...
 *
 * [project]
 * name="demo"
 * version="0.1.0"
 * dependencies=[{name="requests", new_packages=["urllib3"]}]
 *
 * [executable]
 * demo="demo:run"
 * </pre>
 *
 * All reads and updates go through the underlying {@link TomlDocument}.
 */
public class AppManifest {

	private static final Logger logger = LoggerFactory.getLogger(AppManifest.class);

	public static final String TOOLS = "tools";
	public static final String PROJECT = "project";
	public static final String EXECUTABLE = "executable";
	public static final String DEPENDENCIES = "dependencies";
	public static final String LOCAL_DEPENDENCIES = "local_dependencies";

	private final TomlDocument document;

	public AppManifest(TomlDocument document) {
		if (document == null) {
			throw new IllegalArgumentException("Document cannot be null");
		}
		this.document = document;
	}

	/**
	 * @throws NoSuchFileException if there is no manifest at {@code path}
	 */
	public static AppManifest load(Path path) throws IOException {
		if (!Files.exists(path)) {
			throw new NoSuchFileException(path.toString(), null, "Manifest not found");
		}
		return new AppManifest(new TomlReader().read(path));
	}

	public void save(Path path) throws IOException {
		new TomlWriter().write(document, path);
	}

	/**
	 * Builds the manifest of a freshly initialised application. The executable entry is keyed by the
	 * application name with {@code -} written as {@code _}. The default dependencies from the
	 * settings are recorded without any installed packages.
	 */
	public static AppManifest createDefault(String appName, AppmSettings settings) {
		if (StringUtils.isBlank(appName)) {
			throw new IllegalArgumentException("Application name cannot be blank");
		}
		TomlDocument document = new TomlDocument();
		document.ensureTable(TOOLS)
				.put("env_create_tool", settings.envCreateTool())
				.put("env_activate_tool", settings.envActivateTool())
				.put("env_deactivate_tool", settings.envDeactivateTool())
				.put("env_name", settings.defaultEnvName())
				.put("env_lib_installer", settings.envLibInstallerTool());
		document.ensureTable(PROJECT)
				.put("name", appName)
				.put("version", settings.defaultAppVersion())
				.put("readme", "README.md")
				.put("license", "LICENSE.txt")
				.put("description", "")
				.put("authors", new TomlValue.Array(settings.authors().stream().map(Author::toValue).toList()))
				.put("requires_python", settings.requiresPython())
				.put("type", "application")
				.put(DEPENDENCIES, new TomlValue.Array(settings.dependencies().stream()
						.map(name -> new DependencyRecord(name, List.of()).toValue())
						.toList()))
				.put(LOCAL_DEPENDENCIES, new TomlValue.Array(List.of()));
		document.ensureTable(EXECUTABLE)
				.put(TomlParser.normalizeKey(appName), appName + ":run");
		return new AppManifest(document);
	}

	/**
	 * Writes the default manifest to a new file.
	 *
	 * @throws FileAlreadyExistsException if {@code path} already exists
	 */
	public static AppManifest create(Path path, String appName, AppmSettings settings) throws IOException {
		if (Files.exists(path)) {
			throw new FileAlreadyExistsException(path.toString());
		}
		AppManifest manifest = createDefault(appName, settings);
		manifest.save(path);
		logger.info("Created manifest for {} at {}", appName, path);
		return manifest;
	}

	public TomlDocument document() {
		return document;
	}

	public Optional<String> name() {
		return section(PROJECT).flatMap(project -> project.getString("name"));
	}

	public Optional<String> version() {
		return section(PROJECT).flatMap(project -> project.getString("version"));
	}

	public Map<String, String> tools() {
		return stringEntries(TOOLS);
	}

	public Map<String, String> executables() {
		return stringEntries(EXECUTABLE);
	}

	public List<DependencyRecord> dependencies() {
		return records(DEPENDENCIES);
	}

	public List<DependencyRecord> localDependencies() {
		return records(LOCAL_DEPENDENCIES);
	}

	public boolean hasDependency(String name) {
		return find(DEPENDENCIES, name).isPresent();
	}

	public boolean hasLocalDependency(String name) {
		return find(LOCAL_DEPENDENCIES, name).isPresent();
	}

	/**
	 * Appends a dependency record, creating the list if the manifest has none yet.
	 *
	 * @return false if a dependency with the same name is already recorded
	 */
	public boolean addDependency(DependencyRecord dependency) {
		return add(DEPENDENCIES, dependency);
	}

	public boolean addLocalDependency(DependencyRecord dependency) {
		return add(LOCAL_DEPENDENCIES, dependency);
	}

	/**
	 * Removes a dependency record by name.
	 *
	 * @return the removed record, so its {@code new_packages} can be uninstalled with it
	 */
	public Optional<DependencyRecord> removeDependency(String name) {
		return remove(DEPENDENCIES, name);
	}

	public Optional<DependencyRecord> removeLocalDependency(String name) {
		return remove(LOCAL_DEPENDENCIES, name);
	}

	private boolean add(String listKey, DependencyRecord dependency) {
		if (find(listKey, dependency.name()).isPresent()) {
			logger.debug("{} is already listed in {}", dependency.name(), listKey);
			return false;
		}
		TomlDocument project = document.ensureTable(PROJECT);
		TomlValue.Array list = project.getArray(listKey).orElse(new TomlValue.Array(List.of()));
		project.put(listKey, list.with(dependency.toValue()));
		return true;
	}

	private Optional<DependencyRecord> remove(String listKey, String name) {
		Optional<DependencyRecord> found = find(listKey, name);
		found.ifPresent(record -> {
			TomlDocument project = document.ensureTable(PROJECT);
			TomlValue.Array list = project.getArray(listKey).orElseThrow();
			project.put(listKey, list.without(value -> DependencyRecord.isNamed(value, name)));
		});
		return found;
	}

	private Optional<DependencyRecord> find(String listKey, String name) {
		return records(listKey).stream().filter(record -> record.name().equals(name)).findFirst();
	}

	private List<DependencyRecord> records(String listKey) {
		return section(PROJECT)
				.flatMap(project -> project.getArray(listKey))
				.map(list -> list.values().stream().map(DependencyRecord::fromValue).toList())
				.orElse(List.of());
	}

	private Optional<TomlDocument> section(String name) {
		return document.getTable(name);
	}

	private Map<String, String> stringEntries(String sectionName) {
		Map<String, String> result = new LinkedHashMap<>();
		section(sectionName).ifPresent(table -> table.keySet()
				.forEach(key -> result.put(key, table.getString(key).orElseThrow())));
		return result;
	}
}
