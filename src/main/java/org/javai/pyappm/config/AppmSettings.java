package org.javai.pyappm.config;

import java.util.List;
import org.javai.pyappm.toml.TomlDocument;

/**
 * Tool-wide settings, stored in the reserved section of the configuration file.
 * Missing keys fall back to {@link #defaults()}.
 */
public record AppmSettings(
		String tempDir,
		String envCreateTool,
		String envActivateTool,
		String envDeactivateTool,
		String defaultEnvName,
		String defaultAppType,
		String defaultMainFunction,
		String envLibInstallerTool,
		String requiresPython,
		String defaultAppVersion,
		List<Author> authors,
		List<String> dependencies,
		boolean createVenv,
		boolean createLicense,
		boolean createReadme,
		boolean createChangelog,
		boolean createInit,
		boolean createAbout,
		boolean createTyped,
		boolean createGitignore,
		boolean runGitInit) {

	public AppmSettings {
		authors = authors != null ? List.copyOf(authors) : List.of();
		dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
	}

	public static AppmSettings defaults() {
		return new AppmSettings(
				"/tmp/pyappm",
				"python3 -m venv",
				"source bin/activate",
				"deactivate",
				"env",
				"application",
				"main",
				"pip3 install",
				">=3.10",
				"0.1.0",
				List.of(),
				List.of(),
				true,
				true,
				true,
				true,
				false,
				true,
				false,
				false,
				false);
	}

	public AppmSettings withAuthors(List<Author> newAuthors) {
		return new AppmSettings(tempDir, envCreateTool, envActivateTool, envDeactivateTool, defaultEnvName,
				defaultAppType, defaultMainFunction, envLibInstallerTool, requiresPython, defaultAppVersion,
				newAuthors, dependencies, createVenv, createLicense, createReadme, createChangelog, createInit,
				createAbout, createTyped, createGitignore, runGitInit);
	}

	public AppmSettings withDependencies(List<String> newDependencies) {
		return new AppmSettings(tempDir, envCreateTool, envActivateTool, envDeactivateTool, defaultEnvName,
				defaultAppType, defaultMainFunction, envLibInstallerTool, requiresPython, defaultAppVersion,
				authors, newDependencies, createVenv, createLicense, createReadme, createChangelog, createInit,
				createAbout, createTyped, createGitignore, runGitInit);
	}

	/**
	 * Reads settings from the reserved section, using defaults for absent keys.
	 *
	 * @throws org.javai.pyappm.toml.TomlTypeException if a key holds a value of the wrong kind
	 */
	public static AppmSettings fromTable(TomlDocument table) {
		AppmSettings d = defaults();
		return new AppmSettings(
				table.getString("temp_dir", d.tempDir()),
				table.getString("env_create_tool", d.envCreateTool()),
				table.getString("env_activate_tool", d.envActivateTool()),
				table.getString("env_deactivate_tool", d.envDeactivateTool()),
				table.getString("default_env_name", d.defaultEnvName()),
				table.getString("default_app_type", d.defaultAppType()),
				table.getString("default_main_function", d.defaultMainFunction()),
				table.getString("env_lib_installer_tool", d.envLibInstallerTool()),
				table.getString("requires_python", d.requiresPython()),
				table.getString("default_app_version", d.defaultAppVersion()),
				table.getArray("authors").map(Author::fromArray).orElse(d.authors()),
				table.containsKey("dependencies") ? table.getStrings("dependencies") : d.dependencies(),
				table.getBoolean("create_venv", d.createVenv()),
				table.getBoolean("create_license", d.createLicense()),
				table.getBoolean("create_readme", d.createReadme()),
				table.getBoolean("create_changelog", d.createChangelog()),
				table.getBoolean("create_init", d.createInit()),
				table.getBoolean("create_about", d.createAbout()),
				table.getBoolean("create_typed", d.createTyped()),
				table.getBoolean("create_gitignore", d.createGitignore()),
				table.getBoolean("run_git_init", d.runGitInit()));
	}

	public TomlDocument toTable() {
		return new TomlDocument()
				.put("temp_dir", tempDir)
				.put("env_create_tool", envCreateTool)
				.put("env_activate_tool", envActivateTool)
				.put("env_deactivate_tool", envDeactivateTool)
				.put("default_env_name", defaultEnvName)
				.put("default_app_type", defaultAppType)
				.put("default_main_function", defaultMainFunction)
				.put("env_lib_installer_tool", envLibInstallerTool)
				.put("requires_python", requiresPython)
				.put("default_app_version", defaultAppVersion)
				.put("authors", Author.toArray(authors))
				.putStrings("dependencies", dependencies)
				.put("create_venv", createVenv)
				.put("create_license", createLicense)
				.put("create_readme", createReadme)
				.put("create_changelog", createChangelog)
				.put("create_init", createInit)
				.put("create_about", createAbout)
				.put("create_typed", createTyped)
				.put("create_gitignore", createGitignore)
				.put("run_git_init", runGitInit);
	}
}
