package org.javai.pyappm.manifest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import org.javai.pyappm.config.AppmPaths;
import org.javai.pyappm.config.AppmSettings;
import org.javai.pyappm.config.Author;
import org.javai.pyappm.toml.TomlDocument;
import org.javai.pyappm.toml.TomlTypeException;
import org.javai.pyappm.toml.TomlValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("AppManifest")
class AppManifestTest {

	private static final AppmSettings SETTINGS = AppmSettings.defaults()
			.withAuthors(List.of(new Author("Jane Doe", "j.doe@example.com")))
			.withDependencies(List.of("rich"));

	@Nested
	@DisplayName("Creation")
	class CreationTests {

		@Test
		@DisplayName("Default manifest has tools, project and executable sections")
		void defaultLayout() {
			AppManifest manifest = AppManifest.createDefault("demo", SETTINGS);
			TomlDocument document = manifest.document();

			assertThat(document.keySet()).containsExactly("tools", "project", "executable");
			assertThat(manifest.tools()).containsEntry("env_create_tool", "python3 -m venv")
					.containsEntry("env_name", "env")
					.containsEntry("env_lib_installer", "pip3 install");
			TomlDocument project = document.getTable("project").orElseThrow();
			assertThat(project.keySet()).containsExactly("name", "version", "readme", "license", "description",
					"authors", "requires_python", "type", "dependencies", "local_dependencies");
			assertThat(manifest.name()).contains("demo");
			assertThat(manifest.version()).contains("0.1.0");
			assertThat(manifest.dependencies()).containsExactly(new DependencyRecord("rich", List.of()));
			assertThat(manifest.localDependencies()).isEmpty();
			assertThat(manifest.executables()).containsExactly(entry("demo", "demo:run"));
		}

		@Test
		@DisplayName("Written manifest reads back the same")
		void createWritesFile(@TempDir Path dir) throws IOException {
			Path file = AppmPaths.in(dir.resolve("config")).manifestIn(dir);

			AppManifest created = AppManifest.create(file, "demo", SETTINGS);
			AppManifest loaded = AppManifest.load(file);

			assertThat(file.getFileName()).hasToString("pyapp.toml");
			assertThat(loaded.document()).isEqualTo(created.document());
			assertThat(Files.readString(file)).startsWith("[tools]\nenv_create_tool=\"python3 -m venv\"\n")
					.contains("authors=[{name=\"Jane Doe\", email=\"j.doe@example.com\"}]");
		}

		@Test
		@DisplayName("Dashed application name reads back with an underscored executable key")
		void dashedName(@TempDir Path dir) throws IOException {
			Path file = dir.resolve("pyapp.toml");

			AppManifest created = AppManifest.create(file, "my-app", AppmSettings.defaults());
			AppManifest loaded = AppManifest.load(file);

			assertThat(loaded.document()).isEqualTo(created.document());
			assertThat(loaded.name()).contains("my-app");
			assertThat(loaded.executables()).containsExactly(entry("my_app", "my-app:run"));
		}

		@Test
		@DisplayName("Existing manifest is not overwritten")
		void createRefusesExisting(@TempDir Path dir) throws IOException {
			Path file = dir.resolve("pyapp.toml");
			Files.writeString(file, "[project]\nname=\"old\"\n");

			assertThatThrownBy(() -> AppManifest.create(file, "demo", SETTINGS))
					.isInstanceOf(FileAlreadyExistsException.class);
			assertThat(Files.readString(file)).isEqualTo("[project]\nname=\"old\"\n");
		}

		@Test
		@DisplayName("Blank application name is rejected")
		void blankName() {
			assertThatThrownBy(() -> AppManifest.createDefault(" ", SETTINGS))
					.isInstanceOf(IllegalArgumentException.class);
		}

		@Test
		@DisplayName("Loading a missing manifest fails")
		void loadMissing(@TempDir Path dir) {
			assertThatThrownBy(() -> AppManifest.load(dir.resolve("pyapp.toml")))
					.isInstanceOf(NoSuchFileException.class);
		}
	}

	@Nested
	@DisplayName("Dependencies")
	class DependencyTests {

		@Test
		@DisplayName("Added dependency survives a save and load")
		void addAndPersist(@TempDir Path dir) throws IOException {
			Path file = dir.resolve("pyapp.toml");
			AppManifest manifest = AppManifest.create(file, "demo", AppmSettings.defaults());

			boolean added = manifest.addDependency(new DependencyRecord("requests", List.of("urllib3", "idna")));
			manifest.save(file);

			assertThat(added).isTrue();
			AppManifest loaded = AppManifest.load(file);
			assertThat(loaded.hasDependency("requests")).isTrue();
			assertThat(loaded.dependencies())
					.containsExactly(new DependencyRecord("requests", List.of("urllib3", "idna")));
			assertThat(Files.readString(file))
					.contains("dependencies=[{name=\"requests\", new_packages=[\"urllib3\", \"idna\"]}]");
		}

		@Test
		@DisplayName("Duplicate dependency is not added twice")
		void duplicate() {
			AppManifest manifest = AppManifest.createDefault("demo", AppmSettings.defaults());
			manifest.addDependency(new DependencyRecord("requests", List.of()));

			assertThat(manifest.addDependency(new DependencyRecord("requests", List.of("idna")))).isFalse();
			assertThat(manifest.dependencies()).hasSize(1);
		}

		@Test
		@DisplayName("Removing returns the record with its installed packages")
		void remove() {
			AppManifest manifest = AppManifest.createDefault("demo", AppmSettings.defaults());
			manifest.addDependency(new DependencyRecord("requests", List.of("idna")));
			manifest.addDependency(new DependencyRecord("rich", List.of()));

			assertThat(manifest.removeDependency("requests"))
					.contains(new DependencyRecord("requests", List.of("idna")));
			assertThat(manifest.removeDependency("requests")).isEmpty();
			assertThat(manifest.dependencies()).extracting(DependencyRecord::name).containsExactly("rich");
		}

		@Test
		@DisplayName("Local dependencies are kept apart from dependencies")
		void localDependencies() {
			AppManifest manifest = AppManifest.createDefault("demo", AppmSettings.defaults());
			manifest.document().getTable("project").orElseThrow().remove("local_dependencies");

			manifest.addLocalDependency(new DependencyRecord("mylib", List.of()));

			assertThat(manifest.hasLocalDependency("mylib")).isTrue();
			assertThat(manifest.hasDependency("mylib")).isFalse();
			assertThat(manifest.document().find("project", "local_dependencies")).isPresent();
			assertThat(manifest.removeLocalDependency("mylib")).isPresent();
			assertThat(manifest.localDependencies()).isEmpty();
		}

		@Test
		@DisplayName("Manifest without a project section gets one on first add")
		void noProjectSection() {
			AppManifest manifest = new AppManifest(new TomlDocument());
			assertThat(manifest.dependencies()).isEmpty();
			assertThat(manifest.document().isEmpty()).isTrue();

			manifest.addDependency(new DependencyRecord("requests", List.of()));

			assertThat(manifest.document().keySet()).containsExactly("project");
		}

		@Test
		@DisplayName("Malformed dependency entries are reported")
		void malformedEntry() {
			TomlDocument document = new TomlDocument();
			document.ensureTable("project").put("dependencies", TomlValue.array(TomlValue.str("requests")));

			assertThatThrownBy(() -> new AppManifest(document).dependencies())
					.isInstanceOf(TomlTypeException.class);
		}
	}
}
