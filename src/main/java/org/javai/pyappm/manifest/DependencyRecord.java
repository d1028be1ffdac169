package org.javai.pyappm.manifest;

import java.util.List;
import java.util.Objects;
import org.javai.pyappm.toml.TomlDocument;
import org.javai.pyappm.toml.TomlTypeException;
import org.javai.pyappm.toml.TomlValue;

/**
 * A dependency installed into an application's environment, together with the packages its
 * installation pulled in, so they can be removed again with it.
 * Stored as {@code {name="requests", new_packages=["urllib3", "idna"]}}.
 */
public record DependencyRecord(String name, List<String> newPackages) {

	public DependencyRecord {
		Objects.requireNonNull(name, "name");
		newPackages = newPackages != null ? List.copyOf(newPackages) : List.of();
	}

	public TomlValue toValue() {
		return TomlValue.table(new TomlDocument()
				.put("name", name)
				.putStrings("new_packages", newPackages));
	}

	/**
	 * @throws TomlTypeException if the value is not a table with a {@code name}
	 */
	public static DependencyRecord fromValue(TomlValue value) {
		if (!(value instanceof TomlValue.Table table)) {
			throw new TomlTypeException("Dependency entries must be tables: " + value);
		}
		TomlDocument document = table.document();
		String name = document.getString("name")
				.orElseThrow(() -> new TomlTypeException("Dependency entry without a name: " + document));
		return new DependencyRecord(name, document.getStrings("new_packages"));
	}

	static boolean isNamed(TomlValue value, String name) {
		return value instanceof TomlValue.Table table
				&& table.document().getString("name").map(name::equals).orElse(false);
	}
}
