package org.javai.pyappm.config;

import java.util.List;
import org.javai.pyappm.toml.TomlDocument;
import org.javai.pyappm.toml.TomlTypeException;
import org.javai.pyappm.toml.TomlValue;

/**
 * Author entry, stored as an inline table {@code {name="...", email="..."}}.
 */
public record Author(String name, String email) {

	public Author {
		name = name != null ? name : "";
		email = email != null ? email : "";
	}

	public TomlValue toValue() {
		return TomlValue.table(new TomlDocument().put("name", name).put("email", email));
	}

	public static Author fromTable(TomlDocument table) {
		return new Author(table.getString("name", ""), table.getString("email", ""));
	}

	static List<Author> fromArray(TomlValue.Array array) {
		return array.values().stream()
				.map(value -> {
					if (value instanceof TomlValue.Table table) {
						return fromTable(table.document());
					}
					throw new TomlTypeException("Author entries must be tables: " + value);
				})
				.toList();
	}

	static TomlValue.Array toArray(List<Author> authors) {
		return new TomlValue.Array(authors.stream().map(Author::toValue).toList());
	}
}
