package org.javai.pyappm.toml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Ordered, string-keyed map of {@link TomlValue}s.
 *
 * <p>At the top level a document maps section names to {@link TomlValue.Table}s; one level down
 * the same type holds the key/value pairs of a single table. Insertion order is preserved and
 * reproduced when the document is written.</p>
 *
 * <p>Reads never modify the document. The only operation that creates intermediate tables is
 * {@link #ensureTable(String...)}, intended for code that is about to populate the result:</p>
 *
 * <pre>
 * TomlDocument doc = new TomlDocument();
 * doc.ensureTable("project").put("name", "demo");
 * doc.find("project", "dependencies");   // Optional.empty(), doc unchanged
 * </pre>
 *
 * <p>Not thread-safe.</p>
 */
public final class TomlDocument {

	private final Map<String, TomlValue> entries = new LinkedHashMap<>();

	public TomlDocument() {
	}

	/**
	 * Builds a document from plain Java values.
	 * {@link String} becomes {@link TomlValue.Str}, {@link Boolean} becomes {@code True}/{@code False},
	 * {@link Number} becomes a bare word, {@link List} an array and {@link Map} a nested table.
	 * {@code null} values are skipped.
	 *
	 * @throws TomlTypeException if a value has no representation
	 */
	public static TomlDocument fromPlainMap(Map<String, ?> values) {
		TomlDocument document = new TomlDocument();
		values.forEach((key, value) -> {
			if (value != null) {
				document.put(key, toValue(key, value));
			}
		});
		return document;
	}

	private static TomlValue toValue(String key, Object value) {
		if (value instanceof TomlValue tomlValue) {
			return tomlValue;
		}
		if (value instanceof TomlDocument document) {
			return TomlValue.table(document);
		}
		if (value instanceof String s) {
			return TomlValue.str(s);
		}
		if (value instanceof Boolean b) {
			return TomlValue.bool(b);
		}
		if (value instanceof Number n) {
			return TomlValue.bare(n.toString());
		}
		if (value instanceof List<?> list) {
			List<TomlValue> converted = new ArrayList<>(list.size());
			for (Object element : list) {
				if (element == null) {
					throw new TomlTypeException("Null element in list '" + key + "'");
				}
				converted.add(toValue(key, element));
			}
			return new TomlValue.Array(converted);
		}
		if (value instanceof Map<?, ?> map) {
			Map<String, Object> table = new LinkedHashMap<>();
			map.forEach((k, v) -> table.put(String.valueOf(k), v));
			return TomlValue.table(fromPlainMap(table));
		}
		throw new TomlTypeException("Cannot store " + value.getClass().getSimpleName() + " under '" + key + "'");
	}

	// ------------------------------------------------------------------
	// Mutation
	// ------------------------------------------------------------------

	/**
	 * Assigns a value. An existing key keeps its position and takes the new value.
	 *
	 * @return this document, for chaining
	 */
	public TomlDocument put(String key, TomlValue value) {
		Objects.requireNonNull(key, "key");
		Objects.requireNonNull(value, "value");
		entries.put(key, value);
		return this;
	}

	public TomlDocument put(String key, String value) {
		return put(key, TomlValue.str(value));
	}

	public TomlDocument put(String key, boolean value) {
		return put(key, TomlValue.bool(value));
	}

	public TomlDocument put(String key, TomlDocument table) {
		return put(key, TomlValue.table(table));
	}

	public TomlDocument putStrings(String key, List<String> values) {
		return put(key, TomlValue.strings(values));
	}

	public Optional<TomlValue> remove(String key) {
		return Optional.ofNullable(entries.remove(key));
	}

	/**
	 * Returns the table at the given path, creating and inserting every missing table on the way.
	 *
	 * @param path one or more keys, outermost first
	 * @return the (possibly new) table at the end of the path
	 * @throws TomlTypeException if a key on the path holds something other than a table
	 */
	public TomlDocument ensureTable(String... path) {
		if (path.length == 0) {
			throw new IllegalArgumentException("Path must contain at least one key");
		}
		TomlDocument current = this;
		for (String key : path) {
			TomlValue existing = current.entries.get(key);
			if (existing == null) {
				TomlDocument created = new TomlDocument();
				current.entries.put(key, TomlValue.table(created));
				current = created;
			}
			else if (existing instanceof TomlValue.Table table) {
				current = table.document();
			}
			else {
				throw new TomlTypeException(
						"Cannot create table '" + key + "': key already holds " + describe(existing));
			}
		}
		return current;
	}

	// ------------------------------------------------------------------
	// Non-mutating access
	// ------------------------------------------------------------------

	public Optional<TomlValue> get(String key) {
		return Optional.ofNullable(entries.get(key));
	}

	/**
	 * Looks up a value through nested tables without modifying anything.
	 *
	 * @param path one or more keys, outermost first
	 * @return the value, or empty if any step is missing or is not a table
	 */
	public Optional<TomlValue> find(String... path) {
		if (path.length == 0) {
			return Optional.empty();
		}
		TomlDocument current = this;
		for (int i = 0; i < path.length - 1; i++) {
			TomlValue step = current.entries.get(path[i]);
			if (!(step instanceof TomlValue.Table table)) {
				return Optional.empty();
			}
			current = table.document();
		}
		return current.get(path[path.length - 1]);
	}

	public boolean containsKey(String key) {
		return entries.containsKey(key);
	}

	/**
	 * @throws TomlTypeException if the key holds something other than a table
	 */
	public Optional<TomlDocument> getTable(String key) {
		return get(key).map(value -> {
			if (value instanceof TomlValue.Table table) {
				return table.document();
			}
			throw typeMismatch(key, "a table", value);
		});
	}

	/**
	 * Text of a quoted string or a bare word.
	 *
	 * @throws TomlTypeException if the key holds an array or table
	 */
	public Optional<String> getString(String key) {
		return get(key).map(value -> {
			if (value instanceof TomlValue.Str s) {
				return s.value();
			}
			if (value instanceof TomlValue.Bare b) {
				return b.value();
			}
			throw typeMismatch(key, "a string", value);
		});
	}

	public String getString(String key, String defaultValue) {
		return getString(key).orElse(defaultValue);
	}

	/**
	 * Coerces the bare words {@code True} and {@code False} to a boolean.
	 *
	 * @throws TomlTypeException if the key holds anything else
	 */
	public Optional<Boolean> getBoolean(String key) {
		return get(key).map(value -> {
			if (value instanceof TomlValue.Bare b && b.isBoolean()) {
				return TomlValue.TRUE.equals(b.value());
			}
			throw typeMismatch(key, "True or False", value);
		});
	}

	public boolean getBoolean(String key, boolean defaultValue) {
		return getBoolean(key).orElse(defaultValue);
	}

	/**
	 * @throws TomlTypeException if the key holds something other than an array
	 */
	public Optional<TomlValue.Array> getArray(String key) {
		return get(key).map(value -> {
			if (value instanceof TomlValue.Array array) {
				return array;
			}
			throw typeMismatch(key, "a list", value);
		});
	}

	/**
	 * Text of every string or bare element of the array under the given key.
	 */
	public List<String> getStrings(String key) {
		return getArray(key)
				.map(array -> array.values().stream().map(element -> {
					if (element instanceof TomlValue.Str s) {
						return s.value();
					}
					if (element instanceof TomlValue.Bare b) {
						return b.value();
					}
					throw typeMismatch(key, "a list of strings", element);
				}).toList())
				.orElse(List.of());
	}

	public Set<String> keySet() {
		return Collections.unmodifiableSet(entries.keySet());
	}

	public Set<Map.Entry<String, TomlValue>> entrySet() {
		return Collections.unmodifiableMap(entries).entrySet();
	}

	public void forEach(BiConsumer<String, TomlValue> action) {
		entries.forEach(action);
	}

	public int size() {
		return entries.size();
	}

	public boolean isEmpty() {
		return entries.isEmpty();
	}

	/**
	 * Converts to plain Java collections: strings and bare words become {@link String},
	 * arrays become {@link List}, tables become insertion-ordered {@link Map}s.
	 */
	public Map<String, Object> toPlainMap() {
		Map<String, Object> plain = new LinkedHashMap<>();
		entries.forEach((key, value) -> plain.put(key, toPlain(value)));
		return plain;
	}

	private static Object toPlain(TomlValue value) {
		if (value instanceof TomlValue.Str s) {
			return s.value();
		}
		if (value instanceof TomlValue.Bare b) {
			return b.value();
		}
		if (value instanceof TomlValue.Array array) {
			return array.values().stream().map(TomlDocument::toPlain).toList();
		}
		return ((TomlValue.Table) value).document().toPlainMap();
	}

	static String describe(TomlValue value) {
		if (value instanceof TomlValue.Str) {
			return "a string";
		}
		if (value instanceof TomlValue.Bare) {
			return "a bare word";
		}
		if (value instanceof TomlValue.Array) {
			return "a list";
		}
		return "a table";
	}

	private static TomlTypeException typeMismatch(String key, String expected, TomlValue actual) {
		return new TomlTypeException("Expected " + expected + " for '" + key + "' but found " + describe(actual));
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		return o instanceof TomlDocument other && entries.equals(other.entries);
	}

	@Override
	public int hashCode() {
		return entries.hashCode();
	}

	@Override
	public String toString() {
		return entries.toString();
	}
}
