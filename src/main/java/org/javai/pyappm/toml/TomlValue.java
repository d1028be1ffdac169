package org.javai.pyappm.toml;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * A value stored in a {@link TomlDocument}.
 * There is no numeric variant: numeric-looking text is kept as a {@link Bare} word.
 */
public sealed interface TomlValue {

	String TRUE = "True";
	String FALSE = "False";

	/**
	 * A quoted string.
	 */
	record Str(String value) implements TomlValue {
		public Str {
			Objects.requireNonNull(value, "value");
		}
	}

	/**
	 * An unquoted word, including the boolean-looking {@code True} and {@code False}.
	 */
	record Bare(String value) implements TomlValue {
		public Bare {
			Objects.requireNonNull(value, "value");
		}

		public boolean isBoolean() {
			return TRUE.equals(value) || FALSE.equals(value);
		}
	}

	/**
	 * A {@code [a, b]} list. Immutable; use {@link #with} and {@link #without} to derive new lists.
	 */
	record Array(List<TomlValue> values) implements TomlValue {
		public Array {
			values = values != null ? List.copyOf(values) : List.of();
		}

		public Array with(TomlValue value) {
			List<TomlValue> copy = new ArrayList<>(values);
			copy.add(value);
			return new Array(copy);
		}

		public Array without(Predicate<TomlValue> filter) {
			return new Array(values.stream().filter(filter.negate()).toList());
		}

		public int size() {
			return values.size();
		}
	}

	/**
	 * A nested table: a {@code [section]} at the top level or an inline {@code {k=v}} below it.
	 */
	record Table(TomlDocument document) implements TomlValue {
		public Table {
			Objects.requireNonNull(document, "document");
		}
	}

	static Str str(String value) {
		return new Str(value);
	}

	static Bare bare(String value) {
		return new Bare(value);
	}

	static Bare bool(boolean value) {
		return new Bare(value ? TRUE : FALSE);
	}

	static Array array(TomlValue... values) {
		return new Array(List.of(values));
	}

	static Array strings(List<String> values) {
		return new Array(values.stream().<TomlValue>map(Str::new).toList());
	}

	static Table table(TomlDocument document) {
		return new Table(document);
	}
}
