package org.javai.pyappm.toml;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serializes a {@link TomlDocument} in the grammar accepted by {@link TomlParser}.
 *
 * <p>Top-level entries become {@code [section]} blocks separated by a blank line. Nested tables are
 * written inline as {@code {k=v, k=v}}, lists as {@code [a, b]}. Strings are double-quoted unless they
 * contain a double quote, in which case single quotes are used. Bare words are written verbatim.</p>
 *
 * <p>The whole document is rendered before anything touches the file system, so a
 * {@link TomlTypeException} never leaves a partially written file behind.</p>
 */
public class TomlWriter {

	private static final Logger logger = LoggerFactory.getLogger(TomlWriter.class);

	/**
	 * Renders the document to text.
	 *
	 * @throws TomlTypeException if the document has a non-table top-level entry or holds a value
	 *         that cannot be represented
	 */
	public String write(TomlDocument document) {
		StringBuilder output = new StringBuilder();
		for (Map.Entry<String, TomlValue> section : document.entrySet()) {
			if (!(section.getValue() instanceof TomlValue.Table table)) {
				throw new TomlTypeException("Value of section '" + section.getKey() + "' must be a table but is "
						+ TomlDocument.describe(section.getValue()));
			}
			output.append('[').append(checkBare(section.getKey(), "section name")).append("]\n");
			table.document().forEach((key, value) -> {
				output.append(checkKey(key)).append('=');
				writeValue(value, output);
				output.append('\n');
			});
			output.append('\n');
		}
		return output.toString();
	}

	/**
	 * Renders the document and replaces the file at {@code path} with the result.
	 * The text goes to a temporary file next to the target first and is then moved into place.
	 * An existing file keeps its POSIX permissions.
	 *
	 * @throws IOException if the file cannot be written
	 * @throws TomlTypeException if the document cannot be rendered; the target is left untouched
	 */
	public void write(TomlDocument document, Path path) throws IOException {
		String text = write(document);
		Path target = path.toAbsolutePath();
		Path temp = target.resolveSibling("." + target.getFileName() + "." + UUID.randomUUID() + ".tmp");
		try {
			Files.writeString(temp, text, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW,
					StandardOpenOption.WRITE);
			copyPermissions(target, temp);
			try {
				Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
			}
			catch (AtomicMoveNotSupportedException e) {
				logger.debug("Atomic move not supported for {}, replacing in place", target);
				Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
			}
		}
		finally {
			Files.deleteIfExists(temp);
		}
		logger.debug("Wrote {} sections to {}", document.size(), target);
	}

	/**
	 * A new file gets the default permissions; an existing file keeps its own.
	 */
	private static void copyPermissions(Path target, Path temp) throws IOException {
		if (Files.exists(target)
				&& Files.getFileStore(target).supportsFileAttributeView(PosixFileAttributeView.class)) {
			Files.setPosixFilePermissions(temp, Files.getPosixFilePermissions(target));
		}
	}

	private void writeValue(TomlValue value, StringBuilder output) {
		if (value instanceof TomlValue.Str s) {
			writeString(s.value(), output);
		}
		else if (value instanceof TomlValue.Bare b) {
			output.append(checkBare(b.value(), "bare word"));
		}
		else if (value instanceof TomlValue.Array array) {
			writeList(array.values(), output);
		}
		else if (value instanceof TomlValue.Table table) {
			writeInlineTable(table.document(), output);
		}
	}

	private void writeList(List<TomlValue> values, StringBuilder output) {
		output.append('[');
		Iterator<TomlValue> it = values.iterator();
		while (it.hasNext()) {
			writeValue(it.next(), output);
			if (it.hasNext()) {
				output.append(", ");
			}
		}
		output.append(']');
	}

	private void writeInlineTable(TomlDocument table, StringBuilder output) {
		output.append('{');
		Iterator<Map.Entry<String, TomlValue>> it = table.entrySet().iterator();
		while (it.hasNext()) {
			Map.Entry<String, TomlValue> entry = it.next();
			output.append(checkKey(entry.getKey())).append('=');
			writeValue(entry.getValue(), output);
			if (it.hasNext()) {
				output.append(", ");
			}
		}
		output.append('}');
	}

	private void writeString(String value, StringBuilder output) {
		char quote = '"';
		if (value.indexOf('"') >= 0) {
			if (value.indexOf('\'') >= 0) {
				throw new TomlTypeException("String cannot contain both quote characters: " + value);
			}
			quote = '\'';
		}
		if (value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) {
			throw new TomlTypeException("String cannot contain a line break: " + value.strip());
		}
		output.append(quote).append(value).append(quote);
	}

	/**
	 * Keys come back from the parser with {@code -} replaced by {@code _}, so a dashed key could not
	 * be read back as written.
	 */
	private static String checkKey(String key) {
		checkBare(key, "key");
		if (key.indexOf('-') >= 0) {
			throw new TomlTypeException("Key '" + key + "' cannot contain '-'; use '"
					+ TomlParser.normalizeKey(key) + "'");
		}
		return key;
	}

	/**
	 * A key, section name or bare word must read back as a single run of plain characters.
	 */
	private static String checkBare(String text, String what) {
		if (text.isEmpty()) {
			throw new TomlTypeException("Empty " + what);
		}
		for (int i = 0; i < text.length(); i++) {
			if (TomlToken.classify(text.charAt(i)) != TomlToken.TokenType.CHAR) {
				throw new TomlTypeException("Invalid character '" + text.charAt(i) + "' in " + what + " '" + text + "'");
			}
		}
		return text;
	}
}
