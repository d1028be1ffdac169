package org.javai.pyappm.toml;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads configuration files into {@link TomlDocument}s.
 *
 * <pre>
 * TomlDocument manifest = new TomlReader().read(Path.of("pyapp.toml"));
 * String name = manifest.find("project", "name").orElseThrow();
 * </pre>
 */
public class TomlReader {

	private static final Logger logger = LoggerFactory.getLogger(TomlReader.class);

	private final TomlParser parser;

	public TomlReader() {
		this(new TomlParser());
	}

	public TomlReader(TomlParser parser) {
		if (parser == null) {
			throw new IllegalArgumentException("Parser cannot be null");
		}
		this.parser = parser;
	}

	/**
	 * Tokenizes and parses a file.
	 *
	 * @throws IOException if the file cannot be read
	 * @throws TomlParseException if the contents are not valid
	 */
	public TomlDocument read(Path path) throws IOException {
		List<TomlToken> tokens = TomlTokenizer.forFile(path).tokenize();
		TomlDocument document;
		try {
			document = parser.parse(tokens);
		}
		catch (TomlParseException e) {
			throw new TomlParseException(path + ": " + e.getMessage(), e);
		}
		logger.debug("Read {} sections from {}", document.size(), path);
		return document;
	}

	/**
	 * Parses in-memory text.
	 *
	 * @throws TomlParseException if the text is not valid
	 */
	public TomlDocument read(String text) {
		return parser.parse(new TomlTokenizer(text).tokenize());
	}
}
