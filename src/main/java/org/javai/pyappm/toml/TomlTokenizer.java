package org.javai.pyappm.toml;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Character-level tokenizer for configuration files.
 * Every character of a non-comment line becomes exactly one token. Lines whose
 * first character is {@code #} are dropped entirely; there are no trailing comments.
 */
public class TomlTokenizer {

	private final String input;

	public TomlTokenizer(String input) {
		this.input = input != null ? input : "";
	}

	/**
	 * Creates a tokenizer over the contents of a file.
	 *
	 * @param path the file to read
	 * @return a tokenizer for the file contents
	 * @throws IOException if the file cannot be read
	 */
	public static TomlTokenizer forFile(Path path) throws IOException {
		return new TomlTokenizer(Files.readString(path, StandardCharsets.UTF_8));
	}

	/**
	 * Tokenizes the entire input.
	 *
	 * @return list of tokens (includes EOF token at end)
	 */
	public List<TomlToken> tokenize() {
		List<TomlToken> tokens = new ArrayList<>(input.length() + 1);
		int line = 1;
		int start = 0;

		while (start < input.length()) {
			int end = input.indexOf('\n', start);
			end = end < 0 ? input.length() : end + 1;

			if (input.charAt(start) != '#') {
				readLine(tokens, start, end, line);
			}
			start = end;
			line++;
		}

		tokens.add(new TomlToken(TomlToken.TokenType.EOF, "", line, 1));
		return tokens;
	}

	private void readLine(List<TomlToken> tokens, int start, int end, int line) {
		for (int pos = start; pos < end; pos++) {
			char c = input.charAt(pos);
			tokens.add(new TomlToken(TomlToken.classify(c), String.valueOf(c), line, pos - start + 1));
		}
	}
}
