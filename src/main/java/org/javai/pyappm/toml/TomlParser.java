package org.javai.pyappm.toml;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive-descent parser turning the token stream of {@link TomlTokenizer} into a {@link TomlDocument}.
 *
 * <pre>
 * document      := ( section | key_value )*
 * section       := '[' bare_run ']'
 * key_value     := bare_run '=' value
 * value         := string | bare_run | list | inline_table
 * list          := '[' ( value ( ',' value )* )? ']'
 * inline_table  := '{' ( bare_run '=' value ( ',' bare_run '=' value )* )? '}'
 * string        := quote ... quote      (closed by the same quote character, no escapes)
 * bare_run      := CHAR+
 * </pre>
 *
 * Whitespace and line breaks are skipped between elements. Keys have {@code -} replaced by {@code _}.
 * Every key/value must belong to a section. Parsing stops at the first error; no partial document
 * is returned.
 */
public class TomlParser {

	private static final Logger logger = LoggerFactory.getLogger(TomlParser.class);

	/**
	 * Parses a complete token list.
	 *
	 * @param tokens tokens ending with EOF
	 * @return the parsed document; top-level entries are all tables
	 * @throws TomlParseException if the tokens cannot be reduced by the grammar
	 */
	public TomlDocument parse(List<TomlToken> tokens) {
		ParserState state = new ParserState(tokens);
		TomlDocument document = new TomlDocument();
		TomlDocument current = null;

		while (true) {
			state.skipWhitespace();
			TomlToken token = state.peek();

			switch (token.type()) {
				case EOF -> {
					return document;
				}
				case LBRACKET -> {
					String name = parseSection(state);
					if (document.containsKey(name)) {
						logger.warn("Section [{}] at {} redefined; earlier keys are discarded", name, token.position());
					}
					current = new TomlDocument();
					document.put(name, current);
				}
				case CHAR -> {
					if (current == null) {
						throw new TomlParseException(
								"Key-value pair outside of a section at " + token.position());
					}
					parseKeyValue(state, current);
				}
				case COMMENT -> skipComment(state);
				default -> throw unexpected(token);
			}
		}
	}

	private String parseSection(ParserState state) {
		state.advance(); // consume '['
		String name = parseBareRun(state, "section name");
		state.expect(TomlToken.TokenType.RBRACKET, "Expected right bracket");
		return name;
	}

	private void parseKeyValue(ParserState state, TomlDocument table) {
		String key = normalizeKey(parseBareRun(state, "key"));
		state.skipWhitespace();
		state.expect(TomlToken.TokenType.EQUAL, "Expected equal sign");
		table.put(key, parseValue(state));
	}

	private TomlValue parseValue(ParserState state) {
		state.skipWhitespace();
		TomlToken token = state.peek();

		return switch (token.type()) {
			case QUOTE -> parseString(state);
			case CHAR -> TomlValue.bare(parseBareRun(state, "value"));
			case LBRACKET -> parseList(state);
			case LBRACE -> parseInlineTable(state);
			case EOF -> throw new TomlParseException("Expected value at " + token.position() + " but reached end of input");
			default -> throw unexpected(token);
		};
	}

	private TomlValue parseString(ParserState state) {
		TomlToken open = state.advance();
		StringBuilder sb = new StringBuilder();

		while (true) {
			TomlToken token = state.peek();
			switch (token.type()) {
				case NEWLINE, CARRIAGE_RETURN, EOF -> throw new TomlParseException(
						"Unterminated string starting at " + open.position());
				case QUOTE -> {
					if (token.text().equals(open.text())) {
						state.advance(); // consume closing quote
						return TomlValue.str(sb.toString());
					}
					sb.append(token.text());
				}
				default -> sb.append(token.text());
			}
			state.advance();
		}
	}

	private TomlValue parseList(ParserState state) {
		TomlToken open = state.advance(); // consume '['
		List<TomlValue> values = new ArrayList<>();
		state.skipWhitespace();

		while (!state.check(TomlToken.TokenType.RBRACKET)) {
			if (state.isAtEnd()) {
				throw new TomlParseException("Expected right bracket to close list at " + open.position());
			}
			values.add(parseValue(state));
			state.skipWhitespace();
			if (state.check(TomlToken.TokenType.COMMA)) {
				TomlToken comma = state.advance();
				state.skipWhitespace();
				if (state.check(TomlToken.TokenType.RBRACKET)) {
					throw new TomlParseException("Unexpected comma at " + comma.position());
				}
			}
			else if (!state.check(TomlToken.TokenType.RBRACKET)) {
				throw new TomlParseException("Expected right bracket to close list at " + open.position()
						+ ", found " + state.peek() + " at " + state.peek().position());
			}
		}

		state.advance(); // consume ']'
		return new TomlValue.Array(values);
	}

	private TomlValue parseInlineTable(ParserState state) {
		TomlToken open = state.advance(); // consume '{'
		TomlDocument table = new TomlDocument();
		state.skipWhitespace();

		while (!state.check(TomlToken.TokenType.RBRACE)) {
			if (state.isAtEnd()) {
				throw new TomlParseException("Expected right brace to close table at " + open.position());
			}
			parseKeyValue(state, table);
			state.skipWhitespace();
			if (state.check(TomlToken.TokenType.COMMA)) {
				TomlToken comma = state.advance();
				state.skipWhitespace();
				if (state.check(TomlToken.TokenType.RBRACE)) {
					throw new TomlParseException("Unexpected comma at " + comma.position());
				}
			}
			else if (!state.check(TomlToken.TokenType.RBRACE)) {
				throw new TomlParseException("Expected right brace to close table at " + open.position()
						+ ", found " + state.peek() + " at " + state.peek().position());
			}
		}

		state.advance(); // consume '}'
		return TomlValue.table(table);
	}

	private String parseBareRun(ParserState state, String what) {
		TomlToken first = state.peek();
		if (!first.isType(TomlToken.TokenType.CHAR)) {
			throw new TomlParseException("Expected " + what + " at " + first.position() + ", found " + first);
		}
		StringBuilder sb = new StringBuilder();
		while (state.check(TomlToken.TokenType.CHAR)) {
			sb.append(state.advance().text());
		}
		return sb.toString();
	}

	private void skipComment(ParserState state) {
		while (!state.isAtEnd() && !state.check(TomlToken.TokenType.NEWLINE)) {
			state.advance();
		}
	}

	/**
	 * The form in which a key is stored once parsed: {@code -} replaced by {@code _}.
	 */
	public static String normalizeKey(String key) {
		return key.replace('-', '_');
	}

	private static TomlParseException unexpected(TomlToken token) {
		return new TomlParseException("Unexpected token " + token.type() + " at " + token.position());
	}

	/**
	 * Cursor over the token list shared by the grammar routines.
	 */
	static class ParserState {
		private final List<TomlToken> tokens;
		private int current = 0;

		ParserState(List<TomlToken> tokens) {
			if (tokens == null || tokens.isEmpty()
					|| !tokens.get(tokens.size() - 1).isType(TomlToken.TokenType.EOF)) {
				throw new IllegalArgumentException("Token list must end with EOF");
			}
			this.tokens = tokens;
		}

		TomlToken peek() {
			return tokens.get(current);
		}

		/**
		 * Consumes and returns the current token. The cursor never moves past EOF.
		 */
		TomlToken advance() {
			TomlToken token = tokens.get(current);
			if (!isAtEnd()) {
				current++;
			}
			return token;
		}

		boolean check(TomlToken.TokenType type) {
			return peek().type() == type;
		}

		TomlToken expect(TomlToken.TokenType type, String message) {
			TomlToken token = peek();
			if (token.type() != type) {
				throw new TomlParseException(message + " at " + token.position() + ", found " + token);
			}
			return advance();
		}

		boolean isAtEnd() {
			return peek().isType(TomlToken.TokenType.EOF);
		}

		void skipWhitespace() {
			while (peek().isWhitespace()) {
				current++;
			}
		}
	}
}
