package org.javai.pyappm.toml;

/**
 * A single character of a configuration file, classified by kind.
 *
 * @param type the token type
 * @param text the character this token was read from (empty for EOF)
 * @param line the 1-based line in the source, counting skipped comment lines
 * @param column the 1-based column in the source
 */
public record TomlToken(TokenType type, String text, int line, int column) {

	public enum TokenType {
		EQUAL,            // =
		LBRACKET,         // [
		RBRACKET,         // ]
		LBRACE,           // {
		RBRACE,           // }
		QUOTE,            // " or '
		COMMA,            // ,
		COMMENT,          // #
		NEWLINE,          // \n
		CARRIAGE_RETURN,  // \r
		SPACE,            // ' '
		CHAR,             // anything else
		EOF               // end of input
	}

	@Override
	public String toString() {
		return switch (type) {
			case CHAR, QUOTE -> type + "(" + text + ")";
			default -> type.toString();
		};
	}

	public boolean isType(TokenType expectedType) {
		return this.type == expectedType;
	}

	public boolean isWhitespace() {
		return type == TokenType.SPACE || type == TokenType.NEWLINE || type == TokenType.CARRIAGE_RETURN;
	}

	/**
	 * Position of this token in {@code line:column} form, used in error messages.
	 */
	public String position() {
		return line + ":" + column;
	}

	static TokenType classify(char c) {
		return switch (c) {
			case '=' -> TokenType.EQUAL;
			case '[' -> TokenType.LBRACKET;
			case ']' -> TokenType.RBRACKET;
			case '{' -> TokenType.LBRACE;
			case '}' -> TokenType.RBRACE;
			case '"', '\'' -> TokenType.QUOTE;
			case ',' -> TokenType.COMMA;
			case '#' -> TokenType.COMMENT;
			case '\n' -> TokenType.NEWLINE;
			case '\r' -> TokenType.CARRIAGE_RETURN;
			case ' ' -> TokenType.SPACE;
			default -> TokenType.CHAR;
		};
	}
}
