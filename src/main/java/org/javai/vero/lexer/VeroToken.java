package org.javai.vero.lexer;

import java.util.Locale;

/**
 * A single lexical token with its 1-based source position.
 */
public record VeroToken(TokenType type, String value, int line, int column) {

	/**
	 * Whether this token is an identifier spelled as the given contextual word, ignoring case.
	 */
	public boolean isWord(String word) {
		return type == TokenType.IDENTIFIER && value.toLowerCase(Locale.ROOT).equals(word);
	}

	@Override
	public String toString() {
		return type + "('" + value + "')@" + line + ":" + column;
	}
}
