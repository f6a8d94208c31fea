package org.javai.vero.lexer;

/**
 * A problem found while scanning source text. Scanning continues after the offending span.
 */
public record LexError(String message, int line, int column) {

	@Override
	public String toString() {
		return "line " + line + ":" + column + " " + message;
	}
}
