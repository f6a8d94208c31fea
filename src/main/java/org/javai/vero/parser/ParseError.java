package org.javai.vero.parser;

/**
 * A syntax error with its 1-based source position.
 */
public record ParseError(String message, int line, int column) {

	@Override
	public String toString() {
		return "line " + line + ":" + column + " " + message;
	}
}
