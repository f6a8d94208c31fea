package org.javai.vero.transpile;

/**
 * Thrown when a statement cannot be lowered to target code, e.g. a literal tab index that is not
 * a positive integer.
 */
public class VeroTranspileException extends RuntimeException {

	private final int line;

	public VeroTranspileException(String message, int line) {
		super(message + " (line " + line + ")");
		this.line = line;
	}

	public int getLine() {
		return line;
	}
}
