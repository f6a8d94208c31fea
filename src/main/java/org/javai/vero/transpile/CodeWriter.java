package org.javai.vero.transpile;

/**
 * Line-oriented builder for generated source with two-space indentation.
 */
public final class CodeWriter {

	private static final String INDENT = "  ";

	private final StringBuilder out = new StringBuilder();
	private int level;

	public CodeWriter() {
		this(0);
	}

	public CodeWriter(int level) {
		this.level = level;
	}

	public CodeWriter line(String text) {
		if (text.isEmpty()) {
			out.append('\n');
		} else {
			out.append(INDENT.repeat(level)).append(text).append('\n');
		}
		return this;
	}

	public CodeWriter blank() {
		return line("");
	}

	/**
	 * Writes a line that opens a block and indents what follows.
	 */
	public CodeWriter open(String text) {
		line(text);
		level++;
		return this;
	}

	/**
	 * Dedents and writes the line that closes the current block.
	 */
	public CodeWriter close(String text) {
		if (level == 0) {
			throw new IllegalStateException("No open block to close with '" + text + "'");
		}
		level--;
		return line(text);
	}

	/**
	 * Writes a line that closes one block and opens the next, e.g. {@code "} else {"}.
	 */
	public CodeWriter next(String text) {
		close(text);
		level++;
		return this;
	}

	public int level() {
		return level;
	}

	@Override
	public String toString() {
		return out.toString();
	}
}
