package org.javai.vero.ast;

import java.util.Locale;

/**
 * Declared type of a variable or action return value.
 */
public enum VarType {
	TEXT,
	NUMBER,
	FLAG,
	LIST;

	public String keyword() {
		return name().toLowerCase(Locale.ROOT);
	}
}
