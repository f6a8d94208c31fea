package org.javai.vero.validate;

/**
 * Closed set of semantic diagnostic codes.
 */
public enum ErrorCode {
	UNDEFINED_PAGE,
	UNDEFINED_FIELD,
	UNDEFINED_PAGEACTIONS,
	UNDEFINED_ACTION,
	INVALID_PAGEACTIONS_FOR,
	INVALID_TAB_CONTEXT,
	INVALID_TAB_INDEX,
	ARGUMENT_COUNT_MISMATCH,
	DUPLICATE_DEFINITION,
	RESERVED_NAME,
	RETURN_OUTSIDE_ACTION,
	INVALID_CONDITION,
	UNDEFINED_VARIABLE(Severity.WARNING);

	private final Severity defaultSeverity;

	ErrorCode() {
		this(Severity.ERROR);
	}

	ErrorCode(Severity defaultSeverity) {
		this.defaultSeverity = defaultSeverity;
	}

	public Severity defaultSeverity() {
		return defaultSeverity;
	}
}
