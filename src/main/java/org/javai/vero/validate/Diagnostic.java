package org.javai.vero.validate;

import java.util.List;
import java.util.Objects;

/**
 * A semantic finding, with "did you mean" suggestions where the validator found close names.
 */
public record Diagnostic(ErrorCode code, Severity severity, String message, int line, List<String> suggestions) {

	public Diagnostic {
		Objects.requireNonNull(code, "code must not be null");
		Objects.requireNonNull(severity, "severity must not be null");
		Objects.requireNonNull(message, "message must not be null");
		suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
	}

	/**
	 * Creates a diagnostic with the code's default severity.
	 */
	public static Diagnostic of(ErrorCode code, String message, int line, List<String> suggestions) {
		return new Diagnostic(code, code.defaultSeverity(), message, line, suggestions);
	}

	public static Diagnostic of(ErrorCode code, String message, int line) {
		return of(code, message, line, List.of());
	}

	public boolean isError() {
		return severity == Severity.ERROR;
	}

	public boolean hasSuggestions() {
		return !suggestions.isEmpty();
	}
}
