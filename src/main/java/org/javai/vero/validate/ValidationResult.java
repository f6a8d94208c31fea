package org.javai.vero.validate;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of semantic validation. Errors are reported in the order the validator met them.
 * Warnings never affect {@link #valid()}.
 */
public record ValidationResult(boolean valid, int errorCount, List<Diagnostic> errors, List<Diagnostic> warnings) {

	public ValidationResult {
		errors = List.copyOf(errors);
		warnings = List.copyOf(warnings);
	}

	public static ValidationResult of(List<Diagnostic> errors, List<Diagnostic> warnings) {
		return new ValidationResult(errors.isEmpty(), errors.size(), errors, warnings);
	}

	public List<Diagnostic> errorsWithCode(ErrorCode code) {
		return errors.stream().filter(d -> d.code() == code).collect(Collectors.toList());
	}

	public List<Diagnostic> warningsWithCode(ErrorCode code) {
		return warnings.stream().filter(d -> d.code() == code).collect(Collectors.toList());
	}
}
