package org.javai.vero;

import java.util.List;
import org.javai.vero.lexer.LexError;
import org.javai.vero.parser.ParseError;
import org.javai.vero.transpile.TranspileResult;
import org.javai.vero.validate.ValidationResult;

/**
 * Outcome of running the pipeline on one source text. Each error channel is kept separate.
 *
 * @param validation {@code null} when the pipeline stopped before validation
 * @param output {@code null} when the pipeline stopped before transpiling
 * @param stage the stage the pipeline stopped at
 */
public record CompilationResult(List<LexError> lexErrors, List<ParseError> parseErrors, ValidationResult validation,
		TranspileResult output, Stage stage) {

	public CompilationResult {
		lexErrors = List.copyOf(lexErrors);
		parseErrors = List.copyOf(parseErrors);
	}

	public enum Stage {
		LEX,
		PARSE,
		VALIDATE,
		TRANSPILE
	}

	/**
	 * Whether every stage ran and produced output.
	 */
	public boolean succeeded() {
		return output != null;
	}

	public boolean hasSyntaxErrors() {
		return !lexErrors.isEmpty() || !parseErrors.isEmpty();
	}
}
