package org.javai.vero.parser;

import java.util.List;
import org.javai.vero.ast.Program;

/**
 * Output of {@link VeroParser#parse()}. The program holds every declaration that parsed cleanly.
 */
public record ParseResult(Program program, List<ParseError> errors) {

	public ParseResult {
		errors = List.copyOf(errors);
	}

	public boolean hasErrors() {
		return !errors.isEmpty();
	}
}
