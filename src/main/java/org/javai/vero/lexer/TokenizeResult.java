package org.javai.vero.lexer;

import java.util.List;

/**
 * Output of {@link VeroTokenizer#tokenize()}: the token stream (always terminated by EOF)
 * and any lexical errors.
 */
public record TokenizeResult(List<VeroToken> tokens, List<LexError> errors) {

	public TokenizeResult {
		tokens = List.copyOf(tokens);
		errors = List.copyOf(errors);
	}

	public boolean hasErrors() {
		return !errors.isEmpty();
	}
}
