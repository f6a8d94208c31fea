package org.javai.vero.ast;

import java.util.List;

/**
 * A named, parameterized statement body declared inside a page or a page-actions bundle.
 *
 * @param returnType declared return type, or {@code null} when the action returns nothing
 */
public record ActionDefinition(String name, List<String> parameters, VarType returnType, List<Statement> statements,
		int line) {

	public ActionDefinition {
		parameters = List.copyOf(parameters);
		statements = List.copyOf(statements);
	}
}
