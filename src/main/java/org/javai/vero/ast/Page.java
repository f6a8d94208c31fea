package org.javai.vero.ast;

import java.util.List;
import java.util.Optional;

/**
 * A UI abstraction: named field selectors, page variables and inline actions.
 */
public record Page(String name, List<Field> fields, List<Variable> variables, List<ActionDefinition> actions,
		int line) {

	public Page {
		fields = List.copyOf(fields);
		variables = List.copyOf(variables);
		actions = List.copyOf(actions);
	}

	public Optional<Field> findField(String fieldName) {
		return fields.stream().filter(f -> f.name().equals(fieldName)).findFirst();
	}

	public Optional<ActionDefinition> findAction(String actionName) {
		return actions.stream().filter(a -> a.name().equals(actionName)).findFirst();
	}
}
