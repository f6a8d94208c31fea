package org.javai.vero.ast;

import java.util.List;
import java.util.Optional;

/**
 * A reusable action bundle bound to exactly one page.
 */
public record PageActions(String name, String forPage, List<ActionDefinition> actions, int line) {

	public PageActions {
		actions = List.copyOf(actions);
	}

	public Optional<ActionDefinition> findAction(String actionName) {
		return actions.stream().filter(a -> a.name().equals(actionName)).findFirst();
	}
}
