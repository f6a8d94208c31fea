package org.javai.vero.ast;

import java.util.List;

/**
 * Shared setup/teardown that a feature opts into with {@code use}.
 */
public record Fixture(String name, List<Statement> setup, List<Statement> teardown, int line) {

	public Fixture {
		setup = List.copyOf(setup);
		teardown = List.copyOf(teardown);
	}
}
