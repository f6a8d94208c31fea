package org.javai.vero.ast;

import java.util.List;

public record Hook(HookType type, List<Statement> statements, int line) {

	public Hook {
		statements = List.copyOf(statements);
	}

	public enum HookType {
		BEFORE_ALL("before all"),
		BEFORE_EACH("before each"),
		AFTER_ALL("after all"),
		AFTER_EACH("after each");

		private final String keywords;

		HookType(String keywords) {
			this.keywords = keywords;
		}

		/**
		 * Source spelling, e.g. {@code before all}.
		 */
		public String keywords() {
			return keywords;
		}

		/**
		 * Suite-level hooks run outside any single scenario's page lifecycle.
		 */
		public boolean isSuiteLevel() {
			return this == BEFORE_ALL || this == AFTER_ALL;
		}
	}
}
