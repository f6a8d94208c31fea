package org.javai.vero.ast;

/**
 * The element (or value) a statement acts on.
 */
public sealed interface Target {

	/**
	 * Source form of the target, e.g. {@code HomePage.launch}.
	 */
	String describe();

	/**
	 * {@code Page.field}; resolved against the declared pages.
	 */
	record PageFieldTarget(String page, String field) implements Target {

		@Override
		public String describe() {
			return page + "." + field;
		}
	}

	/**
	 * An unqualified name. Inside page and page-actions bodies it names a field of the
	 * enclosing page (or a parameter); inside features it names a variable.
	 */
	record FieldTarget(String field) implements Target {

		@Override
		public String describe() {
			return field;
		}
	}

	/**
	 * Visible text, e.g. {@code verify "Welcome" is visible}.
	 */
	record TextTarget(String text) implements Target {

		@Override
		public String describe() {
			return "\"" + text + "\"";
		}
	}
}
