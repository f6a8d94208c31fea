package org.javai.vero.ast;

import java.util.Locale;
import java.util.Optional;

/**
 * A field selector. {@link SelectorType#AUTO} selectors are classified when code is generated.
 */
public record Selector(SelectorType type, String value) {

	public static Selector auto(String value) {
		return new Selector(SelectorType.AUTO, value);
	}

	public enum SelectorType {
		AUTO,
		CSS,
		XPATH,
		TESTID;

		/**
		 * Explicit selector kinds as written before the selector string, e.g. {@code css "#id"}.
		 */
		public static Optional<SelectorType> fromKeyword(String word) {
			return switch (word.toLowerCase(Locale.ROOT)) {
				case "css" -> Optional.of(CSS);
				case "xpath" -> Optional.of(XPATH);
				case "testid" -> Optional.of(TESTID);
				default -> Optional.empty();
			};
		}

		public String keyword() {
			return name().toLowerCase(Locale.ROOT);
		}
	}
}
