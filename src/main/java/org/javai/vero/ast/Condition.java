package org.javai.vero.ast;

import java.util.Locale;
import java.util.Optional;

/**
 * The predicate of a {@code verify} or {@code if} statement, applied to its subject.
 */
public sealed interface Condition {

	boolean negated();

	/**
	 * {@code is [not] visible|hidden|enabled|disabled|checked|empty|focused}.
	 */
	record StateCondition(boolean negated, ElementState state) implements Condition {
	}

	/**
	 * {@code [is] [not] contains <expr>}.
	 */
	record ContainsCondition(boolean negated, Expression value) implements Condition {
	}

	/**
	 * {@code is [not] <expr>}.
	 */
	record EqualsCondition(boolean negated, Expression value) implements Condition {
	}

	enum ElementState {
		VISIBLE,
		HIDDEN,
		ENABLED,
		DISABLED,
		CHECKED,
		EMPTY,
		FOCUSED;

		public static Optional<ElementState> fromKeyword(String word) {
			for (ElementState state : values()) {
				if (state.keyword().equals(word.toLowerCase(Locale.ROOT))) {
					return Optional.of(state);
				}
			}
			return Optional.empty();
		}

		public String keyword() {
			return name().toLowerCase(Locale.ROOT);
		}
	}
}
