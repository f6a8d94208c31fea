package org.javai.vero.ast;

import java.math.BigDecimal;
import java.util.List;

/**
 * Value expressions.
 */
public sealed interface Expression {

	record StringLiteral(String value) implements Expression {
	}

	record NumberLiteral(BigDecimal value) implements Expression {

		public boolean isPositiveInteger() {
			return value.signum() > 0 && value.stripTrailingZeros().scale() <= 0;
		}
	}

	record BooleanLiteral(boolean value) implements Expression {
	}

	record NullLiteral() implements Expression {
	}

	record ListLiteral(List<Expression> elements) implements Expression {

		public ListLiteral {
			elements = List.copyOf(elements);
		}
	}

	/**
	 * A variable, parameter or page variable reference.
	 *
	 * @param page owning page for {@code Page.variable} references, otherwise {@code null}
	 */
	record VariableReference(String page, String name) implements Expression {

		public static VariableReference local(String name) {
			return new VariableReference(null, name);
		}

		public boolean isQualified() {
			return page != null;
		}
	}
}
