package org.javai.vero.transpile;

import java.util.stream.Collectors;
import org.javai.vero.ast.Expression;

/**
 * Renders Vero expressions as TypeScript expressions.
 */
public final class ExpressionRenderer {

	private ExpressionRenderer() {
	}

	static String render(Expression expression, EmitContext context) {
		if (expression instanceof Expression.StringLiteral s) {
			return jsString(s.value());
		}
		if (expression instanceof Expression.NumberLiteral n) {
			return n.value().toPlainString();
		}
		if (expression instanceof Expression.BooleanLiteral b) {
			return String.valueOf(b.value());
		}
		if (expression instanceof Expression.NullLiteral) {
			return "null";
		}
		if (expression instanceof Expression.ListLiteral list) {
			return list.elements().stream()
					.map(e -> render(e, context))
					.collect(Collectors.joining(", ", "[", "]"));
		}
		Expression.VariableReference ref = (Expression.VariableReference) expression;
		if (ref.isQualified()) {
			return context.objectRef(ref.page()) + "." + ref.name();
		}
		if (context.isOwnVariable(ref.name())) {
			return context.objectRef(context.ownPage().name()) + "." + ref.name();
		}
		// Declared locals, parameters and undeclared names are all emitted as bare identifiers.
		return ref.name();
	}

	/**
	 * Renders an expression where a string is required, converting non-string values.
	 */
	static String renderText(Expression expression, EmitContext context) {
		String rendered = render(expression, context);
		return expression instanceof Expression.StringLiteral ? rendered : "String(" + rendered + ")";
	}

	/**
	 * Human-readable form for step titles: string contents unquoted, names as written.
	 */
	public static String describe(Expression expression) {
		if (expression instanceof Expression.StringLiteral s) {
			return s.value();
		}
		if (expression instanceof Expression.NumberLiteral n) {
			return n.value().toPlainString();
		}
		if (expression instanceof Expression.BooleanLiteral b) {
			return String.valueOf(b.value());
		}
		if (expression instanceof Expression.NullLiteral) {
			return "null";
		}
		if (expression instanceof Expression.ListLiteral list) {
			return list.elements().stream()
					.map(ExpressionRenderer::describe)
					.collect(Collectors.joining(", ", "[", "]"));
		}
		Expression.VariableReference ref = (Expression.VariableReference) expression;
		return ref.isQualified() ? ref.page() + "." + ref.name() : ref.name();
	}

	/**
	 * Single-quoted TypeScript string literal.
	 */
	public static String jsString(String value) {
		StringBuilder sb = new StringBuilder("'");
		for (char c : value.toCharArray()) {
			switch (c) {
				case '\\' -> sb.append("\\\\");
				case '\'' -> sb.append("\\'");
				case '\n' -> sb.append("\\n");
				case '\r' -> sb.append("\\r");
				case '\t' -> sb.append("\\t");
				default -> sb.append(c);
			}
		}
		return sb.append('\'').toString();
	}
}
