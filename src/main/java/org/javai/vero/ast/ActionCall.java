package org.javai.vero.ast;

import java.util.List;

/**
 * Invocation of a page or page-actions action.
 *
 * @param page owning page or page-actions name, or {@code null} for an unqualified call
 */
public record ActionCall(String page, String action, List<Expression> arguments) {

	public ActionCall {
		arguments = List.copyOf(arguments);
	}

	public boolean isQualified() {
		return page != null;
	}

	public String qualifiedName() {
		return page != null ? page + "." + action : action;
	}
}
