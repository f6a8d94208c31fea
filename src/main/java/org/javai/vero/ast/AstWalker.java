package org.javai.vero.ast;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Traversal helpers over statement lists.
 */
public final class AstWalker {

	private static final ReferenceCollector REFERENCES = new ReferenceCollector();

	private AstWalker() {
		// Utility class - no instantiation
	}

	/**
	 * Visits every statement in pre-order, descending into nested blocks.
	 */
	public static void walk(List<Statement> statements, Consumer<Statement> visitor) {
		if (statements == null) {
			return;
		}
		for (Statement statement : statements) {
			visitor.accept(statement);
			for (List<Statement> block : statement.blocks()) {
				walk(block, visitor);
			}
		}
	}

	/**
	 * Whether any statement, at any nesting depth, matches.
	 */
	public static boolean anyMatch(List<Statement> statements, Predicate<Statement> predicate) {
		if (statements == null) {
			return false;
		}
		for (Statement statement : statements) {
			if (predicate.test(statement)) {
				return true;
			}
			for (List<Statement> block : statement.blocks()) {
				if (anyMatch(block, predicate)) {
					return true;
				}
			}
		}
		return false;
	}

	/**
	 * Unqualified names the statements declare or read, at any depth: variable declarations,
	 * loop items and bare variable references.
	 */
	public static Set<String> localNames(List<Statement> statements) {
		Set<String> names = new LinkedHashSet<>();
		walk(statements, s -> {
			if (s instanceof Statement.VariableDeclaration declaration) {
				names.add(declaration.name());
			} else if (s instanceof Statement.ForEach forEach) {
				names.add(forEach.item());
			}
			for (Expression expression : references(s).expressions()) {
				collectUnqualifiedReferences(expression, names);
			}
		});
		return names;
	}

	/**
	 * The targets, expressions and action call a statement references directly (not through nested blocks).
	 */
	public static References references(Statement statement) {
		return statement.accept(REFERENCES);
	}

	/**
	 * Names of pages and page-actions bundles referenced anywhere in the statements, in first-use order:
	 * {@code Page.field} targets, {@code Page.variable} expressions and {@code Owner.action} calls.
	 */
	public static Set<String> referencedOwners(List<Statement> statements) {
		Set<String> owners = new LinkedHashSet<>();
		walk(statements, s -> {
			References refs = references(s);
			for (Target target : refs.targets()) {
				if (target instanceof Target.PageFieldTarget pageField) {
					owners.add(pageField.page());
				}
			}
			for (Expression expression : refs.expressions()) {
				collectQualifiedReferences(expression, owners);
			}
			if (refs.call() != null && refs.call().isQualified()) {
				owners.add(refs.call().page());
			}
		});
		return owners;
	}

	private static void collectQualifiedReferences(Expression expression, Set<String> owners) {
		if (expression instanceof Expression.VariableReference ref && ref.isQualified()) {
			owners.add(ref.page());
		} else if (expression instanceof Expression.ListLiteral list) {
			for (Expression element : list.elements()) {
				collectQualifiedReferences(element, owners);
			}
		}
	}

	private static void collectUnqualifiedReferences(Expression expression, Set<String> names) {
		if (expression instanceof Expression.VariableReference ref && !ref.isQualified()) {
			names.add(ref.name());
		} else if (expression instanceof Expression.ListLiteral list) {
			for (Expression element : list.elements()) {
				collectUnqualifiedReferences(element, names);
			}
		}
	}

	/**
	 * Direct references of a single statement.
	 *
	 * @param call the action call, or {@code null}
	 */
	public record References(List<Target> targets, List<Expression> expressions, ActionCall call) {

		static References of(Target target) {
			return new References(List.of(target), List.of(), null);
		}

		static References of(Expression expression) {
			return new References(List.of(), List.of(expression), null);
		}

		static References none() {
			return new References(List.of(), List.of(), null);
		}
	}

	private static final class ReferenceCollector implements StatementVisitor<References> {

		@Override
		public References visitClick(Statement.Click click) {
			return References.of(click.target());
		}

		@Override
		public References visitFill(Statement.Fill fill) {
			return new References(List.of(fill.target()), List.of(fill.value()), null);
		}

		@Override
		public References visitOpen(Statement.Open open) {
			return References.of(open.url());
		}

		@Override
		public References visitOpenInNewTab(Statement.OpenInNewTab open) {
			return References.of(open.url());
		}

		@Override
		public References visitCheck(Statement.Check check) {
			return References.of(check.target());
		}

		@Override
		public References visitUncheck(Statement.Uncheck uncheck) {
			return References.of(uncheck.target());
		}

		@Override
		public References visitSelect(Statement.Select select) {
			return new References(List.of(select.target()), List.of(select.option()), null);
		}

		@Override
		public References visitHover(Statement.Hover hover) {
			return References.of(hover.target());
		}

		@Override
		public References visitPress(Statement.Press press) {
			return References.none();
		}

		@Override
		public References visitScroll(Statement.Scroll scroll) {
			return scroll.target() != null ? References.of(scroll.target()) : References.none();
		}

		@Override
		public References visitWait(Statement.Wait wait) {
			return References.none();
		}

		@Override
		public References visitWaitFor(Statement.WaitFor waitFor) {
			return References.of(waitFor.target());
		}

		@Override
		public References visitPerform(Statement.Perform perform) {
			return new References(List.of(), perform.call().arguments(), perform.call());
		}

		@Override
		public References visitRefresh(Statement.Refresh refresh) {
			return References.none();
		}

		@Override
		public References visitClear(Statement.Clear clear) {
			return References.of(clear.target());
		}

		@Override
		public References visitTakeScreenshot(Statement.TakeScreenshot screenshot) {
			return References.none();
		}

		@Override
		public References visitLog(Statement.Log log) {
			return References.of(log.message());
		}

		@Override
		public References visitIf(Statement.If ifStatement) {
			return new References(List.of(ifStatement.subject()), conditionExpressions(ifStatement.condition()), null);
		}

		@Override
		public References visitRepeat(Statement.Repeat repeat) {
			return References.of(repeat.count());
		}

		@Override
		public References visitVerify(Statement.Verify verify) {
			return new References(List.of(verify.subject()), conditionExpressions(verify.condition()), null);
		}

		@Override
		public References visitVerifyUrl(Statement.VerifyUrl verifyUrl) {
			return References.of(verifyUrl.value());
		}

		@Override
		public References visitVerifyTitle(Statement.VerifyTitle verifyTitle) {
			return References.of(verifyTitle.value());
		}

		@Override
		public References visitReturn(Statement.Return returnStatement) {
			if (returnStatement.target() != null) {
				return References.of(returnStatement.target());
			}
			return References.of(returnStatement.expression());
		}

		@Override
		public References visitSwitchToNewTab(Statement.SwitchToNewTab switchToNewTab) {
			return switchToNewTab.url() != null ? References.of(switchToNewTab.url()) : References.none();
		}

		@Override
		public References visitSwitchToTab(Statement.SwitchToTab switchToTab) {
			return References.of(switchToTab.index());
		}

		@Override
		public References visitCloseTab(Statement.CloseTab closeTab) {
			return References.none();
		}

		@Override
		public References visitSwitchToFrame(Statement.SwitchToFrame switchToFrame) {
			return References.none();
		}

		@Override
		public References visitSwitchToMainFrame(Statement.SwitchToMainFrame switchToMainFrame) {
			return References.none();
		}

		@Override
		public References visitAcceptDialog(Statement.AcceptDialog acceptDialog) {
			return acceptDialog.response() != null ? References.of(acceptDialog.response()) : References.none();
		}

		@Override
		public References visitDismissDialog(Statement.DismissDialog dismissDialog) {
			return References.none();
		}

		@Override
		public References visitVerifyHas(Statement.VerifyHas verifyHas) {
			List<Expression> expressions = verifyHas.attribute() != null
					? List.of(verifyHas.attribute(), verifyHas.value())
					: List.of(verifyHas.value());
			return new References(List.of(verifyHas.target()), expressions, null);
		}

		@Override
		public References visitUpload(Statement.Upload upload) {
			return new References(List.of(upload.target()), upload.files(), null);
		}

		@Override
		public References visitForEach(Statement.ForEach forEach) {
			return References.of(forEach.collection());
		}

		@Override
		public References visitVariableDeclaration(Statement.VariableDeclaration declaration) {
			if (declaration.call() != null) {
				return new References(List.of(), declaration.call().arguments(), declaration.call());
			}
			return References.of(declaration.value());
		}

		private static List<Expression> conditionExpressions(Condition condition) {
			if (condition instanceof Condition.ContainsCondition contains) {
				return List.of(contains.value());
			}
			if (condition instanceof Condition.EqualsCondition equals) {
				return List.of(equals.value());
			}
			return List.of();
		}
	}
}
