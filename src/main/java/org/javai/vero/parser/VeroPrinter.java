package org.javai.vero.parser;

import java.util.List;
import java.util.stream.Collectors;
import org.javai.vero.ast.ActionCall;
import org.javai.vero.ast.ActionDefinition;
import org.javai.vero.ast.Condition;
import org.javai.vero.ast.Expression;
import org.javai.vero.ast.Feature;
import org.javai.vero.ast.Field;
import org.javai.vero.ast.Fixture;
import org.javai.vero.ast.Hook;
import org.javai.vero.ast.Page;
import org.javai.vero.ast.PageActions;
import org.javai.vero.ast.Program;
import org.javai.vero.ast.Scenario;
import org.javai.vero.ast.Selector;
import org.javai.vero.ast.Statement;
import org.javai.vero.ast.StatementVisitor;
import org.javai.vero.ast.Target;
import org.javai.vero.ast.Variable;

/**
 * Prints a {@link Program} back to canonical Vero source.
 * <p>
 * Printing is a fixpoint: parsing the output and printing again yields the same text.
 */
public class VeroPrinter implements StatementVisitor<Void> {

	private final StringBuilder output = new StringBuilder();
	private final int indentSize;
	private int indentLevel = 0;

	public VeroPrinter() {
		this(2);
	}

	public VeroPrinter(int indentSize) {
		this.indentSize = indentSize;
	}

	/**
	 * Static convenience method to print a whole program.
	 */
	public static String print(Program program) {
		VeroPrinter printer = new VeroPrinter();
		printer.printProgram(program);
		return printer.toString();
	}

	public void printProgram(Program program) {
		boolean first = true;
		for (Page page : program.pages()) {
			first = separate(first);
			printPage(page);
		}
		for (PageActions pageActions : program.pageActions()) {
			first = separate(first);
			printPageActions(pageActions);
		}
		for (Fixture fixture : program.fixtures()) {
			first = separate(first);
			printFixture(fixture);
		}
		for (Feature feature : program.features()) {
			first = separate(first);
			printFeature(feature);
		}
	}

	private boolean separate(boolean first) {
		if (!first) {
			output.append('\n');
		}
		return false;
	}

	private void printPage(Page page) {
		line("page " + page.name() + " {");
		indentLevel++;
		for (Field field : page.fields()) {
			line("field " + field.name() + " = " + selector(field.selector()));
		}
		for (Variable variable : page.variables()) {
			line(variable.type().keyword() + " " + variable.name() + " = " + expression(variable.value()));
		}
		for (ActionDefinition action : page.actions()) {
			printAction(action);
		}
		indentLevel--;
		line("}");
	}

	private void printPageActions(PageActions pageActions) {
		line("pageactions " + pageActions.name() + " for " + pageActions.forPage() + " {");
		indentLevel++;
		for (ActionDefinition action : pageActions.actions()) {
			printAction(action);
		}
		indentLevel--;
		line("}");
	}

	private void printAction(ActionDefinition action) {
		StringBuilder header = new StringBuilder(action.name());
		if (!action.parameters().isEmpty()) {
			header.append(" with ").append(String.join(", ", action.parameters()));
		}
		if (action.returnType() != null) {
			header.append(" returns ").append(action.returnType().keyword());
		}
		printBlock(header.toString(), action.statements());
	}

	private void printFixture(Fixture fixture) {
		line("fixture " + fixture.name() + " {");
		indentLevel++;
		printBlock("setup", fixture.setup());
		printBlock("teardown", fixture.teardown());
		indentLevel--;
		line("}");
	}

	private void printFeature(Feature feature) {
		String annotations = feature.annotations().stream()
				.map(a -> a.keyword() + " ")
				.collect(Collectors.joining());
		line(annotations + "feature " + feature.name() + " {");
		indentLevel++;
		if (!feature.uses().isEmpty()) {
			line("use " + feature.uses().stream().map(Feature.Use::name).collect(Collectors.joining(", ")));
		}
		for (Hook hook : feature.hooks()) {
			printBlock(hook.type().keywords(), hook.statements());
		}
		for (Scenario scenario : feature.scenarios()) {
			StringBuilder header = new StringBuilder();
			scenario.annotations().forEach(a -> header.append(a.keyword()).append(' '));
			header.append("scenario ").append(quote(scenario.name()));
			scenario.tags().forEach(tag -> header.append(" @").append(tag));
			printBlock(header.toString(), scenario.statements());
		}
		indentLevel--;
		line("}");
	}

	private void printBlock(String header, List<Statement> statements) {
		line(header + " {");
		printStatements(statements);
		line("}");
	}

	private void printStatements(List<Statement> statements) {
		indentLevel++;
		for (Statement statement : statements) {
			statement.accept(this);
		}
		indentLevel--;
	}

	// ==================== Statements ====================

	@Override
	public Void visitClick(Statement.Click click) {
		String prefix = switch (click.kind()) {
			case SINGLE -> "";
			case RIGHT -> "right ";
			case DOUBLE -> "double ";
		};
		line(prefix + "click " + target(click.target()));
		return null;
	}

	@Override
	public Void visitFill(Statement.Fill fill) {
		line("fill " + target(fill.target()) + " with " + expression(fill.value()));
		return null;
	}

	@Override
	public Void visitOpen(Statement.Open open) {
		line("open " + expression(open.url()));
		return null;
	}

	@Override
	public Void visitOpenInNewTab(Statement.OpenInNewTab open) {
		line("open " + expression(open.url()) + " in new tab");
		return null;
	}

	@Override
	public Void visitCheck(Statement.Check check) {
		line("check " + target(check.target()));
		return null;
	}

	@Override
	public Void visitUncheck(Statement.Uncheck uncheck) {
		line("uncheck " + target(uncheck.target()));
		return null;
	}

	@Override
	public Void visitSelect(Statement.Select select) {
		line("select " + expression(select.option()) + " from " + target(select.target()));
		return null;
	}

	@Override
	public Void visitHover(Statement.Hover hover) {
		line("hover " + target(hover.target()));
		return null;
	}

	@Override
	public Void visitPress(Statement.Press press) {
		line("press " + quote(press.key()));
		return null;
	}

	@Override
	public Void visitScroll(Statement.Scroll scroll) {
		if (scroll.target() != null) {
			line("scroll to " + target(scroll.target()));
		} else {
			line("scroll " + (scroll.direction() == Statement.ScrollDirection.UP ? "up" : "down"));
		}
		return null;
	}

	@Override
	public Void visitWait(Statement.Wait wait) {
		line(wait.millis() == null ? "wait" : "wait " + wait.millis() + " milliseconds");
		return null;
	}

	@Override
	public Void visitWaitFor(Statement.WaitFor waitFor) {
		line("wait for " + target(waitFor.target()));
		return null;
	}

	@Override
	public Void visitPerform(Statement.Perform perform) {
		line("perform " + call(perform.call()));
		return null;
	}

	@Override
	public Void visitRefresh(Statement.Refresh refresh) {
		line("refresh");
		return null;
	}

	@Override
	public Void visitClear(Statement.Clear clear) {
		line("clear " + target(clear.target()));
		return null;
	}

	@Override
	public Void visitTakeScreenshot(Statement.TakeScreenshot screenshot) {
		line(screenshot.filename() == null ? "take screenshot" : "take screenshot " + quote(screenshot.filename()));
		return null;
	}

	@Override
	public Void visitLog(Statement.Log log) {
		line("log " + expression(log.message()));
		return null;
	}

	@Override
	public Void visitIf(Statement.If ifStatement) {
		printIf(ifStatement, "if ");
		return null;
	}

	private void printIf(Statement.If ifStatement, String keyword) {
		line(keyword + target(ifStatement.subject()) + " " + condition(ifStatement.condition()) + " {");
		printStatements(ifStatement.thenStatements());
		List<Statement> elseStatements = ifStatement.elseStatements();
		if (elseStatements.size() == 1 && elseStatements.get(0) instanceof Statement.If elseIf) {
			printIf(elseIf, "} else if ");
		} else if (!elseStatements.isEmpty()) {
			line("} else {");
			printStatements(elseStatements);
			line("}");
		} else {
			line("}");
		}
	}

	@Override
	public Void visitRepeat(Statement.Repeat repeat) {
		printBlock("repeat " + expression(repeat.count()) + " times", repeat.statements());
		return null;
	}

	@Override
	public Void visitVerify(Statement.Verify verify) {
		line("verify " + target(verify.subject()) + " " + condition(verify.condition()));
		return null;
	}

	@Override
	public Void visitVerifyUrl(Statement.VerifyUrl verifyUrl) {
		line("verify url " + operator(verifyUrl.operator()) + " " + expression(verifyUrl.value()));
		return null;
	}

	@Override
	public Void visitVerifyTitle(Statement.VerifyTitle verifyTitle) {
		line("verify title " + operator(verifyTitle.operator()) + " " + expression(verifyTitle.value()));
		return null;
	}

	@Override
	public Void visitReturn(Statement.Return returnStatement) {
		String body = switch (returnStatement.kind()) {
			case VISIBLE -> "visible of " + target(returnStatement.target());
			case TEXT -> "text of " + target(returnStatement.target());
			case VALUE -> "value of " + target(returnStatement.target());
			case EXPRESSION -> expression(returnStatement.expression());
		};
		line("return " + body);
		return null;
	}

	@Override
	public Void visitSwitchToNewTab(Statement.SwitchToNewTab switchToNewTab) {
		line(switchToNewTab.url() == null ? "switch to new tab"
				: "switch to new tab " + expression(switchToNewTab.url()));
		return null;
	}

	@Override
	public Void visitSwitchToTab(Statement.SwitchToTab switchToTab) {
		line("switch to tab " + expression(switchToTab.index()));
		return null;
	}

	@Override
	public Void visitCloseTab(Statement.CloseTab closeTab) {
		line("close tab");
		return null;
	}

	@Override
	public Void visitSwitchToFrame(Statement.SwitchToFrame switchToFrame) {
		line("switch to frame " + selector(switchToFrame.selector()));
		return null;
	}

	@Override
	public Void visitSwitchToMainFrame(Statement.SwitchToMainFrame switchToMainFrame) {
		line("switch to main frame");
		return null;
	}

	@Override
	public Void visitAcceptDialog(Statement.AcceptDialog acceptDialog) {
		line(acceptDialog.response() == null ? "accept dialog"
				: "accept dialog with " + expression(acceptDialog.response()));
		return null;
	}

	@Override
	public Void visitDismissDialog(Statement.DismissDialog dismissDialog) {
		line("dismiss dialog");
		return null;
	}

	@Override
	public Void visitVerifyHas(Statement.VerifyHas verifyHas) {
		String attribute = verifyHas.attribute() != null ? expression(verifyHas.attribute()) + " " : "";
		line("verify " + target(verifyHas.target()) + " has " + verifyHas.kind().keyword() + " "
				+ attribute + expression(verifyHas.value()));
		return null;
	}

	@Override
	public Void visitUpload(Statement.Upload upload) {
		line("upload " + upload.files().stream().map(VeroPrinter::expression).collect(Collectors.joining(", "))
				+ " to " + target(upload.target()));
		return null;
	}

	@Override
	public Void visitForEach(Statement.ForEach forEach) {
		printBlock("for each " + forEach.item() + " in " + expression(forEach.collection()), forEach.statements());
		return null;
	}

	@Override
	public Void visitVariableDeclaration(Statement.VariableDeclaration declaration) {
		String value = declaration.call() != null
				? "perform " + call(declaration.call())
				: expression(declaration.value());
		line(declaration.type().keyword() + " " + declaration.name() + " = " + value);
		return null;
	}

	// ==================== Fragments ====================

	private static String selector(Selector selector) {
		if (selector.type() == Selector.SelectorType.AUTO) {
			return quote(selector.value());
		}
		return selector.type().keyword() + " " + quote(selector.value());
	}

	private static String target(Target target) {
		return target instanceof Target.TextTarget text ? quote(text.text()) : target.describe();
	}

	private static String condition(Condition condition) {
		String not = condition.negated() ? "not " : "";
		if (condition instanceof Condition.StateCondition state) {
			return "is " + not + state.state().keyword();
		}
		if (condition instanceof Condition.ContainsCondition contains) {
			return not + "contains " + expression(contains.value());
		}
		Condition.EqualsCondition equals = (Condition.EqualsCondition) condition;
		return "is " + not + expression(equals.value());
	}

	private static String operator(Statement.MatchOperator operator) {
		return operator == Statement.MatchOperator.CONTAINS ? "contains" : "equals";
	}

	private static String call(ActionCall call) {
		StringBuilder sb = new StringBuilder(call.qualifiedName());
		if (!call.arguments().isEmpty()) {
			sb.append(" with ").append(call.arguments().stream()
					.map(VeroPrinter::expression)
					.collect(Collectors.joining(", ")));
		}
		return sb.toString();
	}

	static String expression(Expression expression) {
		if (expression instanceof Expression.StringLiteral s) {
			return quote(s.value());
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
					.map(VeroPrinter::expression)
					.collect(Collectors.joining(", ", "[", "]"));
		}
		Expression.VariableReference ref = (Expression.VariableReference) expression;
		return ref.isQualified() ? ref.page() + "." + ref.name() : ref.name();
	}

	private static String quote(String value) {
		return '"' + value.replace("\\", "\\\\")
				.replace("\"", "\\\"")
				.replace("\n", "\\n")
				.replace("\t", "\\t")
				.replace("\r", "\\r") + '"';
	}

	private void line(String text) {
		output.append(" ".repeat(indentLevel * indentSize)).append(text).append('\n');
	}

	/**
	 * Returns the printed source.
	 */
	@Override
	public String toString() {
		return output.toString();
	}
}
