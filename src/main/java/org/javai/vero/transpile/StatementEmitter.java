package org.javai.vero.transpile;

import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import org.javai.vero.ast.ActionCall;
import org.javai.vero.ast.Condition;
import org.javai.vero.ast.Expression;
import org.javai.vero.ast.Statement;
import org.javai.vero.ast.StatementVisitor;
import org.javai.vero.ast.Target;

/**
 * Lowers statements into Playwright calls. Inside tests each statement that touches the browser
 * becomes an awaited {@code test.step}; inside page object and page-actions methods statements
 * are written directly.
 */
final class StatementEmitter implements StatementVisitor<Void> {

	private final EmitContext context;
	private final CodeWriter out;
	private final TabOperationEmitter tabs;

	StatementEmitter(EmitContext context, CodeWriter out) {
		this.context = context;
		this.out = out;
		this.tabs = new TabOperationEmitter(context);
	}

	void emit(List<Statement> statements) {
		for (Statement statement : statements) {
			statement.accept(this);
		}
	}

	// ==================== Interaction ====================

	@Override
	public Void visitClick(Statement.Click click) {
		String locator = locator(click.target());
		return switch (click.kind()) {
			case SINGLE -> step("Click " + click.target().describe(), "await " + locator + ".click();");
			case RIGHT -> step("Right click " + click.target().describe(),
					"await " + locator + ".click({ button: 'right' });");
			case DOUBLE -> step("Double click " + click.target().describe(), "await " + locator + ".dblclick();");
		};
	}

	@Override
	public Void visitFill(Statement.Fill fill) {
		return step("Fill " + fill.target().describe(),
				"await " + locator(fill.target()) + ".fill(" + ExpressionRenderer.renderText(fill.value(), context) + ");");
	}

	@Override
	public Void visitOpen(Statement.Open open) {
		return step("Navigate to " + ExpressionRenderer.describe(open.url()),
				"await " + context.pageRef() + ".goto(" + ExpressionRenderer.renderText(open.url(), context) + ");");
	}

	@Override
	public Void visitCheck(Statement.Check check) {
		return step("Check " + check.target().describe(), "await " + locator(check.target()) + ".check();");
	}

	@Override
	public Void visitUncheck(Statement.Uncheck uncheck) {
		return step("Uncheck " + uncheck.target().describe(), "await " + locator(uncheck.target()) + ".uncheck();");
	}

	@Override
	public Void visitSelect(Statement.Select select) {
		String option = select.option() instanceof Expression.ListLiteral
				? ExpressionRenderer.render(select.option(), context)
				: ExpressionRenderer.renderText(select.option(), context);
		return step("Select " + ExpressionRenderer.describe(select.option()) + " from " + select.target().describe(),
				"await " + locator(select.target()) + ".selectOption(" + option + ");");
	}

	@Override
	public Void visitHover(Statement.Hover hover) {
		return step("Hover " + hover.target().describe(), "await " + locator(hover.target()) + ".hover();");
	}

	@Override
	public Void visitPress(Statement.Press press) {
		return step("Press " + press.key(),
				"await " + context.pageRef() + ".keyboard.press(" + ExpressionRenderer.jsString(press.key()) + ");");
	}

	@Override
	public Void visitScroll(Statement.Scroll scroll) {
		if (scroll.target() != null) {
			return step("Scroll to " + scroll.target().describe(),
					"await " + locator(scroll.target()) + ".scrollIntoViewIfNeeded();");
		}
		boolean up = scroll.direction() == Statement.ScrollDirection.UP;
		return step(up ? "Scroll up" : "Scroll down",
				"await " + context.pageRef() + ".mouse.wheel(0, " + (up ? "-500" : "500") + ");");
	}

	@Override
	public Void visitWait(Statement.Wait wait) {
		if (wait.millis() == null) {
			return step("Wait for network idle", "await " + context.pageRef() + ".waitForLoadState('networkidle');");
		}
		return step("Wait " + wait.millis() + "ms", "await " + context.pageRef() + ".waitForTimeout(" + wait.millis() + ");");
	}

	@Override
	public Void visitWaitFor(Statement.WaitFor waitFor) {
		return step("Wait for " + waitFor.target().describe(),
				"await " + locator(waitFor.target()) + ".waitFor({ state: 'visible' });");
	}

	@Override
	public Void visitPerform(Statement.Perform perform) {
		String title = "Perform " + perform.call().qualifiedName();
		String code = "await " + call(perform.call()) + ";";
		String moved = movedReceiver(perform.call());
		if (moved == null) {
			return step(title, code);
		}
		return block(title, w -> {
			w.line(code);
			context.writeAdopt(w, moved);
		});
	}

	@Override
	public Void visitRefresh(Statement.Refresh refresh) {
		return step("Refresh page", "await " + context.pageRef() + ".reload();");
	}

	@Override
	public Void visitClear(Statement.Clear clear) {
		return step("Clear " + clear.target().describe(), "await " + locator(clear.target()) + ".clear();");
	}

	@Override
	public Void visitTakeScreenshot(Statement.TakeScreenshot screenshot) {
		String path = screenshot.filename() != null ? screenshot.filename() : "screenshot-line-" + screenshot.line() + ".png";
		return step("Take screenshot " + path,
				"await " + context.pageRef() + ".screenshot({ path: " + ExpressionRenderer.jsString(path) + " });");
	}

	@Override
	public Void visitLog(Statement.Log log) {
		return step("Log: " + ExpressionRenderer.describe(log.message()),
				"console.log(" + ExpressionRenderer.render(log.message(), context) + ");");
	}

	// ==================== Control flow ====================

	@Override
	public Void visitIf(Statement.If ifStatement) {
		out.open("if (" + condition(ifStatement.subject(), ifStatement.condition()) + ") {");
		emitBranches(ifStatement);
		return null;
	}

	private void emitBranches(Statement.If ifStatement) {
		emit(ifStatement.thenStatements());
		List<Statement> elseStatements = ifStatement.elseStatements();
		if (elseStatements.size() == 1 && elseStatements.get(0) instanceof Statement.If elseIf) {
			out.next("} else if (" + condition(elseIf.subject(), elseIf.condition()) + ") {");
			emitBranches(elseIf);
		} else if (!elseStatements.isEmpty()) {
			out.next("} else {");
			emit(elseStatements);
			out.close("}");
		} else {
			out.close("}");
		}
	}

	@Override
	public Void visitRepeat(Statement.Repeat repeat) {
		String counter = context.enterLoop();
		out.open("for (let " + counter + " = 0; " + counter + " < "
				+ ExpressionRenderer.render(repeat.count(), context) + "; " + counter + "++) {");
		emit(repeat.statements());
		out.close("}");
		context.exitLoop();
		return null;
	}

	@Override
	public Void visitVariableDeclaration(Statement.VariableDeclaration declaration) {
		String value = declaration.call() != null
				? "await " + call(declaration.call())
				: ExpressionRenderer.render(declaration.value(), context);
		out.line("let " + declaration.name() + " = " + value + ";");
		context.declareLocal(declaration.name());
		String moved = declaration.call() != null ? movedReceiver(declaration.call()) : null;
		if (moved != null) {
			context.writeAdopt(out, moved);
		}
		return null;
	}

	@Override
	public Void visitForEach(Statement.ForEach forEach) {
		String item = forEach.item();
		boolean shadows = context.isLocal(item);
		context.declareLocal(item);
		out.open("for (const " + item + " of " + ExpressionRenderer.render(forEach.collection(), context) + ") {");
		emit(forEach.statements());
		out.close("}");
		if (!shadows) {
			context.forgetLocal(item);
		}
		return null;
	}

	@Override
	public Void visitReturn(Statement.Return returnStatement) {
		String value = switch (returnStatement.kind()) {
			case VISIBLE -> "await " + locator(returnStatement.target()) + ".isVisible()";
			case TEXT -> "(await " + locator(returnStatement.target()) + ".textContent()) ?? ''";
			case VALUE -> "await " + locator(returnStatement.target()) + ".inputValue()";
			case EXPRESSION -> ExpressionRenderer.render(returnStatement.expression(), context);
		};
		out.line("return " + value + ";");
		return null;
	}

	// ==================== Assertions ====================

	@Override
	public Void visitVerify(Statement.Verify verify) {
		Target subject = verify.subject();
		Condition condition = verify.condition();
		String title = "Verify " + subject.describe() + " " + describe(condition);
		String not = condition.negated() ? ".not" : "";

		if (condition instanceof Condition.StateCondition state) {
			return step(title, "await expect(" + locator(subject) + ")" + not + "." + matcher(state.state()) + "();");
		}
		Expression expected = condition instanceof Condition.ContainsCondition contains
				? contains.value()
				: ((Condition.EqualsCondition) condition).value();
		boolean isContains = condition instanceof Condition.ContainsCondition;
		if (isValueSubject(subject)) {
			String assertion = isContains
					? "expect(String(" + value(subject) + "))" + not + ".toContain("
							+ ExpressionRenderer.renderText(expected, context) + ");"
					: "expect(" + value(subject) + ")" + not + ".toBe("
							+ ExpressionRenderer.render(expected, context) + ");";
			return step(title, assertion);
		}
		return step(title, "await expect(" + locator(subject) + ")" + not
				+ (isContains ? ".toContainText(" : ".toHaveText(")
				+ ExpressionRenderer.renderText(expected, context) + ");");
	}

	@Override
	public Void visitVerifyUrl(Statement.VerifyUrl verifyUrl) {
		String expected = ExpressionRenderer.renderText(verifyUrl.value(), context);
		String page = context.pageRef();
		if (verifyUrl.operator() == Statement.MatchOperator.CONTAINS) {
			return step("Verify URL contains " + ExpressionRenderer.describe(verifyUrl.value()),
					"await expect.poll(() => " + page + ".url()).toContain(" + expected + ");");
		}
		return step("Verify URL equals " + ExpressionRenderer.describe(verifyUrl.value()),
				"await expect(" + page + ").toHaveURL(" + expected + ");");
	}

	@Override
	public Void visitVerifyTitle(Statement.VerifyTitle verifyTitle) {
		String expected = ExpressionRenderer.renderText(verifyTitle.value(), context);
		String page = context.pageRef();
		if (verifyTitle.operator() == Statement.MatchOperator.CONTAINS) {
			return step("Verify title contains " + ExpressionRenderer.describe(verifyTitle.value()),
					"await expect.poll(() => " + page + ".title()).toContain(" + expected + ");");
		}
		return step("Verify title equals " + ExpressionRenderer.describe(verifyTitle.value()),
				"await expect(" + page + ").toHaveTitle(" + expected + ");");
	}

	@Override
	public Void visitVerifyHas(Statement.VerifyHas verifyHas) {
		Expression value = verifyHas.value();
		String assertion = switch (verifyHas.kind()) {
			case COUNT -> "toHaveCount(" + (value instanceof Expression.NumberLiteral
					? ExpressionRenderer.render(value, context)
					: "Number(" + ExpressionRenderer.render(value, context) + ")") + ")";
			case VALUE -> "toHaveValue(" + ExpressionRenderer.renderText(value, context) + ")";
			case ATTRIBUTE -> "toHaveAttribute(" + ExpressionRenderer.renderText(verifyHas.attribute(), context) + ", "
					+ ExpressionRenderer.renderText(value, context) + ")";
			case CLASS -> "toHaveClass(" + classPattern(value) + ")";
		};
		String attribute = verifyHas.attribute() != null
				? ExpressionRenderer.describe(verifyHas.attribute()) + " "
				: "";
		return step("Verify " + verifyHas.target().describe() + " has " + verifyHas.kind().keyword() + " " + attribute
						+ ExpressionRenderer.describe(value),
				"await expect(" + locator(verifyHas.target()) + ")." + assertion + ";");
	}

	/**
	 * Matches one class among the element's space-separated classes.
	 */
	private String classPattern(Expression className) {
		if (className instanceof Expression.StringLiteral literal) {
			StringBuilder escaped = new StringBuilder();
			for (char c : literal.value().toCharArray()) {
				if (".*+?^${}()|[]\\/".indexOf(c) >= 0) {
					escaped.append('\\');
				}
				escaped.append(c);
			}
			return "/(^|\\s)" + escaped + "(\\s|$)/";
		}
		return "new RegExp('(^|\\\\s)' + String(" + ExpressionRenderer.render(className, context)
				+ ").replace(/[.*+?^${}()|[\\]\\\\]/g, '\\\\$&') + '(\\\\s|$)')";
	}

	// ==================== Dialogs and files ====================

	@Override
	public Void visitAcceptDialog(Statement.AcceptDialog acceptDialog) {
		Expression response = acceptDialog.response();
		String title = response != null
				? "Accept next dialog with " + ExpressionRenderer.describe(response)
				: "Accept next dialog";
		String argument = response != null ? ExpressionRenderer.renderText(response, context) : "";
		return step(title, context.pageRef() + ".once('dialog', (dialog) => dialog.accept(" + argument + "));");
	}

	@Override
	public Void visitDismissDialog(Statement.DismissDialog dismissDialog) {
		return step("Dismiss next dialog", context.pageRef() + ".once('dialog', (dialog) => dialog.dismiss());");
	}

	@Override
	public Void visitUpload(Statement.Upload upload) {
		List<Expression> files = upload.files();
		String argument = files.size() == 1
				? ExpressionRenderer.render(files.get(0), context)
				: files.stream()
						.map(f -> ExpressionRenderer.renderText(f, context))
						.collect(Collectors.joining(", ", "[", "]"));
		String described = files.stream().map(ExpressionRenderer::describe).collect(Collectors.joining(", "));
		return step("Upload " + described + " to " + upload.target().describe(),
				"await " + locator(upload.target()) + ".setInputFiles(" + argument + ");");
	}

	// ==================== Frames ====================

	@Override
	public Void visitSwitchToFrame(Statement.SwitchToFrame switchToFrame) {
		String selector = ExpressionRenderer.jsString(SelectorRenderer.frameSelector(switchToFrame.selector()));
		return block("Switch to frame " + switchToFrame.selector().value(),
				w -> context.writeFrameRebind(w, context.rootRef() + ".frameLocator(" + selector + ")"));
	}

	@Override
	public Void visitSwitchToMainFrame(Statement.SwitchToMainFrame switchToMainFrame) {
		return block("Switch to main frame", w -> context.writeFrameRebind(w, context.pageRef()));
	}

	// ==================== Tabs ====================

	@Override
	public Void visitOpenInNewTab(Statement.OpenInNewTab open) {
		return block("Open " + ExpressionRenderer.describe(open.url()) + " in new tab", w -> tabs.openInNewTab(open, w));
	}

	@Override
	public Void visitSwitchToNewTab(Statement.SwitchToNewTab switchToNewTab) {
		String title = switchToNewTab.url() != null
				? "Switch to new tab " + ExpressionRenderer.describe(switchToNewTab.url())
				: "Switch to new tab";
		return block(title, w -> tabs.switchToNewTab(switchToNewTab, w));
	}

	@Override
	public Void visitSwitchToTab(Statement.SwitchToTab switchToTab) {
		return block("Switch to tab " + ExpressionRenderer.describe(switchToTab.index()),
				w -> tabs.switchToTab(switchToTab, w));
	}

	@Override
	public Void visitCloseTab(Statement.CloseTab closeTab) {
		return block("Close tab", w -> tabs.closeTab(closeTab, w));
	}

	// ==================== Helpers ====================

	private Void step(String title, String code) {
		if (context.usesSteps()) {
			out.open("await test.step(" + ExpressionRenderer.jsString(title) + ", async () => {");
			out.line(code);
			out.close("});");
		} else {
			out.line(code);
		}
		return null;
	}

	/**
	 * Multi-line body; outside tests it is wrapped in a bare block so its constants stay local.
	 */
	private Void block(String title, Consumer<CodeWriter> body) {
		if (context.usesSteps()) {
			out.open("await test.step(" + ExpressionRenderer.jsString(title) + ", async () => {");
		} else {
			out.open("{");
		}
		body.accept(out);
		out.close(context.usesSteps() ? "});" : "}");
		return null;
	}

	/**
	 * The object whose page and frame the caller follows after {@code call} returns, or {@code null}
	 * when the call cannot move the browsing context or moved this object itself.
	 */
	private String movedReceiver(ActionCall call) {
		if (!call.isQualified() || !context.symbols().changesContext(call, context.owner())) {
			return null;
		}
		String receiver = context.objectRef(call.page());
		return receiver.equals("this") ? null : receiver;
	}

	private String call(ActionCall call) {
		String arguments = call.arguments().stream()
				.map(a -> ExpressionRenderer.render(a, context))
				.collect(Collectors.joining(", "));
		String receiver;
		if (call.isQualified()) {
			receiver = context.objectRef(call.page()) + ".";
		} else {
			receiver = context.kind() == EmitContext.Kind.TEST ? "" : "this.";
		}
		return receiver + call.action() + "(" + arguments + ")";
	}

	/**
	 * Locator expression for an element target.
	 */
	String locator(Target target) {
		if (target instanceof Target.TextTarget text) {
			return context.rootRef() + ".getByText(" + ExpressionRenderer.jsString(text.text()) + ")";
		}
		if (target instanceof Target.PageFieldTarget pageField) {
			String property = context.objectRef(pageField.page()) + "." + pageField.field();
			return isValueSubject(target) ? context.rootRef() + ".locator(String(" + property + "))" : property;
		}
		Target.FieldTarget field = (Target.FieldTarget) target;
		if (context.isOwnField(field.field())) {
			return context.objectRef(context.ownPage().name()) + "." + field.field();
		}
		return context.rootRef() + ".locator(String(" + value(target) + "))";
	}

	/**
	 * Whether the target names a value (variable, parameter, page variable) rather than an element.
	 */
	private boolean isValueSubject(Target target) {
		if (target instanceof Target.PageFieldTarget pageField) {
			return !context.symbols().fieldsForPage(pageField.page()).contains(pageField.field())
					&& context.symbols().variablesForPage(pageField.page()).contains(pageField.field());
		}
		if (target instanceof Target.FieldTarget field) {
			return !context.isOwnField(field.field());
		}
		return false;
	}

	private String value(Target target) {
		if (target instanceof Target.PageFieldTarget pageField) {
			return context.objectRef(pageField.page()) + "." + pageField.field();
		}
		String name = ((Target.FieldTarget) target).field();
		if (context.isOwnVariable(name)) {
			return context.objectRef(context.ownPage().name()) + "." + name;
		}
		return name;
	}

	private String condition(Target subject, Condition condition) {
		String expression;
		if (condition instanceof Condition.StateCondition state) {
			expression = stateCheck(locator(subject), state.state());
		} else if (isValueSubject(subject)) {
			expression = condition instanceof Condition.ContainsCondition contains
					? "String(" + value(subject) + ").includes(" + ExpressionRenderer.renderText(contains.value(), context) + ")"
					: value(subject) + " === "
							+ ExpressionRenderer.render(((Condition.EqualsCondition) condition).value(), context);
		} else {
			String text = "((await " + locator(subject) + ".textContent()) ?? '')";
			expression = condition instanceof Condition.ContainsCondition contains
					? text + ".includes(" + ExpressionRenderer.renderText(contains.value(), context) + ")"
					: text + ".trim() === "
							+ ExpressionRenderer.renderText(((Condition.EqualsCondition) condition).value(), context);
		}
		return condition.negated() ? "!(" + expression + ")" : expression;
	}

	private static String stateCheck(String locator, Condition.ElementState state) {
		return switch (state) {
			case VISIBLE -> "await " + locator + ".isVisible()";
			case HIDDEN -> "await " + locator + ".isHidden()";
			case ENABLED -> "await " + locator + ".isEnabled()";
			case DISABLED -> "await " + locator + ".isDisabled()";
			case CHECKED -> "await " + locator + ".isChecked()";
			case EMPTY -> "((await " + locator + ".textContent()) ?? '').trim() === ''";
			case FOCUSED -> "await " + locator + ".evaluate((el) => el === document.activeElement)";
		};
	}

	private static String matcher(Condition.ElementState state) {
		return switch (state) {
			case VISIBLE -> "toBeVisible";
			case HIDDEN -> "toBeHidden";
			case ENABLED -> "toBeEnabled";
			case DISABLED -> "toBeDisabled";
			case CHECKED -> "toBeChecked";
			case EMPTY -> "toBeEmpty";
			case FOCUSED -> "toBeFocused";
		};
	}

	private static String describe(Condition condition) {
		String not = condition.negated() ? "not " : "";
		if (condition instanceof Condition.StateCondition state) {
			return "is " + not + state.state().keyword();
		}
		if (condition instanceof Condition.ContainsCondition contains) {
			return not + "contains " + ExpressionRenderer.describe(contains.value());
		}
		return "is " + not + ExpressionRenderer.describe(((Condition.EqualsCondition) condition).value());
	}
}
