package org.javai.vero.ast;

import java.util.List;

/**
 * Statement variants. Passes dispatch through {@link StatementVisitor}, so adding a
 * variant breaks every pass that does not handle it.
 */
public sealed interface Statement {

	int line();

	<R> R accept(StatementVisitor<R> visitor);

	/**
	 * Nested statement lists (branches, loop bodies). Empty for simple statements.
	 */
	default List<List<Statement>> blocks() {
		return List.of();
	}

	/**
	 * Whether executing this statement changes the active tab.
	 */
	default boolean changesTab() {
		return false;
	}

	/**
	 * Whether executing this statement moves element lookups into or out of an iframe.
	 */
	default boolean changesFrame() {
		return false;
	}

	default boolean changesContext() {
		return changesTab() || changesFrame();
	}

	enum ClickKind {
		SINGLE,
		RIGHT,
		DOUBLE
	}

	enum ScrollDirection {
		UP,
		DOWN
	}

	enum MatchOperator {
		CONTAINS,
		EQUALS
	}

	enum HasKind {
		COUNT("count"),
		VALUE("value"),
		ATTRIBUTE("attribute"),
		CLASS("class");

		private final String keyword;

		HasKind(String keyword) {
			this.keyword = keyword;
		}

		public String keyword() {
			return keyword;
		}
	}

	enum ReturnKind {
		VISIBLE,
		TEXT,
		VALUE,
		EXPRESSION
	}

	record Click(Target target, ClickKind kind, int line) implements Statement {

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitClick(this);
		}
	}

	record Fill(Target target, Expression value, int line) implements Statement {

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitFill(this);
		}
	}

	record Open(Expression url, int line) implements Statement {

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitOpen(this);
		}
	}

	record OpenInNewTab(Expression url, int line) implements Statement {

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitOpenInNewTab(this);
		}

		@Override
		public boolean changesTab() {
			return true;
		}
	}

	record Check(Target target, int line) implements Statement {

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitCheck(this);
		}
	}

	record Uncheck(Target target, int line) implements Statement {

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitUncheck(this);
		}
	}

	record Select(Expression option, Target target, int line) implements Statement {

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitSelect(this);
		}
	}

	record Hover(Target target, int line) implements Statement {

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitHover(this);
		}
	}

	record Press(String key, int line) implements Statement {

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitPress(this);
		}
	}

	/**
	 * Either {@code direction} or {@code target} is set.
	 */
	record Scroll(ScrollDirection direction, Target target, int line) implements Statement {

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitScroll(this);
		}
	}

	/**
	 * @param millis fixed delay, or {@code null} to wait for network idle
	 */
	record Wait(Long millis, int line) implements Statement {

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitWait(this);
		}
	}

	record WaitFor(Target target, int line) implements Statement {

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitWaitFor(this);
		}
	}

	record Perform(ActionCall call, int line) implements Statement {

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitPerform(this);
		}
	}

	record Refresh(int line) implements Statement {

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitRefresh(this);
		}
	}

	record Clear(Target target, int line) implements Statement {

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitClear(this);
		}
	}

	/**
	 * @param filename screenshot path, or {@code null} for an unnamed capture
	 */
	record TakeScreenshot(String filename, int line) implements Statement {

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitTakeScreenshot(this);
		}
	}

	record Log(Expression message, int line) implements Statement {

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitLog(this);
		}
	}

	/**
	 * {@code else if} chains are represented as a single nested {@code If} in {@code elseStatements}.
	 */
	record If(Target subject, Condition condition, List<Statement> thenStatements, List<Statement> elseStatements,
			int line) implements Statement {

		public If {
			thenStatements = List.copyOf(thenStatements);
			elseStatements = List.copyOf(elseStatements);
		}

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitIf(this);
		}

		@Override
		public List<List<Statement>> blocks() {
			return List.of(thenStatements, elseStatements);
		}
	}

	record Repeat(Expression count, List<Statement> statements, int line) implements Statement {

		public Repeat {
			statements = List.copyOf(statements);
		}

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitRepeat(this);
		}

		@Override
		public List<List<Statement>> blocks() {
			return List.of(statements);
		}
	}

	record Verify(Target subject, Condition condition, int line) implements Statement {

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitVerify(this);
		}
	}

	record VerifyUrl(MatchOperator operator, Expression value, int line) implements Statement {

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitVerifyUrl(this);
		}
	}

	record VerifyTitle(MatchOperator operator, Expression value, int line) implements Statement {

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitVerifyTitle(this);
		}
	}

	/**
	 * {@code target} is set for {@code visible|text|value of}, {@code expression} for
	 * {@link ReturnKind#EXPRESSION}.
	 */
	record Return(ReturnKind kind, Target target, Expression expression, int line) implements Statement {

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitReturn(this);
		}
	}

	/**
	 * @param url page to open in a fresh tab, or {@code null} to follow a tab opened by the page
	 */
	record SwitchToNewTab(Expression url, int line) implements Statement {

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitSwitchToNewTab(this);
		}

		@Override
		public boolean changesTab() {
			return true;
		}
	}

	/**
	 * @param index 1-based tab position
	 */
	record SwitchToTab(Expression index, int line) implements Statement {

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitSwitchToTab(this);
		}

		@Override
		public boolean changesTab() {
			return true;
		}
	}

	record CloseTab(int line) implements Statement {

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitCloseTab(this);
		}

		@Override
		public boolean changesTab() {
			return true;
		}
	}

	/**
	 * Element lookups continue inside the iframe matched by {@code selector}, relative to the current frame.
	 */
	record SwitchToFrame(Selector selector, int line) implements Statement {

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitSwitchToFrame(this);
		}

		@Override
		public boolean changesFrame() {
			return true;
		}
	}

	record SwitchToMainFrame(int line) implements Statement {

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitSwitchToMainFrame(this);
		}

		@Override
		public boolean changesFrame() {
			return true;
		}
	}

	/**
	 * Arms a handler for the next dialog the page opens.
	 *
	 * @param response prompt text to answer with, or {@code null}
	 */
	record AcceptDialog(Expression response, int line) implements Statement {

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitAcceptDialog(this);
		}
	}

	record DismissDialog(int line) implements Statement {

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitDismissDialog(this);
		}
	}

	/**
	 * {@code attribute} is set only for {@link HasKind#ATTRIBUTE}.
	 */
	record VerifyHas(Target target, HasKind kind, Expression attribute, Expression value, int line)
			implements Statement {

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitVerifyHas(this);
		}
	}

	record Upload(List<Expression> files, Target target, int line) implements Statement {

		public Upload {
			files = List.copyOf(files);
		}

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitUpload(this);
		}
	}

	record ForEach(String item, Expression collection, List<Statement> statements, int line) implements Statement {

		public ForEach {
			statements = List.copyOf(statements);
		}

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitForEach(this);
		}

		@Override
		public List<List<Statement>> blocks() {
			return List.of(statements);
		}
	}

	/**
	 * Exactly one of {@code value} and {@code call} is set.
	 */
	record VariableDeclaration(VarType type, String name, Expression value, ActionCall call, int line)
			implements Statement {

		@Override
		public <R> R accept(StatementVisitor<R> visitor) {
			return visitor.visitVariableDeclaration(this);
		}
	}
}
