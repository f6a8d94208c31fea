package org.javai.vero.transpile;

import org.javai.vero.ast.Expression;
import org.javai.vero.ast.Statement;

/**
 * Lowers the tab-changing statements. Every operation ends by bringing the new current page to
 * the front, waiting for {@code domcontentloaded} and rebinding all page objects to it.
 * <p>
 * Runtime failures are thrown as {@code Error}s naming the operation and the quantities involved.
 * A timeout is terminal: nothing is retried.
 */
final class TabOperationEmitter {

	private final EmitContext context;

	TabOperationEmitter(EmitContext context) {
		this.context = context;
	}

	/**
	 * Without a URL: races a scan of the context's open pages for one opened by the current page
	 * against the context's {@code page} event, bounded by the new-tab timeout. With a URL the tab is
	 * created explicitly, so no race is needed.
	 */
	void switchToNewTab(Statement.SwitchToNewTab statement, CodeWriter out) {
		if (statement.url() != null) {
			openExplicitTab(statement.url(), out);
			return;
		}
		long timeoutMs = context.options().newTabTimeoutMs();
		String timeoutError = "`SWITCH TO NEW TAB timed out after ${newTabTimeoutMs}ms: no new tab was opened`";

		out.line("const previousPage = " + context.pageRef() + ";");
		out.line("const tabContext = previousPage.context();");
		out.line("const newTabTimeoutMs = " + timeoutMs + ";");
		out.line("const deadline = Date.now() + newTabTimeoutMs;");
		out.line("let settled = false;");
		out.open("const openerScan = (async (): Promise<Page> => {");
		out.open("while (!settled && Date.now() < deadline) {");
		out.open("for (const candidate of tabContext.pages()) {");
		out.open("if (candidate !== previousPage && (await candidate.opener()) === previousPage) {");
		out.line("return candidate;");
		out.close("}");
		out.close("}");
		out.line("await new Promise((resolve) => setTimeout(resolve, " + context.options().tabPollIntervalMs() + "));");
		out.close("}");
		out.line("throw new Error(" + timeoutError + ");");
		out.close("})();");
		out.open("const pageEvent = tabContext.waitForEvent('page', {");
		out.line("predicate: (candidate) => candidate !== previousPage,");
		out.line("timeout: newTabTimeoutMs,");
		out.open("}).catch(() => {");
		out.line("throw new Error(" + timeoutError + ");");
		out.close("});");
		out.line("openerScan.catch(() => undefined);");
		out.line("pageEvent.catch(() => undefined);");
		out.line("let newPage: Page;");
		out.open("try {");
		out.line("newPage = await Promise.race([openerScan, pageEvent]);");
		out.next("} finally {");
		out.line("settled = true;");
		out.close("}");
		activate("newPage", out);
	}

	/**
	 * {@code open <url> in new tab}.
	 */
	void openInNewTab(Statement.OpenInNewTab statement, CodeWriter out) {
		openExplicitTab(statement.url(), out);
	}

	private void openExplicitTab(Expression url, CodeWriter out) {
		out.line("const newPage = await " + context.pageRef() + ".context().newPage();");
		out.line("await newPage.goto(" + ExpressionRenderer.renderText(url, context) + ");");
		activate("newPage", out);
	}

	/**
	 * Tab indices are 1-based. A literal index is checked here; a variable index is checked by the
	 * generated code. The generated code polls the open pages until the index exists or the
	 * switch-tab timeout elapses.
	 *
	 * @throws VeroTranspileException for a literal index that is not a positive integer
	 */
	void switchToTab(Statement.SwitchToTab statement, CodeWriter out) {
		Expression index = statement.index();
		long timeoutMs = context.options().switchTabTimeoutMs();
		if (index instanceof Expression.VariableReference) {
			out.line("const requestedTab = Number(" + ExpressionRenderer.render(index, context) + ");");
			out.open("if (!Number.isInteger(requestedTab) || requestedTab < 1) {");
			out.line("throw new Error(`SWITCH TO TAB requires a positive integer index but got ${requestedTab}`);");
			out.close("}");
		} else {
			if (!(index instanceof Expression.NumberLiteral number) || !number.isPositiveInteger()) {
				throw new VeroTranspileException("SWITCH TO TAB requires a positive integer index but got "
						+ ExpressionRenderer.describe(index), statement.line());
			}
			out.line("const requestedTab = " + number.value().stripTrailingZeros().toPlainString() + ";");
		}
		out.line("const tabContext = " + context.pageRef() + ".context();");
		out.line("const switchTabTimeoutMs = " + timeoutMs + ";");
		out.line("const deadline = Date.now() + switchTabTimeoutMs;");
		out.open("while (tabContext.pages().length < requestedTab && Date.now() < deadline) {");
		out.line("await new Promise((resolve) => setTimeout(resolve, " + context.options().tabPollIntervalMs() + "));");
		out.close("}");
		out.line("const openTabs = tabContext.pages();");
		out.open("if (openTabs.length < requestedTab) {");
		out.line("throw new Error(`SWITCH TO TAB timed out after ${switchTabTimeoutMs}ms: "
				+ "requested tab ${requestedTab} but only ${openTabs.length} available`);");
		out.close("}");
		out.line("const targetPage = openTabs[requestedTab - 1];");
		activate("targetPage", out);
	}

	/**
	 * Closes the current page and falls back to the page now at the closed page's position, or to
	 * the new last page when the closed page was last.
	 */
	void closeTab(Statement.CloseTab statement, CodeWriter out) {
		out.line("const closingPage = " + context.pageRef() + ";");
		out.line("const tabContext = closingPage.context();");
		out.line("const tabsBeforeClose = tabContext.pages();");
		out.line("const closingIndex = tabsBeforeClose.indexOf(closingPage);");
		out.line("await closingPage.close();");
		out.line("const remainingTabs = tabContext.pages();");
		out.open("if (remainingTabs.length === 0) {");
		out.line("throw new Error(`CLOSE TAB failed: no tabs remain open (closed tab ${closingIndex + 1} of "
				+ "${tabsBeforeClose.length})`);");
		out.close("}");
		out.line("const fallbackIndex = closingIndex >= remainingTabs.length");
		out.line("  ? remainingTabs.length - 1");
		out.line("  : Math.max(0, closingIndex);");
		out.line("const fallbackPage = remainingTabs[fallbackIndex];");
		activate("fallbackPage", out);
	}

	private void activate(String pageVariable, CodeWriter out) {
		out.line("await " + pageVariable + ".bringToFront();");
		out.line("await " + pageVariable + ".waitForLoadState('domcontentloaded');");
		context.writeRebind(out, pageVariable);
	}
}
