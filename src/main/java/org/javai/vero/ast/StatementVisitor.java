package org.javai.vero.ast;

/**
 * Visitor over every {@link Statement} variant.
 *
 * @param <R> the return type of the visitor operations
 */
public interface StatementVisitor<R> {

	R visitClick(Statement.Click click);

	R visitFill(Statement.Fill fill);

	R visitOpen(Statement.Open open);

	R visitOpenInNewTab(Statement.OpenInNewTab open);

	R visitCheck(Statement.Check check);

	R visitUncheck(Statement.Uncheck uncheck);

	R visitSelect(Statement.Select select);

	R visitHover(Statement.Hover hover);

	R visitPress(Statement.Press press);

	R visitScroll(Statement.Scroll scroll);

	R visitWait(Statement.Wait wait);

	R visitWaitFor(Statement.WaitFor waitFor);

	R visitPerform(Statement.Perform perform);

	R visitRefresh(Statement.Refresh refresh);

	R visitClear(Statement.Clear clear);

	R visitTakeScreenshot(Statement.TakeScreenshot screenshot);

	R visitLog(Statement.Log log);

	R visitIf(Statement.If ifStatement);

	R visitRepeat(Statement.Repeat repeat);

	R visitVerify(Statement.Verify verify);

	R visitVerifyUrl(Statement.VerifyUrl verifyUrl);

	R visitVerifyTitle(Statement.VerifyTitle verifyTitle);

	R visitReturn(Statement.Return returnStatement);

	R visitSwitchToNewTab(Statement.SwitchToNewTab switchToNewTab);

	R visitSwitchToTab(Statement.SwitchToTab switchToTab);

	R visitCloseTab(Statement.CloseTab closeTab);

	R visitSwitchToFrame(Statement.SwitchToFrame switchToFrame);

	R visitSwitchToMainFrame(Statement.SwitchToMainFrame switchToMainFrame);

	R visitAcceptDialog(Statement.AcceptDialog acceptDialog);

	R visitDismissDialog(Statement.DismissDialog dismissDialog);

	R visitVerifyHas(Statement.VerifyHas verifyHas);

	R visitUpload(Statement.Upload upload);

	R visitForEach(Statement.ForEach forEach);

	R visitVariableDeclaration(Statement.VariableDeclaration declaration);
}
