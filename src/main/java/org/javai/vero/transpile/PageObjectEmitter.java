package org.javai.vero.transpile;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import org.javai.vero.ast.ActionDefinition;
import org.javai.vero.ast.AstWalker;
import org.javai.vero.ast.Field;
import org.javai.vero.ast.Page;
import org.javai.vero.ast.PageActions;
import org.javai.vero.ast.Statement;
import org.javai.vero.ast.VarType;
import org.javai.vero.ast.Variable;
import org.javai.vero.validate.SymbolTable;

/**
 * Generates the page object class of a page and the class of a page-actions bundle.
 * <p>
 * Both kinds of class build their locators in {@code attach(page, root)}, so an instance can
 * follow a tab or frame change made inside one of its own actions. {@code root} is the page or the
 * frame that element lookups start from. Collaborators are created on first use and dropped on
 * every attach, which keeps mutually referencing pages from constructing each other forever.
 */
final class PageObjectEmitter {

	private final SymbolTable symbols;
	private final TranspilerOptions options;

	PageObjectEmitter(SymbolTable symbols, TranspilerOptions options) {
		this.symbols = symbols;
		this.options = options;
	}

	String emitPage(Page page) {
		List<String> collaborators = collaborators(page.name(), allStatements(page.actions()), null);

		CodeWriter body = new CodeWriter(1);
		body.line("page!: Page;");
		body.line("root!: Page | FrameLocator;");
		for (Field field : page.fields()) {
			body.line(field.name() + "!: Locator;");
		}
		writeCollaboratorFields(body, collaborators);
		for (Variable variable : page.variables()) {
			EmitContext context = EmitContext.pageObject(page, symbols, options, List.of());
			body.line(variable.name() + " = " + ExpressionRenderer.render(variable.value(), context) + ";");
		}
		body.blank();
		writeConstructorAndAttach(body, collaborators, attach -> {
			for (Field field : page.fields()) {
				attach.line("this." + field.name() + " = " + SelectorRenderer.render(field.selector(), "root") + ";");
			}
		});
		writeCollaboratorAccessors(body, collaborators);
		for (ActionDefinition action : page.actions()) {
			body.blank();
			EmitContext context = EmitContext.pageObject(page, symbols, options, action.parameters());
			writeAction(body, action, context);
		}

		String imports = imports(body.toString(), collaborators, "./", "../" + options.pageActionsDir() + "/");
		return imports + "\nexport class " + page.name() + " {\n" + body + "}\n";
	}

	String emitPageActions(PageActions bundle) {
		Page forPage = symbols.findPage(bundle.forPage()).orElse(null);
		List<String> collaborators = collaborators(bundle.name(), allStatements(bundle.actions()),
				forPage != null ? forPage.name() : null);

		CodeWriter body = new CodeWriter(1);
		body.line("page!: Page;");
		body.line("root!: Page | FrameLocator;");
		writeCollaboratorFields(body, collaborators);
		body.blank();
		writeConstructorAndAttach(body, collaborators, attach -> {
		});
		writeCollaboratorAccessors(body, collaborators);
		for (ActionDefinition action : bundle.actions()) {
			body.blank();
			EmitContext context = EmitContext.pageActions(forPage, bundle.name(), symbols, options,
					action.parameters());
			writeAction(body, action, context);
		}

		String imports = imports(body.toString(), collaborators, "../" + options.pageObjectDir() + "/", "./");
		return imports + "\nexport class " + bundle.name() + " {\n" + body + "}\n";
	}

	private void writeConstructorAndAttach(CodeWriter body, List<String> collaborators,
			Consumer<CodeWriter> locators) {
		body.open("constructor(page: Page, root: Page | FrameLocator = page) {");
		body.line("this.attach(page, root);");
		body.close("}");
		body.blank();
		body.open("attach(page: Page, root: Page | FrameLocator = page): void {");
		body.line("this.page = page;");
		body.line("this.root = root;");
		locators.accept(body);
		for (String collaborator : collaborators) {
			body.line("this." + backingField(collaborator) + " = undefined;");
		}
		body.close("}");
	}

	private static void writeCollaboratorFields(CodeWriter body, List<String> collaborators) {
		for (String collaborator : collaborators) {
			body.line("private " + backingField(collaborator) + "?: " + collaborator + ";");
		}
	}

	private static void writeCollaboratorAccessors(CodeWriter body, List<String> collaborators) {
		for (String collaborator : collaborators) {
			String field = "this." + backingField(collaborator);
			body.blank();
			body.open("get " + EmitContext.variableName(collaborator) + "(): " + collaborator + " {");
			body.open("if (!" + field + ") {");
			body.line(field + " = new " + collaborator + "(this.page, this.root);");
			body.close("}");
			body.line("return " + field + ";");
			body.close("}");
		}
	}

	private static String backingField(String collaborator) {
		return "_" + EmitContext.variableName(collaborator);
	}

	private void writeAction(CodeWriter body, ActionDefinition action, EmitContext context) {
		String parameters = action.parameters().stream()
				.map(p -> p + ": any")
				.collect(Collectors.joining(", "));
		context.reserveUserNames(AstWalker.localNames(action.statements()));
		body.open("async " + action.name() + "(" + parameters + "): Promise<" + tsType(action.returnType()) + "> {");
		new StatementEmitter(context, body).emit(action.statements());
		body.close("}");
	}

	/**
	 * Pages and page-actions bundles an owner's statements reach, {@code first} leading.
	 */
	private List<String> collaborators(String self, List<Statement> statements, String first) {
		Set<String> names = new LinkedHashSet<>();
		if (first != null) {
			names.add(first);
		}
		names.addAll(AstWalker.referencedOwners(statements));
		names.remove(self);
		return names.stream()
				.filter(n -> symbols.isPage(n) || symbols.isPageActions(n))
				.collect(Collectors.toList());
	}

	private String imports(String body, List<String> collaborators, String pagePath, String pageActionsPath) {
		List<String> playwright = new ArrayList<>();
		if (body.contains("expect(") || body.contains("expect.poll(")) {
			playwright.add("expect");
		}
		playwright.add("FrameLocator");
		playwright.add("Locator");
		playwright.add("Page");

		StringBuilder sb = new StringBuilder();
		sb.append("import { ").append(String.join(", ", playwright)).append(" } from '@playwright/test';\n");
		for (String collaborator : collaborators) {
			String path = symbols.isPageActions(collaborator) ? pageActionsPath : pagePath;
			sb.append("import { ").append(collaborator).append(" } from '").append(path).append(collaborator)
					.append("';\n");
		}
		return sb.toString();
	}

	private static List<Statement> allStatements(List<ActionDefinition> actions) {
		List<Statement> statements = new ArrayList<>();
		actions.forEach(a -> statements.addAll(a.statements()));
		return statements;
	}

	static String tsType(VarType type) {
		if (type == null) {
			return "void";
		}
		return switch (type) {
			case TEXT -> "string";
			case NUMBER -> "number";
			case FLAG -> "boolean";
			case LIST -> "string[]";
		};
	}
}
