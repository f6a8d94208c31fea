package org.javai.vero.transpile;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.javai.vero.ast.AstWalker;
import org.javai.vero.ast.Feature;
import org.javai.vero.ast.Fixture;
import org.javai.vero.ast.Hook;
import org.javai.vero.ast.Page;
import org.javai.vero.ast.PageActions;
import org.javai.vero.ast.Program;
import org.javai.vero.ast.Scenario;
import org.javai.vero.ast.Statement;
import org.javai.vero.validate.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lowers a validated program to Playwright TypeScript: one test file per feature, one class per
 * page and per page-actions bundle.
 * <p>
 * The program must have passed validation; the transpiler does not re-check references.
 */
public class Transpiler {

	private static final Logger logger = LoggerFactory.getLogger(Transpiler.class);

	private final TranspilerOptions options;

	public Transpiler() {
		this(TranspilerOptions.defaults());
	}

	public Transpiler(TranspilerOptions options) {
		this.options = Objects.requireNonNull(options, "options must not be null");
	}

	public TranspileResult transpile(Program program) {
		Objects.requireNonNull(program, "program must not be null");
		return transpile(program, SymbolTable.from(program));
	}

	/**
	 * Transpiles with the symbol table produced by validation.
	 */
	public TranspileResult transpile(Program program, SymbolTable symbols) {
		Objects.requireNonNull(program, "program must not be null");
		Objects.requireNonNull(symbols, "symbols must not be null");
		PageObjectEmitter pageObjects = new PageObjectEmitter(symbols, options);

		Map<String, String> pages = new LinkedHashMap<>();
		for (Page page : program.pages()) {
			pages.put(page.name(), pageObjects.emitPage(page));
			logger.debug("Generated page object {}", page.name());
		}
		Map<String, String> pageActions = new LinkedHashMap<>();
		for (PageActions bundle : program.pageActions()) {
			pageActions.put(bundle.name(), pageObjects.emitPageActions(bundle));
			logger.debug("Generated page actions {}", bundle.name());
		}
		Map<String, String> tests = new LinkedHashMap<>();
		for (Feature feature : program.features()) {
			tests.put(feature.name(), emitFeature(feature, symbols));
			logger.debug("Generated test file for feature {} ({} scenario(s))", feature.name(),
					feature.scenarios().size());
		}
		return new TranspileResult(pages, pageActions, tests);
	}

	private String emitFeature(Feature feature, SymbolTable symbols) {
		List<Fixture> fixtures = feature.uses().stream()
				.map(use -> symbols.findFixture(use.name()).orElse(null))
				.filter(Objects::nonNull)
				.collect(Collectors.toList());
		List<String> usedObjects = feature.uses().stream()
				.map(Feature.Use::name)
				.filter(name -> symbols.isPage(name) || symbols.isPageActions(name))
				.collect(Collectors.toList());
		CodeWriter out = new CodeWriter();
		Set<String> imported = new LinkedHashSet<>(usedObjects);
		out.open("test.describe" + describeModifier(feature) + "(" + ExpressionRenderer.jsString(feature.name())
				+ ", () => {");
		if (feature.hasAnnotation(Feature.Annotation.SERIAL)) {
			out.line("test.describe.configure({ mode: 'serial' });");
			out.blank();
		}

		for (Hook hook : feature.hooks()) {
			if (hook.type() == Hook.HookType.BEFORE_ALL) {
				emitSuiteHook(out, "beforeAll", hook.statements(), usedObjects, symbols, imported);
			}
		}
		for (Fixture fixture : fixtures) {
			if (!fixture.setup().isEmpty()) {
				emitEachHook(out, "beforeEach", fixture.setup(), usedObjects, symbols, imported);
			}
		}
		for (Hook hook : feature.hooks()) {
			if (hook.type() == Hook.HookType.BEFORE_EACH) {
				emitEachHook(out, "beforeEach", hook.statements(), usedObjects, symbols, imported);
			}
		}
		for (Hook hook : feature.hooks()) {
			if (hook.type() == Hook.HookType.AFTER_EACH) {
				emitEachHook(out, "afterEach", hook.statements(), usedObjects, symbols, imported);
			}
		}
		for (Fixture fixture : fixtures) {
			if (!fixture.teardown().isEmpty()) {
				emitEachHook(out, "afterEach", fixture.teardown(), usedObjects, symbols, imported);
			}
		}
		for (Hook hook : feature.hooks()) {
			if (hook.type() == Hook.HookType.AFTER_ALL) {
				emitSuiteHook(out, "afterAll", hook.statements(), usedObjects, symbols, imported);
			}
		}

		for (Scenario scenario : feature.scenarios()) {
			emitScenario(out, scenario, usedObjects, symbols, imported);
		}
		out.close("});");

		String body = trimTrailingBlank(out.toString());
		return header(imported, symbols, body.contains("FrameLocator")) + "\n" + body;
	}

	private void emitScenario(CodeWriter out, Scenario scenario, List<String> usedObjects, SymbolTable symbols,
			Set<String> imported) {
		out.open("test" + testModifier(scenario) + "(" + ExpressionRenderer.jsString(ScenarioTitles.testTitle(scenario))
				+ ", async ({ page }, testInfo) => {");
		if (scenario.hasAnnotation(Scenario.Annotation.SLOW)) {
			out.line("test.slow();");
		}
		EmitContext context = bodyContext(scenario.statements(), usedObjects, symbols, imported);
		declareObjects(out, context);
		new StatementEmitter(context, out).emit(scenario.statements());
		if (options.evidenceScreenshot()) {
			out.open("await test.step('Capture Evidence Screenshot', async () => {");
			out.line("const screenshot = await page.screenshot({ fullPage: true });");
			out.line("await testInfo.attach('evidence-screenshot.png', { body: screenshot, contentType: 'image/png' });");
			out.close("});");
		}
		out.close("});");
		out.blank();
	}

	private void emitEachHook(CodeWriter out, String hookName, List<Statement> statements, List<String> usedObjects,
			SymbolTable symbols, Set<String> imported) {
		out.open("test." + hookName + "(async ({ page }) => {");
		EmitContext context = bodyContext(statements, usedObjects, symbols, imported);
		declareObjects(out, context);
		new StatementEmitter(context, out).emit(statements);
		out.close("});");
		out.blank();
	}

	/**
	 * Suite-level hooks get no test page, so they open their own context and page.
	 */
	private void emitSuiteHook(CodeWriter out, String hookName, List<Statement> statements, List<String> usedObjects,
			SymbolTable symbols, Set<String> imported) {
		out.open("test." + hookName + "(async ({ browser }) => {");
		out.line("const context = await browser.newContext();");
		out.line("let page = await context.newPage();");
		out.open("try {");
		EmitContext context = bodyContext(statements, usedObjects, symbols, imported);
		declareObjects(out, context);
		new StatementEmitter(context, out).emit(statements);
		out.next("} finally {");
		out.line("await context.close();");
		out.close("}");
		out.close("});");
		out.blank();
	}

	private EmitContext bodyContext(List<Statement> statements, List<String> usedObjects, SymbolTable symbols,
			Set<String> imported) {
		Set<String> bound = new LinkedHashSet<>(usedObjects);
		for (String owner : AstWalker.referencedOwners(statements)) {
			if (symbols.isPage(owner) || symbols.isPageActions(owner)) {
				bound.add(owner);
			}
		}
		imported.addAll(bound);
		EmitContext context = EmitContext.test(symbols, options, new ArrayList<>(bound),
				symbols.reachesFrameChange(statements, null));
		context.reserveUserNames(AstWalker.localNames(statements));
		return context;
	}

	private static void declareObjects(CodeWriter out, EmitContext context) {
		if (context.frameAware()) {
			out.line("let root: Page | FrameLocator = page;");
		}
		for (String name : context.boundObjects()) {
			out.line("let " + EmitContext.variableName(name) + " = " + context.construct(name) + ";");
		}
	}

	private String header(Set<String> imported, SymbolTable symbols, boolean usesFrames) {
		StringBuilder sb = new StringBuilder(usesFrames
				? "import { test, expect, FrameLocator, Page } from '@playwright/test';\n"
				: "import { test, expect, Page } from '@playwright/test';\n");
		for (String name : imported) {
			String dir = symbols.isPageActions(name) ? options.pageActionsDir() : options.pageObjectDir();
			sb.append("import { ").append(name).append(" } from '../").append(dir).append('/').append(name)
					.append("';\n");
		}
		return sb.toString();
	}

	private static String describeModifier(Feature feature) {
		if (feature.hasAnnotation(Feature.Annotation.SKIP)) {
			return ".skip";
		}
		if (feature.hasAnnotation(Feature.Annotation.ONLY)) {
			return ".only";
		}
		return "";
	}

	private static String testModifier(Scenario scenario) {
		if (scenario.hasAnnotation(Scenario.Annotation.FIXME)) {
			return ".fixme";
		}
		if (scenario.hasAnnotation(Scenario.Annotation.SKIP)) {
			return ".skip";
		}
		if (scenario.hasAnnotation(Scenario.Annotation.ONLY)) {
			return ".only";
		}
		return "";
	}

	private static String trimTrailingBlank(String code) {
		return code.replace("\n\n});\n", "\n});\n");
	}

	public TranspilerOptions getOptions() {
		return options;
	}
}
