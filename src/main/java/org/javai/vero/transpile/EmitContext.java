package org.javai.vero.transpile;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.javai.vero.ast.Page;
import org.javai.vero.validate.ReservedNames;
import org.javai.vero.validate.SymbolTable;

/**
 * Where generated statements live and how they reach the browser page and page objects.
 */
final class EmitContext {

	enum Kind {
		/** Body of a test or hook; page objects are locals. */
		TEST,
		/** Method of a page object class. */
		PAGE_OBJECT,
		/** Method of a page-actions class. */
		PAGE_ACTIONS
	}

	private final Kind kind;
	private final Page ownPage;
	private final SymbolTable symbols;
	private final TranspilerOptions options;
	private final List<String> boundObjects;
	private final String owner;
	private final boolean frameAware;
	private final Set<String> locals = new HashSet<>();
	private final Set<String> userNames = new HashSet<>();
	private int loopDepth;

	private EmitContext(Kind kind, Page ownPage, String owner, SymbolTable symbols, TranspilerOptions options,
			List<String> boundObjects, boolean frameAware) {
		this.kind = kind;
		this.ownPage = ownPage;
		this.owner = owner;
		this.symbols = symbols;
		this.options = options;
		this.boundObjects = List.copyOf(boundObjects);
		this.frameAware = frameAware;
	}

	/**
	 * @param boundObjects page and page-actions names held as locals and rebound after tab changes
	 * @param frameAware whether the body tracks the current frame in a {@code root} local
	 */
	static EmitContext test(SymbolTable symbols, TranspilerOptions options, List<String> boundObjects,
			boolean frameAware) {
		return new EmitContext(Kind.TEST, null, null, symbols, options, boundObjects, frameAware);
	}

	static EmitContext test(SymbolTable symbols, TranspilerOptions options, List<String> boundObjects) {
		return test(symbols, options, boundObjects, false);
	}

	static EmitContext pageObject(Page page, SymbolTable symbols, TranspilerOptions options, List<String> parameters) {
		EmitContext context = new EmitContext(Kind.PAGE_OBJECT, page, page.name(), symbols, options, List.of(),
				true);
		context.locals.addAll(parameters);
		context.userNames.addAll(parameters);
		return context;
	}

	static EmitContext pageActions(Page forPage, String bundle, SymbolTable symbols, TranspilerOptions options,
			List<String> parameters) {
		EmitContext context = new EmitContext(Kind.PAGE_ACTIONS, forPage, bundle, symbols, options, List.of(),
				true);
		context.locals.addAll(parameters);
		context.userNames.addAll(parameters);
		return context;
	}

	/**
	 * Local variable name of a page object, e.g. {@code homePage} for {@code HomePage}.
	 */
	static String variableName(String typeName) {
		return ReservedNames.objectVariable(typeName);
	}

	Kind kind() {
		return kind;
	}

	boolean usesSteps() {
		return kind == Kind.TEST;
	}

	SymbolTable symbols() {
		return symbols;
	}

	TranspilerOptions options() {
		return options;
	}

	Page ownPage() {
		return ownPage;
	}

	List<String> boundObjects() {
		return boundObjects;
	}

	/**
	 * Page or page-actions name that unqualified calls resolve against, or {@code null} in tests.
	 */
	String owner() {
		return owner;
	}

	boolean frameAware() {
		return frameAware;
	}

	/**
	 * Names the Vero source uses as locals; loop counters avoid them.
	 */
	void reserveUserNames(Set<String> names) {
		userNames.addAll(names);
	}

	/**
	 * Expression holding the current browser page.
	 */
	String pageRef() {
		return kind == Kind.TEST ? "page" : "this.page";
	}

	/**
	 * Expression element lookups start from: the current frame, or the page outside frames.
	 */
	String rootRef() {
		if (kind != Kind.TEST) {
			return "this.root";
		}
		return frameAware ? "root" : "page";
	}

	/**
	 * Expression holding the page object or page-actions instance named {@code name}.
	 */
	String objectRef(String name) {
		return switch (kind) {
			case TEST -> variableName(name);
			case PAGE_OBJECT -> name.equals(ownPage.name()) ? "this" : "this." + variableName(name);
			case PAGE_ACTIONS -> "this." + variableName(name);
		};
	}

	void declareLocal(String name) {
		locals.add(name);
	}

	void forgetLocal(String name) {
		locals.remove(name);
	}

	boolean isLocal(String name) {
		return locals.contains(name);
	}

	boolean isOwnField(String name) {
		return ownPage != null && !isLocal(name) && ownPage.findField(name).isPresent();
	}

	boolean isOwnVariable(String name) {
		return ownPage != null && !isLocal(name)
				&& ownPage.variables().stream().anyMatch(v -> v.name().equals(name));
	}

	/**
	 * Counter name for a {@code repeat} loop at the current nesting depth: i, j, k, then i3, i4, ...
	 * A name the source already uses is skipped in favour of the next free depth name.
	 */
	String enterLoop() {
		int depth = loopDepth++;
		String name = counterName(depth);
		for (int next = depth + 1; userNames.contains(name); next++) {
			name = counterName(next);
		}
		return name;
	}

	private static String counterName(int depth) {
		return depth < 3 ? String.valueOf((char) ('i' + depth)) : "i" + depth;
	}

	void exitLoop() {
		loopDepth--;
	}

	/**
	 * Writes the code that makes {@code newPageExpr} the current page and rebinds every page object.
	 * A new tab always starts in its main frame.
	 */
	void writeRebind(CodeWriter out, String newPageExpr) {
		if (kind != Kind.TEST) {
			out.line("this.attach(" + newPageExpr + ");");
			return;
		}
		out.line("page = " + newPageExpr + ";");
		if (frameAware) {
			out.line("root = page;");
		}
		rebindObjects(out);
	}

	/**
	 * Makes {@code rootExpr} the frame element lookups start from, on the current page.
	 */
	void writeFrameRebind(CodeWriter out, String rootExpr) {
		if (kind != Kind.TEST) {
			out.line("this.attach(this.page" + (rootExpr.equals("this.page") ? "" : ", " + rootExpr) + ");");
			return;
		}
		out.line("root = " + rootExpr + ";");
		rebindObjects(out);
	}

	/**
	 * Follows the page and frame an object moved to inside one of its actions.
	 */
	void writeAdopt(CodeWriter out, String objectExpr) {
		if (kind != Kind.TEST) {
			out.line("this.attach(" + objectExpr + ".page, " + objectExpr + ".root);");
			return;
		}
		out.line("page = " + objectExpr + ".page;");
		if (frameAware) {
			out.line("root = " + objectExpr + ".root;");
		}
		rebindObjects(out);
	}

	private void rebindObjects(CodeWriter out) {
		for (String name : boundObjects) {
			out.line(variableName(name) + " = " + construct(name) + ";");
		}
	}

	/**
	 * Constructor call binding a page object to the current page (and frame, when tracked).
	 */
	String construct(String name) {
		return "new " + name + (frameAware && kind == Kind.TEST ? "(page, root)" : "(page)");
	}
}
