package org.javai.vero.validate;

import java.util.Locale;
import java.util.Set;

/**
 * Identifiers the generated TypeScript binds itself. Vero variables, parameters and loop items
 * become TypeScript locals, so they must stay clear of these.
 */
public final class ReservedNames {

	/**
	 * Bindings of the generated test and hook functions, plus the constants of lowered tab and
	 * dialog operations.
	 */
	private static final Set<String> GENERATED = Set.of(
			"page", "root", "context", "browser", "test", "expect", "testInfo", "dialog", "screenshot",
			"previousPage", "tabContext", "newTabTimeoutMs", "deadline", "settled", "openerScan", "pageEvent",
			"newPage", "requestedTab", "switchTabTimeoutMs", "openTabs", "targetPage", "closingPage",
			"tabsBeforeClose", "closingIndex", "remainingTabs", "fallbackIndex", "fallbackPage");

	private static final Set<String> TYPESCRIPT = Set.of(
			"arguments", "await", "break", "case", "catch", "class", "const", "continue", "debugger", "default",
			"delete", "enum", "eval", "export", "extends", "finally", "function", "implements", "import",
			"instanceof", "interface", "let", "new", "package", "private", "protected", "public", "static",
			"super", "this", "throw", "try", "typeof", "undefined", "var", "void", "while", "yield");

	/**
	 * Members every generated page object and page-actions class declares.
	 */
	private static final Set<String> CLASS_MEMBERS = Set.of("page", "root", "attach", "constructor");

	private static final Set<String> OBJECT_SUFFIXED = Set.of("page", "context", "browser", "test", "expect",
			"testInfo", "root");

	private ReservedNames() {
	}

	/**
	 * Whether a local name would collide with generated code or is not a legal TypeScript binding.
	 */
	public static boolean isReservedLocal(String name) {
		return GENERATED.contains(name) || TYPESCRIPT.contains(name);
	}

	public static boolean isReservedMember(String name) {
		return CLASS_MEMBERS.contains(name);
	}

	/**
	 * Local variable (and accessor) name of a page object or page-actions instance, e.g.
	 * {@code homePage} for {@code HomePage}.
	 */
	public static String objectVariable(String typeName) {
		String name = typeName.substring(0, 1).toLowerCase(Locale.ROOT) + typeName.substring(1);
		return OBJECT_SUFFIXED.contains(name) || TYPESCRIPT.contains(name) ? name + "Object" : name;
	}
}
