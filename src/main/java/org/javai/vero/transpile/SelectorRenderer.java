package org.javai.vero.transpile;

import java.util.regex.Pattern;
import org.javai.vero.ast.Selector;

/**
 * Turns field selectors into Playwright locator expressions.
 * <p>
 * {@link Selector.SelectorType#AUTO} selectors that look like CSS or XPath become
 * {@code locator(...)}; anything else is treated as visible text.
 */
public final class SelectorRenderer {

	private static final String[] SELECTOR_PREFIXES = {"#", ".", "[", "//", "/html", "xpath=", "css="};
	private static final Pattern CSS_COMBINATOR = Pattern.compile("^[a-z.#\\[*][^\\s>+~]*\\s*[>+~]\\s*[a-z.#\\[*].*$");
	private static final Pattern TAG_WITH_QUALIFIER =
			Pattern.compile("^[a-z][a-z0-9-]*([.#][A-Za-z_-][\\w-]*|\\[[^\\]]+\\]|:[a-z-]+(\\([^)]*\\))?)+$");

	private SelectorRenderer() {
	}

	public static String render(Selector selector, String pageRef) {
		String value = ExpressionRenderer.jsString(selector.value());
		return switch (selector.type()) {
			case CSS -> pageRef + ".locator(" + value + ")";
			case XPATH -> pageRef + ".locator(" + ExpressionRenderer.jsString("xpath=" + selector.value()) + ")";
			case TESTID -> pageRef + ".getByTestId(" + value + ")";
			case AUTO -> looksLikeSelector(selector.value())
					? pageRef + ".locator(" + value + ")"
					: pageRef + ".getByText(" + value + ")";
		};
	}

	/**
	 * Selector string for {@code frameLocator}. An auto selector that is not CSS or XPath names the
	 * iframe by its {@code name} attribute.
	 */
	public static String frameSelector(Selector selector) {
		String value = selector.value();
		return switch (selector.type()) {
			case CSS -> value;
			case XPATH -> "xpath=" + value;
			case TESTID -> "[data-testid=" + attributeValue(value) + "]";
			case AUTO -> looksLikeSelector(value) ? value : "iframe[name=" + attributeValue(value) + "]";
		};
	}

	private static String attributeValue(String value) {
		return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
	}

	/**
	 * Whether an auto selector is CSS or XPath rather than visible text.
	 */
	public static boolean looksLikeSelector(String value) {
		String v = value.trim();
		if (v.isEmpty()) {
			return false;
		}
		for (String prefix : SELECTOR_PREFIXES) {
			if (v.startsWith(prefix)) {
				return true;
			}
		}
		return CSS_COMBINATOR.matcher(v).matches() || TAG_WITH_QUALIFIER.matcher(v).matches();
	}
}
