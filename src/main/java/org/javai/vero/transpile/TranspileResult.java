package org.javai.vero.transpile;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Generated TypeScript sources keyed by declaration name, in declaration order.
 *
 * @param pages page object class per page
 * @param pageActions class per page-actions bundle
 * @param tests one test file per feature
 */
public record TranspileResult(Map<String, String> pages, Map<String, String> pageActions, Map<String, String> tests) {

	public TranspileResult {
		pages = Collections.unmodifiableMap(new LinkedHashMap<>(pages));
		pageActions = Collections.unmodifiableMap(new LinkedHashMap<>(pageActions));
		tests = Collections.unmodifiableMap(new LinkedHashMap<>(tests));
	}

	public int unitCount() {
		return pages.size() + pageActions.size() + tests.size();
	}
}
