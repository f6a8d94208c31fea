package org.javai.vero.transpile;

import java.util.regex.Pattern;
import org.javai.vero.ast.Scenario;

/**
 * Naming convention of generated tests: the scenario name followed by {@code " @tag"} for each tag.
 * Report tooling relies on it to recover scenario names, so it must not change.
 */
public final class ScenarioTitles {

	private static final Pattern TRAILING_TAG = Pattern.compile("\\s+@[A-Za-z_][A-Za-z0-9_]*\\s*$");

	private ScenarioTitles() {
	}

	public static String testTitle(Scenario scenario) {
		StringBuilder title = new StringBuilder(scenario.name());
		for (String tag : scenario.tags()) {
			title.append(" @").append(tag);
		}
		return title.toString();
	}

	/**
	 * Recovers the scenario name from a generated test title by dropping the trailing tags.
	 */
	public static String scenarioName(String testTitle) {
		String name = testTitle;
		String stripped = TRAILING_TAG.matcher(name).replaceFirst("");
		while (!stripped.equals(name)) {
			name = stripped;
			stripped = TRAILING_TAG.matcher(name).replaceFirst("");
		}
		return name.trim();
	}
}
