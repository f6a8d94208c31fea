package org.javai.vero.transpile;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashSet;
import java.util.List;
import org.javai.vero.ast.Scenario;
import org.junit.jupiter.api.Test;

class ScenarioTitlesTest {

	@Test
	void appendsTagsInDeclarationOrder() {
		Scenario scenario = new Scenario("Checkout works", List.of(), new LinkedHashSet<>(List.of("smoke", "cart")),
				List.of(), 1);

		assertThat(ScenarioTitles.testTitle(scenario)).isEqualTo("Checkout works @smoke @cart");
	}

	@Test
	void untaggedTitleIsTheName() {
		Scenario scenario = new Scenario("Plain", List.of(), new LinkedHashSet<>(), List.of(), 1);

		assertThat(ScenarioTitles.testTitle(scenario)).isEqualTo("Plain");
	}

	@Test
	void recoversScenarioNameFromTitle() {
		assertThat(ScenarioTitles.scenarioName("Checkout works @smoke @cart")).isEqualTo("Checkout works");
		assertThat(ScenarioTitles.scenarioName("Plain")).isEqualTo("Plain");
		assertThat(ScenarioTitles.scenarioName("Email me@home")).isEqualTo("Email me@home");
	}
}
