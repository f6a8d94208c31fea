package org.javai.vero.ast;

import java.util.List;
import java.util.Optional;

/**
 * Root of a parsed Vero source unit.
 */
public record Program(List<Page> pages, List<PageActions> pageActions, List<Feature> features,
		List<Fixture> fixtures) {

	public Program {
		pages = List.copyOf(pages);
		pageActions = List.copyOf(pageActions);
		features = List.copyOf(features);
		fixtures = List.copyOf(fixtures);
	}

	public static Program empty() {
		return new Program(List.of(), List.of(), List.of(), List.of());
	}

	public Optional<Page> findPage(String name) {
		return pages.stream().filter(p -> p.name().equals(name)).findFirst();
	}

	public Optional<Feature> findFeature(String name) {
		return features.stream().filter(f -> f.name().equals(name)).findFirst();
	}
}
