package org.javai.vero.ast;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * A named group of hooks and scenarios. {@code uses} holds the optional explicit USE list.
 */
public record Feature(String name, List<Annotation> annotations, List<Use> uses, List<Hook> hooks,
		List<Scenario> scenarios, int line) {

	public Feature {
		annotations = List.copyOf(annotations);
		uses = List.copyOf(uses);
		hooks = List.copyOf(hooks);
		scenarios = List.copyOf(scenarios);
	}

	public boolean hasAnnotation(Annotation annotation) {
		return annotations.contains(annotation);
	}

	public record Use(String name, int line) {
	}

	public enum Annotation {
		SERIAL,
		SKIP,
		ONLY;

		public static Optional<Annotation> fromKeyword(String word) {
			for (Annotation annotation : values()) {
				if (annotation.keyword().equals(word.toLowerCase(Locale.ROOT))) {
					return Optional.of(annotation);
				}
			}
			return Optional.empty();
		}

		public String keyword() {
			return name().toLowerCase(Locale.ROOT);
		}
	}
}
