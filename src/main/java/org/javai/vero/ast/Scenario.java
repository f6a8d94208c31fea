package org.javai.vero.ast;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * One executable test case. Tags keep their declaration order.
 */
public record Scenario(String name, List<Annotation> annotations, Set<String> tags, List<Statement> statements,
		int line) {

	public Scenario {
		annotations = List.copyOf(annotations);
		tags = Collections.unmodifiableSet(new LinkedHashSet<>(tags));
		statements = List.copyOf(statements);
	}

	public boolean hasAnnotation(Annotation annotation) {
		return annotations.contains(annotation);
	}

	public enum Annotation {
		SKIP,
		ONLY,
		SLOW,
		FIXME;

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
