package org.javai.vero.config;

import java.util.Objects;
import org.javai.vero.transpile.TranspilerOptions;
import org.javai.vero.validate.SuggestionEngine;

/**
 * Immutable toolchain configuration, normally read from {@code vero.yml} by {@link VeroConfigLoader}.
 */
public record VeroConfig(TranspilerOptions transpiler, int maxSuggestions, int maxSuggestionDistance) {

	public VeroConfig {
		Objects.requireNonNull(transpiler, "transpiler must not be null");
	}

	public static VeroConfig defaults() {
		return new VeroConfig(TranspilerOptions.defaults(), SuggestionEngine.DEFAULT_MAX_SUGGESTIONS,
				SuggestionEngine.DEFAULT_MAX_DISTANCE);
	}

	public SuggestionEngine suggestionEngine() {
		return new SuggestionEngine(maxSuggestions, maxSuggestionDistance);
	}
}
