package org.javai.vero.validate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import org.apache.commons.lang3.StringUtils;

/**
 * "Did you mean" ranking of candidate names against a name that failed to resolve.
 * <p>
 * A candidate qualifies when its case-insensitive edit distance to the name is at most
 * {@code maxDistance}, or when either name contains the other. Qualifying candidates are
 * returned nearest first, ties in alphabetical order, at most {@code maxSuggestions} of them.
 */
public final class SuggestionEngine {

	public static final int DEFAULT_MAX_SUGGESTIONS = 3;
	public static final int DEFAULT_MAX_DISTANCE = 2;

	private final int maxSuggestions;
	private final int maxDistance;

	public SuggestionEngine() {
		this(DEFAULT_MAX_SUGGESTIONS, DEFAULT_MAX_DISTANCE);
	}

	public SuggestionEngine(int maxSuggestions, int maxDistance) {
		if (maxSuggestions < 0) {
			throw new IllegalArgumentException("maxSuggestions must not be negative");
		}
		if (maxDistance < 0) {
			throw new IllegalArgumentException("maxDistance must not be negative");
		}
		this.maxSuggestions = maxSuggestions;
		this.maxDistance = maxDistance;
	}

	public List<String> suggest(String name, Collection<String> candidates) {
		if (StringUtils.isEmpty(name) || candidates == null || candidates.isEmpty()) {
			return List.of();
		}
		String needle = name.toLowerCase(Locale.ROOT);
		List<Ranked> ranked = new ArrayList<>();
		for (String candidate : new LinkedHashSet<>(candidates)) {
			if (StringUtils.isEmpty(candidate) || candidate.equals(name)) {
				continue;
			}
			String hay = candidate.toLowerCase(Locale.ROOT);
			int distance = editDistance(needle, hay);
			if (distance <= maxDistance || hay.contains(needle) || needle.contains(hay)) {
				ranked.add(new Ranked(candidate, distance));
			}
		}
		return ranked.stream()
				.sorted(Comparator.comparingInt(Ranked::distance).thenComparing(Ranked::name))
				.limit(maxSuggestions)
				.map(Ranked::name)
				.collect(Collectors.toList());
	}

	public int maxSuggestions() {
		return maxSuggestions;
	}

	public int maxDistance() {
		return maxDistance;
	}

	static int editDistance(String a, String b) {
		int[] previous = new int[b.length() + 1];
		int[] current = new int[b.length() + 1];
		for (int j = 0; j <= b.length(); j++) {
			previous[j] = j;
		}
		for (int i = 1; i <= a.length(); i++) {
			current[0] = i;
			for (int j = 1; j <= b.length(); j++) {
				int substitution = previous[j - 1] + (a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1);
				current[j] = Math.min(substitution, Math.min(previous[j], current[j - 1]) + 1);
			}
			int[] swap = previous;
			previous = current;
			current = swap;
		}
		return previous[b.length()];
	}

	private record Ranked(String name, int distance) {
	}
}
