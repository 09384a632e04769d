package io.evitadb.docast.security;

import javax.annotation.Nonnull;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Screens user supplied regular expressions before they are compiled and applied to document
 * text. The check is heuristic: it rejects over-long patterns and the constructs that are known to
 * cause exponential backtracking, such as a quantified group whose body is itself quantified.
 */
public final class RegexSafety {

	/**
	 * Longest accepted pattern.
	 */
	public static final int MAX_PATTERN_LENGTH = 1000;

	// (a+)+, (a*)*, (.*)*, (\w+\s?)+, (a{1,5})+
	private static final Pattern NESTED_QUANTIFIER = Pattern.compile("\\([^()]*(?:[+*]|\\{\\d+,\\d*})[^()]*\\)\\s*(?:[+*]|\\{\\d+,\\d*})");

	private static final Pattern QUANTIFIED_ALTERNATION = Pattern.compile("\\(([^()]*\\|[^()]*)\\)\\s*(?:[+*]|\\{\\d+,\\d*})");

	private RegexSafety() {
	}

	/**
	 * Validates the pattern and compiles it.
	 *
	 * @param pattern regular expression supplied by a user
	 * @return compiled pattern
	 * @throws UnsafePatternException   when the pattern is too long or may backtrack catastrophically
	 * @throws IllegalArgumentException when the pattern is not a valid regular expression
	 */
	@Nonnull
	public static Pattern compile(@Nonnull String pattern) {
		return compile(pattern, 0);
	}

	/**
	 * Validates the pattern and compiles it with the given flags.
	 *
	 * @param pattern regular expression supplied by a user
	 * @param flags   {@link Pattern} match flags
	 * @return compiled pattern
	 * @throws UnsafePatternException   when the pattern is too long or may backtrack catastrophically
	 * @throws IllegalArgumentException when the pattern is not a valid regular expression
	 */
	@Nonnull
	public static Pattern compile(@Nonnull String pattern, int flags) {
		validate(pattern);
		try {
			return Pattern.compile(pattern, flags);
		} catch (PatternSyntaxException e) {
			throw new IllegalArgumentException("Invalid regular expression pattern: " + e.getMessage(), e);
		}
	}

	/**
	 * Validates the pattern without compiling it.
	 *
	 * @param pattern regular expression supplied by a user
	 * @throws UnsafePatternException when the pattern is too long or may backtrack catastrophically
	 */
	public static void validate(@Nonnull String pattern) {
		if (pattern.length() > MAX_PATTERN_LENGTH) {
			throw new UnsafePatternException(
				pattern.substring(0, 50) + "...",
				"pattern is longer than " + MAX_PATTERN_LENGTH + " characters"
			);
		}
		if (NESTED_QUANTIFIER.matcher(pattern).find()) {
			throw new UnsafePatternException(pattern, "nested quantifiers may cause catastrophic backtracking");
		}
		final Matcher matcher = QUANTIFIED_ALTERNATION.matcher(pattern);
		while (matcher.find()) {
			if (hasOverlappingAlternatives(matcher.group(1))) {
				throw new UnsafePatternException(pattern, "overlapping alternatives under a quantifier may cause catastrophic backtracking");
			}
		}
	}

	/**
	 * Returns true when one alternative equals or starts with another one, e.g. {@code a|a} or
	 * {@code a|ab}.
	 */
	private static boolean hasOverlappingAlternatives(@Nonnull String alternation) {
		final String[] alternatives = alternation.split("\\|", -1);
		for (int i = 0; i < alternatives.length; i++) {
			for (int j = 0; j < alternatives.length; j++) {
				if (i != j && !alternatives[j].isEmpty() && alternatives[i].startsWith(alternatives[j])) {
					return true;
				}
			}
		}
		return false;
	}
}
