package io.evitadb.docast.transform;

import io.evitadb.docast.node.Node;
import io.evitadb.docast.node.Text;
import io.evitadb.docast.security.RegexSafety;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces occurrences of a literal string or a regular expression in the content of every
 * {@link Text} node. Code, math and raw HTML are left untouched.
 *
 * Regular expressions are screened by {@link RegexSafety} and compiled when the transformer is
 * created, so an invalid pattern never reaches a tree. The replacement of a regular expression
 * may refer to groups with {@code $1}; a literal replacement is inserted as is.
 */
public class TextReplacer extends NodeTransformer {

	@Nonnull
	private final String pattern;
	@Nonnull
	private final String replacement;
	@Nullable
	private final Pattern regex;

	public TextReplacer(@Nonnull String pattern, @Nonnull String replacement) {
		this(pattern, replacement, false);
	}

	/**
	 * Creates a replacer.
	 *
	 * @param pattern     text or regular expression to search for
	 * @param replacement replacement text
	 * @param useRegex    whether the pattern is a regular expression
	 * @throws IllegalArgumentException when the regular expression does not compile
	 * @throws io.evitadb.docast.security.UnsafePatternException when the regular expression is unsafe
	 */
	public TextReplacer(@Nonnull String pattern, @Nonnull String replacement, boolean useRegex) {
		this.pattern = Objects.requireNonNull(pattern, "pattern must not be null");
		this.replacement = Objects.requireNonNull(replacement, "replacement must not be null");
		if (pattern.isEmpty()) {
			throw new IllegalArgumentException("pattern must not be empty");
		}
		this.regex = useRegex ? RegexSafety.compile(pattern) : null;
	}

	@Override
	public Node visit(@Nonnull Text text) {
		final String content = this.regex == null ?
			text.content().replace(this.pattern, this.replacement) :
			replaceRegex(text.content());
		return new Text(content, text.metadata(), text.sourceLocation());
	}

	@Nonnull
	private String replaceRegex(@Nonnull String content) {
		final Matcher matcher = Objects.requireNonNull(this.regex).matcher(content);
		try {
			return matcher.replaceAll(this.replacement);
		} catch (IllegalArgumentException | IndexOutOfBoundsException e) {
			throw new IllegalArgumentException("Invalid replacement '" + this.replacement + "': " + e.getMessage(), e);
		}
	}
}
