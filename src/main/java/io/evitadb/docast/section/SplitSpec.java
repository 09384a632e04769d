package io.evitadb.docast.section;

import io.evitadb.docast.node.Document;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Parsed split specification such as {@code h2}, {@code length=500}, {@code parts=3},
 * {@code delimiter=<!-- split -->}, {@code break}, {@code auto} or {@code sections}.
 *
 * @param strategy  selected strategy
 * @param amount    heading level, target word count or number of parts; 0 when the strategy takes none
 * @param delimiter delimiter text for {@link SplitStrategy#DELIMITER}, null otherwise
 */
public record SplitSpec(
	@Nonnull SplitStrategy strategy,
	int amount,
	@Nullable String delimiter
) {

	public static final SplitSpec SECTIONS = new SplitSpec(SplitStrategy.SECTIONS, 0, null);
	private static final String EXPECTED = "Expected: h1-h6, length=N, parts=N, delimiter=TEXT, break, auto or sections";

	public SplitSpec {
		Objects.requireNonNull(strategy, "strategy must not be null");
		if (strategy == SplitStrategy.DELIMITER && (delimiter == null || delimiter.isEmpty())) {
			throw new IllegalArgumentException("Delimiter cannot be empty");
		}
	}

	/**
	 * Parses the textual form. Keywords and keys are case insensitive, the delimiter value
	 * understands the escapes {@code \n}, {@code \t} and {@code \\}.
	 *
	 * @param spec textual specification
	 * @return parsed specification
	 * @throws IllegalArgumentException when the text is not a valid specification
	 */
	@Nonnull
	public static SplitSpec parse(@Nonnull String spec) {
		Objects.requireNonNull(spec, "spec must not be null");
		final String trimmed = spec.trim();
		final String lower = trimmed.toLowerCase(Locale.ROOT);

		if (lower.length() == 2 && lower.charAt(0) == 'h' && Character.isDigit(lower.charAt(1))) {
			final int level = lower.charAt(1) - '0';
			if (level < 1 || level > 6) {
				throw new IllegalArgumentException("Heading level must be between 1 and 6, got " + level);
			}
			return new SplitSpec(SplitStrategy.HEADING, level, null);
		}

		final int separator = trimmed.indexOf('=');
		if (separator >= 0) {
			final String key = trimmed.substring(0, separator).trim().toLowerCase(Locale.ROOT);
			final String value = trimmed.substring(separator + 1).trim();
			switch (key) {
				case "length":
					return new SplitSpec(SplitStrategy.LENGTH, positive(value, key), null);
				case "parts":
					return new SplitSpec(SplitStrategy.PARTS, positive(value, key), null);
				case "delimiter":
					if (value.isEmpty()) {
						throw new IllegalArgumentException("Delimiter value cannot be empty");
					}
					return new SplitSpec(SplitStrategy.DELIMITER, 0, unescape(value));
				default:
					throw new IllegalArgumentException("Unknown split strategy: " + key);
			}
		}

		switch (lower) {
			case "break":
				return new SplitSpec(SplitStrategy.BREAK, 0, null);
			case "auto":
				return new SplitSpec(SplitStrategy.AUTO, 0, null);
			case "sections":
				return SECTIONS;
			default:
				throw new IllegalArgumentException("Invalid split specification: " + spec + ". " + EXPECTED);
		}
	}

	/**
	 * Splits the document with the strategy of this specification. Section and heading splits
	 * include the preamble.
	 *
	 * @param document document to split
	 * @return parts in document order
	 */
	@Nonnull
	public List<SplitResult> apply(@Nonnull Document document) {
		return switch (this.strategy) {
			case SECTIONS -> DocumentSplitter.splitBySections(document, true);
			case HEADING -> DocumentSplitter.splitByHeadingLevel(document, this.amount, true);
			case LENGTH -> DocumentSplitter.splitByWordCount(document, this.amount);
			case PARTS -> DocumentSplitter.splitByParts(document, this.amount);
			case DELIMITER -> DocumentSplitter.splitByDelimiter(document, Objects.requireNonNull(this.delimiter));
			case BREAK -> DocumentSplitter.splitByBreak(document);
			case AUTO -> DocumentSplitter.splitAuto(document);
		};
	}

	private static int positive(@Nonnull String value, @Nonnull String key) {
		final int number;
		try {
			number = Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + key + " value: " + value, e);
		}
		if (number < 1) {
			throw new IllegalArgumentException("Invalid " + key + " value: " + value + " (" + key + " must be at least 1)");
		}
		return number;
	}

	@Nonnull
	private static String unescape(@Nonnull String value) {
		final StringBuilder sb = new StringBuilder(value.length());
		for (int i = 0; i < value.length(); i++) {
			final char c = value.charAt(i);
			if (c == '\\' && i + 1 < value.length()) {
				final char next = value.charAt(i + 1);
				switch (next) {
					case 'n':
						sb.append('\n');
						i++;
						continue;
					case 't':
						sb.append('\t');
						i++;
						continue;
					case '\\':
						sb.append('\\');
						i++;
						continue;
					default:
						break;
				}
			}
			sb.append(c);
		}
		return sb.toString();
	}
}
