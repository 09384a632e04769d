package io.evitadb.docast.section;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.text.Normalizer;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Converts heading text to URL-safe anchor slugs.
 *
 * The text is decomposed (NFKD) and stripped of combining marks, so "Über" becomes "uber". It is
 * then lowercased, runs of whitespace and underscores become a single hyphen, every character that
 * is neither a letter, a digit nor a hyphen is removed, repeated hyphens are collapsed and leading
 * and trailing hyphens trimmed. An empty result falls back to {@value #FALLBACK}.
 */
public final class Slugifier {

	/**
	 * Slug used when nothing of the text survives.
	 */
	public static final String FALLBACK = "section";

	private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
	private static final Pattern SEPARATORS = Pattern.compile("[\\s_]+");
	private static final Pattern DISALLOWED = Pattern.compile("[^\\p{L}\\p{N}-]");
	private static final Pattern REPEATED_HYPHENS = Pattern.compile("-{2,}");
	private static final Pattern EDGE_HYPHENS = Pattern.compile("^-+|-+$");

	private Slugifier() {
	}

	/**
	 * Converts the text to a slug.
	 *
	 * @param text heading text
	 * @return slug, never empty
	 */
	@Nonnull
	public static String slugify(@Nonnull String text) {
		String slug = Normalizer.normalize(text, Normalizer.Form.NFKD);
		slug = COMBINING_MARKS.matcher(slug).replaceAll("");
		slug = slug.toLowerCase(Locale.ROOT);
		slug = SEPARATORS.matcher(slug).replaceAll("-");
		slug = DISALLOWED.matcher(slug).replaceAll("");
		slug = REPEATED_HYPHENS.matcher(slug).replaceAll("-");
		slug = EDGE_HYPHENS.matcher(slug).replaceAll("");
		return slug.isEmpty() ? FALLBACK : slug;
	}

	/**
	 * Converts the text to a slug that is not yet contained in {@code seenSlugs}. On collision the
	 * first free suffix {@code -2}, {@code -3}, ... is appended. The returned slug is added to the
	 * set, so one set threads uniqueness through a sequence of calls.
	 *
	 * @param text      heading text
	 * @param seenSlugs slugs already in use, updated by this call; null disables collision handling
	 * @return unique slug
	 */
	@Nonnull
	public static String slugify(@Nonnull String text, @Nullable Set<String> seenSlugs) {
		final String base = slugify(text);
		if (seenSlugs == null) {
			return base;
		}
		String slug = base;
		for (int counter = 2; seenSlugs.contains(slug); counter++) {
			slug = base + "-" + counter;
		}
		seenSlugs.add(slug);
		return slug;
	}
}
