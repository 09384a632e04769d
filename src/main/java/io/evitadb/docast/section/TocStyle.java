package io.evitadb.docast.section;

import javax.annotation.Nonnull;
import java.util.Locale;

/**
 * Output style of a generated table of contents.
 */
public enum TocStyle {

	/**
	 * Markdown text with indented link lines.
	 */
	MARKDOWN,
	/**
	 * Flat list, one item per heading.
	 */
	LIST,
	/**
	 * List nested along the heading hierarchy.
	 */
	NESTED;

	/**
	 * Returns the lowercase name used in configuration.
	 *
	 * @return style name
	 */
	@Nonnull
	public String getName() {
		return name().toLowerCase(Locale.ROOT);
	}

	/**
	 * Resolves the style from its configuration name.
	 *
	 * @param name {@code markdown}, {@code list} or {@code nested}
	 * @return style
	 * @throws IllegalArgumentException for an unknown name
	 */
	@Nonnull
	public static TocStyle fromName(@Nonnull String name) {
		for (final TocStyle style : values()) {
			if (style.getName().equals(name)) {
				return style;
			}
		}
		throw new IllegalArgumentException("Invalid style: " + name + ". Expected one of markdown, list, nested.");
	}
}
