package io.evitadb.docast.section;

import javax.annotation.Nonnull;
import java.util.Locale;

/**
 * Where an inserted table of contents is placed.
 */
public enum TocPosition {

	/**
	 * Before the first node of the document.
	 */
	START,
	/**
	 * Right after the first heading, or at the start when the document has no heading.
	 */
	AFTER_FIRST_HEADING;

	@Nonnull
	public String getName() {
		return name().toLowerCase(Locale.ROOT);
	}

	/**
	 * Resolves the position from its configuration name.
	 *
	 * @param name {@code start} or {@code after_first_heading}
	 * @return position
	 * @throws IllegalArgumentException for an unknown name
	 */
	@Nonnull
	public static TocPosition fromName(@Nonnull String name) {
		for (final TocPosition position : values()) {
			if (position.getName().equals(name)) {
				return position;
			}
		}
		throw new IllegalArgumentException("Invalid position: " + name + ". Expected start or after_first_heading.");
	}
}
