package io.evitadb.docast.section;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Identifies a section either by its heading text or by its index in the list of all sections,
 * where negative indexes count from the end. Heading text is compared ignoring case unless the
 * target asks for a case-sensitive match.
 *
 * @param headingText   heading text or null when the target is an index
 * @param index         section index, ignored when the heading text is set
 * @param caseSensitive whether the heading text comparison respects case
 */
public record SectionTarget(@Nullable String headingText, int index, boolean caseSensitive) {

	@Nonnull
	public static SectionTarget heading(@Nonnull String text) {
		return heading(text, false);
	}

	@Nonnull
	public static SectionTarget heading(@Nonnull String text, boolean caseSensitive) {
		return new SectionTarget(Objects.requireNonNull(text, "text must not be null"), 0, caseSensitive);
	}

	@Nonnull
	public static SectionTarget index(int index) {
		return new SectionTarget(null, index, false);
	}

	public boolean isHeading() {
		return this.headingText != null;
	}

	@Override
	public String toString() {
		return this.headingText != null ? this.headingText : String.valueOf(this.index);
	}
}
