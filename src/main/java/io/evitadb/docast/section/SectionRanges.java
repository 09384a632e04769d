package io.evitadb.docast.section;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Parses section selections such as {@code "1-3,5,10-"}.
 *
 * Numbers are 1-based and inclusive. A range with an empty start begins at the first section, a
 * range with an empty end stops at the last one. A reversed range such as {@code "10-5"} is
 * accepted and read as {@code "5-10"}. Indexes outside the document are ignored.
 */
public final class SectionRanges {

	private SectionRanges() {
	}

	/**
	 * Parses the selection into 0-based section indexes.
	 *
	 * @param spec          comma separated ranges and single numbers
	 * @param totalSections number of sections of the document
	 * @return sorted distinct indexes within {@code [0, totalSections)}
	 * @throws IllegalArgumentException when a part is not a number or a range of numbers
	 */
	@Nonnull
	public static List<Integer> parse(@Nonnull String spec, int totalSections) {
		final TreeSet<Integer> indexes = new TreeSet<>();
		for (final String rawPart : spec.split(",")) {
			final String part = rawPart.trim();
			if (part.isEmpty()) {
				continue;
			}
			final int dash = part.indexOf('-');
			if (dash >= 0) {
				final String startText = part.substring(0, dash).trim();
				final String endText = part.substring(dash + 1).trim();
				int start = startText.isEmpty() ? 0 : parseNumber(startText, part) - 1;
				int end = endText.isEmpty() ? totalSections - 1 : parseNumber(endText, part) - 1;
				if (start > end) {
					final int swap = start;
					start = end;
					end = swap;
				}
				for (int i = Math.max(0, start); i <= end && i < totalSections; i++) {
					indexes.add(i);
				}
			} else {
				final int index = parseNumber(part, part) - 1;
				if (index >= 0 && index < totalSections) {
					indexes.add(index);
				}
			}
		}
		return new ArrayList<>(indexes);
	}

	private static int parseNumber(@Nonnull String text, @Nonnull String part) {
		try {
			return Integer.parseInt(text);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid section range '" + part + "': '" + text + "' is not a number", e);
		}
	}
}
