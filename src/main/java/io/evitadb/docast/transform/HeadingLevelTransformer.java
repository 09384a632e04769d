package io.evitadb.docast.transform;

import io.evitadb.docast.node.Heading;
import io.evitadb.docast.node.Node;

import javax.annotation.Nonnull;

/**
 * Shifts every heading level by a fixed offset and clamps the result into a level range.
 */
public class HeadingLevelTransformer extends NodeTransformer {

	private final int offset;
	private final int minLevel;
	private final int maxLevel;

	public HeadingLevelTransformer(int offset) {
		this(offset, Heading.MIN_LEVEL, Heading.MAX_LEVEL);
	}

	/**
	 * Creates a transformer shifting heading levels.
	 *
	 * @param offset   amount added to each level, may be negative
	 * @param minLevel lowest level a heading may end up with
	 * @param maxLevel highest level a heading may end up with
	 * @throws IllegalArgumentException when the bounds are outside 1-6 or reversed
	 */
	public HeadingLevelTransformer(int offset, int minLevel, int maxLevel) {
		if (minLevel < Heading.MIN_LEVEL || maxLevel > Heading.MAX_LEVEL || minLevel > maxLevel) {
			throw new IllegalArgumentException(
				"Invalid level range: min_level=" + minLevel + ", max_level=" + maxLevel +
					". Levels must be between 1 and 6, with min_level <= max_level."
			);
		}
		this.offset = offset;
		this.minLevel = minLevel;
		this.maxLevel = maxLevel;
	}

	@Override
	public Node visit(@Nonnull Heading heading) {
		final long shifted = (long) heading.level() + this.offset;
		final int level = (int) Math.max(this.minLevel, Math.min(this.maxLevel, shifted));
		return new Heading(level, transformInlines(heading.content()), heading.metadata(), heading.sourceLocation());
	}
}
