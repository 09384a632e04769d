package io.evitadb.docast.node;

import io.evitadb.docast.visitor.NodeVisitor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Section heading of level 1 (most important) to 6.
 *
 * @param level          heading level, 1-6
 * @param content        inline content of the heading
 * @param metadata       node metadata (parsers may store e.g. an explicit {@code id})
 * @param sourceLocation provenance
 */
public record Heading(
	int level,
	@Nonnull List<Inline> content,
	@Nonnull Metadata metadata,
	@Nullable SourceLocation sourceLocation
) implements Block {

	/**
	 * The most significant heading level.
	 */
	public static final int MIN_LEVEL = 1;

	/**
	 * The least significant heading level.
	 */
	public static final int MAX_LEVEL = 6;

	public Heading {
		if (level < MIN_LEVEL || level > MAX_LEVEL) {
			throw new IllegalArgumentException("Heading level must be 1-6, got " + level);
		}
		content = List.copyOf(Objects.requireNonNull(content, "content must not be null"));
		Objects.requireNonNull(metadata, "metadata must not be null");
	}

	public Heading(int level, @Nonnull List<Inline> content) {
		this(level, content, Metadata.empty(), null);
	}

	/**
	 * Creates a heading with plain text content.
	 *
	 * @param level heading level, 1-6
	 * @param text  heading text
	 * @return new heading
	 */
	@Nonnull
	public static Heading of(int level, @Nonnull String text) {
		return new Heading(level, List.of(new Text(text)));
	}

	@Override
	public <R> R accept(@Nonnull NodeVisitor<R> visitor) {
		return visitor.visit(this);
	}
}
