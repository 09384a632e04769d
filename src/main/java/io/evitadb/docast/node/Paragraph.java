package io.evitadb.docast.node;

import io.evitadb.docast.visitor.NodeVisitor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Paragraph of inline content.
 *
 * @param content        inline content
 * @param metadata       node metadata
 * @param sourceLocation provenance
 */
public record Paragraph(
	@Nonnull List<Inline> content,
	@Nonnull Metadata metadata,
	@Nullable SourceLocation sourceLocation
) implements Block {

	public Paragraph {
		content = List.copyOf(Objects.requireNonNull(content, "content must not be null"));
		Objects.requireNonNull(metadata, "metadata must not be null");
	}

	public Paragraph(@Nonnull List<Inline> content) {
		this(content, Metadata.empty(), null);
	}

	/**
	 * Creates a paragraph with a single text node.
	 *
	 * @param text paragraph text
	 * @return new paragraph
	 */
	@Nonnull
	public static Paragraph of(@Nonnull String text) {
		return new Paragraph(List.of(new Text(text)));
	}

	/**
	 * Creates a paragraph from the given inline nodes.
	 *
	 * @param content inline nodes
	 * @return new paragraph
	 */
	@Nonnull
	public static Paragraph of(@Nonnull Inline... content) {
		return new Paragraph(List.of(content));
	}

	@Override
	public <R> R accept(@Nonnull NodeVisitor<R> visitor) {
		return visitor.visit(this);
	}
}
