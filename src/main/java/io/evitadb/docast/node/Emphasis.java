package io.evitadb.docast.node;

import io.evitadb.docast.visitor.NodeVisitor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Emphasized (usually italic) inline content.
 *
 * @param content        formatted inline content
 * @param metadata       node metadata
 * @param sourceLocation provenance
 */
public record Emphasis(
	@Nonnull List<Inline> content,
	@Nonnull Metadata metadata,
	@Nullable SourceLocation sourceLocation
) implements Inline {

	public Emphasis {
		content = List.copyOf(Objects.requireNonNull(content, "content must not be null"));
		Objects.requireNonNull(metadata, "metadata must not be null");
	}

	public Emphasis(@Nonnull List<Inline> content) {
		this(content, Metadata.empty(), null);
	}

	@Override
	public <R> R accept(@Nonnull NodeVisitor<R> visitor) {
		return visitor.visit(this);
	}
}
