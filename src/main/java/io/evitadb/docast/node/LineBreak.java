package io.evitadb.docast.node;

import io.evitadb.docast.visitor.NodeVisitor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Line break inside inline content.
 *
 * @param soft           true for a soft break (source line wrap), false for a hard break
 * @param metadata       node metadata
 * @param sourceLocation provenance
 */
public record LineBreak(
	boolean soft,
	@Nonnull Metadata metadata,
	@Nullable SourceLocation sourceLocation
) implements Inline {

	public LineBreak {
		Objects.requireNonNull(metadata, "metadata must not be null");
	}

	public LineBreak(boolean soft) {
		this(soft, Metadata.empty(), null);
	}

	@Override
	public <R> R accept(@Nonnull NodeVisitor<R> visitor) {
		return visitor.visit(this);
	}
}
