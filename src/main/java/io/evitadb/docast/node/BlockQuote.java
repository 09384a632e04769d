package io.evitadb.docast.node;

import io.evitadb.docast.visitor.NodeVisitor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Quoted block content.
 *
 * @param children       quoted blocks
 * @param metadata       node metadata
 * @param sourceLocation provenance
 */
public record BlockQuote(
	@Nonnull List<Block> children,
	@Nonnull Metadata metadata,
	@Nullable SourceLocation sourceLocation
) implements Block {

	public BlockQuote {
		children = List.copyOf(Objects.requireNonNull(children, "children must not be null"));
		Objects.requireNonNull(metadata, "metadata must not be null");
	}

	public BlockQuote(@Nonnull List<Block> children) {
		this(children, Metadata.empty(), null);
	}

	@Override
	public <R> R accept(@Nonnull NodeVisitor<R> visitor) {
		return visitor.visit(this);
	}
}
