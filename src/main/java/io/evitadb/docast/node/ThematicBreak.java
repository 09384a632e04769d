package io.evitadb.docast.node;

import io.evitadb.docast.visitor.NodeVisitor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Horizontal rule separating blocks.
 *
 * @param metadata       node metadata
 * @param sourceLocation provenance
 */
public record ThematicBreak(
	@Nonnull Metadata metadata,
	@Nullable SourceLocation sourceLocation
) implements Block {

	public ThematicBreak {
		Objects.requireNonNull(metadata, "metadata must not be null");
	}

	public ThematicBreak() {
		this(Metadata.empty(), null);
	}

	@Override
	public <R> R accept(@Nonnull NodeVisitor<R> visitor) {
		return visitor.visit(this);
	}
}
