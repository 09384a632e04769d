package io.evitadb.docast.node;

import io.evitadb.docast.visitor.NodeVisitor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Reference to a {@link FootnoteDefinition}.
 *
 * @param identifier     identifier of the referenced footnote
 * @param metadata       node metadata
 * @param sourceLocation provenance
 */
public record FootnoteReference(
	@Nonnull String identifier,
	@Nonnull Metadata metadata,
	@Nullable SourceLocation sourceLocation
) implements Inline {

	public FootnoteReference {
		Objects.requireNonNull(identifier, "identifier must not be null");
		Objects.requireNonNull(metadata, "metadata must not be null");
	}

	public FootnoteReference(@Nonnull String identifier) {
		this(identifier, Metadata.empty(), null);
	}

	@Override
	public <R> R accept(@Nonnull NodeVisitor<R> visitor) {
		return visitor.visit(this);
	}
}
