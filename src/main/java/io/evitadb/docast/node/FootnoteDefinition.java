package io.evitadb.docast.node;

import io.evitadb.docast.visitor.NodeVisitor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Body of a footnote referenced by {@link FootnoteReference} nodes with the same identifier.
 *
 * @param identifier     footnote identifier, unique within the document
 * @param content        footnote blocks
 * @param metadata       node metadata
 * @param sourceLocation provenance
 */
public record FootnoteDefinition(
	@Nonnull String identifier,
	@Nonnull List<Block> content,
	@Nonnull Metadata metadata,
	@Nullable SourceLocation sourceLocation
) implements Block {

	public FootnoteDefinition {
		Objects.requireNonNull(identifier, "identifier must not be null");
		content = List.copyOf(Objects.requireNonNull(content, "content must not be null"));
		Objects.requireNonNull(metadata, "metadata must not be null");
	}

	public FootnoteDefinition(@Nonnull String identifier, @Nonnull List<Block> content) {
		this(identifier, content, Metadata.empty(), null);
	}

	@Override
	public <R> R accept(@Nonnull NodeVisitor<R> visitor) {
		return visitor.visit(this);
	}
}
