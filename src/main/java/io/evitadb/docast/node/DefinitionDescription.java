package io.evitadb.docast.node;

import io.evitadb.docast.visitor.NodeVisitor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Description of a {@link DefinitionTerm}.
 *
 * @param content        block content of the description
 * @param metadata       node metadata
 * @param sourceLocation provenance
 */
public record DefinitionDescription(
	@Nonnull List<Block> content,
	@Nonnull Metadata metadata,
	@Nullable SourceLocation sourceLocation
) implements Node {

	public DefinitionDescription {
		content = List.copyOf(Objects.requireNonNull(content, "content must not be null"));
		Objects.requireNonNull(metadata, "metadata must not be null");
	}

	public DefinitionDescription(@Nonnull List<Block> content) {
		this(content, Metadata.empty(), null);
	}

	@Override
	public <R> R accept(@Nonnull NodeVisitor<R> visitor) {
		return visitor.visit(this);
	}
}
