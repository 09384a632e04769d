package io.evitadb.docast.node;

import io.evitadb.docast.visitor.NodeVisitor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Term of a {@link DefinitionList} entry.
 *
 * @param content        inline content of the term
 * @param metadata       node metadata
 * @param sourceLocation provenance
 */
public record DefinitionTerm(
	@Nonnull List<Inline> content,
	@Nonnull Metadata metadata,
	@Nullable SourceLocation sourceLocation
) implements Node {

	public DefinitionTerm {
		content = List.copyOf(Objects.requireNonNull(content, "content must not be null"));
		Objects.requireNonNull(metadata, "metadata must not be null");
	}

	public DefinitionTerm(@Nonnull List<Inline> content) {
		this(content, Metadata.empty(), null);
	}

	@Override
	public <R> R accept(@Nonnull NodeVisitor<R> visitor) {
		return visitor.visit(this);
	}
}
