package io.evitadb.docast.node;

import io.evitadb.docast.visitor.NodeVisitor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Inline code span.
 *
 * @param content        literal code
 * @param metadata       node metadata
 * @param sourceLocation provenance
 */
public record Code(
	@Nonnull String content,
	@Nonnull Metadata metadata,
	@Nullable SourceLocation sourceLocation
) implements Inline {

	public Code {
		Objects.requireNonNull(content, "content must not be null");
		Objects.requireNonNull(metadata, "metadata must not be null");
	}

	public Code(@Nonnull String content) {
		this(content, Metadata.empty(), null);
	}

	@Override
	public <R> R accept(@Nonnull NodeVisitor<R> visitor) {
		return visitor.visit(this);
	}
}
