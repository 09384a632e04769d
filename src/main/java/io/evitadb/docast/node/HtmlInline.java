package io.evitadb.docast.node;

import io.evitadb.docast.visitor.NodeVisitor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Raw inline HTML passed through from the source.
 *
 * @param content        raw markup
 * @param metadata       node metadata
 * @param sourceLocation provenance
 */
public record HtmlInline(
	@Nonnull String content,
	@Nonnull Metadata metadata,
	@Nullable SourceLocation sourceLocation
) implements Inline {

	public HtmlInline {
		Objects.requireNonNull(content, "content must not be null");
		Objects.requireNonNull(metadata, "metadata must not be null");
	}

	public HtmlInline(@Nonnull String content) {
		this(content, Metadata.empty(), null);
	}

	@Override
	public <R> R accept(@Nonnull NodeVisitor<R> visitor) {
		return visitor.visit(this);
	}
}
