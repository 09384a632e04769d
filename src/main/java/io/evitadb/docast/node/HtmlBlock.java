package io.evitadb.docast.node;

import io.evitadb.docast.visitor.NodeVisitor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Raw HTML block passed through from the source. The core never sanitizes the content.
 *
 * @param content        raw markup
 * @param metadata       node metadata
 * @param sourceLocation provenance
 */
public record HtmlBlock(
	@Nonnull String content,
	@Nonnull Metadata metadata,
	@Nullable SourceLocation sourceLocation
) implements Block {

	public HtmlBlock {
		Objects.requireNonNull(content, "content must not be null");
		Objects.requireNonNull(metadata, "metadata must not be null");
	}

	public HtmlBlock(@Nonnull String content) {
		this(content, Metadata.empty(), null);
	}

	@Override
	public <R> R accept(@Nonnull NodeVisitor<R> visitor) {
		return visitor.visit(this);
	}
}
