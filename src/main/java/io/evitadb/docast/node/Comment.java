package io.evitadb.docast.node;

import io.evitadb.docast.visitor.NodeVisitor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Block level comment, such as an HTML comment or a reviewer note extracted from a word
 * processor document.
 *
 * @param content        comment text
 * @param commentType    source specific kind of comment (e.g. "html", "docx_review"), or null
 * @param metadata       node metadata (author, date and similar)
 * @param sourceLocation provenance
 */
public record Comment(
	@Nonnull String content,
	@Nullable String commentType,
	@Nonnull Metadata metadata,
	@Nullable SourceLocation sourceLocation
) implements Block {

	public Comment {
		Objects.requireNonNull(content, "content must not be null");
		Objects.requireNonNull(metadata, "metadata must not be null");
	}

	public Comment(@Nonnull String content) {
		this(content, null, Metadata.empty(), null);
	}

	@Override
	public <R> R accept(@Nonnull NodeVisitor<R> visitor) {
		return visitor.visit(this);
	}
}
