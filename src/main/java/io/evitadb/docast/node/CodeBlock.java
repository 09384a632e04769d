package io.evitadb.docast.node;

import io.evitadb.docast.visitor.NodeVisitor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Block of preformatted code.
 *
 * @param content        the literal code
 * @param language       language hint from the info string, or null
 * @param fenceChar      fence character used by markdown-like formats ({@code `} or {@code ~})
 * @param fenceLength    number of fence characters, at least 3
 * @param metadata       node metadata
 * @param sourceLocation provenance
 */
public record CodeBlock(
	@Nonnull String content,
	@Nullable String language,
	char fenceChar,
	int fenceLength,
	@Nonnull Metadata metadata,
	@Nullable SourceLocation sourceLocation
) implements Block {

	public CodeBlock {
		Objects.requireNonNull(content, "content must not be null");
		Objects.requireNonNull(metadata, "metadata must not be null");
		if (fenceChar != '`' && fenceChar != '~') {
			throw new IllegalArgumentException("fenceChar must be '`' or '~', got '" + fenceChar + "'");
		}
		if (fenceLength < 3) {
			throw new IllegalArgumentException("fenceLength must be at least 3, got " + fenceLength);
		}
	}

	public CodeBlock(@Nonnull String content, @Nullable String language) {
		this(content, language, '`', 3, Metadata.empty(), null);
	}

	@Override
	public <R> R accept(@Nonnull NodeVisitor<R> visitor) {
		return visitor.visit(this);
	}
}
