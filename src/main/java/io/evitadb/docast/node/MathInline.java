package io.evitadb.docast.node;

import io.evitadb.docast.visitor.NodeVisitor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Inline math.
 *
 * @param content        math source
 * @param notation       notation of the source
 * @param metadata       node metadata
 * @param sourceLocation provenance
 */
public record MathInline(
	@Nonnull String content,
	@Nonnull MathNotation notation,
	@Nonnull Metadata metadata,
	@Nullable SourceLocation sourceLocation
) implements Inline {

	public MathInline {
		Objects.requireNonNull(content, "content must not be null");
		Objects.requireNonNull(notation, "notation must not be null");
		Objects.requireNonNull(metadata, "metadata must not be null");
	}

	public MathInline(@Nonnull String content) {
		this(content, MathNotation.LATEX, Metadata.empty(), null);
	}

	@Override
	public <R> R accept(@Nonnull NodeVisitor<R> visitor) {
		return visitor.visit(this);
	}
}
