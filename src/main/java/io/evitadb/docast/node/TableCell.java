package io.evitadb.docast.node;

import io.evitadb.docast.visitor.NodeVisitor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Cell of a {@link TableRow}. Spans are validated to be positive here; whether they fit the
 * table grid is checked by {@link io.evitadb.docast.visitor.StructureValidator}.
 *
 * @param content        inline content
 * @param colspan        number of columns spanned, at least 1
 * @param rowspan        number of rows spanned, at least 1
 * @param alignment      cell alignment or null
 * @param metadata       node metadata
 * @param sourceLocation provenance
 */
public record TableCell(
	@Nonnull List<Inline> content,
	int colspan,
	int rowspan,
	@Nullable Alignment alignment,
	@Nonnull Metadata metadata,
	@Nullable SourceLocation sourceLocation
) implements Node {

	public TableCell {
		content = List.copyOf(Objects.requireNonNull(content, "content must not be null"));
		Objects.requireNonNull(metadata, "metadata must not be null");
		if (colspan < 1) {
			throw new IllegalArgumentException("colspan must be at least 1, got " + colspan);
		}
		if (rowspan < 1) {
			throw new IllegalArgumentException("rowspan must be at least 1, got " + rowspan);
		}
	}

	public TableCell(@Nonnull List<Inline> content) {
		this(content, 1, 1, null, Metadata.empty(), null);
	}

	/**
	 * Creates a single-span cell with plain text.
	 *
	 * @param text cell text
	 * @return new cell
	 */
	@Nonnull
	public static TableCell of(@Nonnull String text) {
		return new TableCell(List.of(new Text(text)));
	}

	@Override
	public <R> R accept(@Nonnull NodeVisitor<R> visitor) {
		return visitor.visit(this);
	}
}
