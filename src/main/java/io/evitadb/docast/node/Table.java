package io.evitadb.docast.node;

import io.evitadb.docast.visitor.NodeVisitor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Table with an optional header row and any number of body rows.
 *
 * The header row is kept in a dedicated slot so that renderers and transforms can tell it apart
 * from data rows without inspecting row flags. A row placed in the header slot is always flagged
 * as header. Column alignments may contain null entries for columns without explicit alignment.
 *
 * @param header         header row or null
 * @param rows           body rows
 * @param alignments     per-column alignment, entries may be null
 * @param caption        table caption or null
 * @param metadata       node metadata
 * @param sourceLocation provenance
 */
public record Table(
	@Nullable TableRow header,
	@Nonnull List<TableRow> rows,
	@Nonnull List<Alignment> alignments,
	@Nullable String caption,
	@Nonnull Metadata metadata,
	@Nullable SourceLocation sourceLocation
) implements Block {

	public Table {
		if (header != null && !header.header()) {
			header = new TableRow(header.cells(), true, header.metadata(), header.sourceLocation());
		}
		rows = List.copyOf(Objects.requireNonNull(rows, "rows must not be null"));
		// alignments may legitimately hold nulls, so List.copyOf cannot be used
		alignments = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(alignments, "alignments must not be null")));
		Objects.requireNonNull(metadata, "metadata must not be null");
	}

	public Table(@Nullable TableRow header, @Nonnull List<TableRow> rows) {
		this(header, rows, List.of(), null, Metadata.empty(), null);
	}

	/**
	 * Returns all rows with the header row, when present, in the first position.
	 *
	 * @return rows in visual order
	 */
	@Nonnull
	public List<TableRow> allRows() {
		if (this.header == null) {
			return this.rows;
		}
		final List<TableRow> result = new ArrayList<>(this.rows.size() + 1);
		result.add(this.header);
		result.addAll(this.rows);
		return result;
	}

	@Override
	public <R> R accept(@Nonnull NodeVisitor<R> visitor) {
		return visitor.visit(this);
	}
}
