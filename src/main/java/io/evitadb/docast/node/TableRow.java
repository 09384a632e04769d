package io.evitadb.docast.node;

import io.evitadb.docast.visitor.NodeVisitor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Row of a {@link Table}.
 *
 * @param cells          cells of the row
 * @param header         true for the header row
 * @param metadata       node metadata
 * @param sourceLocation provenance
 */
public record TableRow(
	@Nonnull List<TableCell> cells,
	boolean header,
	@Nonnull Metadata metadata,
	@Nullable SourceLocation sourceLocation
) implements Node {

	public TableRow {
		cells = List.copyOf(Objects.requireNonNull(cells, "cells must not be null"));
		Objects.requireNonNull(metadata, "metadata must not be null");
	}

	public TableRow(@Nonnull List<TableCell> cells, boolean header) {
		this(cells, header, Metadata.empty(), null);
	}

	/**
	 * Returns the number of grid columns this row occupies, counting column spans.
	 *
	 * @return column count
	 */
	public int columnCount() {
		int count = 0;
		for (final TableCell cell : this.cells) {
			count += cell.colspan();
		}
		return count;
	}

	@Override
	public <R> R accept(@Nonnull NodeVisitor<R> visitor) {
		return visitor.visit(this);
	}
}
