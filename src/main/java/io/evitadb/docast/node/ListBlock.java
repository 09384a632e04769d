package io.evitadb.docast.node;

import io.evitadb.docast.visitor.NodeVisitor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Ordered or bullet list.
 *
 * @param ordered        true for numbered lists
 * @param items          list items
 * @param start          number of the first item of an ordered list
 * @param tight          true when items are not separated by blank lines
 * @param metadata       node metadata
 * @param sourceLocation provenance
 */
public record ListBlock(
	boolean ordered,
	@Nonnull List<ListItem> items,
	int start,
	boolean tight,
	@Nonnull Metadata metadata,
	@Nullable SourceLocation sourceLocation
) implements Block {

	public ListBlock {
		items = List.copyOf(Objects.requireNonNull(items, "items must not be null"));
		Objects.requireNonNull(metadata, "metadata must not be null");
		if (start < 0) {
			throw new IllegalArgumentException("start must be non-negative, got " + start);
		}
	}

	public ListBlock(boolean ordered, @Nonnull List<ListItem> items) {
		this(ordered, items, 1, true, Metadata.empty(), null);
	}

	/**
	 * Creates a tight bullet list.
	 *
	 * @param items list items
	 * @return new list
	 */
	@Nonnull
	public static ListBlock bullet(@Nonnull List<ListItem> items) {
		return new ListBlock(false, items);
	}

	@Override
	public <R> R accept(@Nonnull NodeVisitor<R> visitor) {
		return visitor.visit(this);
	}
}
