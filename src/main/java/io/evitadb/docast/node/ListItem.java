package io.evitadb.docast.node;

import io.evitadb.docast.visitor.NodeVisitor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Single item of a {@link ListBlock}. Items only ever appear in the items slot of a list.
 *
 * @param children       block content of the item
 * @param taskStatus     checkbox state for task list items, null for plain items
 * @param metadata       node metadata
 * @param sourceLocation provenance
 */
public record ListItem(
	@Nonnull List<Block> children,
	@Nullable TaskStatus taskStatus,
	@Nonnull Metadata metadata,
	@Nullable SourceLocation sourceLocation
) implements Node {

	public ListItem {
		children = List.copyOf(Objects.requireNonNull(children, "children must not be null"));
		Objects.requireNonNull(metadata, "metadata must not be null");
	}

	public ListItem(@Nonnull List<Block> children) {
		this(children, null, Metadata.empty(), null);
	}

	@Override
	public <R> R accept(@Nonnull NodeVisitor<R> visitor) {
		return visitor.visit(this);
	}
}
