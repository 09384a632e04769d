package io.evitadb.docast.node;

import io.evitadb.docast.visitor.NodeVisitor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Root of every document tree.
 *
 * The {@code metadata} of a document holds document-wide information extracted by parsers
 * (title, author, keywords, custom front matter fields) and is distinct from the per-node
 * metadata of its descendants. See {@link DocumentMetadata} for typed access to well-known keys.
 *
 * @param children       ordered block level content
 * @param metadata       document-wide metadata
 * @param sourceLocation provenance of the document
 */
public record Document(
	@Nonnull List<Block> children,
	@Nonnull Metadata metadata,
	@Nullable SourceLocation sourceLocation
) implements Node {

	public Document {
		children = List.copyOf(Objects.requireNonNull(children, "children must not be null"));
		Objects.requireNonNull(metadata, "metadata must not be null");
	}

	public Document(@Nonnull List<Block> children) {
		this(children, Metadata.empty(), null);
	}

	public Document(@Nonnull List<Block> children, @Nonnull Metadata metadata) {
		this(children, metadata, null);
	}

	/**
	 * Creates a document from the given blocks.
	 *
	 * @param children blocks in document order
	 * @return new document without metadata
	 */
	@Nonnull
	public static Document of(@Nonnull Block... children) {
		return new Document(List.of(children));
	}

	/**
	 * Returns a copy of this document with different children and the same metadata and source
	 * location.
	 *
	 * @param newChildren replacement children
	 * @return new document
	 */
	@Nonnull
	public Document withChildren(@Nonnull List<Block> newChildren) {
		return new Document(newChildren, this.metadata, this.sourceLocation);
	}

	/**
	 * Returns a copy of this document with different metadata.
	 *
	 * @param newMetadata replacement metadata
	 * @return new document
	 */
	@Nonnull
	public Document withMetadata(@Nonnull Metadata newMetadata) {
		return new Document(this.children, newMetadata, this.sourceLocation);
	}

	@Override
	public <R> R accept(@Nonnull NodeVisitor<R> visitor) {
		return visitor.visit(this);
	}
}
