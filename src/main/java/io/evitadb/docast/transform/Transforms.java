package io.evitadb.docast.transform;

import io.evitadb.docast.node.Block;
import io.evitadb.docast.node.Document;
import io.evitadb.docast.node.Metadata;
import io.evitadb.docast.node.Node;
import io.evitadb.docast.visitor.NodeCollector;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Whole-tree operations built on {@link NodeCollector} and {@link NodeTransformer}.
 *
 * @author Jan Novotný (novotny@fg.cz), FG Forrest a.s. (c) 2025
 */
public final class Transforms {

	private Transforms() {
	}

	/**
	 * Returns every node of the tree in pre-order, the root included.
	 *
	 * @param root tree root
	 * @return all nodes
	 */
	@Nonnull
	public static List<Node> extractNodes(@Nonnull Node root) {
		final NodeCollector collector = NodeCollector.all();
		root.accept(collector);
		return collector.getCollected();
	}

	/**
	 * Returns every node of the given type in pre-order.
	 *
	 * @param root tree root
	 * @param type node variant or marker interface
	 * @param <T>  node type
	 * @return matching nodes
	 */
	@Nonnull
	public static <T extends Node> List<T> extractNodes(@Nonnull Node root, @Nonnull Class<T> type) {
		final NodeCollector collector = NodeCollector.ofType(type);
		root.accept(collector);
		final List<T> result = new ArrayList<>(collector.getCollected().size());
		for (final Node node : collector.getCollected()) {
			result.add(type.cast(node));
		}
		return result;
	}

	/**
	 * Creates a document keeping only nodes the predicate accepts. The root is always kept; a
	 * rejected node is removed with its whole subtree, its children are never promoted.
	 *
	 * @param document  source document
	 * @param predicate test applied to every node below the root
	 * @return filtered document
	 */
	@Nonnull
	public static Document filterNodes(@Nonnull Document document, @Nonnull Predicate<? super Node> predicate) {
		Objects.requireNonNull(predicate, "predicate must not be null");
		return transformNodes(document, new NodeTransformer() {
			@Nullable
			@Override
			public Node transform(@Nonnull Node node) {
				if (node instanceof Document || predicate.test(node)) {
					return super.transform(node);
				}
				return null;
			}
		});
	}

	/**
	 * Creates a deep copy of the node. Every node of the copy is a new instance equal to its
	 * original.
	 *
	 * @param node node to copy
	 * @return copy of the node, of the same variant
	 */
	@Nonnull
	public static Node cloneNode(@Nonnull Node node) {
		return Objects.requireNonNull(new NodeTransformer() {}.transform(node));
	}

	/**
	 * Applies the transformer to the document.
	 *
	 * @param document    source document, left unchanged
	 * @param transformer transformer to apply
	 * @return transformed document
	 * @throws IllegalStateException when the transformer removes or replaces the document root
	 */
	@Nonnull
	public static Document transformNodes(@Nonnull Document document, @Nonnull NodeTransformer transformer) {
		Objects.requireNonNull(document, "document must not be null");
		Objects.requireNonNull(transformer, "transformer must not be null");
		final Node result = transformer.transform(document);
		if (!(result instanceof Document transformed)) {
			throw new IllegalStateException(
				transformer.getClass().getSimpleName() + " did not return a Document for the document root"
			);
		}
		return transformed;
	}

	/**
	 * Concatenates the documents with {@link MetadataMerger#LAST_WRITE_WINS} metadata merging.
	 *
	 * @param documents documents in order
	 * @return merged document
	 */
	@Nonnull
	public static Document mergeDocuments(@Nonnull List<Document> documents) {
		return mergeDocuments(documents, MetadataMerger.LAST_WRITE_WINS);
	}

	/**
	 * Concatenates the children of all documents in order and folds their metadata from left to
	 * right with the merger.
	 *
	 * @param documents documents in order
	 * @param merger    metadata merge policy
	 * @return merged document, empty for an empty input
	 */
	@Nonnull
	public static Document mergeDocuments(@Nonnull List<Document> documents, @Nonnull MetadataMerger merger) {
		Objects.requireNonNull(documents, "documents must not be null");
		Objects.requireNonNull(merger, "merger must not be null");
		final List<Block> children = new ArrayList<>();
		Metadata metadata = Metadata.empty();
		for (final Document document : documents) {
			children.addAll(document.children());
			metadata = merger.merge(metadata, document.metadata());
		}
		return new Document(children, metadata);
	}
}
