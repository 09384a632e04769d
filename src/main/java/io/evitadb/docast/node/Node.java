package io.evitadb.docast.node;

import io.evitadb.docast.visitor.NodeVisitor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Common contract of every element of the document AST.
 *
 * The set of implementations is closed: parsers produce only the variants of this package and
 * renderers consume only them. Each variant is an immutable record that owns its children, so a
 * tree never contains back-references or shared subtrees and every edit produces a new tree.
 *
 * Nodes are split into two categories by the {@link Block} and {@link Inline} marker interfaces.
 * Container slots are typed with these markers so that inline content can never be placed among
 * document blocks and vice versa. A few structural nodes ({@link Document}, {@link ListItem},
 * {@link TableRow}, {@link TableCell}, {@link DefinitionTerm}, {@link DefinitionDescription})
 * belong to neither category and may only appear in their dedicated parent slot.
 *
 * @author Jan Novotný (novotny@fg.cz), FG Forrest a.s. (c) 2025
 */
public interface Node {

	/**
	 * Returns format specific attributes attached to this node by parsers or transforms.
	 *
	 * @return node metadata, never null
	 */
	@Nonnull
	Metadata metadata();

	/**
	 * Returns the provenance of this node in the original source, if the parser recorded it.
	 *
	 * @return source location or null
	 */
	@Nullable
	SourceLocation sourceLocation();

	/**
	 * Dispatches to the {@link NodeVisitor} method handling this node variant.
	 *
	 * @param visitor the visitor to dispatch to
	 * @param <R>     visitor result type
	 * @return result produced by the visitor
	 */
	<R> R accept(@Nonnull NodeVisitor<R> visitor);

}
