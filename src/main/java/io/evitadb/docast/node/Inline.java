package io.evitadb.docast.node;

/**
 * Marker for nodes that live inside the inline content of a paragraph, heading, table cell or
 * another inline container. Inline nodes are never direct children of a {@link Document}.
 */
public interface Inline extends Node {
}
