package io.evitadb.docast.node;

/**
 * Marker for nodes that may appear as direct children of a {@link Document} or of other
 * block containers (block quotes, list items, footnote definitions).
 */
public interface Block extends Node {
}
