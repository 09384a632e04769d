package io.evitadb.docast.node;

/**
 * Horizontal alignment of a table column or cell.
 */
public enum Alignment {
	LEFT,
	CENTER,
	RIGHT
}
