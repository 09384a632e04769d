package io.evitadb.docast.node;

/**
 * Checkbox state of a task list item.
 */
public enum TaskStatus {
	CHECKED,
	UNCHECKED
}
