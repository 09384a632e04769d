package io.evitadb.docast.section;

/**
 * Where nodes are inserted into an existing section.
 */
public enum InsertPosition {

	/**
	 * Right after the section heading.
	 */
	START,
	/**
	 * Same as {@link #START}.
	 */
	AFTER_HEADING,
	/**
	 * After the last node of the section content.
	 */
	END

}
