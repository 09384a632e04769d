package io.evitadb.docast.section;

/**
 * Criterion used by {@link DocumentSplitter} to cut a document into parts.
 */
public enum SplitStrategy {

	/**
	 * One part per section of any level, preceded by the preamble.
	 */
	SECTIONS,
	/**
	 * One part per section of a single heading level.
	 */
	HEADING,
	/**
	 * Sections accumulated until a target word count is reached.
	 */
	LENGTH,
	/**
	 * A given number of parts of roughly equal word count.
	 */
	PARTS,
	/**
	 * Parts separated by a custom text delimiter.
	 */
	DELIMITER,
	/**
	 * Parts separated by thematic breaks.
	 */
	BREAK,
	/**
	 * Heading level or word count, whichever fits the document.
	 */
	AUTO

}
