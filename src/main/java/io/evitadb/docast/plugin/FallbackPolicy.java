package io.evitadb.docast.plugin;

/**
 * How a renderer treats a node its target format cannot express.
 */
public enum FallbackPolicy {

	/**
	 * Render the text of the node without its formatting.
	 */
	PLAIN_TEXT,
	/**
	 * Emit raw markup (typically HTML) that preserves the meaning of the node.
	 */
	RAW_MARKUP,
	/**
	 * Leave the node and its content out.
	 */
	DROP

}
