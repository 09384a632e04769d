package io.evitadb.docast.node;

/**
 * Notation of the source of {@link MathInline} and {@link MathBlock} nodes.
 */
public enum MathNotation {
	LATEX,
	MATHML,
	HTML
}
