package io.evitadb.docast.section;

import io.evitadb.docast.node.Block;
import io.evitadb.docast.node.Document;
import io.evitadb.docast.node.Heading;
import io.evitadb.docast.visitor.Nodes;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A heading together with the top-level nodes that follow it up to the next heading of the same
 * or a more significant level. Sections are computed on demand from a document snapshot and are
 * never stored in the tree; the indexes refer to the children of the document they were computed
 * from.
 *
 * @param heading    the heading opening the section
 * @param content    nodes following the heading that belong to the section
 * @param level      level of the heading
 * @param startIndex index of the heading in the document children
 * @param endIndex   index of the first node after the section, exclusive
 */
public record Section(
	@Nonnull Heading heading,
	@Nonnull List<Block> content,
	int level,
	int startIndex,
	int endIndex
) {

	public Section {
		Objects.requireNonNull(heading, "heading must not be null");
		content = List.copyOf(Objects.requireNonNull(content, "content must not be null"));
		if (startIndex < 0 || endIndex <= startIndex) {
			throw new IllegalArgumentException("Invalid section bounds: start=" + startIndex + ", end=" + endIndex);
		}
	}

	/**
	 * Returns the heading followed by the content.
	 *
	 * @return nodes of the section in document order
	 */
	@Nonnull
	public List<Block> nodes() {
		final List<Block> result = new ArrayList<>(this.content.size() + 1);
		result.add(this.heading);
		result.addAll(this.content);
		return result;
	}

	/**
	 * Creates a standalone document holding the heading and the content.
	 *
	 * @return new document
	 */
	@Nonnull
	public Document toDocument() {
		return new Document(nodes());
	}

	/**
	 * Returns the plain text of the heading.
	 *
	 * @return heading text
	 */
	@Nonnull
	public String headingText() {
		return Nodes.extractText(this.heading);
	}
}
