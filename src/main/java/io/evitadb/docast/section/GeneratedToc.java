package io.evitadb.docast.section;

import io.evitadb.docast.node.ListBlock;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Result of {@link TableOfContents#generate}: markdown text for {@link TocStyle#MARKDOWN}, a list
 * node for the other styles.
 *
 * @param style    style the table was generated in
 * @param markdown markdown text, set for the markdown style only
 * @param list     list node, set for the list styles only
 */
public record GeneratedToc(
	@Nonnull TocStyle style,
	@Nullable String markdown,
	@Nullable ListBlock list
) {

	public GeneratedToc {
		Objects.requireNonNull(style, "style must not be null");
		if ((style == TocStyle.MARKDOWN) != (markdown != null) || (style != TocStyle.MARKDOWN) != (list != null)) {
			throw new IllegalArgumentException("Style " + style.getName() + " does not match the generated content");
		}
	}

	@Nonnull
	public String asMarkdown() {
		if (this.markdown == null) {
			throw new IllegalStateException("Table of contents was generated as " + this.style.getName() + ", not markdown");
		}
		return this.markdown;
	}

	@Nonnull
	public ListBlock asList() {
		if (this.list == null) {
			throw new IllegalStateException("Table of contents was generated as markdown, not as a list");
		}
		return this.list;
	}
}
