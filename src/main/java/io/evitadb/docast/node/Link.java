package io.evitadb.docast.node;

import io.evitadb.docast.visitor.NodeVisitor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Hyperlink around inline content.
 *
 * @param url            link destination, may be relative or a fragment such as {@code #intro}
 * @param content        link text
 * @param title          link title or null
 * @param metadata       node metadata
 * @param sourceLocation provenance
 */
public record Link(
	@Nonnull String url,
	@Nonnull List<Inline> content,
	@Nullable String title,
	@Nonnull Metadata metadata,
	@Nullable SourceLocation sourceLocation
) implements Inline {

	public Link {
		Objects.requireNonNull(url, "url must not be null");
		content = List.copyOf(Objects.requireNonNull(content, "content must not be null"));
		Objects.requireNonNull(metadata, "metadata must not be null");
	}

	public Link(@Nonnull String url, @Nonnull List<Inline> content) {
		this(url, content, null, Metadata.empty(), null);
	}

	/**
	 * Creates a link with plain text content.
	 *
	 * @param url  destination
	 * @param text link text
	 * @return new link
	 */
	@Nonnull
	public static Link of(@Nonnull String url, @Nonnull String text) {
		return new Link(url, List.of(new Text(text)));
	}

	@Override
	public <R> R accept(@Nonnull NodeVisitor<R> visitor) {
		return visitor.visit(this);
	}
}
