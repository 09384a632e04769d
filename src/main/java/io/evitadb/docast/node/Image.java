package io.evitadb.docast.node;

import io.evitadb.docast.visitor.NodeVisitor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Inline image.
 *
 * @param url            image source
 * @param altText        alternative text, empty when missing
 * @param title          image title or null
 * @param width          width in pixels or null
 * @param height         height in pixels or null
 * @param metadata       node metadata
 * @param sourceLocation provenance
 */
public record Image(
	@Nonnull String url,
	@Nonnull String altText,
	@Nullable String title,
	@Nullable Integer width,
	@Nullable Integer height,
	@Nonnull Metadata metadata,
	@Nullable SourceLocation sourceLocation
) implements Inline {

	public Image {
		Objects.requireNonNull(url, "url must not be null");
		Objects.requireNonNull(altText, "altText must not be null");
		Objects.requireNonNull(metadata, "metadata must not be null");
	}

	public Image(@Nonnull String url, @Nonnull String altText) {
		this(url, altText, null, null, null, Metadata.empty(), null);
	}

	@Override
	public <R> R accept(@Nonnull NodeVisitor<R> visitor) {
		return visitor.visit(this);
	}
}
