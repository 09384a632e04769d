package io.evitadb.docast.transform;

import io.evitadb.docast.node.Image;
import io.evitadb.docast.node.Link;
import io.evitadb.docast.node.Node;
import io.evitadb.docast.security.UnsafeUrlException;
import io.evitadb.docast.security.UrlSafety;

import javax.annotation.Nonnull;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Rewrites the URLs of links and images with a mapping function.
 *
 * With validation enabled every rewritten URL is checked by {@link UrlSafety} and the first
 * dangerous or unknown scheme aborts the transformation with {@link UnsafeUrlException}, so no
 * partially rewritten tree is ever returned.
 */
public class LinkRewriter extends NodeTransformer {

	@Nonnull
	private final UnaryOperator<String> urlMapper;
	private final boolean validateUrls;

	public LinkRewriter(@Nonnull UnaryOperator<String> urlMapper) {
		this(urlMapper, true);
	}

	public LinkRewriter(@Nonnull UnaryOperator<String> urlMapper, boolean validateUrls) {
		this.urlMapper = Objects.requireNonNull(urlMapper, "urlMapper must not be null");
		this.validateUrls = validateUrls;
	}

	@Override
	public Node visit(@Nonnull Link link) {
		final String url = rewrite(link.url(), "Link");
		return new Link(url, transformInlines(link.content()), link.title(), link.metadata(), link.sourceLocation());
	}

	@Override
	public Node visit(@Nonnull Image image) {
		final String url = rewrite(image.url(), "Image");
		return new Image(
			url, image.altText(), image.title(), image.width(), image.height(),
			image.metadata(), image.sourceLocation()
		);
	}

	@Nonnull
	private String rewrite(@Nonnull String url, @Nonnull String context) {
		final String rewritten = Objects.requireNonNull(
			this.urlMapper.apply(url), "urlMapper returned null for " + url
		);
		if (this.validateUrls) {
			UrlSafety.validate(rewritten, context);
		}
		return rewritten;
	}
}
