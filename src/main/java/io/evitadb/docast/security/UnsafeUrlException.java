package io.evitadb.docast.security;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Exception thrown when a URL uses a dangerous or unrecognized scheme.
 */
public final class UnsafeUrlException extends RuntimeException {

	/**
	 * Maximum number of URL characters reproduced in the message and kept by the exception.
	 */
	public static final int MAX_URL_LENGTH = 50;

	@Nonnull
	private final String scheme;
	@Nonnull
	private final String url;

	/**
	 * Creates a new UnsafeUrlException.
	 *
	 * @param context   what kind of URL was checked, e.g. "Link" or "Image"
	 * @param scheme    the offending scheme, lowercased
	 * @param url       the offending URL, truncated to {@link #MAX_URL_LENGTH} characters
	 * @param dangerous true when the scheme is known to be dangerous, false when it is only unknown
	 */
	public UnsafeUrlException(@Nonnull String context, @Nonnull String scheme, @Nonnull String url, boolean dangerous) {
		super(
			context + " URL " + (dangerous ? "uses dangerous" : "has unrecognized") +
				" scheme '" + scheme + "': " + truncate(url)
		);
		this.scheme = Objects.requireNonNull(scheme, "scheme must not be null");
		this.url = truncate(Objects.requireNonNull(url, "url must not be null"));
	}

	@Nonnull
	private static String truncate(@Nonnull String url) {
		return url.length() > MAX_URL_LENGTH ? url.substring(0, MAX_URL_LENGTH) : url;
	}

	@Nonnull
	public String getScheme() {
		return this.scheme;
	}

	/**
	 * Returns the offending URL truncated to {@link #MAX_URL_LENGTH} characters.
	 *
	 * @return truncated URL
	 */
	@Nonnull
	public String getUrl() {
		return this.url;
	}
}
