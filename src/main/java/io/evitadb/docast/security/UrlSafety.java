package io.evitadb.docast.security;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * URL classification used by link rewriting and document validation.
 *
 * A URL is dangerous when its scheme can execute code or reach local resources. Any other URL
 * with a scheme must use one of {@link #SAFE_SCHEMES}; URLs without a scheme (paths, fragments,
 * queries) are relative and always accepted.
 */
public final class UrlSafety {

	/**
	 * Schemes accepted in links and images.
	 */
	public static final Set<String> SAFE_SCHEMES = Set.of("http", "https", "mailto", "ftp", "ftps", "tel", "sms");

	/**
	 * Schemes rejected regardless of context.
	 */
	public static final Set<String> DANGEROUS_SCHEMES = Set.of("javascript", "vbscript", "data", "file", "about");

	private static final Pattern SCHEME_PATTERN = Pattern.compile("^([a-zA-Z][a-zA-Z0-9+.\\-]*):");
	// browsers ignore whitespace and control characters inside the scheme, e.g. "java\tscript:"
	private static final Pattern IGNORED_CHARACTERS = Pattern.compile("[\\s\\p{Cntrl}]+");

	private UrlSafety() {
	}

	/**
	 * Returns the lowercased scheme of the URL, or null when the URL is relative.
	 *
	 * @param url URL to inspect
	 * @return scheme without the colon, or null
	 */
	@Nullable
	public static String schemeOf(@Nonnull String url) {
		final Matcher matcher = SCHEME_PATTERN.matcher(IGNORED_CHARACTERS.matcher(url).replaceAll(""));
		return matcher.find() ? matcher.group(1).toLowerCase(Locale.ROOT) : null;
	}

	/**
	 * Returns true when the URL uses one of {@link #DANGEROUS_SCHEMES}.
	 *
	 * @param url URL to inspect
	 * @return true for dangerous URLs
	 */
	public static boolean isDangerous(@Nonnull String url) {
		final String scheme = schemeOf(url);
		return scheme != null && DANGEROUS_SCHEMES.contains(scheme);
	}

	/**
	 * Returns true when the URL has no scheme, i.e. it is a path, a fragment or a query.
	 *
	 * @param url URL to inspect
	 * @return true for relative URLs
	 */
	public static boolean isRelative(@Nonnull String url) {
		return url.startsWith("/") || url.startsWith("#") || url.startsWith("?") || schemeOf(url) == null;
	}

	/**
	 * Validates the URL, rejecting data URIs.
	 *
	 * @param url     URL to validate, empty URLs pass
	 * @param context what kind of URL is checked, used in the error message
	 * @throws UnsafeUrlException when the URL is dangerous or uses an unknown scheme
	 * @see #validate(String, String, boolean)
	 */
	public static void validate(@Nonnull String url, @Nonnull String context) {
		validate(url, context, false);
	}

	/**
	 * Validates the URL.
	 *
	 * @param url             URL to validate, empty URLs pass
	 * @param context         what kind of URL is checked, used in the error message
	 * @param allowDataImages whether {@code data:image/...} URIs are accepted
	 * @throws UnsafeUrlException when the URL is dangerous or uses an unknown scheme
	 */
	public static void validate(@Nonnull String url, @Nonnull String context, boolean allowDataImages) {
		if (url.isEmpty() || isRelative(url)) {
			return;
		}
		final String scheme = schemeOf(url);
		if (scheme == null) {
			return;
		}
		if (allowDataImages && "data".equals(scheme) && url.trim().toLowerCase(Locale.ROOT).startsWith("data:image/")) {
			return;
		}
		if (DANGEROUS_SCHEMES.contains(scheme)) {
			throw new UnsafeUrlException(context, scheme, url, true);
		}
		if (!SAFE_SCHEMES.contains(scheme)) {
			throw new UnsafeUrlException(context, scheme, url, false);
		}
	}
}
