package io.evitadb.docast.security;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Exception thrown when a user supplied regular expression could backtrack catastrophically or
 * exceeds the allowed length.
 */
public final class UnsafePatternException extends RuntimeException {

	@Nonnull
	private final String pattern;

	public UnsafePatternException(@Nonnull String pattern, @Nonnull String reason) {
		super("Unsafe regular expression pattern '" + pattern + "': " + reason);
		this.pattern = Objects.requireNonNull(pattern, "pattern must not be null");
	}

	@Nonnull
	public String getPattern() {
		return this.pattern;
	}
}
