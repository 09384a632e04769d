package io.evitadb.docast.section;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Exception thrown when a section mutation cannot resolve its target section.
 */
public final class SectionNotFoundException extends RuntimeException {

	@Nonnull
	private final SectionTarget target;

	public SectionNotFoundException(@Nonnull SectionTarget target) {
		super("Target section not found: " + target);
		this.target = Objects.requireNonNull(target, "target must not be null");
	}

	@Nonnull
	public SectionTarget getTarget() {
		return this.target;
	}
}
