package io.evitadb.docast.section;

import io.evitadb.docast.node.Document;
import io.evitadb.docast.node.Metadata;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * One part of a split document.
 *
 * @param document  the part as a standalone document carrying the source document metadata
 * @param index     1-based position of the part
 * @param title     heading text, "Preamble" or "Part N" depending on the strategy, or null
 * @param wordCount approximate number of words in the part
 * @param metadata  information about the split itself (e.g. the strategy chosen automatically)
 */
public record SplitResult(
	@Nonnull Document document,
	int index,
	@Nullable String title,
	int wordCount,
	@Nonnull Metadata metadata
) {

	/**
	 * Longest slug produced by {@link #filenameSlug()}.
	 */
	public static final int MAX_SLUG_LENGTH = 100;

	public SplitResult {
		Objects.requireNonNull(document, "document must not be null");
		Objects.requireNonNull(metadata, "metadata must not be null");
		if (index < 1) {
			throw new IllegalArgumentException("index must be at least 1, got " + index);
		}
	}

	public SplitResult(@Nonnull Document document, int index, @Nullable String title, int wordCount) {
		this(document, index, title, wordCount, Metadata.empty());
	}

	/**
	 * Returns a file system safe slug of the title.
	 *
	 * @return slug of at most {@value #MAX_SLUG_LENGTH} characters, empty when there is no title
	 */
	@Nonnull
	public String filenameSlug() {
		if (this.title == null || this.title.isBlank()) {
			return "";
		}
		final String slug = Slugifier.slugify(this.title);
		if (slug.length() <= MAX_SLUG_LENGTH) {
			return slug;
		}
		return slug.substring(0, MAX_SLUG_LENGTH).replaceAll("-+$", "");
	}

	/**
	 * Returns a copy with an additional split metadata entry.
	 *
	 * @param key   metadata key
	 * @param value metadata value
	 * @return new result
	 */
	@Nonnull
	public SplitResult with(@Nonnull String key, @Nonnull Object value) {
		return new SplitResult(this.document, this.index, this.title, this.wordCount, this.metadata.with(key, value));
	}
}
