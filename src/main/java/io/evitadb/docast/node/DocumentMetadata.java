package io.evitadb.docast.node;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Typed view of the well-known document level metadata fields.
 *
 * Parsers populate {@link Document#metadata()} with a flat map; this record maps the well-known
 * keys to typed components and keeps every other entry in {@link #custom()}. The conversion is
 * lossless in both directions for well-known keys with supported value shapes.
 *
 * @param title            document title
 * @param author           document author
 * @param subject          document subject or description
 * @param keywords         keywords, empty when none
 * @param creationDate     creation date as found in the source (ISO-8601 preferred)
 * @param modificationDate last modification date as found in the source
 * @param creator          application that created the original document
 * @param producer         application that produced the file
 * @param category         document category
 * @param language         document language tag
 * @param custom           all remaining entries in insertion order
 */
public record DocumentMetadata(
	@Nullable String title,
	@Nullable String author,
	@Nullable String subject,
	@Nonnull List<String> keywords,
	@Nullable String creationDate,
	@Nullable String modificationDate,
	@Nullable String creator,
	@Nullable String producer,
	@Nullable String category,
	@Nullable String language,
	@Nonnull Map<String, Object> custom
) {

	public static final String TITLE = "title";
	public static final String AUTHOR = "author";
	public static final String SUBJECT = "subject";
	public static final String KEYWORDS = "keywords";
	public static final String CREATION_DATE = "creation_date";
	public static final String MODIFICATION_DATE = "modification_date";
	public static final String CREATOR = "creator";
	public static final String PRODUCER = "producer";
	public static final String CATEGORY = "category";
	public static final String LANGUAGE = "language";

	private static final Set<String> WELL_KNOWN_KEYS = Set.of(
		TITLE, AUTHOR, SUBJECT, KEYWORDS, CREATION_DATE, MODIFICATION_DATE, CREATOR, PRODUCER, CATEGORY, LANGUAGE
	);

	public DocumentMetadata {
		keywords = List.copyOf(Objects.requireNonNull(keywords, "keywords must not be null"));
		// validates value types and freezes the map
		custom = Metadata.of(Objects.requireNonNull(custom, "custom must not be null")).asMap();
	}

	/**
	 * Reads the typed view from raw metadata. String keyword values are split on commas.
	 *
	 * @param metadata raw document metadata
	 * @return typed view
	 */
	@Nonnull
	public static DocumentMetadata from(@Nonnull Metadata metadata) {
		Objects.requireNonNull(metadata, "metadata must not be null");
		final Map<String, Object> custom = new LinkedHashMap<>();
		for (final Map.Entry<String, Object> entry : metadata.asMap().entrySet()) {
			if (!WELL_KNOWN_KEYS.contains(entry.getKey())) {
				custom.put(entry.getKey(), entry.getValue());
			}
		}
		return new DocumentMetadata(
			stringValue(metadata, TITLE),
			stringValue(metadata, AUTHOR),
			stringValue(metadata, SUBJECT),
			keywordsValue(metadata),
			stringValue(metadata, CREATION_DATE),
			stringValue(metadata, MODIFICATION_DATE),
			stringValue(metadata, CREATOR),
			stringValue(metadata, PRODUCER),
			stringValue(metadata, CATEGORY),
			stringValue(metadata, LANGUAGE),
			custom
		);
	}

	/**
	 * Converts the typed view back to a flat metadata map. Null fields and empty keywords are
	 * omitted; custom entries follow the well-known ones.
	 *
	 * @return raw metadata
	 */
	@Nonnull
	public Metadata toMetadata() {
		final Map<String, Object> result = new LinkedHashMap<>();
		putIfPresent(result, TITLE, this.title);
		putIfPresent(result, AUTHOR, this.author);
		putIfPresent(result, SUBJECT, this.subject);
		if (!this.keywords.isEmpty()) {
			result.put(KEYWORDS, this.keywords);
		}
		putIfPresent(result, CREATION_DATE, this.creationDate);
		putIfPresent(result, MODIFICATION_DATE, this.modificationDate);
		putIfPresent(result, CREATOR, this.creator);
		putIfPresent(result, PRODUCER, this.producer);
		putIfPresent(result, CATEGORY, this.category);
		putIfPresent(result, LANGUAGE, this.language);
		result.putAll(this.custom);
		return Metadata.of(result);
	}

	private static void putIfPresent(@Nonnull Map<String, Object> target, @Nonnull String key, @Nullable String value) {
		if (value != null) {
			target.put(key, value);
		}
	}

	@Nullable
	private static String stringValue(@Nonnull Metadata metadata, @Nonnull String key) {
		return metadata.get(key).map(String::valueOf).orElse(null);
	}

	@Nonnull
	private static List<String> keywordsValue(@Nonnull Metadata metadata) {
		final Object value = metadata.get(KEYWORDS).orElse(null);
		final List<String> result = new ArrayList<>();
		if (value instanceof List<?> list) {
			for (final Object item : list) {
				result.add(String.valueOf(item));
			}
		} else if (value != null) {
			for (final String part : String.valueOf(value).split(",")) {
				final String trimmed = part.trim();
				if (!trimmed.isEmpty()) {
					result.add(trimmed);
				}
			}
		}
		return result;
	}
}
