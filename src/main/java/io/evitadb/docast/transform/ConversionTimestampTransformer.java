package io.evitadb.docast.transform;

import io.evitadb.docast.node.Document;
import io.evitadb.docast.node.Node;

import javax.annotation.Nonnull;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Records the time of the conversion in the document metadata.
 *
 * The format is either {@code iso} (ISO-8601 date-time with offset), {@code unix} (epoch seconds)
 * or a {@link DateTimeFormatter} pattern.
 */
public class ConversionTimestampTransformer extends NodeTransformer {

	public static final String DEFAULT_FIELD = "conversion_timestamp";
	public static final String ISO = "iso";
	public static final String UNIX = "unix";

	@Nonnull
	private final String fieldName;
	@Nonnull
	private final String format;
	@Nonnull
	private final Clock clock;

	public ConversionTimestampTransformer() {
		this(DEFAULT_FIELD, ISO, Clock.systemDefaultZone());
	}

	/**
	 * Creates the transformer.
	 *
	 * @param fieldName metadata key of the timestamp
	 * @param format    {@code iso}, {@code unix} or a date-time pattern
	 * @param clock     source of the current time
	 * @throws IllegalArgumentException when the pattern is invalid
	 */
	public ConversionTimestampTransformer(@Nonnull String fieldName, @Nonnull String format, @Nonnull Clock clock) {
		this.fieldName = Objects.requireNonNull(fieldName, "fieldName must not be null");
		this.format = Objects.requireNonNull(format, "format must not be null");
		this.clock = Objects.requireNonNull(clock, "clock must not be null");
		if (!ISO.equals(format) && !UNIX.equals(format)) {
			// validates the pattern
			DateTimeFormatter.ofPattern(format);
		}
	}

	@Override
	public Node visit(@Nonnull Document document) {
		final Document transformed = transformDocument(document);
		return transformed.withMetadata(transformed.metadata().with(this.fieldName, timestamp()));
	}

	@Nonnull
	private String timestamp() {
		final OffsetDateTime now = OffsetDateTime.now(this.clock);
		if (ISO.equals(this.format)) {
			return now.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
		} else if (UNIX.equals(this.format)) {
			return String.valueOf(now.toEpochSecond());
		} else {
			return now.format(DateTimeFormatter.ofPattern(this.format));
		}
	}
}
