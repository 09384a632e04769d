package io.evitadb.docast.plugin;

import javax.annotation.Nonnull;
import java.util.Locale;

/**
 * Stage of a conversion in which a failure occurred.
 */
public enum ConversionStage {

	INPUT_READING,
	CONTENT_PARSING,
	METADATA_EXTRACTION,
	TRANSFORMING,
	RENDERING,
	OUTPUT_WRITING;

	/**
	 * Returns the lowercase name used in messages and configuration, e.g. {@code content_parsing}.
	 *
	 * @return stage name
	 */
	@Nonnull
	public String getName() {
		return name().toLowerCase(Locale.ROOT);
	}
}
