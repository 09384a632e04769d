package io.evitadb.docast.markdown;

import io.evitadb.docast.node.Metadata;

import javax.annotation.Nonnull;
import java.util.Collection;
import java.util.Map;

/**
 * Serializes document metadata into a YAML front matter block delimited by {@code ---} lines.
 *
 * Strings, numbers, booleans and dates become scalars, lists become block sequences. Nested maps
 * are written as their string form, the front matter reader on the parsing side only understands
 * flat properties.
 */
public final class FrontMatter {

	private FrontMatter() {
	}

	/**
	 * Serializes the metadata into front matter.
	 *
	 * @param metadata metadata to serialize
	 * @return front matter including the delimiters and a trailing new line, or empty string when
	 *         the metadata is empty
	 */
	@Nonnull
	public static String serialize(@Nonnull Metadata metadata) {
		if (metadata.isEmpty()) {
			return "";
		}
		final StringBuilder sb = new StringBuilder("---\n");
		for (final Map.Entry<String, Object> entry : metadata.asMap().entrySet()) {
			final String key = entry.getKey();
			final Object value = entry.getValue();
			if (value instanceof Collection<?> values) {
				if (values.isEmpty()) {
					continue;
				}
				sb.append(key).append(":\n");
				for (final Object item : values) {
					sb.append("  - ").append(scalar(item)).append("\n");
				}
			} else if (value instanceof String text && text.contains("\n")) {
				sb.append(key).append(": |\n");
				for (final String line : text.split("\n", -1)) {
					sb.append("  ").append(line).append("\n");
				}
			} else {
				sb.append(key).append(": ").append(scalar(value)).append("\n");
			}
		}
		sb.append("---\n");
		return sb.toString();
	}

	@Nonnull
	private static String scalar(@Nonnull Object value) {
		if (value instanceof Number || value instanceof Boolean) {
			return String.valueOf(value);
		}
		return quoteIfNeeded(String.valueOf(value));
	}

	/**
	 * Quotes a YAML value if it contains special characters that require quoting.
	 *
	 * @param value the value to potentially quote
	 * @return the quoted value if needed, or the original value
	 */
	@Nonnull
	static String quoteIfNeeded(@Nonnull String value) {
		if (value.isEmpty()) {
			return "''";
		}

		final boolean needsQuoting = value.contains(":") ||
			value.contains("#") ||
			value.contains("'") ||
			value.contains("\"") ||
			value.startsWith("-") ||
			value.startsWith("[") ||
			value.startsWith("{") ||
			value.startsWith("!") ||
			value.startsWith("&") ||
			value.startsWith("*") ||
			value.startsWith(">") ||
			value.startsWith("|") ||
			value.startsWith("@") ||
			value.startsWith("`") ||
			value.matches("^\\d.*") ||
			value.equalsIgnoreCase("true") ||
			value.equalsIgnoreCase("false") ||
			value.equalsIgnoreCase("null") ||
			value.equalsIgnoreCase("yes") ||
			value.equalsIgnoreCase("no");

		if (needsQuoting) {
			// single quotes, embedded single quotes doubled
			return "'" + value.replace("'", "''") + "'";
		}

		return value;
	}
}
