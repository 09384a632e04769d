package io.evitadb.docast.node;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Provenance of a node in the original input. The core never interprets it, it is only carried
 * along so that renderers or diagnostics can point back to the source.
 *
 * @param format    identifier of the source format (e.g. "markdown", "pdf")
 * @param page      1-based page number for paginated formats
 * @param line      1-based line number for textual formats
 * @param column    1-based column number for textual formats
 * @param elementId format specific element identifier
 */
public record SourceLocation(
	@Nonnull String format,
	@Nullable Integer page,
	@Nullable Integer line,
	@Nullable Integer column,
	@Nullable String elementId
) {

	public SourceLocation {
		Objects.requireNonNull(format, "format must not be null");
	}

	/**
	 * Creates a line/column location in a textual format.
	 *
	 * @param format source format identifier
	 * @param line   1-based line
	 * @param column 1-based column
	 * @return new location
	 */
	@Nonnull
	public static SourceLocation at(@Nonnull String format, int line, int column) {
		return new SourceLocation(format, null, line, column, null);
	}
}
