package io.evitadb.docast.markdown;

import io.evitadb.docast.node.Document;
import io.evitadb.docast.node.Metadata;
import io.evitadb.docast.plugin.ConversionException;
import io.evitadb.docast.plugin.ConversionStage;
import io.evitadb.docast.plugin.DocumentParser;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Parses markdown with CommonMark and the GFM table, strikethrough and task list extensions. The
 * YAML front matter becomes the document metadata.
 *
 * @author Jan Novotný (novotny@fg.cz), FG Forrest a.s. (c) 2025
 */
public class CommonMarkParser implements DocumentParser {

	@Nonnull
	@Override
	public Document parse(@Nonnull String content) throws ConversionException {
		Objects.requireNonNull(content, "content must not be null");
		final MarkdownDocument markdown = new MarkdownDocument(content);
		final Metadata metadata = metadata(markdown);
		try {
			return new CommonMarkConverter().convert(markdown.getRoot(), metadata);
		} catch (RuntimeException e) {
			throw new ConversionException(ConversionStage.CONTENT_PARSING, "Failed to convert markdown: " + e.getMessage(), e);
		}
	}

	/**
	 * Reads the front matter only, the markdown body is not converted.
	 */
	@Nonnull
	@Override
	public Metadata extractMetadata(@Nonnull String content) throws ConversionException {
		Objects.requireNonNull(content, "content must not be null");
		return metadata(new MarkdownDocument(content));
	}

	@Nonnull
	private static Metadata metadata(@Nonnull MarkdownDocument markdown) throws ConversionException {
		try {
			return markdown.toMetadata();
		} catch (IllegalArgumentException e) {
			throw new ConversionException(ConversionStage.METADATA_EXTRACTION, "Invalid front matter: " + e.getMessage(), e);
		}
	}
}
