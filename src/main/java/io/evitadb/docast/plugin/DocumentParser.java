package io.evitadb.docast.plugin;

import io.evitadb.docast.node.Document;
import io.evitadb.docast.node.Metadata;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Produces a {@link Document} from the raw input of one source format.
 */
public interface DocumentParser {

	/**
	 * Parses textual input.
	 *
	 * @param content source text
	 * @return parsed document
	 * @throws ConversionException when the content cannot be parsed
	 */
	@Nonnull
	Document parse(@Nonnull String content) throws ConversionException;

	/**
	 * Parses input read from the stream as UTF-8. The stream is not closed.
	 *
	 * @param input source stream
	 * @return parsed document
	 * @throws ConversionException when the input cannot be read or parsed
	 */
	@Nonnull
	default Document parse(@Nonnull InputStream input) throws ConversionException {
		final String content;
		try {
			content = new String(input.readAllBytes(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new ConversionException(ConversionStage.INPUT_READING, "Failed to read input: " + e.getMessage(), e);
		}
		return parse(content);
	}

	/**
	 * Extracts document metadata only. Parsers that can read metadata without parsing the body
	 * override this method; the default parses the whole input.
	 *
	 * @param content source text
	 * @return document metadata
	 * @throws ConversionException when the metadata cannot be extracted
	 */
	@Nonnull
	default Metadata extractMetadata(@Nonnull String content) throws ConversionException {
		return parse(content).metadata();
	}
}
