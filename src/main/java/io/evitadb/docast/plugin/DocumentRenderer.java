package io.evitadb.docast.plugin;

import io.evitadb.docast.node.Document;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Produces the output of one target format from a {@link Document}. Implementations document the
 * {@link FallbackPolicy} they apply to node types the target format cannot express.
 */
public interface DocumentRenderer {

	/**
	 * Renders the document to text.
	 *
	 * @param document document to render
	 * @return rendered content
	 * @throws ConversionException when the document cannot be rendered
	 */
	@Nonnull
	String render(@Nonnull Document document) throws ConversionException;

	/**
	 * Renders the document and writes it to the stream as UTF-8. The stream is not closed.
	 *
	 * @param document document to render
	 * @param output   destination
	 * @throws ConversionException when rendering or writing fails
	 */
	default void render(@Nonnull Document document, @Nonnull OutputStream output) throws ConversionException {
		final String content = render(document);
		try {
			output.write(content.getBytes(StandardCharsets.UTF_8));
			output.flush();
		} catch (IOException e) {
			throw new ConversionException(ConversionStage.OUTPUT_WRITING, "Failed to write output: " + e.getMessage(), e);
		}
	}
}
