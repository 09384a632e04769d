package io.evitadb.docast;

import io.evitadb.docast.node.Document;
import io.evitadb.docast.plugin.ConversionException;
import io.evitadb.docast.plugin.DocumentRenderer;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writer renders documents and stores them in target files using UTF-8, creating the parent
 * directories on the way.
 */
public final class Writer {

	@Nonnull
	private final DocumentRenderer renderer;

	public Writer(@Nonnull DocumentRenderer renderer) {
		this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
	}

	/**
	 * Renders the document and writes it to the target file.
	 *
	 * @param document   the document to be written; must not be null
	 * @param targetFile the path to the target file; must not be null
	 * @throws ConversionException if rendering fails
	 * @throws IOException         if an I/O error occurs while creating directories or writing the file
	 */
	public void write(
		@Nonnull final Document document,
		@Nonnull final Path targetFile
	) throws ConversionException, IOException {
		Objects.requireNonNull(document, "document must not be null");
		write(this.renderer.render(document), targetFile);
	}

	/**
	 * Writes already rendered content to the target file.
	 *
	 * @param content    rendered content; must not be null
	 * @param targetFile the path to the target file; must not be null
	 * @throws IOException if an I/O error occurs while creating directories or writing the file
	 */
	public void write(
		@Nonnull final String content,
		@Nonnull final Path targetFile
	) throws IOException {
		Objects.requireNonNull(content, "content must not be null");
		Objects.requireNonNull(targetFile, "targetFile must not be null");

		final Path absolute = targetFile.toAbsolutePath().normalize();
		final Path parent = absolute.getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		Files.write(absolute, content.getBytes(StandardCharsets.UTF_8));
	}

	@Nonnull
	public DocumentRenderer getRenderer() {
		return this.renderer;
	}
}
