package io.evitadb.docast;

import io.evitadb.docast.markdown.MarkdownRenderer;
import io.evitadb.docast.node.Document;
import io.evitadb.docast.node.Heading;
import io.evitadb.docast.node.Metadata;
import io.evitadb.docast.node.Paragraph;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Writer should render documents into UTF-8 files")
public class WriterTest {

	private Path tempDir;
	private Writer writer;

	@BeforeEach
	void setUp() throws IOException {
		this.tempDir = Files.createTempDirectory("writer-test-");
		this.writer = new Writer(new MarkdownRenderer());
	}

	@AfterEach
	void tearDown() throws IOException {
		try (Stream<Path> walk = Files.walk(this.tempDir)) {
			walk.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
		}
	}

	@Test
	@DisplayName("creates parent directories")
	public void shouldCreateParentDirectories() throws Exception {
		final Path target = this.tempDir.resolve("a/b/c/out.md");

		this.writer.write("žluťoučký kůň", target);

		assertTrue(Files.exists(target));
		assertEquals("žluťoučký kůň", Files.readString(target, StandardCharsets.UTF_8));
	}

	@Test
	@DisplayName("overwrites an existing file")
	public void shouldOverwriteExistingFile() throws Exception {
		final Path target = this.tempDir.resolve("out.md");
		Files.writeString(target, "old content that is longer", StandardCharsets.UTF_8);

		this.writer.write("new", target);

		assertEquals("new", Files.readString(target, StandardCharsets.UTF_8));
	}

	@Test
	@DisplayName("renders a document with its front matter")
	public void shouldRenderDocument() throws Exception {
		final Path target = this.tempDir.resolve("doc.md");
		final Document document = new Document(
			List.of(Heading.of(1, "Hello"), Paragraph.of("World")),
			Metadata.of("title", "Greeting")
		);

		this.writer.write(document, target);

		assertEquals("---\ntitle: Greeting\n---\n\n# Hello\n\nWorld\n", Files.readString(target, StandardCharsets.UTF_8));
		assertTrue(this.writer.getRenderer() instanceof MarkdownRenderer);
	}
}
