package io.evitadb.docast.markdown;

import io.evitadb.docast.node.Metadata;
import org.commonmark.node.Heading;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("MarkdownDocument should expose front matter and body")
public class MarkdownDocumentTest {

	private static final String CONTENT = "---\n" +
		"title: Guide\n" +
		"tags:\n" +
		"  - java\n" +
		"  - maven\n" +
		"---\n" +
		"# Heading\n\nBody text.\n";

	@Test
	@DisplayName("shouldReadFrontMatterProperties")
	public void shouldReadFrontMatterProperties() {
		final MarkdownDocument document = new MarkdownDocument(CONTENT);

		assertEquals(Optional.of("Guide"), document.getProperty("title"));
		assertEquals(Optional.of("java"), document.getProperty("tags"));
		assertEquals(List.of("java", "maven"), document.getProperties().get("tags"));
		assertFalse(document.getProperty("missing").isPresent());
	}

	@Test
	@DisplayName("shouldConvertPropertiesToMetadata")
	public void shouldConvertPropertiesToMetadata() {
		final Metadata metadata = new MarkdownDocument(CONTENT).toMetadata();

		assertEquals(Optional.of("Guide"), metadata.getString("title"));
		assertEquals(Optional.of(List.of("java", "maven")), metadata.getList("tags"));
		assertEquals(2, metadata.size());
	}

	@Test
	@DisplayName("shouldStripFrontMatterFromBody")
	public void shouldStripFrontMatterFromBody() {
		final MarkdownDocument document = new MarkdownDocument(CONTENT);

		assertEquals("# Heading\n\nBody text.\n", document.getBodyContent());
		assertEquals(CONTENT, document.getRawMarkdown());
		assertInstanceOf(Heading.class, document.getRoot().getFirstChild().getNext());
	}

	@Test
	@DisplayName("shouldHandleDocumentWithoutFrontMatter")
	public void shouldHandleDocumentWithoutFrontMatter() {
		final MarkdownDocument document = new MarkdownDocument("Just text\n");

		assertTrue(document.getProperties().isEmpty());
		assertTrue(document.toMetadata().isEmpty());
		assertEquals("Just text\n", document.getBodyContent());
	}
}
