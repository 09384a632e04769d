package io.evitadb.docast.node;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("Node records should validate their fields and stay immutable")
public class NodeModelTest {

	@Test
	@DisplayName("shouldRejectHeadingLevelOutsideRange")
	public void shouldRejectHeadingLevelOutsideRange() {
		assertThrows(IllegalArgumentException.class, () -> Heading.of(0, "Zero"));
		assertThrows(IllegalArgumentException.class, () -> Heading.of(7, "Seven"));
		assertEquals(6, Heading.of(6, "Six").level());
	}

	@Test
	@DisplayName("shouldRejectInvalidTableCellSpans")
	public void shouldRejectInvalidTableCellSpans() {
		assertThrows(IllegalArgumentException.class, () -> new TableCell(List.of(), 0, 1, null, Metadata.empty(), null));
		assertThrows(IllegalArgumentException.class, () -> new TableCell(List.of(), 1, 0, null, Metadata.empty(), null));
	}

	@Test
	@DisplayName("shouldRejectInvalidCodeFence")
	public void shouldRejectInvalidCodeFence() {
		assertThrows(IllegalArgumentException.class, () -> new CodeBlock("x", null, '-', 3, Metadata.empty(), null));
		assertThrows(IllegalArgumentException.class, () -> new CodeBlock("x", null, '`', 2, Metadata.empty(), null));
	}

	@Test
	@DisplayName("shouldCopyChildListsOnConstruction")
	public void shouldCopyChildListsOnConstruction() {
		final List<Block> children = new ArrayList<>(List.of(Paragraph.of("a")));
		final Document document = new Document(children);
		children.add(Paragraph.of("b"));

		assertEquals(1, document.children().size());
		assertThrows(UnsupportedOperationException.class, () -> document.children().add(Paragraph.of("c")));
	}

	@Test
	@DisplayName("shouldKeepMetadataWhenChildrenReplaced")
	public void shouldKeepMetadataWhenChildrenReplaced() {
		final Document document = new Document(List.of(Paragraph.of("a")), Metadata.of("title", "T"));
		final Document replaced = document.withChildren(List.of(Paragraph.of("b")));

		assertNotSame(document, replaced);
		assertEquals("T", replaced.metadata().getString("title").orElse(null));
		assertEquals(Paragraph.of("a"), document.children().get(0));
	}

	@Test
	@DisplayName("shouldExposeHeaderFirstInAllRows")
	public void shouldExposeHeaderFirstInAllRows() {
		final TableRow header = new TableRow(List.of(TableCell.of("H")), true);
		final TableRow row = new TableRow(List.of(TableCell.of("R")), false);
		final Table table = new Table(header, List.of(row));

		assertEquals(List.of(header, row), table.allRows());
		assertEquals(List.of(row), new Table(null, List.of(row)).allRows());
	}

	@Test
	@DisplayName("shouldSeparateWellKnownMetadataFromCustomEntries")
	public void shouldSeparateWellKnownMetadataFromCustomEntries() {
		final Metadata metadata = Metadata.of(DocumentMetadata.TITLE, "Guide")
			.with(DocumentMetadata.KEYWORDS, List.of("java", "ast"))
			.with("reviewed", true);

		final DocumentMetadata documentMetadata = DocumentMetadata.from(metadata);

		assertEquals("Guide", documentMetadata.title());
		assertNull(documentMetadata.author());
		assertEquals(List.of("java", "ast"), documentMetadata.keywords());
		assertEquals(true, documentMetadata.custom().get("reviewed"));
		assertEquals(metadata.asMap().keySet(), documentMetadata.toMetadata().asMap().keySet());
	}
}
