package io.evitadb.docast.transform;

import io.evitadb.docast.node.Document;
import io.evitadb.docast.node.Heading;
import io.evitadb.docast.node.ListBlock;
import io.evitadb.docast.node.ListItem;
import io.evitadb.docast.node.Metadata;
import io.evitadb.docast.node.Node;
import io.evitadb.docast.node.Paragraph;
import io.evitadb.docast.node.Text;
import io.evitadb.docast.node.ThematicBreak;
import io.evitadb.docast.visitor.NodeCollectorTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Transforms should extract, filter, clone and merge documents")
public class TransformsTest {

	@Test
	@DisplayName("shouldExtractNodesOfType")
	public void shouldExtractNodesOfType() {
		final Document document = NodeCollectorTest.sampleDocument();

		final List<Text> texts = Transforms.extractNodes(document, Text.class);

		assertEquals(new Text("Title"), texts.get(0));
		assertEquals(11, texts.size());
		assertSame(document, Transforms.extractNodes(document).get(0));
	}

	@Test
	@DisplayName("shouldRemoveRejectedNodeWithItsSubtree")
	public void shouldRemoveRejectedNodeWithItsSubtree() {
		final Document document = NodeCollectorTest.sampleDocument();

		final Document filtered = Transforms.filterNodes(document, node -> !(node instanceof ListBlock));

		assertEquals(4, filtered.children().size());
		assertTrue(Transforms.extractNodes(filtered, ListItem.class).isEmpty());
		assertTrue(Transforms.extractNodes(filtered, Text.class).stream().noneMatch(text -> "one".equals(text.content())));
	}

	@Test
	@DisplayName("shouldKeepDocumentRootWhenFiltering")
	public void shouldKeepDocumentRootWhenFiltering() {
		final Document document = new Document(List.of(Paragraph.of("text")), Metadata.of("title", "Kept"));

		final Document filtered = Transforms.filterNodes(document, node -> false);

		assertTrue(filtered.children().isEmpty());
		assertEquals(Optional.of("Kept"), filtered.metadata().getString("title"));
	}

	@Test
	@DisplayName("shouldRejectTransformerRemovingRoot")
	public void shouldRejectTransformerRemovingRoot() {
		final NodeTransformer transformer = new NodeTransformer() {
			@Override
			public Node visit(@Nonnull Document document) {
				return null;
			}
		};

		assertThrows(IllegalStateException.class, () -> Transforms.transformNodes(Document.of(), transformer));
	}

	@Test
	@DisplayName("shouldMergeDocumentsWithLastWriteWins")
	public void shouldMergeDocumentsWithLastWriteWins() {
		final Document first = new Document(
			List.of(Heading.of(1, "First")),
			Metadata.empty().with("v", "1.0").with("a", "Alice")
		);
		final Document second = new Document(
			List.of(new ThematicBreak(), Heading.of(1, "Second")),
			Metadata.empty().with("v", "2.0").with("d", "2025")
		);

		final Document merged = Transforms.mergeDocuments(List.of(first, second));

		assertEquals(List.of(Heading.of(1, "First"), new ThematicBreak(), Heading.of(1, "Second")), merged.children());
		assertEquals(Metadata.empty().with("v", "2.0").with("a", "Alice").with("d", "2025"), merged.metadata());
	}

	@Test
	@DisplayName("shouldMergeMetadataWithAlternativePolicies")
	public void shouldMergeMetadataWithAlternativePolicies() {
		final Document first = new Document(List.of(), Metadata.empty().with("v", "1.0").with("tags", List.of("x")));
		final Document second = new Document(List.of(), Metadata.empty().with("v", "2.0").with("tags", List.of("y")));

		final Metadata firstWins = Transforms.mergeDocuments(List.of(first, second), MetadataMerger.FIRST_WRITE_WINS).metadata();
		final Metadata lists = Transforms.mergeDocuments(List.of(first, second), MetadataMerger.MERGE_LISTS).metadata();

		assertEquals(Optional.of("1.0"), firstWins.getString("v"));
		assertEquals(Optional.of(List.of("x")), firstWins.getList("tags"));
		assertEquals(Optional.of("2.0"), lists.getString("v"));
		assertEquals(Optional.of(List.of("x", "y")), lists.getList("tags"));
	}

	@Test
	@DisplayName("shouldMergeEmptyListIntoEmptyDocument")
	public void shouldMergeEmptyListIntoEmptyDocument() {
		final Document merged = Transforms.mergeDocuments(List.of());

		assertTrue(merged.children().isEmpty());
		assertTrue(merged.metadata().isEmpty());
	}
}
