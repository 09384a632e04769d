package io.evitadb.docast.visitor;

import io.evitadb.docast.node.DefinitionDescription;
import io.evitadb.docast.node.DefinitionList;
import io.evitadb.docast.node.DefinitionTerm;
import io.evitadb.docast.node.Document;
import io.evitadb.docast.node.Heading;
import io.evitadb.docast.node.ListBlock;
import io.evitadb.docast.node.ListItem;
import io.evitadb.docast.node.Node;
import io.evitadb.docast.node.Paragraph;
import io.evitadb.docast.node.Strong;
import io.evitadb.docast.node.Table;
import io.evitadb.docast.node.TableCell;
import io.evitadb.docast.node.TableRow;
import io.evitadb.docast.node.Text;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;

@DisplayName("NodeCollector should visit every node once in pre-order")
public class NodeCollectorTest {

	public static Document sampleDocument() {
		return Document.of(
			Heading.of(1, "Title"),
			Paragraph.of(new Text("plain "), new Strong(List.of(new Text("bold")))),
			ListBlock.bullet(List.of(
				new ListItem(List.of(Paragraph.of("one"))),
				new ListItem(List.of(Paragraph.of("two")))
			)),
			new Table(
				new TableRow(List.of(TableCell.of("Name"), TableCell.of("Value")), true),
				List.of(new TableRow(List.of(TableCell.of("a"), TableCell.of("b")), false))
			),
			new DefinitionList(List.of(new DefinitionList.Entry(
				new DefinitionTerm(List.of(new Text("term"))),
				List.of(new DefinitionDescription(List.of(Paragraph.of("meaning"))))
			)))
		);
	}

	private static int countRecursively(Node node) {
		int count = 1;
		for (final Node child : Nodes.children(node)) {
			count += countRecursively(child);
		}
		return count;
	}

	@Test
	@DisplayName("shouldCollectEveryNodeOfTheTree")
	public void shouldCollectEveryNodeOfTheTree() {
		final Document document = sampleDocument();
		final NodeCollector collector = NodeCollector.all();
		document.accept(collector);

		// 15 for heading, paragraph and list, 11 for the table, 6 for the definition list
		assertEquals(32, collector.getCollected().size());
		assertEquals(countRecursively(document), collector.getCollected().size());
	}

	@Test
	@DisplayName("shouldCollectInPreOrder")
	public void shouldCollectInPreOrder() {
		final Document document = sampleDocument();
		final NodeCollector collector = NodeCollector.all();
		document.accept(collector);

		final List<Node> collected = collector.getCollected();
		assertSame(document, collected.get(0));
		assertInstanceOf(Heading.class, collected.get(1));
		assertEquals(new Text("Title"), collected.get(2));
		assertInstanceOf(Paragraph.class, collected.get(3));
	}

	@Test
	@DisplayName("shouldCollectOnlyRequestedType")
	public void shouldCollectOnlyRequestedType() {
		final NodeCollector collector = NodeCollector.ofType(TableCell.class);
		sampleDocument().accept(collector);

		assertEquals(4, collector.getCollected().size());
	}

	@Test
	@DisplayName("shouldCollectNodesMatchingPredicate")
	public void shouldCollectNodesMatchingPredicate() {
		final NodeCollector collector = new NodeCollector(node -> node instanceof Text text && text.content().startsWith("t"));
		sampleDocument().accept(collector);

		assertEquals(List.of(new Text("two"), new Text("term")), collector.getCollected());
	}
}
