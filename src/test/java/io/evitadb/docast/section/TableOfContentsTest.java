package io.evitadb.docast.section;

import io.evitadb.docast.node.Document;
import io.evitadb.docast.node.Heading;
import io.evitadb.docast.node.Link;
import io.evitadb.docast.node.ListBlock;
import io.evitadb.docast.node.ListItem;
import io.evitadb.docast.node.Paragraph;
import io.evitadb.docast.visitor.NodeCollector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("TableOfContents should list document sections")
public class TableOfContentsTest {

	private static Document guide() {
		return Document.of(
			Paragraph.of("Intro text"),
			Heading.of(1, "Guide"),
			Paragraph.of("g"),
			Heading.of(2, "Install"),
			Paragraph.of("i"),
			Heading.of(2, "Usage"),
			Heading.of(3, "Advanced"),
			Heading.of(1, "FAQ")
		);
	}

	private static int itemsWithText(ListBlock list) {
		final NodeCollector collector = new NodeCollector(
			node -> node instanceof ListItem item && !item.children().isEmpty() &&
				item.children().get(0) instanceof Paragraph
		);
		list.accept(collector);
		return collector.getCollected().size();
	}

	@Test
	@DisplayName("shouldGenerateMarkdownOutline")
	public void shouldGenerateMarkdownOutline() {
		final String markdown = TableOfContents.generate(guide(), 3, TocStyle.MARKDOWN).asMarkdown();

		assertEquals(
			"# Table of Contents\n\n" +
				"- [Guide](#guide)\n" +
				"  - [Install](#install)\n" +
				"  - [Usage](#usage)\n" +
				"    - [Advanced](#advanced)\n" +
				"- [FAQ](#faq)",
			markdown
		);
	}

	@Test
	@DisplayName("shouldRespectMaxLevel")
	public void shouldRespectMaxLevel() {
		final String markdown = TableOfContents.generate(guide(), 1, TocStyle.MARKDOWN).asMarkdown();

		assertEquals("# Table of Contents\n\n- [Guide](#guide)\n- [FAQ](#faq)", markdown);
		assertThrows(IllegalArgumentException.class, () -> TableOfContents.generate(guide(), 7, TocStyle.LIST));
	}

	@Test
	@DisplayName("shouldGenerateEmptyMarkdownForDocumentWithoutHeadings")
	public void shouldGenerateEmptyMarkdownForDocumentWithoutHeadings() {
		assertEquals("", TableOfContents.generate(Document.of(Paragraph.of("x")), 3, TocStyle.MARKDOWN).asMarkdown());
	}

	@Test
	@DisplayName("shouldGenerateFlatAndNestedListsWithSameItemCount")
	public void shouldGenerateFlatAndNestedListsWithSameItemCount() {
		final ListBlock flat = TableOfContents.generate(guide(), 3, TocStyle.LIST).asList();
		final ListBlock nested = TableOfContents.generate(guide(), 3, TocStyle.NESTED).asList();

		assertEquals(5, flat.items().size());
		assertEquals(5, itemsWithText(nested));
		assertEquals(2, nested.items().size());

		final ListItem guide = nested.items().get(0);
		assertEquals(Paragraph.of("Guide"), guide.children().get(0));
		final ListBlock guideChildren = (ListBlock) guide.children().get(1);
		assertEquals(2, guideChildren.items().size());
		final ListBlock usageChildren = (ListBlock) guideChildren.items().get(1).children().get(1);
		assertEquals(Paragraph.of("Advanced"), usageChildren.items().get(0).children().get(0));
	}

	@Test
	@DisplayName("shouldBridgeLevelGapWithPreviousItem")
	public void shouldBridgeLevelGapWithPreviousItem() {
		final Document document = Document.of(Heading.of(1, "A"), Heading.of(3, "deep"), Heading.of(1, "B"));

		final ListBlock nested = TableOfContents.generate(document, 3, TocStyle.NESTED).asList();

		assertEquals(3, itemsWithText(nested));
		assertEquals(2, nested.items().size());
		final ListBlock bridged = (ListBlock) nested.items().get(0).children().get(1);
		assertEquals(List.of(new ListItem(List.of(Paragraph.of("deep")))), bridged.items());
		assertEquals(Paragraph.of("B"), nested.items().get(1).children().get(0));
	}

	@Test
	@DisplayName("shouldRejectAccessInWrongStyle")
	public void shouldRejectAccessInWrongStyle() {
		assertThrows(IllegalStateException.class, () -> TableOfContents.generate(guide(), 3, TocStyle.LIST).asMarkdown());
		assertThrows(IllegalStateException.class, () -> TableOfContents.generate(guide(), 3, TocStyle.MARKDOWN).asList());
	}

	@Test
	@DisplayName("shouldInsertLinkedTableAtStart")
	public void shouldInsertLinkedTableAtStart() {
		final Document document = TableOfContents.insert(guide(), TocPosition.START, 2, TocStyle.MARKDOWN);

		assertEquals(Heading.of(1, TableOfContents.TITLE), document.children().get(0));
		final ListBlock list = assertInstanceOf(ListBlock.class, document.children().get(1));
		assertEquals(4, list.items().size());
		assertEquals(
			Paragraph.of(Link.of("#guide", "Guide")),
			list.items().get(0).children().get(0)
		);
		assertEquals(Paragraph.of("Intro text"), document.children().get(2));
	}

	@Test
	@DisplayName("shouldInsertListAfterFirstHeading")
	public void shouldInsertListAfterFirstHeading() {
		final Document document = TableOfContents.insert(guide(), TocPosition.AFTER_FIRST_HEADING, 3, TocStyle.LIST);

		assertEquals(Heading.of(1, "Guide"), document.children().get(1));
		assertInstanceOf(ListBlock.class, document.children().get(2));
		assertEquals(guide().children().size() + 1, document.children().size());
	}

	@Test
	@DisplayName("shouldLeaveDocumentWithoutHeadingsUnchanged")
	public void shouldLeaveDocumentWithoutHeadingsUnchanged() {
		final Document document = Document.of(Paragraph.of("x"));

		assertEquals(document, TableOfContents.insert(document, TocPosition.START, 3, TocStyle.MARKDOWN));
	}

	@Test
	@DisplayName("shouldParseStyleAndPositionNames")
	public void shouldParseStyleAndPositionNames() {
		assertSame(TocStyle.NESTED, TocStyle.fromName("nested"));
		assertSame(TocPosition.AFTER_FIRST_HEADING, TocPosition.fromName("after_first_heading"));
		assertEquals(
			"Invalid style: fancy. Expected one of markdown, list, nested.",
			assertThrows(IllegalArgumentException.class, () -> TocStyle.fromName("fancy")).getMessage()
		);
		assertThrows(IllegalArgumentException.class, () -> TocPosition.fromName("end"));
	}
}
