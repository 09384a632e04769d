package io.evitadb.docast.markdown;

import io.evitadb.docast.node.Alignment;
import io.evitadb.docast.node.CodeBlock;
import io.evitadb.docast.node.Comment;
import io.evitadb.docast.node.Document;
import io.evitadb.docast.node.Emphasis;
import io.evitadb.docast.node.Heading;
import io.evitadb.docast.node.HtmlBlock;
import io.evitadb.docast.node.Image;
import io.evitadb.docast.node.LineBreak;
import io.evitadb.docast.node.Link;
import io.evitadb.docast.node.ListBlock;
import io.evitadb.docast.node.MathBlock;
import io.evitadb.docast.node.Metadata;
import io.evitadb.docast.node.Paragraph;
import io.evitadb.docast.node.SourceLocation;
import io.evitadb.docast.node.Strikethrough;
import io.evitadb.docast.node.Table;
import io.evitadb.docast.node.TaskStatus;
import io.evitadb.docast.node.Text;
import io.evitadb.docast.node.ThematicBreak;
import io.evitadb.docast.plugin.ConversionException;
import io.evitadb.docast.visitor.Nodes;
import io.evitadb.docast.visitor.StructureValidator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("CommonMarkParser should convert markdown into the document tree")
public class CommonMarkParserTest {

	private final CommonMarkParser parser = new CommonMarkParser();

	@Test
	@DisplayName("shouldReadFrontMatterAndHeadings")
	public void shouldReadFrontMatterAndHeadings() throws ConversionException {
		final Document document = this.parser.parse("---\ntitle: Guide\n---\n# Hello\n\nSome *text*.\n");

		assertEquals(Optional.of("Guide"), document.metadata().getString("title"));
		final Heading heading = assertInstanceOf(Heading.class, document.children().get(0));
		assertEquals(1, heading.level());
		assertEquals("Hello", Nodes.extractText(heading));
		assertEquals(SourceLocation.at("markdown", 4, 1), heading.sourceLocation());

		final Paragraph paragraph = assertInstanceOf(Paragraph.class, document.children().get(1));
		assertEquals(new Text("Some "), paragraph.content().get(0));
		assertEquals(new Emphasis(List.of(new Text("text"))), paragraph.content().get(1));
	}

	@Test
	@DisplayName("shouldExtractMetadataOnly")
	public void shouldExtractMetadataOnly() throws ConversionException {
		final Metadata metadata = this.parser.extractMetadata("---\nauthor: Jane\nkeywords:\n  - a\n  - b\n---\nText\n");

		assertEquals(Optional.of("Jane"), metadata.getString("author"));
		assertEquals(Optional.of(List.of("a", "b")), metadata.getList("keywords"));
	}

	@Test
	@DisplayName("shouldParseFromStream")
	public void shouldParseFromStream() throws ConversionException {
		final Document document = this.parser.parse(new ByteArrayInputStream("Příliš žluťoučký\n".getBytes(StandardCharsets.UTF_8)));

		assertEquals("Příliš žluťoučký", Nodes.extractText(document));
	}

	@Test
	@DisplayName("shouldConvertListsWithTasksAndStartNumber")
	public void shouldConvertListsWithTasksAndStartNumber() throws ConversionException {
		final Document document = this.parser.parse("- [x] done\n- [ ] todo\n- plain\n\n3. third\n4. fourth\n");

		final ListBlock tasks = assertInstanceOf(ListBlock.class, document.children().get(0));
		assertFalse(tasks.ordered());
		assertTrue(tasks.tight());
		assertEquals(TaskStatus.CHECKED, tasks.items().get(0).taskStatus());
		assertEquals(TaskStatus.UNCHECKED, tasks.items().get(1).taskStatus());
		assertNull(tasks.items().get(2).taskStatus());
		assertEquals("done", Nodes.extractText(tasks.items().get(0)).trim());

		final ListBlock ordered = assertInstanceOf(ListBlock.class, document.children().get(1));
		assertTrue(ordered.ordered());
		assertEquals(3, ordered.start());
		assertEquals(2, ordered.items().size());
	}

	@Test
	@DisplayName("shouldConvertCodeAndMathBlocks")
	public void shouldConvertCodeAndMathBlocks() throws ConversionException {
		final Document document = this.parser.parse("```java title\nint x;\n```\n\n~~~~\nraw\n~~~~\n\n```math\nx^2\n```\n");

		final CodeBlock java = assertInstanceOf(CodeBlock.class, document.children().get(0));
		assertEquals("int x;", java.content());
		assertEquals("java", java.language());
		final CodeBlock tilde = assertInstanceOf(CodeBlock.class, document.children().get(1));
		assertEquals('~', tilde.fenceChar());
		assertEquals(4, tilde.fenceLength());
		assertNull(tilde.language());
		assertEquals("x^2", assertInstanceOf(MathBlock.class, document.children().get(2)).content());
	}

	@Test
	@DisplayName("shouldConvertTables")
	public void shouldConvertTables() throws ConversionException {
		final Document document = this.parser.parse("| Name | Size |\n|:-----|-----:|\n| a | 1 |\n| b | 2 |\n");

		final Table table = assertInstanceOf(Table.class, document.children().get(0));
		assertTrue(table.header().header());
		assertEquals("Name", Nodes.extractText(table.header().cells().get(0)));
		assertEquals(Arrays.asList(Alignment.LEFT, Alignment.RIGHT), table.alignments());
		assertEquals(2, table.rows().size());
		assertEquals("2", Nodes.extractText(table.rows().get(1).cells().get(1)));
	}

	@Test
	@DisplayName("shouldSeparateCommentsFromRawHtml")
	public void shouldSeparateCommentsFromRawHtml() throws ConversionException {
		final Document document = this.parser.parse("<!-- editor note -->\n\n<div>box</div>\n\n---\n");

		assertEquals("editor note", assertInstanceOf(Comment.class, document.children().get(0)).content());
		assertEquals("<div>box</div>", assertInstanceOf(HtmlBlock.class, document.children().get(1)).content());
		assertInstanceOf(ThematicBreak.class, document.children().get(2));
	}

	@Test
	@DisplayName("shouldConvertInlineNodes")
	public void shouldConvertInlineNodes() throws ConversionException {
		final Document document = this.parser.parse(
			"[site](https://example.com \"Example\") ![logo *big*](logo.png) ~~old~~\nsoft  \nhard\n"
		);

		final Paragraph paragraph = (Paragraph) document.children().get(0);
		final Link link = assertInstanceOf(Link.class, paragraph.content().get(0));
		assertEquals("https://example.com", link.url());
		assertEquals("Example", link.title());
		final Image image = assertInstanceOf(Image.class, paragraph.content().get(2));
		assertEquals("logo big", image.altText());
		assertNull(image.title());
		assertInstanceOf(Strikethrough.class, paragraph.content().get(4));
		assertTrue(paragraph.content().contains(new LineBreak(true)));
		assertTrue(paragraph.content().contains(new LineBreak(false)));
	}

	@Test
	@DisplayName("shouldProduceStructurallyValidTree")
	public void shouldProduceStructurallyValidTree() throws ConversionException {
		final Document document = this.parser.parse(
			"# T\n\n- a\n- b\n\n| x | y |\n|---|---|\n| 1 | 2 |\n\n> quote\n\nText[^1]\n"
		);

		assertEquals(5, document.children().size());
		assertTrue(StructureValidator.validate(document).isEmpty());
		assertEquals("Text[^1]", Nodes.extractText(document.children().get(4)));
	}
}
