package io.evitadb.docast.serialization;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.evitadb.docast.node.Alignment;
import io.evitadb.docast.node.BlockQuote;
import io.evitadb.docast.node.Code;
import io.evitadb.docast.node.CodeBlock;
import io.evitadb.docast.node.Comment;
import io.evitadb.docast.node.CommentInline;
import io.evitadb.docast.node.DefinitionDescription;
import io.evitadb.docast.node.DefinitionList;
import io.evitadb.docast.node.DefinitionTerm;
import io.evitadb.docast.node.Document;
import io.evitadb.docast.node.Emphasis;
import io.evitadb.docast.node.FootnoteDefinition;
import io.evitadb.docast.node.FootnoteReference;
import io.evitadb.docast.node.Heading;
import io.evitadb.docast.node.HtmlBlock;
import io.evitadb.docast.node.HtmlInline;
import io.evitadb.docast.node.Image;
import io.evitadb.docast.node.LineBreak;
import io.evitadb.docast.node.Link;
import io.evitadb.docast.node.ListBlock;
import io.evitadb.docast.node.ListItem;
import io.evitadb.docast.node.MathBlock;
import io.evitadb.docast.node.MathInline;
import io.evitadb.docast.node.MathNotation;
import io.evitadb.docast.node.Metadata;
import io.evitadb.docast.node.Node;
import io.evitadb.docast.node.Paragraph;
import io.evitadb.docast.node.SourceLocation;
import io.evitadb.docast.node.Strikethrough;
import io.evitadb.docast.node.Strong;
import io.evitadb.docast.node.Subscript;
import io.evitadb.docast.node.Superscript;
import io.evitadb.docast.node.Table;
import io.evitadb.docast.node.TableCell;
import io.evitadb.docast.node.TableRow;
import io.evitadb.docast.node.TaskStatus;
import io.evitadb.docast.node.Text;
import io.evitadb.docast.node.ThematicBreak;
import io.evitadb.docast.node.Underline;
import io.evitadb.docast.visitor.NodeCollectorTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("AstSerializer should convert node trees to JSON and back")
public class AstSerializerTest {

	private final AstSerializer serializer = new AstSerializer();

	private static Document everyVariant() {
		final Map<String, Object> nested = new LinkedHashMap<>();
		nested.put("name", "Ann");
		nested.put("age", 42);
		final Map<String, Object> documentMetadata = new LinkedHashMap<>();
		documentMetadata.put("title", "All nodes");
		documentMetadata.put("draft", true);
		documentMetadata.put("ratio", 1.5);
		documentMetadata.put("keywords", List.of("ast", "json"));
		documentMetadata.put("author", nested);

		final SourceLocation location = new SourceLocation("markdown", null, 3, 1, "h-1");
		final Table table = new Table(
			new TableRow(List.of(TableCell.of("Name"), TableCell.of("Value")), true),
			List.of(new TableRow(
				List.of(
					new TableCell(List.of(new Text("a")), 1, 2, Alignment.CENTER, Metadata.empty(), null),
					TableCell.of("b")
				),
				false
			)),
			Arrays.asList(Alignment.LEFT, null),
			"Caption",
			Metadata.empty(),
			null
		);

		return new Document(
			List.of(
				new Heading(2, List.of(new Text("Title")), Metadata.of("id", "title"), location),
				Paragraph.of(
					new Text("plain "),
					new Strong(List.of(new Text("bold"))),
					new Emphasis(List.of(new Text("em"))),
					new Strikethrough(List.of(new Text("gone"))),
					new Underline(List.of(new Text("under"))),
					new Superscript(List.of(new Text("2"))),
					new Subscript(List.of(new Text("i"))),
					new Code("x = 1"),
					new Link("https://example.com", List.of(new Text("site")), "Example", Metadata.empty(), null),
					new Image("img.png", "alt", "Picture", 640, 480, Metadata.empty(), null),
					new LineBreak(true),
					new LineBreak(false),
					new HtmlInline("<kbd>"),
					new CommentInline("inline note"),
					new FootnoteReference("1"),
					new MathInline("\\alpha", MathNotation.LATEX, Metadata.empty(), null)
				),
				new CodeBlock("print()", "python", '~', 4, Metadata.empty(), null),
				new CodeBlock("plain", null),
				new BlockQuote(List.of(Paragraph.of("quoted"))),
				new ListBlock(
					true,
					List.of(
						new ListItem(List.of(Paragraph.of("done")), TaskStatus.CHECKED, Metadata.empty(), null),
						new ListItem(List.of(Paragraph.of("open")), TaskStatus.UNCHECKED, Metadata.empty(), null),
						new ListItem(List.of(Paragraph.of("plain")))
					),
					3,
					false,
					Metadata.empty(),
					null
				),
				new DefinitionList(List.of(new DefinitionList.Entry(
					new DefinitionTerm(List.of(new Text("term"))),
					List.of(
						new DefinitionDescription(List.of(Paragraph.of("first"))),
						new DefinitionDescription(List.of(Paragraph.of("second")))
					)
				))),
				table,
				new ThematicBreak(),
				new HtmlBlock("<div>raw</div>"),
				new Comment("review me", "docx_review", Metadata.of("author", "Bob"), null),
				new MathBlock("<math/>", MathNotation.MATHML, Metadata.empty(), null),
				new FootnoteDefinition("1", List.of(Paragraph.of("note")))
			),
			Metadata.of(documentMetadata),
			new SourceLocation("markdown", 1, null, null, null)
		);
	}

	@Test
	@DisplayName("shouldRoundTripEveryNodeVariantThroughJson")
	public void shouldRoundTripEveryNodeVariantThroughJson() {
		final Document document = everyVariant();

		final String json = this.serializer.toJson(document);

		assertEquals(document, this.serializer.fromJson(json));
		assertEquals(document, this.serializer.documentFromJson(json));
	}

	@Test
	@DisplayName("shouldRoundTripSampleDocumentWhenPrettyPrinted")
	public void shouldRoundTripSampleDocumentWhenPrettyPrinted() {
		final Document document = NodeCollectorTest.sampleDocument();

		final String json = this.serializer.toJson(document, true);

		assertTrue(json.contains("\n"), "Pretty output should be indented");
		assertEquals(document, this.serializer.fromJson(json));
	}

	@Test
	@DisplayName("shouldWriteTypeNamesAndSnakeCaseFields")
	public void shouldWriteTypeNamesAndSnakeCaseFields() {
		final ObjectNode tree = this.serializer.toTree(everyVariant());
		final JsonNode children = tree.get("children");

		assertEquals("Document", tree.get(AstSerializer.NODE_TYPE).asText());
		assertEquals("markdown", tree.get("source_location").get("format").asText());
		assertEquals("SourceLocation", tree.get("source_location").get(AstSerializer.NODE_TYPE).asText());
		assertEquals(1, tree.get("source_location").get("page").asInt());
		assertFalse(tree.get("source_location").has("line"), "Unset location fields should be omitted");
		assertEquals("h-1", children.get(0).get("source_location").get("element_id").asText());

		final JsonNode codeBlock = children.get(2);
		assertEquals("CodeBlock", codeBlock.get(AstSerializer.NODE_TYPE).asText());
		assertEquals("~", codeBlock.get("fence_char").asText());
		assertEquals(4, codeBlock.get("fence_length").asInt());
		assertFalse(children.get(3).has("language"), "Missing language should be omitted");

		final JsonNode list = children.get(5);
		assertEquals("List", list.get(AstSerializer.NODE_TYPE).asText());
		assertEquals("checked", list.get("items").get(0).get("task_status").asText());
		assertFalse(list.get("items").get(2).has("task_status"));

		final JsonNode definitions = children.get(6).get("items").get(0);
		assertEquals("DefinitionTerm", definitions.get("term").get(AstSerializer.NODE_TYPE).asText());
		assertEquals(2, definitions.get("descriptions").size());

		final JsonNode table = children.get(7);
		assertTrue(table.get("header").get("is_header").asBoolean());
		assertEquals("left", table.get("alignments").get(0).asText());
		assertTrue(table.get("alignments").get(1).isNull());

		assertEquals("HTMLBlock", children.get(9).get(AstSerializer.NODE_TYPE).asText());
		assertEquals("mathml", children.get(11).get("notation").asText());

		final JsonNode image = children.get(1).get("content").get(9);
		assertEquals("img.png", image.get("url").asText());
		assertEquals("alt", image.get("alt_text").asText());
		assertEquals(640, image.get("width").asInt());
		assertEquals("HTMLInline", children.get(1).get("content").get(12).get(AstSerializer.NODE_TYPE).asText());
	}

	@Test
	@DisplayName("shouldAlwaysWriteMetadataAndOmitMissingSourceLocation")
	public void shouldAlwaysWriteMetadataAndOmitMissingSourceLocation() {
		final ObjectNode tree = this.serializer.toTree(new Text("hello"));

		assertTrue(tree.get("metadata").isObject());
		assertTrue(tree.get("metadata").isEmpty());
		assertFalse(tree.has("source_location"));
		assertEquals("hello", tree.get("content").asText());
	}

	@Test
	@DisplayName("shouldApplyNodeDefaultsForOmittedFields")
	public void shouldApplyNodeDefaultsForOmittedFields() {
		final Node codeBlock = this.serializer.fromJson("{\"node_type\":\"CodeBlock\",\"content\":\"x\"}");
		final Node list = this.serializer.fromJson("{\"node_type\":\"List\",\"items\":[]}");
		final Node cell = this.serializer.fromJson("{\"node_type\":\"TableCell\",\"content\":[]}");

		assertEquals(new CodeBlock("x", null), codeBlock);
		assertEquals(new ListBlock(false, List.of()), list);
		assertEquals(new TableCell(List.of()), cell);
	}

	@Test
	@DisplayName("shouldWriteTemporalMetadataAsIsoText")
	public void shouldWriteTemporalMetadataAsIsoText() {
		final Document document = new Document(List.of(), Metadata.of("creation_date", LocalDate.of(2025, 3, 1)));

		final Document restored = this.serializer.documentFromJson(this.serializer.toJson(document));

		assertEquals("2025-03-01", restored.metadata().getString("creation_date").orElseThrow());
	}

	@Test
	@DisplayName("shouldRejectMissingOrUnknownNodeType")
	public void shouldRejectMissingOrUnknownNodeType() {
		final IllegalArgumentException missing = assertThrows(
			IllegalArgumentException.class,
			() -> this.serializer.fromJson("{\"content\":\"x\"}")
		);
		final IllegalArgumentException unknown = assertThrows(
			IllegalArgumentException.class,
			() -> this.serializer.fromJson("{\"node_type\":\"Widget\"}")
		);

		assertEquals("Node object must contain 'node_type' field", missing.getMessage());
		assertEquals("Unknown node type: Widget", unknown.getMessage());
	}

	@Test
	@DisplayName("shouldRejectChildrenThatDoNotFitTheirSlot")
	public void shouldRejectChildrenThatDoNotFitTheirSlot() {
		final String json = "{\"node_type\":\"Paragraph\",\"content\":[{\"node_type\":\"Paragraph\",\"content\":[]}]}";

		final IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> this.serializer.fromJson(json));

		assertEquals("Paragraph cannot contain Paragraph where Inline is expected", ex.getMessage());
	}

	@Test
	@DisplayName("shouldRejectMalformedJsonAndNonDocumentRoots")
	public void shouldRejectMalformedJsonAndNonDocumentRoots() {
		final IllegalArgumentException malformed = assertThrows(
			IllegalArgumentException.class,
			() -> this.serializer.fromJson("{\"node_type\":")
		);
		final IllegalArgumentException notDocument = assertThrows(
			IllegalArgumentException.class,
			() -> this.serializer.documentFromJson(this.serializer.toJson(new Text("x")))
		);

		assertTrue(malformed.getMessage().startsWith("Invalid AST JSON: "), malformed.getMessage());
		assertEquals("Expected Document at the root, got Text", notDocument.getMessage());
	}

	@Test
	@DisplayName("shouldKeepHeaderFlagOfTableHeaderRow")
	public void shouldKeepHeaderFlagOfTableHeaderRow() {
		final String json = "{\"node_type\":\"Table\",\"rows\":[],\"header\":" +
			"{\"node_type\":\"TableRow\",\"cells\":[],\"is_header\":false}}";

		final Table table = assertInstanceOf(Table.class, this.serializer.fromJson(json));

		assertTrue(table.header().header());
	}
}
