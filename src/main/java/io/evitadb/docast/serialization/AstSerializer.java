package io.evitadb.docast.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.evitadb.docast.node.Alignment;
import io.evitadb.docast.node.Block;
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
import io.evitadb.docast.node.Inline;
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
import io.evitadb.docast.visitor.NodeVisitor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Converts document trees to JSON and back.
 *
 * Every node becomes an object with a {@code node_type} field holding the variant name
 * ({@code List}, {@code HTMLBlock} and {@code HTMLInline} for the list and HTML variants, the
 * record name otherwise) and snake_case attribute fields. The {@code metadata} object is always
 * written, {@code source_location} and the optional attributes only when they are set. Metadata
 * values of temporal types are written as ISO strings and read back as strings.
 *
 * Reading is lenient about omitted optional fields and applies the node defaults (backtick fence
 * of length 3, list start 1, tight lists, single spans). Unknown node types, a missing
 * {@code node_type} and children that do not fit their slot are rejected with
 * {@link IllegalArgumentException}.
 *
 * @author Jan Novotný (novotny@fg.cz), FG Forrest a.s. (c) 2025
 */
public final class AstSerializer {

	public static final String NODE_TYPE = "node_type";
	private static final String SOURCE_LOCATION_TYPE = "SourceLocation";
	private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
	};

	@Nonnull
	private final ObjectMapper objectMapper;

	public AstSerializer() {
		this(new ObjectMapper());
	}

	public AstSerializer(@Nonnull ObjectMapper objectMapper) {
		this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
	}

	/**
	 * Serializes the node and its descendants to compact JSON.
	 *
	 * @param node root of the tree to serialize
	 * @return JSON text
	 */
	@Nonnull
	public String toJson(@Nonnull Node node) {
		return toJson(node, false);
	}

	/**
	 * Serializes the node and its descendants to JSON.
	 *
	 * @param node   root of the tree to serialize
	 * @param pretty whether the output is indented
	 * @return JSON text
	 */
	@Nonnull
	public String toJson(@Nonnull Node node, boolean pretty) {
		final ObjectNode tree = toTree(node);
		try {
			return pretty ?
				this.objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(tree) :
				this.objectMapper.writeValueAsString(tree);
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to write AST as JSON: " + e.getOriginalMessage(), e);
		}
	}

	/**
	 * Parses JSON produced by {@link #toJson(Node)} back into a node tree.
	 *
	 * @param json JSON text
	 * @return reconstructed node
	 * @throws IllegalArgumentException when the text is not valid JSON or does not describe a node
	 */
	@Nonnull
	public Node fromJson(@Nonnull String json) {
		Objects.requireNonNull(json, "json must not be null");
		final JsonNode tree;
		try {
			tree = this.objectMapper.readTree(json);
		} catch (JsonProcessingException e) {
			throw new IllegalArgumentException("Invalid AST JSON: " + e.getOriginalMessage(), e);
		}
		return fromTree(tree);
	}

	/**
	 * Parses JSON that must describe a whole document.
	 *
	 * @param json JSON text
	 * @return reconstructed document
	 * @throws IllegalArgumentException when the root node is not a document
	 */
	@Nonnull
	public Document documentFromJson(@Nonnull String json) {
		final Node node = fromJson(json);
		if (node instanceof Document document) {
			return document;
		}
		throw new IllegalArgumentException("Expected Document at the root, got " + typeName(node));
	}

	/**
	 * Converts the node to a Jackson tree.
	 *
	 * @param node root of the tree to serialize
	 * @return object node
	 */
	@Nonnull
	public ObjectNode toTree(@Nonnull Node node) {
		Objects.requireNonNull(node, "node must not be null");
		return node.accept(new TreeWriter());
	}

	/**
	 * Converts a Jackson tree to a node.
	 *
	 * @param tree object node with a {@code node_type} field
	 * @return reconstructed node
	 * @throws IllegalArgumentException when the tree does not describe a known node
	 */
	@Nonnull
	public Node fromTree(@Nonnull JsonNode tree) {
		Objects.requireNonNull(tree, "tree must not be null");
		final String type = nodeType(tree);
		if (SOURCE_LOCATION_TYPE.equals(type)) {
			throw new IllegalArgumentException("SourceLocation is not a node and may only appear in 'source_location'");
		}
		final Metadata metadata = readMetadata(tree);
		final SourceLocation location = readLocation(tree.get("source_location"));
		return switch (type) {
			case "Document" -> new Document(nodes(tree, "children", Block.class, type), metadata, location);
			case "Heading" -> new Heading(requiredInt(tree, "level", type), nodes(tree, "content", Inline.class, type), metadata, location);
			case "Paragraph" -> new Paragraph(nodes(tree, "content", Inline.class, type), metadata, location);
			case "CodeBlock" -> new CodeBlock(
				requiredText(tree, "content", type),
				optionalText(tree, "language"),
				readFenceChar(tree),
				tree.path("fence_length").asInt(3),
				metadata,
				location
			);
			case "BlockQuote" -> new BlockQuote(nodes(tree, "children", Block.class, type), metadata, location);
			case "List" -> new ListBlock(
				tree.path("ordered").asBoolean(false),
				nodes(tree, "items", ListItem.class, type),
				tree.path("start").asInt(1),
				tree.path("tight").asBoolean(true),
				metadata,
				location
			);
			case "ListItem" -> new ListItem(nodes(tree, "children", Block.class, type), readTaskStatus(tree), metadata, location);
			case "DefinitionList" -> new DefinitionList(readDefinitionEntries(tree), metadata, location);
			case "DefinitionTerm" -> new DefinitionTerm(nodes(tree, "content", Inline.class, type), metadata, location);
			case "DefinitionDescription" -> new DefinitionDescription(nodes(tree, "content", Block.class, type), metadata, location);
			case "Table" -> new Table(
				tree.hasNonNull("header") ? node(tree.get("header"), TableRow.class, type) : null,
				nodes(tree, "rows", TableRow.class, type),
				readAlignments(tree),
				optionalText(tree, "caption"),
				metadata,
				location
			);
			case "TableRow" -> new TableRow(nodes(tree, "cells", TableCell.class, type), tree.path("is_header").asBoolean(false), metadata, location);
			case "TableCell" -> new TableCell(
				nodes(tree, "content", Inline.class, type),
				tree.path("colspan").asInt(1),
				tree.path("rowspan").asInt(1),
				readAlignment(tree.get("alignment")),
				metadata,
				location
			);
			case "ThematicBreak" -> new ThematicBreak(metadata, location);
			case "HTMLBlock" -> new HtmlBlock(requiredText(tree, "content", type), metadata, location);
			case "Comment" -> new Comment(requiredText(tree, "content", type), optionalText(tree, "comment_type"), metadata, location);
			case "MathBlock" -> new MathBlock(requiredText(tree, "content", type), readNotation(tree), metadata, location);
			case "FootnoteDefinition" -> new FootnoteDefinition(
				requiredText(tree, "identifier", type),
				nodes(tree, "content", Block.class, type),
				metadata,
				location
			);
			case "Text" -> new Text(requiredText(tree, "content", type), metadata, location);
			case "Emphasis" -> new Emphasis(nodes(tree, "content", Inline.class, type), metadata, location);
			case "Strong" -> new Strong(nodes(tree, "content", Inline.class, type), metadata, location);
			case "Strikethrough" -> new Strikethrough(nodes(tree, "content", Inline.class, type), metadata, location);
			case "Underline" -> new Underline(nodes(tree, "content", Inline.class, type), metadata, location);
			case "Superscript" -> new Superscript(nodes(tree, "content", Inline.class, type), metadata, location);
			case "Subscript" -> new Subscript(nodes(tree, "content", Inline.class, type), metadata, location);
			case "Code" -> new Code(requiredText(tree, "content", type), metadata, location);
			case "Link" -> new Link(
				requiredText(tree, "url", type),
				nodes(tree, "content", Inline.class, type),
				optionalText(tree, "title"),
				metadata,
				location
			);
			case "Image" -> new Image(
				requiredText(tree, "url", type),
				tree.path("alt_text").asText(""),
				optionalText(tree, "title"),
				optionalInt(tree, "width"),
				optionalInt(tree, "height"),
				metadata,
				location
			);
			case "LineBreak" -> new LineBreak(tree.path("soft").asBoolean(false), metadata, location);
			case "HTMLInline" -> new HtmlInline(requiredText(tree, "content", type), metadata, location);
			case "CommentInline" -> new CommentInline(requiredText(tree, "content", type), metadata, location);
			case "FootnoteReference" -> new FootnoteReference(requiredText(tree, "identifier", type), metadata, location);
			case "MathInline" -> new MathInline(requiredText(tree, "content", type), readNotation(tree), metadata, location);
			default -> throw new IllegalArgumentException("Unknown node type: " + type);
		};
	}

	/**
	 * Returns the {@code node_type} name written for the node.
	 *
	 * @param node any node
	 * @return type name
	 */
	@Nonnull
	public static String typeName(@Nonnull Node node) {
		if (node instanceof ListBlock) {
			return "List";
		} else if (node instanceof HtmlBlock) {
			return "HTMLBlock";
		} else if (node instanceof HtmlInline) {
			return "HTMLInline";
		}
		return node.getClass().getSimpleName();
	}

	@Nonnull
	private static String nodeType(@Nonnull JsonNode tree) {
		if (!tree.isObject()) {
			throw new IllegalArgumentException("Expected JSON object for a node, got " + tree.getNodeType());
		}
		final JsonNode type = tree.get(NODE_TYPE);
		if (type == null || !type.isTextual() || type.asText().isEmpty()) {
			throw new IllegalArgumentException("Node object must contain '" + NODE_TYPE + "' field");
		}
		return type.asText();
	}

	@Nonnull
	private <T extends Node> T node(@Nonnull JsonNode tree, @Nonnull Class<T> expected, @Nonnull String owner) {
		final Node node = fromTree(tree);
		if (!expected.isInstance(node)) {
			throw new IllegalArgumentException(
				owner + " cannot contain " + typeName(node) + " where " + expected.getSimpleName() + " is expected"
			);
		}
		return expected.cast(node);
	}

	@Nonnull
	private <T extends Node> List<T> nodes(
		@Nonnull JsonNode tree,
		@Nonnull String field,
		@Nonnull Class<T> expected,
		@Nonnull String owner
	) {
		final JsonNode array = tree.get(field);
		if (array == null || array.isNull()) {
			return List.of();
		}
		if (!array.isArray()) {
			throw new IllegalArgumentException("Field '" + field + "' of " + owner + " must be an array");
		}
		final List<T> result = new ArrayList<>(array.size());
		for (final JsonNode item : array) {
			result.add(node(item, expected, owner));
		}
		return result;
	}

	@Nonnull
	private List<DefinitionList.Entry> readDefinitionEntries(@Nonnull JsonNode tree) {
		final List<DefinitionList.Entry> entries = new ArrayList<>();
		for (final JsonNode item : tree.path("items")) {
			final JsonNode term = item.get("term");
			if (term == null) {
				throw new IllegalArgumentException("Definition list item must contain 'term' field");
			}
			entries.add(
				new DefinitionList.Entry(
					node(term, DefinitionTerm.class, "DefinitionList"),
					nodes(item, "descriptions", DefinitionDescription.class, "DefinitionList")
				)
			);
		}
		return entries;
	}

	@Nonnull
	private Metadata readMetadata(@Nonnull JsonNode tree) {
		final JsonNode metadata = tree.get("metadata");
		if (metadata == null || metadata.isNull() || metadata.isEmpty()) {
			return Metadata.empty();
		}
		if (!metadata.isObject()) {
			throw new IllegalArgumentException("Field 'metadata' must be an object");
		}
		return Metadata.of(this.objectMapper.convertValue(metadata, METADATA_TYPE));
	}

	@Nullable
	private static SourceLocation readLocation(@Nullable JsonNode tree) {
		if (tree == null || tree.isNull()) {
			return null;
		}
		final String type = nodeType(tree);
		if (!SOURCE_LOCATION_TYPE.equals(type)) {
			throw new IllegalArgumentException("Field 'source_location' must hold a SourceLocation, got " + type);
		}
		return new SourceLocation(
			requiredText(tree, "format", SOURCE_LOCATION_TYPE),
			optionalInt(tree, "page"),
			optionalInt(tree, "line"),
			optionalInt(tree, "column"),
			optionalText(tree, "element_id")
		);
	}

	private static char readFenceChar(@Nonnull JsonNode tree) {
		final String fence = tree.path("fence_char").asText("`");
		if (fence.length() != 1) {
			throw new IllegalArgumentException("Field 'fence_char' must be a single character, got '" + fence + "'");
		}
		return fence.charAt(0);
	}

	@Nullable
	private static TaskStatus readTaskStatus(@Nonnull JsonNode tree) {
		final String status = optionalText(tree, "task_status");
		return status == null ? null : enumValue(TaskStatus.class, status, "task_status");
	}

	@Nonnull
	private static MathNotation readNotation(@Nonnull JsonNode tree) {
		final String notation = optionalText(tree, "notation");
		return notation == null ? MathNotation.LATEX : enumValue(MathNotation.class, notation, "notation");
	}

	@Nonnull
	private static List<Alignment> readAlignments(@Nonnull JsonNode tree) {
		final List<Alignment> alignments = new ArrayList<>();
		for (final JsonNode alignment : tree.path("alignments")) {
			alignments.add(readAlignment(alignment));
		}
		return alignments;
	}

	@Nullable
	private static Alignment readAlignment(@Nullable JsonNode alignment) {
		if (alignment == null || alignment.isNull()) {
			return null;
		}
		return enumValue(Alignment.class, alignment.asText(), "alignment");
	}

	@Nonnull
	private static <E extends Enum<E>> E enumValue(@Nonnull Class<E> type, @Nonnull String value, @Nonnull String field) {
		try {
			return Enum.valueOf(type, value.toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Unsupported value '" + value + "' of field '" + field + "'", e);
		}
	}

	@Nonnull
	private static String requiredText(@Nonnull JsonNode tree, @Nonnull String field, @Nonnull String owner) {
		final JsonNode value = tree.get(field);
		if (value == null || !value.isTextual()) {
			throw new IllegalArgumentException(owner + " must contain text field '" + field + "'");
		}
		return value.asText();
	}

	private static int requiredInt(@Nonnull JsonNode tree, @Nonnull String field, @Nonnull String owner) {
		final JsonNode value = tree.get(field);
		if (value == null || !value.canConvertToInt()) {
			throw new IllegalArgumentException(owner + " must contain integer field '" + field + "'");
		}
		return value.asInt();
	}

	@Nullable
	private static String optionalText(@Nonnull JsonNode tree, @Nonnull String field) {
		final JsonNode value = tree.get(field);
		return value == null || value.isNull() ? null : value.asText();
	}

	@Nullable
	private static Integer optionalInt(@Nonnull JsonNode tree, @Nonnull String field) {
		final JsonNode value = tree.get(field);
		return value == null || value.isNull() ? null : value.asInt();
	}

	/**
	 * Writes one object node per visited node.
	 */
	private final class TreeWriter implements NodeVisitor<ObjectNode> {

		@Nonnull
		private ObjectNode start(@Nonnull Node node) {
			final ObjectNode result = AstSerializer.this.objectMapper.createObjectNode();
			result.put(NODE_TYPE, typeName(node));
			return result;
		}

		@Nonnull
		private ObjectNode finish(@Nonnull ObjectNode result, @Nonnull Metadata metadata, @Nullable SourceLocation location) {
			result.set("metadata", writeMetadata(metadata));
			if (location != null) {
				result.set("source_location", writeLocation(location));
			}
			return result;
		}

		@Nonnull
		private ArrayNode array(@Nonnull List<? extends Node> nodes) {
			final ArrayNode result = AstSerializer.this.objectMapper.createArrayNode();
			for (final Node node : nodes) {
				result.add(node.accept(this));
			}
			return result;
		}

		@Nonnull
		private ObjectNode text(@Nonnull Node node, @Nonnull String content, @Nonnull Metadata metadata, @Nullable SourceLocation location) {
			final ObjectNode result = start(node);
			result.put("content", content);
			return finish(result, metadata, location);
		}

		@Nonnull
		private ObjectNode inlines(@Nonnull Node node, @Nonnull List<Inline> content, @Nonnull Metadata metadata, @Nullable SourceLocation location) {
			final ObjectNode result = start(node);
			result.set("content", array(content));
			return finish(result, metadata, location);
		}

		@Nonnull
		private ObjectNode writeMetadata(@Nonnull Metadata metadata) {
			final ObjectNode result = AstSerializer.this.objectMapper.createObjectNode();
			metadata.asMap().forEach((key, value) -> result.set(key, writeValue(value)));
			return result;
		}

		@Nonnull
		private JsonNode writeValue(@Nonnull Object value) {
			if (value instanceof Temporal) {
				return AstSerializer.this.objectMapper.getNodeFactory().textNode(value.toString());
			} else if (value instanceof List<?> list) {
				final ArrayNode result = AstSerializer.this.objectMapper.createArrayNode();
				list.forEach(item -> result.add(writeValue(item)));
				return result;
			} else if (value instanceof Map<?, ?> map) {
				final ObjectNode result = AstSerializer.this.objectMapper.createObjectNode();
				map.forEach((key, item) -> result.set(String.valueOf(key), writeValue(item)));
				return result;
			}
			return AstSerializer.this.objectMapper.valueToTree(value);
		}

		@Nonnull
		private ObjectNode writeLocation(@Nonnull SourceLocation location) {
			final ObjectNode result = AstSerializer.this.objectMapper.createObjectNode();
			result.put(NODE_TYPE, SOURCE_LOCATION_TYPE);
			result.put("format", location.format());
			if (location.page() != null) {
				result.put("page", location.page());
			}
			if (location.line() != null) {
				result.put("line", location.line());
			}
			if (location.column() != null) {
				result.put("column", location.column());
			}
			if (location.elementId() != null) {
				result.put("element_id", location.elementId());
			}
			return result;
		}

		@Override
		public ObjectNode visit(@Nonnull Document document) {
			final ObjectNode result = start(document);
			result.set("children", array(document.children()));
			return finish(result, document.metadata(), document.sourceLocation());
		}

		@Override
		public ObjectNode visit(@Nonnull Heading heading) {
			final ObjectNode result = start(heading);
			result.put("level", heading.level());
			result.set("content", array(heading.content()));
			return finish(result, heading.metadata(), heading.sourceLocation());
		}

		@Override
		public ObjectNode visit(@Nonnull Paragraph paragraph) {
			return inlines(paragraph, paragraph.content(), paragraph.metadata(), paragraph.sourceLocation());
		}

		@Override
		public ObjectNode visit(@Nonnull CodeBlock codeBlock) {
			final ObjectNode result = start(codeBlock);
			result.put("content", codeBlock.content());
			if (codeBlock.language() != null) {
				result.put("language", codeBlock.language());
			}
			result.put("fence_char", String.valueOf(codeBlock.fenceChar()));
			result.put("fence_length", codeBlock.fenceLength());
			return finish(result, codeBlock.metadata(), codeBlock.sourceLocation());
		}

		@Override
		public ObjectNode visit(@Nonnull BlockQuote blockQuote) {
			final ObjectNode result = start(blockQuote);
			result.set("children", array(blockQuote.children()));
			return finish(result, blockQuote.metadata(), blockQuote.sourceLocation());
		}

		@Override
		public ObjectNode visit(@Nonnull ListBlock listBlock) {
			final ObjectNode result = start(listBlock);
			result.put("ordered", listBlock.ordered());
			result.set("items", array(listBlock.items()));
			result.put("start", listBlock.start());
			result.put("tight", listBlock.tight());
			return finish(result, listBlock.metadata(), listBlock.sourceLocation());
		}

		@Override
		public ObjectNode visit(@Nonnull ListItem listItem) {
			final ObjectNode result = start(listItem);
			result.set("children", array(listItem.children()));
			if (listItem.taskStatus() != null) {
				result.put("task_status", listItem.taskStatus().name().toLowerCase(Locale.ROOT));
			}
			return finish(result, listItem.metadata(), listItem.sourceLocation());
		}

		@Override
		public ObjectNode visit(@Nonnull Table table) {
			final ObjectNode result = start(table);
			result.set("rows", array(table.rows()));
			if (table.header() != null) {
				result.set("header", table.header().accept(this));
			}
			if (!table.alignments().isEmpty()) {
				final ArrayNode alignments = result.putArray("alignments");
				for (final Alignment alignment : table.alignments()) {
					if (alignment == null) {
						alignments.addNull();
					} else {
						alignments.add(alignment.name().toLowerCase(Locale.ROOT));
					}
				}
			}
			if (table.caption() != null) {
				result.put("caption", table.caption());
			}
			return finish(result, table.metadata(), table.sourceLocation());
		}

		@Override
		public ObjectNode visit(@Nonnull TableRow tableRow) {
			final ObjectNode result = start(tableRow);
			result.set("cells", array(tableRow.cells()));
			result.put("is_header", tableRow.header());
			return finish(result, tableRow.metadata(), tableRow.sourceLocation());
		}

		@Override
		public ObjectNode visit(@Nonnull TableCell tableCell) {
			final ObjectNode result = start(tableCell);
			result.set("content", array(tableCell.content()));
			result.put("colspan", tableCell.colspan());
			result.put("rowspan", tableCell.rowspan());
			if (tableCell.alignment() != null) {
				result.put("alignment", tableCell.alignment().name().toLowerCase(Locale.ROOT));
			}
			return finish(result, tableCell.metadata(), tableCell.sourceLocation());
		}

		@Override
		public ObjectNode visit(@Nonnull ThematicBreak thematicBreak) {
			return finish(start(thematicBreak), thematicBreak.metadata(), thematicBreak.sourceLocation());
		}

		@Override
		public ObjectNode visit(@Nonnull HtmlBlock htmlBlock) {
			return text(htmlBlock, htmlBlock.content(), htmlBlock.metadata(), htmlBlock.sourceLocation());
		}

		@Override
		public ObjectNode visit(@Nonnull Comment comment) {
			final ObjectNode result = start(comment);
			result.put("content", comment.content());
			if (comment.commentType() != null) {
				result.put("comment_type", comment.commentType());
			}
			return finish(result, comment.metadata(), comment.sourceLocation());
		}

		@Override
		public ObjectNode visit(@Nonnull MathBlock mathBlock) {
			final ObjectNode result = start(mathBlock);
			result.put("content", mathBlock.content());
			result.put("notation", mathBlock.notation().name().toLowerCase(Locale.ROOT));
			return finish(result, mathBlock.metadata(), mathBlock.sourceLocation());
		}

		@Override
		public ObjectNode visit(@Nonnull FootnoteDefinition footnoteDefinition) {
			final ObjectNode result = start(footnoteDefinition);
			result.put("identifier", footnoteDefinition.identifier());
			result.set("content", array(footnoteDefinition.content()));
			return finish(result, footnoteDefinition.metadata(), footnoteDefinition.sourceLocation());
		}

		@Override
		public ObjectNode visit(@Nonnull DefinitionList definitionList) {
			final ObjectNode result = start(definitionList);
			final ArrayNode items = result.putArray("items");
			for (final DefinitionList.Entry entry : definitionList.entries()) {
				final ObjectNode item = items.addObject();
				item.set("term", entry.term().accept(this));
				item.set("descriptions", array(entry.descriptions()));
			}
			return finish(result, definitionList.metadata(), definitionList.sourceLocation());
		}

		@Override
		public ObjectNode visit(@Nonnull DefinitionTerm definitionTerm) {
			return inlines(definitionTerm, definitionTerm.content(), definitionTerm.metadata(), definitionTerm.sourceLocation());
		}

		@Override
		public ObjectNode visit(@Nonnull DefinitionDescription definitionDescription) {
			final ObjectNode result = start(definitionDescription);
			result.set("content", array(definitionDescription.content()));
			return finish(result, definitionDescription.metadata(), definitionDescription.sourceLocation());
		}

		@Override
		public ObjectNode visit(@Nonnull Text text) {
			return text(text, text.content(), text.metadata(), text.sourceLocation());
		}

		@Override
		public ObjectNode visit(@Nonnull Strong strong) {
			return inlines(strong, strong.content(), strong.metadata(), strong.sourceLocation());
		}

		@Override
		public ObjectNode visit(@Nonnull Emphasis emphasis) {
			return inlines(emphasis, emphasis.content(), emphasis.metadata(), emphasis.sourceLocation());
		}

		@Override
		public ObjectNode visit(@Nonnull Strikethrough strikethrough) {
			return inlines(strikethrough, strikethrough.content(), strikethrough.metadata(), strikethrough.sourceLocation());
		}

		@Override
		public ObjectNode visit(@Nonnull Underline underline) {
			return inlines(underline, underline.content(), underline.metadata(), underline.sourceLocation());
		}

		@Override
		public ObjectNode visit(@Nonnull Superscript superscript) {
			return inlines(superscript, superscript.content(), superscript.metadata(), superscript.sourceLocation());
		}

		@Override
		public ObjectNode visit(@Nonnull Subscript subscript) {
			return inlines(subscript, subscript.content(), subscript.metadata(), subscript.sourceLocation());
		}

		@Override
		public ObjectNode visit(@Nonnull Code code) {
			return text(code, code.content(), code.metadata(), code.sourceLocation());
		}

		@Override
		public ObjectNode visit(@Nonnull Link link) {
			final ObjectNode result = start(link);
			result.put("url", link.url());
			result.set("content", array(link.content()));
			if (link.title() != null) {
				result.put("title", link.title());
			}
			return finish(result, link.metadata(), link.sourceLocation());
		}

		@Override
		public ObjectNode visit(@Nonnull Image image) {
			final ObjectNode result = start(image);
			result.put("url", image.url());
			result.put("alt_text", image.altText());
			if (image.title() != null) {
				result.put("title", image.title());
			}
			if (image.width() != null) {
				result.put("width", image.width());
			}
			if (image.height() != null) {
				result.put("height", image.height());
			}
			return finish(result, image.metadata(), image.sourceLocation());
		}

		@Override
		public ObjectNode visit(@Nonnull LineBreak lineBreak) {
			final ObjectNode result = start(lineBreak);
			result.put("soft", lineBreak.soft());
			return finish(result, lineBreak.metadata(), lineBreak.sourceLocation());
		}

		@Override
		public ObjectNode visit(@Nonnull HtmlInline htmlInline) {
			return text(htmlInline, htmlInline.content(), htmlInline.metadata(), htmlInline.sourceLocation());
		}

		@Override
		public ObjectNode visit(@Nonnull CommentInline commentInline) {
			return text(commentInline, commentInline.content(), commentInline.metadata(), commentInline.sourceLocation());
		}

		@Override
		public ObjectNode visit(@Nonnull FootnoteReference footnoteReference) {
			final ObjectNode result = start(footnoteReference);
			result.put("identifier", footnoteReference.identifier());
			return finish(result, footnoteReference.metadata(), footnoteReference.sourceLocation());
		}

		@Override
		public ObjectNode visit(@Nonnull MathInline mathInline) {
			final ObjectNode result = start(mathInline);
			result.put("content", mathInline.content());
			result.put("notation", mathInline.notation().name().toLowerCase(Locale.ROOT));
			return finish(result, mathInline.metadata(), mathInline.sourceLocation());
		}
	}
}
