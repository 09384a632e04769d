package io.evitadb.docast.transform;

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
import io.evitadb.docast.node.Node;
import io.evitadb.docast.node.Paragraph;
import io.evitadb.docast.node.Strikethrough;
import io.evitadb.docast.node.Strong;
import io.evitadb.docast.node.Subscript;
import io.evitadb.docast.node.Superscript;
import io.evitadb.docast.node.Table;
import io.evitadb.docast.node.TableCell;
import io.evitadb.docast.node.TableRow;
import io.evitadb.docast.node.Text;
import io.evitadb.docast.node.ThematicBreak;
import io.evitadb.docast.node.Underline;
import io.evitadb.docast.visitor.NodeVisitor;
import io.evitadb.docast.visitor.Nodes;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/**
 * Base class of tree rewriting visitors. A transformer produces a new tree and never modifies its
 * input; a {@code visit} method returns the replacement node or {@code null} to remove the node
 * together with its subtree from the parent.
 *
 * Every {@code visit} method defaults to {@link #transformGeneric(Node)}, which transforms the
 * children and rebuilds the node around the surviving ones, so subclasses override only the
 * variants they rewrite. A replacement must fit the slot of the node it replaces: an inline node
 * for an inline, a block for a block and the same structural variant for list items, table rows,
 * table cells and definition parts.
 *
 * Two structural cases differ from the generic rule: removing the header row of a table leaves a
 * table without header, and removing a definition term removes the whole entry with its
 * descriptions.
 *
 * @author Jan Novotný (novotny@fg.cz), FG Forrest a.s. (c) 2025
 */
public abstract class NodeTransformer implements NodeVisitor<Node> {

	/**
	 * Transforms the node.
	 *
	 * @param node node to transform
	 * @return replacement node or null when the node is removed
	 */
	@Nullable
	public Node transform(@Nonnull Node node) {
		return node.accept(this);
	}

	/**
	 * Transforms every child and drops the removed ones.
	 *
	 * @param children nodes to transform
	 * @return transformed nodes in the original order
	 */
	@Nonnull
	protected List<Node> transformChildren(@Nonnull List<? extends Node> children) {
		final List<Node> result = new ArrayList<>(children.size());
		for (final Node child : children) {
			final Node transformed = transform(child);
			if (transformed != null) {
				result.add(transformed);
			}
		}
		return result;
	}

	/**
	 * Transforms inline content.
	 *
	 * @param content inline nodes
	 * @return surviving transformed inline nodes
	 * @throws IllegalStateException when a replacement is not an inline node
	 */
	@Nonnull
	protected List<Inline> transformInlines(@Nonnull List<? extends Inline> content) {
		return requireCategory(transformChildren(content), Inline.class);
	}

	/**
	 * Transforms block content.
	 *
	 * @param content block nodes
	 * @return surviving transformed block nodes
	 * @throws IllegalStateException when a replacement is not a block node
	 */
	@Nonnull
	protected List<Block> transformBlocks(@Nonnull List<? extends Block> content) {
		return requireCategory(transformChildren(content), Block.class);
	}

	/**
	 * Transforms the children of the node and creates a copy of the node holding the surviving
	 * ones. Leaf nodes are copied.
	 *
	 * @param node node to rebuild
	 * @return new node of the same variant
	 * @throws IllegalStateException when a replacement does not fit its slot
	 */
	@Nonnull
	protected Node transformGeneric(@Nonnull Node node) {
		final List<Node> children = transformChildren(Nodes.children(node));
		try {
			return Nodes.withChildren(node, children);
		} catch (IllegalArgumentException e) {
			throw new IllegalStateException(
				getClass().getSimpleName() + " produced an invalid child: " + e.getMessage(), e
			);
		}
	}

	@Nonnull
	private <T extends Node> List<T> requireCategory(@Nonnull List<Node> nodes, @Nonnull Class<T> category) {
		final List<T> result = new ArrayList<>(nodes.size());
		for (final Node node : nodes) {
			if (!category.isInstance(node)) {
				throw new IllegalStateException(
					getClass().getSimpleName() + " replaced a node with " + node.getClass().getSimpleName() +
						", expected " + category.getSimpleName()
				);
			}
			result.add(category.cast(node));
		}
		return result;
	}

	@Override
	public Node visit(@Nonnull Document document) {
		return transformDocument(document);
	}

	/**
	 * Transforms the top-level blocks of the document, keeping its metadata and source location.
	 *
	 * @param document document to rebuild
	 * @return new document
	 * @throws IllegalStateException when a replacement is not a block node
	 */
	@Nonnull
	protected Document transformDocument(@Nonnull Document document) {
		return document.withChildren(transformBlocks(document.children()));
	}

	@Override
	public Node visit(@Nonnull Heading heading) {
		return transformGeneric(heading);
	}

	@Override
	public Node visit(@Nonnull Paragraph paragraph) {
		return transformGeneric(paragraph);
	}

	@Override
	public Node visit(@Nonnull CodeBlock codeBlock) {
		return transformGeneric(codeBlock);
	}

	@Override
	public Node visit(@Nonnull BlockQuote blockQuote) {
		return transformGeneric(blockQuote);
	}

	@Override
	public Node visit(@Nonnull ListBlock listBlock) {
		return transformGeneric(listBlock);
	}

	@Override
	public Node visit(@Nonnull ListItem listItem) {
		return transformGeneric(listItem);
	}

	@Override
	public Node visit(@Nonnull Table table) {
		TableRow header = null;
		if (table.header() != null) {
			final Node transformedHeader = transform(table.header());
			if (transformedHeader instanceof TableRow row) {
				header = row;
			} else if (transformedHeader != null) {
				throw new IllegalStateException(
					getClass().getSimpleName() + " replaced a table header with " + transformedHeader.getClass().getSimpleName()
				);
			}
		}
		final List<TableRow> rows = new ArrayList<>(table.rows().size());
		for (final Node transformed : transformChildren(table.rows())) {
			if (!(transformed instanceof TableRow row)) {
				throw new IllegalStateException(
					getClass().getSimpleName() + " replaced a table row with " + transformed.getClass().getSimpleName()
				);
			}
			rows.add(row);
		}
		return new Table(header, rows, table.alignments(), table.caption(), table.metadata(), table.sourceLocation());
	}

	@Override
	public Node visit(@Nonnull TableRow tableRow) {
		return transformGeneric(tableRow);
	}

	@Override
	public Node visit(@Nonnull TableCell tableCell) {
		return transformGeneric(tableCell);
	}

	@Override
	public Node visit(@Nonnull ThematicBreak thematicBreak) {
		return transformGeneric(thematicBreak);
	}

	@Override
	public Node visit(@Nonnull HtmlBlock htmlBlock) {
		return transformGeneric(htmlBlock);
	}

	@Override
	public Node visit(@Nonnull Comment comment) {
		return transformGeneric(comment);
	}

	@Override
	public Node visit(@Nonnull MathBlock mathBlock) {
		return transformGeneric(mathBlock);
	}

	@Override
	public Node visit(@Nonnull FootnoteDefinition footnoteDefinition) {
		return transformGeneric(footnoteDefinition);
	}

	@Override
	public Node visit(@Nonnull DefinitionList definitionList) {
		final List<DefinitionList.Entry> entries = new ArrayList<>(definitionList.entries().size());
		for (final DefinitionList.Entry entry : definitionList.entries()) {
			final Node transformedTerm = transform(entry.term());
			if (transformedTerm == null) {
				continue;
			}
			if (!(transformedTerm instanceof DefinitionTerm term)) {
				throw new IllegalStateException(
					getClass().getSimpleName() + " replaced a definition term with " + transformedTerm.getClass().getSimpleName()
				);
			}
			final List<DefinitionDescription> descriptions = new ArrayList<>(entry.descriptions().size());
			for (final Node transformed : transformChildren(entry.descriptions())) {
				if (!(transformed instanceof DefinitionDescription description)) {
					throw new IllegalStateException(
						getClass().getSimpleName() + " replaced a definition description with " + transformed.getClass().getSimpleName()
					);
				}
				descriptions.add(description);
			}
			entries.add(new DefinitionList.Entry(term, descriptions));
		}
		return new DefinitionList(entries, definitionList.metadata(), definitionList.sourceLocation());
	}

	@Override
	public Node visit(@Nonnull DefinitionTerm definitionTerm) {
		return transformGeneric(definitionTerm);
	}

	@Override
	public Node visit(@Nonnull DefinitionDescription definitionDescription) {
		return transformGeneric(definitionDescription);
	}

	@Override
	public Node visit(@Nonnull Text text) {
		return transformGeneric(text);
	}

	@Override
	public Node visit(@Nonnull Strong strong) {
		return transformGeneric(strong);
	}

	@Override
	public Node visit(@Nonnull Emphasis emphasis) {
		return transformGeneric(emphasis);
	}

	@Override
	public Node visit(@Nonnull Strikethrough strikethrough) {
		return transformGeneric(strikethrough);
	}

	@Override
	public Node visit(@Nonnull Underline underline) {
		return transformGeneric(underline);
	}

	@Override
	public Node visit(@Nonnull Superscript superscript) {
		return transformGeneric(superscript);
	}

	@Override
	public Node visit(@Nonnull Subscript subscript) {
		return transformGeneric(subscript);
	}

	@Override
	public Node visit(@Nonnull Code code) {
		return transformGeneric(code);
	}

	@Override
	public Node visit(@Nonnull Link link) {
		return transformGeneric(link);
	}

	@Override
	public Node visit(@Nonnull Image image) {
		return transformGeneric(image);
	}

	@Override
	public Node visit(@Nonnull LineBreak lineBreak) {
		return transformGeneric(lineBreak);
	}

	@Override
	public Node visit(@Nonnull HtmlInline htmlInline) {
		return transformGeneric(htmlInline);
	}

	@Override
	public Node visit(@Nonnull CommentInline commentInline) {
		return transformGeneric(commentInline);
	}

	@Override
	public Node visit(@Nonnull FootnoteReference footnoteReference) {
		return transformGeneric(footnoteReference);
	}

	@Override
	public Node visit(@Nonnull MathInline mathInline) {
		return transformGeneric(mathInline);
	}
}
