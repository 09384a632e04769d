package io.evitadb.docast.visitor;

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

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;

/**
 * Rebuilds the visited node with a replacement list of children. Every call produces a new
 * instance, leaf nodes included. The children are checked against the category of the slot they
 * are placed in.
 */
final class ChildReplacer implements NodeVisitor<Node> {

	@Nonnull
	private final List<? extends Node> children;

	ChildReplacer(@Nonnull List<? extends Node> children) {
		this.children = children;
	}

	@Nonnull
	private <T extends Node> List<T> cast(@Nonnull Node parent, @Nonnull Class<T> type) {
		final List<T> result = new ArrayList<>(this.children.size());
		for (final Node child : this.children) {
			if (!type.isInstance(child)) {
				throw new IllegalArgumentException(
					parent.getClass().getSimpleName() + " cannot hold " + child.getClass().getSimpleName() +
						", expected " + type.getSimpleName()
				);
			}
			result.add(type.cast(child));
		}
		return result;
	}

	@Nonnull
	private List<Inline> inlines(@Nonnull Node parent) {
		return cast(parent, Inline.class);
	}

	@Nonnull
	private List<Block> blocks(@Nonnull Node parent) {
		return cast(parent, Block.class);
	}

	private void requireLeaf(@Nonnull Node node) {
		if (!this.children.isEmpty()) {
			throw new IllegalArgumentException(node.getClass().getSimpleName() + " cannot have children");
		}
	}

	@Override
	public Node visit(@Nonnull Document document) {
		return new Document(blocks(document), document.metadata(), document.sourceLocation());
	}

	@Override
	public Node visit(@Nonnull Heading heading) {
		return new Heading(heading.level(), inlines(heading), heading.metadata(), heading.sourceLocation());
	}

	@Override
	public Node visit(@Nonnull Paragraph paragraph) {
		return new Paragraph(inlines(paragraph), paragraph.metadata(), paragraph.sourceLocation());
	}

	@Override
	public Node visit(@Nonnull CodeBlock codeBlock) {
		requireLeaf(codeBlock);
		return new CodeBlock(
			codeBlock.content(), codeBlock.language(), codeBlock.fenceChar(), codeBlock.fenceLength(),
			codeBlock.metadata(), codeBlock.sourceLocation()
		);
	}

	@Override
	public Node visit(@Nonnull BlockQuote blockQuote) {
		return new BlockQuote(blocks(blockQuote), blockQuote.metadata(), blockQuote.sourceLocation());
	}

	@Override
	public Node visit(@Nonnull ListBlock listBlock) {
		return new ListBlock(
			listBlock.ordered(), cast(listBlock, ListItem.class), listBlock.start(), listBlock.tight(),
			listBlock.metadata(), listBlock.sourceLocation()
		);
	}

	@Override
	public Node visit(@Nonnull ListItem listItem) {
		return new ListItem(blocks(listItem), listItem.taskStatus(), listItem.metadata(), listItem.sourceLocation());
	}

	@Override
	public Node visit(@Nonnull Table table) {
		final List<TableRow> rows = cast(table, TableRow.class);
		TableRow header = null;
		// a flagged row in the first position returns to the header slot
		if (!rows.isEmpty() && rows.get(0).header()) {
			header = rows.remove(0);
		}
		return new Table(header, rows, table.alignments(), table.caption(), table.metadata(), table.sourceLocation());
	}

	@Override
	public Node visit(@Nonnull TableRow tableRow) {
		return new TableRow(cast(tableRow, TableCell.class), tableRow.header(), tableRow.metadata(), tableRow.sourceLocation());
	}

	@Override
	public Node visit(@Nonnull TableCell tableCell) {
		return new TableCell(
			inlines(tableCell), tableCell.colspan(), tableCell.rowspan(), tableCell.alignment(),
			tableCell.metadata(), tableCell.sourceLocation()
		);
	}

	@Override
	public Node visit(@Nonnull ThematicBreak thematicBreak) {
		requireLeaf(thematicBreak);
		return new ThematicBreak(thematicBreak.metadata(), thematicBreak.sourceLocation());
	}

	@Override
	public Node visit(@Nonnull HtmlBlock htmlBlock) {
		requireLeaf(htmlBlock);
		return new HtmlBlock(htmlBlock.content(), htmlBlock.metadata(), htmlBlock.sourceLocation());
	}

	@Override
	public Node visit(@Nonnull Comment comment) {
		requireLeaf(comment);
		return new Comment(comment.content(), comment.commentType(), comment.metadata(), comment.sourceLocation());
	}

	@Override
	public Node visit(@Nonnull MathBlock mathBlock) {
		requireLeaf(mathBlock);
		return new MathBlock(mathBlock.content(), mathBlock.notation(), mathBlock.metadata(), mathBlock.sourceLocation());
	}

	@Override
	public Node visit(@Nonnull FootnoteDefinition footnoteDefinition) {
		return new FootnoteDefinition(
			footnoteDefinition.identifier(), blocks(footnoteDefinition),
			footnoteDefinition.metadata(), footnoteDefinition.sourceLocation()
		);
	}

	@Override
	public Node visit(@Nonnull DefinitionList definitionList) {
		final List<DefinitionList.Entry> entries = new ArrayList<>();
		DefinitionTerm term = null;
		List<DefinitionDescription> descriptions = new ArrayList<>();
		for (final Node child : this.children) {
			if (child instanceof DefinitionTerm nextTerm) {
				if (term != null) {
					entries.add(new DefinitionList.Entry(term, descriptions));
				}
				term = nextTerm;
				descriptions = new ArrayList<>();
			} else if (child instanceof DefinitionDescription description) {
				if (term == null) {
					throw new IllegalArgumentException("DefinitionDescription must follow a DefinitionTerm");
				}
				descriptions.add(description);
			} else {
				throw new IllegalArgumentException(
					"DefinitionList cannot hold " + child.getClass().getSimpleName() +
						", expected DefinitionTerm or DefinitionDescription"
				);
			}
		}
		if (term != null) {
			entries.add(new DefinitionList.Entry(term, descriptions));
		}
		return new DefinitionList(entries, definitionList.metadata(), definitionList.sourceLocation());
	}

	@Override
	public Node visit(@Nonnull DefinitionTerm definitionTerm) {
		return new DefinitionTerm(inlines(definitionTerm), definitionTerm.metadata(), definitionTerm.sourceLocation());
	}

	@Override
	public Node visit(@Nonnull DefinitionDescription definitionDescription) {
		return new DefinitionDescription(
			blocks(definitionDescription), definitionDescription.metadata(), definitionDescription.sourceLocation()
		);
	}

	@Override
	public Node visit(@Nonnull Text text) {
		requireLeaf(text);
		return new Text(text.content(), text.metadata(), text.sourceLocation());
	}

	@Override
	public Node visit(@Nonnull Strong strong) {
		return new Strong(inlines(strong), strong.metadata(), strong.sourceLocation());
	}

	@Override
	public Node visit(@Nonnull Emphasis emphasis) {
		return new Emphasis(inlines(emphasis), emphasis.metadata(), emphasis.sourceLocation());
	}

	@Override
	public Node visit(@Nonnull Strikethrough strikethrough) {
		return new Strikethrough(inlines(strikethrough), strikethrough.metadata(), strikethrough.sourceLocation());
	}

	@Override
	public Node visit(@Nonnull Underline underline) {
		return new Underline(inlines(underline), underline.metadata(), underline.sourceLocation());
	}

	@Override
	public Node visit(@Nonnull Superscript superscript) {
		return new Superscript(inlines(superscript), superscript.metadata(), superscript.sourceLocation());
	}

	@Override
	public Node visit(@Nonnull Subscript subscript) {
		return new Subscript(inlines(subscript), subscript.metadata(), subscript.sourceLocation());
	}

	@Override
	public Node visit(@Nonnull Code code) {
		requireLeaf(code);
		return new Code(code.content(), code.metadata(), code.sourceLocation());
	}

	@Override
	public Node visit(@Nonnull Link link) {
		return new Link(link.url(), inlines(link), link.title(), link.metadata(), link.sourceLocation());
	}

	@Override
	public Node visit(@Nonnull Image image) {
		requireLeaf(image);
		return new Image(
			image.url(), image.altText(), image.title(), image.width(), image.height(),
			image.metadata(), image.sourceLocation()
		);
	}

	@Override
	public Node visit(@Nonnull LineBreak lineBreak) {
		requireLeaf(lineBreak);
		return new LineBreak(lineBreak.soft(), lineBreak.metadata(), lineBreak.sourceLocation());
	}

	@Override
	public Node visit(@Nonnull HtmlInline htmlInline) {
		requireLeaf(htmlInline);
		return new HtmlInline(htmlInline.content(), htmlInline.metadata(), htmlInline.sourceLocation());
	}

	@Override
	public Node visit(@Nonnull CommentInline commentInline) {
		requireLeaf(commentInline);
		return new CommentInline(commentInline.content(), commentInline.metadata(), commentInline.sourceLocation());
	}

	@Override
	public Node visit(@Nonnull FootnoteReference footnoteReference) {
		requireLeaf(footnoteReference);
		return new FootnoteReference(
			footnoteReference.identifier(), footnoteReference.metadata(), footnoteReference.sourceLocation()
		);
	}

	@Override
	public Node visit(@Nonnull MathInline mathInline) {
		requireLeaf(mathInline);
		return new MathInline(mathInline.content(), mathInline.notation(), mathInline.metadata(), mathInline.sourceLocation());
	}
}
