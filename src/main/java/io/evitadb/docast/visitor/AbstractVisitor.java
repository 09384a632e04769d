package io.evitadb.docast.visitor;

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

/**
 * Read-only tree walker with a generic default for every node variant.
 *
 * Each {@code visit} overload delegates to {@link #visitNode(Node)}, which descends into the
 * children of the node. Subclasses override a specific overload when a variant needs custom
 * handling, and call {@link #visitChildren(Node)} themselves to continue the walk below it, or
 * override {@link #visitNode(Node)} to apply the same logic to every node.
 */
public abstract class AbstractVisitor implements NodeVisitor<Void> {

	/**
	 * Generic handler invoked by every {@code visit} overload that is not overridden.
	 *
	 * @param node visited node
	 */
	protected void visitNode(@Nonnull Node node) {
		visitChildren(node);
	}

	/**
	 * Visits the immediate children of the node in document order.
	 *
	 * @param parent node whose children are visited
	 */
	protected void visitChildren(@Nonnull Node parent) {
		for (final Node child : Nodes.children(parent)) {
			child.accept(this);
		}
	}

	@Override
	public Void visit(@Nonnull Document document) {
		visitNode(document);
		return null;
	}

	@Override
	public Void visit(@Nonnull Heading heading) {
		visitNode(heading);
		return null;
	}

	@Override
	public Void visit(@Nonnull Paragraph paragraph) {
		visitNode(paragraph);
		return null;
	}

	@Override
	public Void visit(@Nonnull CodeBlock codeBlock) {
		visitNode(codeBlock);
		return null;
	}

	@Override
	public Void visit(@Nonnull BlockQuote blockQuote) {
		visitNode(blockQuote);
		return null;
	}

	@Override
	public Void visit(@Nonnull ListBlock listBlock) {
		visitNode(listBlock);
		return null;
	}

	@Override
	public Void visit(@Nonnull ListItem listItem) {
		visitNode(listItem);
		return null;
	}

	@Override
	public Void visit(@Nonnull Table table) {
		visitNode(table);
		return null;
	}

	@Override
	public Void visit(@Nonnull TableRow tableRow) {
		visitNode(tableRow);
		return null;
	}

	@Override
	public Void visit(@Nonnull TableCell tableCell) {
		visitNode(tableCell);
		return null;
	}

	@Override
	public Void visit(@Nonnull ThematicBreak thematicBreak) {
		visitNode(thematicBreak);
		return null;
	}

	@Override
	public Void visit(@Nonnull HtmlBlock htmlBlock) {
		visitNode(htmlBlock);
		return null;
	}

	@Override
	public Void visit(@Nonnull Comment comment) {
		visitNode(comment);
		return null;
	}

	@Override
	public Void visit(@Nonnull MathBlock mathBlock) {
		visitNode(mathBlock);
		return null;
	}

	@Override
	public Void visit(@Nonnull FootnoteDefinition footnoteDefinition) {
		visitNode(footnoteDefinition);
		return null;
	}

	@Override
	public Void visit(@Nonnull DefinitionList definitionList) {
		visitNode(definitionList);
		return null;
	}

	@Override
	public Void visit(@Nonnull DefinitionTerm definitionTerm) {
		visitNode(definitionTerm);
		return null;
	}

	@Override
	public Void visit(@Nonnull DefinitionDescription definitionDescription) {
		visitNode(definitionDescription);
		return null;
	}

	@Override
	public Void visit(@Nonnull Text text) {
		visitNode(text);
		return null;
	}

	@Override
	public Void visit(@Nonnull Strong strong) {
		visitNode(strong);
		return null;
	}

	@Override
	public Void visit(@Nonnull Emphasis emphasis) {
		visitNode(emphasis);
		return null;
	}

	@Override
	public Void visit(@Nonnull Strikethrough strikethrough) {
		visitNode(strikethrough);
		return null;
	}

	@Override
	public Void visit(@Nonnull Underline underline) {
		visitNode(underline);
		return null;
	}

	@Override
	public Void visit(@Nonnull Superscript superscript) {
		visitNode(superscript);
		return null;
	}

	@Override
	public Void visit(@Nonnull Subscript subscript) {
		visitNode(subscript);
		return null;
	}

	@Override
	public Void visit(@Nonnull Code code) {
		visitNode(code);
		return null;
	}

	@Override
	public Void visit(@Nonnull Link link) {
		visitNode(link);
		return null;
	}

	@Override
	public Void visit(@Nonnull Image image) {
		visitNode(image);
		return null;
	}

	@Override
	public Void visit(@Nonnull LineBreak lineBreak) {
		visitNode(lineBreak);
		return null;
	}

	@Override
	public Void visit(@Nonnull HtmlInline htmlInline) {
		visitNode(htmlInline);
		return null;
	}

	@Override
	public Void visit(@Nonnull CommentInline commentInline) {
		visitNode(commentInline);
		return null;
	}

	@Override
	public Void visit(@Nonnull FootnoteReference footnoteReference) {
		visitNode(footnoteReference);
		return null;
	}

	@Override
	public Void visit(@Nonnull MathInline mathInline) {
		visitNode(mathInline);
		return null;
	}
}
