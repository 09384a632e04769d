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
import java.util.ArrayList;
import java.util.List;

/**
 * Returns the immediate children of a node as a uniform list. Stateless, a single shared
 * instance is used by {@link Nodes#children(Node)}.
 */
final class ChildAccessor implements NodeVisitor<List<Node>> {

	static final ChildAccessor INSTANCE = new ChildAccessor();

	private ChildAccessor() {
	}

	@Nonnull
	private static List<Node> of(@Nonnull List<? extends Node> children) {
		return List.copyOf(children);
	}

	@Override
	public List<Node> visit(@Nonnull Document document) {
		return of(document.children());
	}

	@Override
	public List<Node> visit(@Nonnull Heading heading) {
		return of(heading.content());
	}

	@Override
	public List<Node> visit(@Nonnull Paragraph paragraph) {
		return of(paragraph.content());
	}

	@Override
	public List<Node> visit(@Nonnull CodeBlock codeBlock) {
		return List.of();
	}

	@Override
	public List<Node> visit(@Nonnull BlockQuote blockQuote) {
		return of(blockQuote.children());
	}

	@Override
	public List<Node> visit(@Nonnull ListBlock listBlock) {
		return of(listBlock.items());
	}

	@Override
	public List<Node> visit(@Nonnull ListItem listItem) {
		return of(listItem.children());
	}

	@Override
	public List<Node> visit(@Nonnull Table table) {
		return of(table.allRows());
	}

	@Override
	public List<Node> visit(@Nonnull TableRow tableRow) {
		return of(tableRow.cells());
	}

	@Override
	public List<Node> visit(@Nonnull TableCell tableCell) {
		return of(tableCell.content());
	}

	@Override
	public List<Node> visit(@Nonnull ThematicBreak thematicBreak) {
		return List.of();
	}

	@Override
	public List<Node> visit(@Nonnull HtmlBlock htmlBlock) {
		return List.of();
	}

	@Override
	public List<Node> visit(@Nonnull Comment comment) {
		return List.of();
	}

	@Override
	public List<Node> visit(@Nonnull MathBlock mathBlock) {
		return List.of();
	}

	@Override
	public List<Node> visit(@Nonnull FootnoteDefinition footnoteDefinition) {
		return of(footnoteDefinition.content());
	}

	@Override
	public List<Node> visit(@Nonnull DefinitionList definitionList) {
		final List<Node> result = new ArrayList<>();
		for (final DefinitionList.Entry entry : definitionList.entries()) {
			result.add(entry.term());
			result.addAll(entry.descriptions());
		}
		return List.copyOf(result);
	}

	@Override
	public List<Node> visit(@Nonnull DefinitionTerm definitionTerm) {
		return of(definitionTerm.content());
	}

	@Override
	public List<Node> visit(@Nonnull DefinitionDescription definitionDescription) {
		return of(definitionDescription.content());
	}

	@Override
	public List<Node> visit(@Nonnull Text text) {
		return List.of();
	}

	@Override
	public List<Node> visit(@Nonnull Strong strong) {
		return of(strong.content());
	}

	@Override
	public List<Node> visit(@Nonnull Emphasis emphasis) {
		return of(emphasis.content());
	}

	@Override
	public List<Node> visit(@Nonnull Strikethrough strikethrough) {
		return of(strikethrough.content());
	}

	@Override
	public List<Node> visit(@Nonnull Underline underline) {
		return of(underline.content());
	}

	@Override
	public List<Node> visit(@Nonnull Superscript superscript) {
		return of(superscript.content());
	}

	@Override
	public List<Node> visit(@Nonnull Subscript subscript) {
		return of(subscript.content());
	}

	@Override
	public List<Node> visit(@Nonnull Code code) {
		return List.of();
	}

	@Override
	public List<Node> visit(@Nonnull Link link) {
		return of(link.content());
	}

	@Override
	public List<Node> visit(@Nonnull Image image) {
		return List.of();
	}

	@Override
	public List<Node> visit(@Nonnull LineBreak lineBreak) {
		return List.of();
	}

	@Override
	public List<Node> visit(@Nonnull HtmlInline htmlInline) {
		return List.of();
	}

	@Override
	public List<Node> visit(@Nonnull CommentInline commentInline) {
		return List.of();
	}

	@Override
	public List<Node> visit(@Nonnull FootnoteReference footnoteReference) {
		return List.of();
	}

	@Override
	public List<Node> visit(@Nonnull MathInline mathInline) {
		return List.of();
	}
}
