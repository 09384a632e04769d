package io.evitadb.docast.markdown;

import io.evitadb.docast.node.Alignment;
import io.evitadb.docast.node.Block;
import io.evitadb.docast.node.BlockQuote;
import io.evitadb.docast.node.Code;
import io.evitadb.docast.node.CodeBlock;
import io.evitadb.docast.node.Comment;
import io.evitadb.docast.node.CommentInline;
import io.evitadb.docast.node.Document;
import io.evitadb.docast.node.Emphasis;
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
import io.evitadb.docast.node.MathNotation;
import io.evitadb.docast.node.Metadata;
import io.evitadb.docast.node.Node;
import io.evitadb.docast.node.Paragraph;
import io.evitadb.docast.node.SourceLocation;
import io.evitadb.docast.node.Strikethrough;
import io.evitadb.docast.node.Strong;
import io.evitadb.docast.node.Table;
import io.evitadb.docast.node.TableCell;
import io.evitadb.docast.node.TableRow;
import io.evitadb.docast.node.TaskStatus;
import io.evitadb.docast.node.Text;
import io.evitadb.docast.node.ThematicBreak;
import io.evitadb.docast.visitor.Nodes;
import org.commonmark.ext.front.matter.YamlFrontMatterBlock;
import org.commonmark.ext.front.matter.YamlFrontMatterNode;
import org.commonmark.ext.gfm.tables.TableBlock;
import org.commonmark.ext.gfm.tables.TableBody;
import org.commonmark.ext.gfm.tables.TableHead;
import org.commonmark.ext.task.list.items.TaskListItemMarker;
import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.BulletList;
import org.commonmark.node.CustomBlock;
import org.commonmark.node.CustomNode;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.HardLineBreak;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.LinkReferenceDefinition;
import org.commonmark.node.OrderedList;
import org.commonmark.node.SoftLineBreak;
import org.commonmark.node.SourceSpan;
import org.commonmark.node.StrongEmphasis;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts a CommonMark tree into the document AST.
 *
 * Every visited CommonMark node emits at most one AST node into the frame of its parent. Fenced
 * code blocks with the {@code math} info string become math blocks, HTML comments become comment
 * nodes and link reference definitions are dropped since links are already resolved.
 *
 * Instances are single use and not thread safe.
 */
final class CommonMarkConverter extends AbstractVisitor {

	static final String SOURCE_FORMAT = "markdown";

	private static final Pattern HTML_COMMENT = Pattern.compile("^\\s*<!--(.*?)-->\\s*$", Pattern.DOTALL);

	private final Deque<List<Node>> frames = new ArrayDeque<>();

	/**
	 * Converts the CommonMark document.
	 *
	 * @param root     root of the CommonMark tree
	 * @param metadata document metadata
	 * @return document AST
	 */
	@Nonnull
	Document convert(@Nonnull org.commonmark.node.Node root, @Nonnull Metadata metadata) {
		return new Document(blocks(convertChildren(root)), metadata, location(root));
	}

	@Override
	public void visit(org.commonmark.node.Heading heading) {
		emit(new Heading(heading.getLevel(), inlines(convertChildren(heading)), Metadata.empty(), location(heading)));
	}

	@Override
	public void visit(org.commonmark.node.Paragraph paragraph) {
		emit(new Paragraph(inlines(convertChildren(paragraph)), Metadata.empty(), location(paragraph)));
	}

	@Override
	public void visit(org.commonmark.node.BlockQuote blockQuote) {
		emit(new BlockQuote(blocks(convertChildren(blockQuote))));
	}

	@Override
	public void visit(BulletList bulletList) {
		emit(new ListBlock(false, listItems(convertChildren(bulletList)), 1, bulletList.isTight(), Metadata.empty(), location(bulletList)));
	}

	@Override
	public void visit(OrderedList orderedList) {
		emit(new ListBlock(true, listItems(convertChildren(orderedList)), orderedList.getStartNumber(), orderedList.isTight(), Metadata.empty(), location(orderedList)));
	}

	@Override
	public void visit(org.commonmark.node.ListItem listItem) {
		emit(new ListItem(blocks(convertChildren(listItem)), taskStatus(listItem), Metadata.empty(), null));
	}

	@Override
	public void visit(FencedCodeBlock codeBlock) {
		final String info = codeBlock.getInfo() == null ? "" : codeBlock.getInfo().trim();
		final String language = info.isEmpty() ? null : info.split("\\s+", 2)[0];
		final String content = stripTrailingNewLine(codeBlock.getLiteral());
		if ("math".equals(language)) {
			emit(new MathBlock(content, MathNotation.LATEX, Metadata.empty(), location(codeBlock)));
		} else {
			emit(new CodeBlock(content, language, codeBlock.getFenceChar(), Math.max(3, codeBlock.getFenceLength()), Metadata.empty(), location(codeBlock)));
		}
	}

	@Override
	public void visit(IndentedCodeBlock codeBlock) {
		emit(new CodeBlock(stripTrailingNewLine(codeBlock.getLiteral()), null, '`', 3, Metadata.empty(), location(codeBlock)));
	}

	@Override
	public void visit(org.commonmark.node.HtmlBlock htmlBlock) {
		final String literal = stripTrailingNewLine(htmlBlock.getLiteral());
		final Matcher comment = HTML_COMMENT.matcher(literal);
		if (comment.matches()) {
			emit(new Comment(comment.group(1).trim(), "html", Metadata.empty(), location(htmlBlock)));
		} else {
			emit(new HtmlBlock(literal));
		}
	}

	@Override
	public void visit(org.commonmark.node.ThematicBreak thematicBreak) {
		emit(new ThematicBreak(Metadata.empty(), location(thematicBreak)));
	}

	@Override
	public void visit(LinkReferenceDefinition linkReferenceDefinition) {
		// already resolved into the links that use it
	}

	@Override
	public void visit(org.commonmark.node.Text text) {
		emit(new Text(text.getLiteral()));
	}

	@Override
	public void visit(org.commonmark.node.Code code) {
		emit(new Code(code.getLiteral()));
	}

	@Override
	public void visit(org.commonmark.node.Emphasis emphasis) {
		emit(new Emphasis(inlines(convertChildren(emphasis))));
	}

	@Override
	public void visit(StrongEmphasis strongEmphasis) {
		emit(new Strong(inlines(convertChildren(strongEmphasis))));
	}

	@Override
	public void visit(org.commonmark.node.Link link) {
		emit(new Link(link.getDestination(), inlines(convertChildren(link)), emptyToNull(link.getTitle()), Metadata.empty(), null));
	}

	@Override
	public void visit(org.commonmark.node.Image image) {
		final String altText = Nodes.extractText(new Paragraph(inlines(convertChildren(image))));
		emit(new Image(image.getDestination(), altText, emptyToNull(image.getTitle()), null, null, Metadata.empty(), null));
	}

	@Override
	public void visit(SoftLineBreak softLineBreak) {
		emit(new LineBreak(true));
	}

	@Override
	public void visit(HardLineBreak hardLineBreak) {
		emit(new LineBreak(false));
	}

	@Override
	public void visit(org.commonmark.node.HtmlInline htmlInline) {
		final Matcher comment = HTML_COMMENT.matcher(htmlInline.getLiteral());
		if (comment.matches()) {
			emit(new CommentInline(comment.group(1).trim()));
		} else {
			emit(new HtmlInline(htmlInline.getLiteral()));
		}
	}

	@Override
	public void visit(CustomBlock customBlock) {
		if (customBlock instanceof TableBlock tableBlock) {
			emit(table(tableBlock));
		} else if (!(customBlock instanceof YamlFrontMatterBlock)) {
			// unknown extension blocks keep their content
			this.frames.peek().addAll(convertChildren(customBlock));
		}
	}

	@Override
	public void visit(CustomNode customNode) {
		if (customNode instanceof org.commonmark.ext.gfm.strikethrough.Strikethrough) {
			emit(new Strikethrough(inlines(convertChildren(customNode))));
		} else if (!(customNode instanceof TaskListItemMarker) && !(customNode instanceof YamlFrontMatterNode)) {
			this.frames.peek().addAll(convertChildren(customNode));
		}
	}

	@Nonnull
	private Table table(@Nonnull TableBlock tableBlock) {
		TableRow header = null;
		final List<TableRow> rows = new ArrayList<>();
		final List<Alignment> alignments = new ArrayList<>();
		for (org.commonmark.node.Node section = tableBlock.getFirstChild(); section != null; section = section.getNext()) {
			final boolean head = section instanceof TableHead;
			if (!head && !(section instanceof TableBody)) {
				continue;
			}
			for (org.commonmark.node.Node row = section.getFirstChild(); row != null; row = row.getNext()) {
				final List<TableCell> cells = new ArrayList<>();
				for (org.commonmark.node.Node cell = row.getFirstChild(); cell != null; cell = cell.getNext()) {
					final org.commonmark.ext.gfm.tables.TableCell tableCell = (org.commonmark.ext.gfm.tables.TableCell) cell;
					final Alignment alignment = alignment(tableCell.getAlignment());
					cells.add(new TableCell(inlines(convertChildren(tableCell)), 1, 1, alignment, Metadata.empty(), null));
					if (head && header == null) {
						alignments.add(alignment);
					}
				}
				if (head && header == null) {
					header = new TableRow(cells, true);
				} else {
					rows.add(new TableRow(cells, false));
				}
			}
		}
		return new Table(header, rows, alignments, null, Metadata.empty(), location(tableBlock));
	}

	@Nullable
	private static Alignment alignment(@Nullable org.commonmark.ext.gfm.tables.TableCell.Alignment alignment) {
		if (alignment == null) {
			return null;
		}
		return switch (alignment) {
			case LEFT -> Alignment.LEFT;
			case CENTER -> Alignment.CENTER;
			case RIGHT -> Alignment.RIGHT;
		};
	}

	@Nullable
	private static TaskStatus taskStatus(@Nonnull org.commonmark.node.ListItem listItem) {
		final org.commonmark.node.Node first = listItem.getFirstChild();
		TaskListItemMarker marker = null;
		if (first instanceof TaskListItemMarker direct) {
			marker = direct;
		} else if (first != null && first.getFirstChild() instanceof TaskListItemMarker nested) {
			marker = nested;
		}
		if (marker == null) {
			return null;
		}
		return marker.isChecked() ? TaskStatus.CHECKED : TaskStatus.UNCHECKED;
	}

	@Nonnull
	private List<Node> convertChildren(@Nonnull org.commonmark.node.Node parent) {
		this.frames.push(new ArrayList<>());
		org.commonmark.node.Node child = parent.getFirstChild();
		while (child != null) {
			final org.commonmark.node.Node next = child.getNext();
			child.accept(this);
			child = next;
		}
		return this.frames.pop();
	}

	private void emit(@Nonnull Node node) {
		this.frames.peek().add(node);
	}

	@Nonnull
	private static List<Block> blocks(@Nonnull List<Node> nodes) {
		final List<Block> blocks = new ArrayList<>(nodes.size());
		List<Inline> looseInlines = null;
		for (final Node node : nodes) {
			if (node instanceof Block block) {
				if (looseInlines != null) {
					blocks.add(new Paragraph(looseInlines));
					looseInlines = null;
				}
				blocks.add(block);
			} else if (node instanceof Inline inline) {
				// inline content of unknown extension blocks
				if (looseInlines == null) {
					looseInlines = new ArrayList<>();
				}
				looseInlines.add(inline);
			}
		}
		if (looseInlines != null) {
			blocks.add(new Paragraph(looseInlines));
		}
		return blocks;
	}

	@Nonnull
	private static List<Inline> inlines(@Nonnull List<Node> nodes) {
		final List<Inline> inlines = new ArrayList<>(nodes.size());
		for (final Node node : nodes) {
			if (node instanceof Inline inline) {
				inlines.add(inline);
			} else {
				throw new IllegalStateException("Unexpected " + Nodes.typeName(node) + " in inline content");
			}
		}
		return inlines;
	}

	@Nonnull
	private static List<ListItem> listItems(@Nonnull List<Node> nodes) {
		final List<ListItem> items = new ArrayList<>(nodes.size());
		for (final Node node : nodes) {
			if (node instanceof ListItem item) {
				items.add(item);
			} else {
				throw new IllegalStateException("Unexpected " + Nodes.typeName(node) + " in list");
			}
		}
		return items;
	}

	@Nullable
	private static SourceLocation location(@Nonnull org.commonmark.node.Node node) {
		final List<SourceSpan> spans = node.getSourceSpans();
		if (spans == null || spans.isEmpty()) {
			return null;
		}
		final SourceSpan span = spans.get(0);
		return SourceLocation.at(SOURCE_FORMAT, span.getLineIndex() + 1, span.getColumnIndex() + 1);
	}

	@Nonnull
	private static String stripTrailingNewLine(@Nonnull String literal) {
		return literal.endsWith("\n") ? literal.substring(0, literal.length() - 1) : literal;
	}

	@Nullable
	private static String emptyToNull(@Nullable String value) {
		return value == null || value.isEmpty() ? null : value;
	}
}
