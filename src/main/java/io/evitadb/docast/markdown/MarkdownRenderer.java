package io.evitadb.docast.markdown;

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
import io.evitadb.docast.node.Paragraph;
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
import io.evitadb.docast.plugin.ConversionException;
import io.evitadb.docast.plugin.ConversionStage;
import io.evitadb.docast.plugin.DocumentRenderer;
import io.evitadb.docast.plugin.FallbackPolicy;
import io.evitadb.docast.visitor.NodeVisitor;
import io.evitadb.docast.visitor.Nodes;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Renders the document AST as CommonMark with the GFM table, strikethrough and task list syntax.
 *
 * Nodes markdown has no syntax for (underline, superscript, subscript, comments and definition
 * lists) are rendered according to the {@link FallbackPolicy} of the {@link Options}:
 *
 * - {@link FallbackPolicy#RAW_MARKUP}: as inline HTML or an HTML block,
 * - {@link FallbackPolicy#PLAIN_TEXT}: as their text content,
 * - {@link FallbackPolicy#DROP}: not at all.
 *
 * Math is written as a {@code math} fenced block and {@code $...$} inline.
 *
 * @author Jan Novotný (novotny@fg.cz), FG Forrest a.s. (c) 2025
 */
public class MarkdownRenderer implements DocumentRenderer {

	private final Options options;

	public MarkdownRenderer() {
		this(Options.DEFAULT);
	}

	public MarkdownRenderer(@Nonnull Options options) {
		this.options = Objects.requireNonNull(options, "options must not be null");
	}

	@Nonnull
	public Options getOptions() {
		return this.options;
	}

	@Nonnull
	@Override
	public String render(@Nonnull Document document) throws ConversionException {
		Objects.requireNonNull(document, "document must not be null");
		try {
			return document.accept(new MarkdownWriter(this.options));
		} catch (RuntimeException e) {
			throw new ConversionException(ConversionStage.RENDERING, "Failed to render markdown: " + e.getMessage(), e);
		}
	}

	/**
	 * Rendering settings.
	 *
	 * @param frontMatter    whether document metadata is written as YAML front matter
	 * @param fallbackPolicy handling of nodes markdown cannot express
	 */
	public record Options(
		boolean frontMatter,
		@Nonnull FallbackPolicy fallbackPolicy
	) {

		public static final Options DEFAULT = new Options(true, FallbackPolicy.RAW_MARKUP);

		public Options {
			Objects.requireNonNull(fallbackPolicy, "fallbackPolicy must not be null");
		}

		@Nonnull
		public Options withFrontMatter(boolean newFrontMatter) {
			return new Options(newFrontMatter, this.fallbackPolicy);
		}

		@Nonnull
		public Options withFallbackPolicy(@Nonnull FallbackPolicy newFallbackPolicy) {
			return new Options(this.frontMatter, newFallbackPolicy);
		}
	}

	/**
	 * Produces the markdown of a single node; block results carry no trailing new line.
	 */
	private static final class MarkdownWriter implements NodeVisitor<String> {

		private final Options options;

		private MarkdownWriter(@Nonnull Options options) {
			this.options = options;
		}

		@Override
		public String visit(@Nonnull Document document) {
			final String frontMatter = this.options.frontMatter() ? FrontMatter.serialize(document.metadata()) : "";
			final String body = blocks(document.children(), "\n\n");
			if (body.isEmpty()) {
				return frontMatter;
			}
			return frontMatter + (frontMatter.isEmpty() ? "" : "\n") + body + "\n";
		}

		@Override
		public String visit(@Nonnull Heading heading) {
			return "#".repeat(heading.level()) + " " + inlines(heading.content());
		}

		@Override
		public String visit(@Nonnull Paragraph paragraph) {
			return inlines(paragraph.content());
		}

		@Override
		public String visit(@Nonnull CodeBlock codeBlock) {
			final String fence = fence(codeBlock.content(), codeBlock.fenceChar(), codeBlock.fenceLength());
			return fenced(fence, codeBlock.language() == null ? "" : codeBlock.language(), codeBlock.content());
		}

		@Override
		public String visit(@Nonnull BlockQuote blockQuote) {
			final StringBuilder sb = new StringBuilder();
			for (final String line : blocks(blockQuote.children(), "\n\n").split("\n", -1)) {
				if (sb.length() > 0) {
					sb.append('\n');
				}
				sb.append(line.isEmpty() ? ">" : "> " + line);
			}
			return sb.toString();
		}

		@Override
		public String visit(@Nonnull ListBlock listBlock) {
			final StringBuilder sb = new StringBuilder();
			final List<ListItem> items = listBlock.items();
			for (int i = 0; i < items.size(); i++) {
				if (i > 0) {
					sb.append(listBlock.tight() ? "\n" : "\n\n");
				}
				final String marker = listBlock.ordered() ? (listBlock.start() + i) + ". " : "- ";
				sb.append(hang(marker, itemContent(items.get(i), listBlock.tight())));
			}
			return sb.toString();
		}

		@Override
		public String visit(@Nonnull ListItem listItem) {
			return itemContent(listItem, true);
		}

		@Override
		public String visit(@Nonnull Table table) {
			int columns = table.alignments().size();
			for (final TableRow row : table.allRows()) {
				columns = Math.max(columns, row.cells().size());
			}
			if (columns == 0) {
				return "";
			}
			final StringBuilder sb = new StringBuilder();
			if (table.header() == null) {
				sb.append(row(List.of(), columns));
			} else {
				sb.append(row(table.header().cells(), columns));
			}
			sb.append("\n|");
			for (int i = 0; i < columns; i++) {
				final Alignment alignment = i < table.alignments().size() ? table.alignments().get(i) : null;
				sb.append(' ').append(delimiter(alignment)).append(" |");
			}
			for (final TableRow row : table.rows()) {
				sb.append('\n').append(row(row.cells(), columns));
			}
			return sb.toString();
		}

		@Override
		public String visit(@Nonnull TableRow tableRow) {
			return row(tableRow.cells(), tableRow.cells().size());
		}

		@Override
		public String visit(@Nonnull TableCell tableCell) {
			return inlines(tableCell.content()).replace("|", "\\|").replace("\n", " ");
		}

		@Override
		public String visit(@Nonnull ThematicBreak thematicBreak) {
			return "---";
		}

		@Override
		public String visit(@Nonnull HtmlBlock htmlBlock) {
			return htmlBlock.content();
		}

		@Override
		public String visit(@Nonnull Comment comment) {
			return fallback("<!-- " + comment.content() + " -->", escape(comment.content()));
		}

		@Override
		public String visit(@Nonnull MathBlock mathBlock) {
			return fenced(fence(mathBlock.content(), '`', 3), "math", mathBlock.content());
		}

		@Override
		public String visit(@Nonnull FootnoteDefinition footnoteDefinition) {
			return hang("[^" + footnoteDefinition.identifier() + "]: ", blocks(footnoteDefinition.content(), "\n\n"), "    ");
		}

		@Override
		public String visit(@Nonnull DefinitionList definitionList) {
			final List<String> parts = new ArrayList<>();
			if (this.options.fallbackPolicy() == FallbackPolicy.RAW_MARKUP) {
				final StringBuilder sb = new StringBuilder("<dl>");
				for (final DefinitionList.Entry entry : definitionList.entries()) {
					sb.append("\n<dt>").append(html(Nodes.extractText(entry.term()))).append("</dt>");
					for (final DefinitionDescription description : entry.descriptions()) {
						sb.append("\n<dd>").append(html(Nodes.extractText(description))).append("</dd>");
					}
				}
				return sb.append("\n</dl>").toString();
			} else if (this.options.fallbackPolicy() == FallbackPolicy.PLAIN_TEXT) {
				for (final DefinitionList.Entry entry : definitionList.entries()) {
					parts.add(entry.term().accept(this));
					for (final DefinitionDescription description : entry.descriptions()) {
						parts.add(description.accept(this));
					}
				}
			}
			return String.join("\n\n", parts);
		}

		@Override
		public String visit(@Nonnull DefinitionTerm definitionTerm) {
			return inlines(definitionTerm.content());
		}

		@Override
		public String visit(@Nonnull DefinitionDescription definitionDescription) {
			return blocks(definitionDescription.content(), "\n\n");
		}

		@Override
		public String visit(@Nonnull Text text) {
			return escape(text.content());
		}

		@Override
		public String visit(@Nonnull Strong strong) {
			return "**" + inlines(strong.content()) + "**";
		}

		@Override
		public String visit(@Nonnull Emphasis emphasis) {
			return "*" + inlines(emphasis.content()) + "*";
		}

		@Override
		public String visit(@Nonnull Strikethrough strikethrough) {
			return "~~" + inlines(strikethrough.content()) + "~~";
		}

		@Override
		public String visit(@Nonnull Underline underline) {
			final String content = inlines(underline.content());
			return fallback("<u>" + content + "</u>", content);
		}

		@Override
		public String visit(@Nonnull Superscript superscript) {
			final String content = inlines(superscript.content());
			return fallback("<sup>" + content + "</sup>", content);
		}

		@Override
		public String visit(@Nonnull Subscript subscript) {
			final String content = inlines(subscript.content());
			return fallback("<sub>" + content + "</sub>", content);
		}

		@Override
		public String visit(@Nonnull Code code) {
			final String content = code.content();
			final String ticks = "`".repeat(longestRun(content, '`') + 1);
			final boolean pad = content.startsWith("`") || content.endsWith("`");
			return ticks + (pad ? " " : "") + content + (pad ? " " : "") + ticks;
		}

		@Override
		public String visit(@Nonnull Link link) {
			return "[" + inlines(link.content()) + "](" + destination(link.url(), link.title()) + ")";
		}

		@Override
		public String visit(@Nonnull Image image) {
			return "![" + escape(image.altText()) + "](" + destination(image.url(), image.title()) + ")";
		}

		@Override
		public String visit(@Nonnull LineBreak lineBreak) {
			return lineBreak.soft() ? "\n" : "\\\n";
		}

		@Override
		public String visit(@Nonnull HtmlInline htmlInline) {
			return htmlInline.content();
		}

		@Override
		public String visit(@Nonnull CommentInline commentInline) {
			return fallback("<!-- " + commentInline.content() + " -->", escape(commentInline.content()));
		}

		@Override
		public String visit(@Nonnull FootnoteReference footnoteReference) {
			return "[^" + footnoteReference.identifier() + "]";
		}

		@Override
		public String visit(@Nonnull MathInline mathInline) {
			return "$" + mathInline.content() + "$";
		}

		@Nonnull
		private String blocks(@Nonnull List<? extends Block> blocks, @Nonnull String separator) {
			final List<String> parts = new ArrayList<>(blocks.size());
			for (final Block block : blocks) {
				final String part = block.accept(this);
				if (!part.isEmpty()) {
					parts.add(part);
				}
			}
			return String.join(separator, parts);
		}

		@Nonnull
		private String inlines(@Nonnull List<? extends Inline> inlines) {
			final StringBuilder sb = new StringBuilder();
			for (final Inline inline : inlines) {
				sb.append(inline.accept(this));
			}
			return sb.toString();
		}

		@Nonnull
		private String itemContent(@Nonnull ListItem item, boolean tight) {
			final String content = blocks(item.children(), tight ? "\n" : "\n\n");
			if (item.taskStatus() == null) {
				return content;
			}
			return (item.taskStatus() == TaskStatus.CHECKED ? "[x] " : "[ ] ") + content;
		}

		@Nonnull
		private String row(@Nonnull List<TableCell> cells, int columns) {
			final StringBuilder sb = new StringBuilder("|");
			for (int i = 0; i < columns; i++) {
				final String cell = i < cells.size() ? cells.get(i).accept(this) : "";
				sb.append(' ').append(cell).append(" |");
			}
			return sb.toString();
		}

		@Nonnull
		private String fallback(@Nonnull String rawMarkup, @Nonnull String plainText) {
			return switch (this.options.fallbackPolicy()) {
				case RAW_MARKUP -> rawMarkup;
				case PLAIN_TEXT -> plainText;
				case DROP -> "";
			};
		}
	}

	/**
	 * Prefixes the first line with the marker and indents the following non-empty lines by the
	 * marker width.
	 */
	@Nonnull
	private static String hang(@Nonnull String marker, @Nonnull String content) {
		return hang(marker, content, " ".repeat(marker.length()));
	}

	@Nonnull
	private static String hang(@Nonnull String marker, @Nonnull String content, @Nonnull String indent) {
		if (content.isEmpty()) {
			return marker.stripTrailing();
		}
		final String[] lines = content.split("\n", -1);
		final StringBuilder sb = new StringBuilder(marker).append(lines[0]);
		for (int i = 1; i < lines.length; i++) {
			sb.append('\n');
			if (!lines[i].isEmpty()) {
				sb.append(indent).append(lines[i]);
			}
		}
		return sb.toString();
	}

	@Nonnull
	private static String fence(@Nonnull String content, char fenceChar, int fenceLength) {
		return String.valueOf(fenceChar).repeat(Math.max(fenceLength, longestRun(content, fenceChar) + 1));
	}

	@Nonnull
	private static String fenced(@Nonnull String fence, @Nonnull String info, @Nonnull String content) {
		if (content.isEmpty()) {
			return fence + info + "\n" + fence;
		}
		return fence + info + "\n" + content + "\n" + fence;
	}

	private static int longestRun(@Nonnull String content, char character) {
		int longest = 0;
		int current = 0;
		for (int i = 0; i < content.length(); i++) {
			if (content.charAt(i) == character) {
				current++;
				longest = Math.max(longest, current);
			} else {
				current = 0;
			}
		}
		return longest;
	}

	@Nonnull
	private static String delimiter(@Nullable Alignment alignment) {
		if (alignment == null) {
			return "---";
		}
		return switch (alignment) {
			case LEFT -> ":---";
			case CENTER -> ":---:";
			case RIGHT -> "---:";
		};
	}

	@Nonnull
	private static String destination(@Nonnull String url, @Nullable String title) {
		final boolean bracketed = url.isEmpty() || url.contains(" ") || url.contains("(") || url.contains(")");
		final String target = bracketed ? "<" + url + ">" : url;
		if (title == null) {
			return target;
		}
		return target + " \"" + title.replace("\"", "\\\"") + "\"";
	}

	/**
	 * Escapes the characters that would otherwise start inline markdown syntax.
	 */
	@Nonnull
	static String escape(@Nonnull String text) {
		final StringBuilder sb = new StringBuilder(text.length());
		for (int i = 0; i < text.length(); i++) {
			final char c = text.charAt(i);
			if (c == '\\' || c == '*' || c == '_' || c == '[' || c == ']' || c == '`' || c == '<' || c == '~') {
				sb.append('\\');
			}
			sb.append(c);
		}
		return sb.toString();
	}

	@Nonnull
	private static String html(@Nonnull String text) {
		return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
	}
}
