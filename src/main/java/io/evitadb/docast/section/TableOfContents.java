package io.evitadb.docast.section;

import io.evitadb.docast.node.Block;
import io.evitadb.docast.node.Document;
import io.evitadb.docast.node.Heading;
import io.evitadb.docast.node.Link;
import io.evitadb.docast.node.ListBlock;
import io.evitadb.docast.node.ListItem;
import io.evitadb.docast.node.Paragraph;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Table of contents generation from the section structure of a document.
 *
 * Anchors are heading slugs made unique within one generated table, so two "Introduction"
 * headings link to {@code #introduction} and {@code #introduction-2}.
 *
 * @author Jan Novotný (novotny@fg.cz), FG Forrest a.s. (c) 2025
 */
public final class TableOfContents {

	/**
	 * Text of the heading of an inserted table of contents.
	 */
	public static final String TITLE = "Table of Contents";

	private TableOfContents() {
	}

	/**
	 * Generates a table of contents of the sections with levels up to {@code maxLevel}.
	 *
	 * - {@link TocStyle#MARKDOWN}: a {@code # Table of Contents} title, an empty line and one line
	 *   {@code - [text](#slug)} per section indented by two spaces per level below 1; empty text
	 *   when the document has no sections,
	 * - {@link TocStyle#LIST}: a flat list with one item per section,
	 * - {@link TocStyle#NESTED}: a list nested along the heading levels; level gaps are bridged by
	 *   intermediate lists hung on the previous item, or on an empty placeholder item when there is
	 *   no previous item.
	 *
	 * Both list styles contain exactly one item with heading text per section.
	 *
	 * @param document source document
	 * @param maxLevel least significant heading level included
	 * @param style    output style
	 * @return generated table
	 * @throws IllegalArgumentException when {@code maxLevel} is outside 1-6
	 */
	@Nonnull
	public static GeneratedToc generate(@Nonnull Document document, int maxLevel, @Nonnull TocStyle style) {
		Objects.requireNonNull(style, "style must not be null");
		final List<Section> sections = sections(document, maxLevel);
		return switch (style) {
			case MARKDOWN -> new GeneratedToc(style, markdown(sections), null);
			case LIST -> new GeneratedToc(style, null, flatList(sections));
			case NESTED -> new GeneratedToc(style, null, nestedList(sections));
		};
	}

	/**
	 * Inserts a table of contents into the document. The markdown style is built directly as
	 * nodes: a level 1 heading {@value #TITLE} followed by a tight list of links to the sections.
	 * The list styles insert the list generated by {@link #generate}.
	 *
	 * @param document source document
	 * @param position where the table goes
	 * @param maxLevel least significant heading level included
	 * @param style    table style
	 * @return new document, equal in content to the source when it has no sections and the style
	 *         is markdown
	 * @throws IllegalArgumentException when {@code maxLevel} is outside 1-6
	 */
	@Nonnull
	public static Document insert(
		@Nonnull Document document,
		@Nonnull TocPosition position,
		int maxLevel,
		@Nonnull TocStyle style
	) {
		Objects.requireNonNull(position, "position must not be null");
		final List<Block> tocNodes = style == TocStyle.MARKDOWN ?
			linkNodes(sections(document, maxLevel)) :
			List.of(generate(document, maxLevel, style).asList());
		final int index = position == TocPosition.START ? 0 : afterFirstHeading(document);
		final List<Block> children = new ArrayList<>(document.children().size() + tocNodes.size());
		children.addAll(document.children().subList(0, index));
		children.addAll(tocNodes);
		children.addAll(document.children().subList(index, document.children().size()));
		return document.withChildren(children);
	}

	@Nonnull
	private static List<Section> sections(@Nonnull Document document, int maxLevel) {
		if (maxLevel < Heading.MIN_LEVEL || maxLevel > Heading.MAX_LEVEL) {
			throw new IllegalArgumentException("max_level must be between 1 and 6, got " + maxLevel);
		}
		return DocumentSections.getAllSections(document, Heading.MIN_LEVEL, maxLevel);
	}

	private static int afterFirstHeading(@Nonnull Document document) {
		final List<Block> children = document.children();
		for (int i = 0; i < children.size(); i++) {
			if (children.get(i) instanceof Heading) {
				return i + 1;
			}
		}
		return 0;
	}

	@Nonnull
	private static String markdown(@Nonnull List<Section> sections) {
		if (sections.isEmpty()) {
			return "";
		}
		final StringBuilder sb = new StringBuilder("# ").append(TITLE).append("\n");
		final Set<String> seenSlugs = new HashSet<>();
		for (final Section section : sections) {
			final String text = section.headingText();
			final String slug = Slugifier.slugify(text, seenSlugs);
			sb.append('\n')
				.append("  ".repeat(section.level() - 1))
				.append("- [").append(text).append("](#").append(slug).append(')');
		}
		return sb.toString();
	}

	@Nonnull
	private static List<Block> linkNodes(@Nonnull List<Section> sections) {
		if (sections.isEmpty()) {
			return List.of();
		}
		final Set<String> seenSlugs = new HashSet<>();
		final List<ListItem> items = new ArrayList<>(sections.size());
		for (final Section section : sections) {
			final String text = section.headingText();
			final String slug = Slugifier.slugify(text, seenSlugs);
			items.add(new ListItem(List.of(Paragraph.of(Link.of("#" + slug, text)))));
		}
		return List.of(Heading.of(1, TITLE), ListBlock.bullet(items));
	}

	@Nonnull
	private static ListBlock flatList(@Nonnull List<Section> sections) {
		final List<ListItem> items = new ArrayList<>(sections.size());
		for (final Section section : sections) {
			items.add(textItem(section.headingText()));
		}
		return ListBlock.bullet(items);
	}

	@Nonnull
	private static ListItem textItem(@Nonnull String text) {
		return new ListItem(List.of(Paragraph.of(text)));
	}

	@Nonnull
	private static ListBlock nestedList(@Nonnull List<Section> sections) {
		final ListDraft root = new ListDraft();
		if (sections.isEmpty()) {
			return root.build();
		}
		int minLevel = Heading.MAX_LEVEL;
		for (final Section section : sections) {
			minLevel = Math.min(minLevel, section.level());
		}
		final Deque<Frame> stack = new ArrayDeque<>();
		stack.push(new Frame(root, minLevel));
		for (final Section section : sections) {
			final int level = section.level();
			while (stack.size() > 1 && stack.peek().level > level) {
				stack.pop();
			}
			ListDraft current = stack.peek().list;
			int currentLevel = stack.peek().level;
			// bridge level gaps such as H1 followed by H3
			while (currentLevel < level - 1) {
				if (current.items.isEmpty()) {
					current.items.add(new ItemDraft(null));
				}
				final ListDraft intermediate = new ListDraft();
				current.lastItem().nested.add(intermediate);
				currentLevel++;
				stack.push(new Frame(intermediate, currentLevel));
				current = intermediate;
			}
			final ItemDraft item = new ItemDraft(section.headingText());
			if (level == currentLevel + 1 && !current.items.isEmpty()) {
				final ItemDraft parent = current.lastItem();
				if (parent.nested.isEmpty()) {
					parent.nested.add(new ListDraft());
				}
				final ListDraft nested = parent.nested.get(0);
				nested.items.add(item);
				stack.push(new Frame(nested, level));
			} else {
				current.items.add(item);
			}
		}
		return root.build();
	}

	/**
	 * Entry of the nested list construction stack.
	 */
	private static final class Frame {
		@Nonnull
		private final ListDraft list;
		private final int level;

		private Frame(@Nonnull ListDraft list, int level) {
			this.list = list;
			this.level = level;
		}
	}

	/**
	 * Mutable list used while the nested structure is assembled.
	 */
	private static final class ListDraft {
		@Nonnull
		private final List<ItemDraft> items = new ArrayList<>();

		@Nonnull
		private ItemDraft lastItem() {
			return this.items.get(this.items.size() - 1);
		}

		@Nonnull
		private ListBlock build() {
			final List<ListItem> built = new ArrayList<>(this.items.size());
			for (final ItemDraft item : this.items) {
				built.add(item.build());
			}
			return ListBlock.bullet(built);
		}
	}

	/**
	 * Mutable list item; a null text marks a placeholder bridging a level gap.
	 */
	private static final class ItemDraft {
		@Nullable
		private final String text;
		@Nonnull
		private final List<ListDraft> nested = new ArrayList<>();

		private ItemDraft(@Nullable String text) {
			this.text = text;
		}

		@Nonnull
		private ListItem build() {
			final List<Block> children = new ArrayList<>(this.nested.size() + 1);
			if (this.text != null) {
				children.add(Paragraph.of(this.text));
			}
			for (final ListDraft list : this.nested) {
				children.add(list.build());
			}
			return new ListItem(children);
		}
	}
}
