package io.evitadb.docast.section;

import io.evitadb.docast.node.Block;
import io.evitadb.docast.node.Comment;
import io.evitadb.docast.node.Document;
import io.evitadb.docast.node.Heading;
import io.evitadb.docast.node.HtmlBlock;
import io.evitadb.docast.node.Metadata;
import io.evitadb.docast.node.Paragraph;
import io.evitadb.docast.node.ThematicBreak;
import io.evitadb.docast.visitor.Nodes;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Cuts a document into standalone parts at semantic boundaries: headings, accumulated word counts,
 * thematic breaks or delimiter paragraphs.
 *
 * Every part is a new document carrying the metadata and source location of the original. Parts
 * are numbered from 1. When a strategy finds no boundary at all, the whole document is returned as
 * a single part whose split metadata holds a {@value #REASON} entry explaining why.
 *
 * @author Jan Novotný (novotny@fg.cz), FG Forrest a.s. (c) 2025
 */
public final class DocumentSplitter {

	public static final String REASON = "reason";
	public static final String STRATEGY = "strategy";
	public static final String PREAMBLE_TITLE = "Preamble";
	public static final int DEFAULT_AUTO_TARGET_WORDS = 1500;

	private static final Pattern WHITESPACE = Pattern.compile("\\s+");
	private static final Pattern RULE_DELIMITER = Pattern.compile("-{3,}|\\*{3,}|_{3,}");
	private static final String COMMENT_OPEN = "<!--";
	private static final String COMMENT_CLOSE = "-->";

	private DocumentSplitter() {
	}

	/**
	 * Splits the document into one part per section of any level.
	 *
	 * @param document        document to split
	 * @param includePreamble whether content before the first heading becomes the first part
	 * @return parts in document order, empty for a document without headings and preamble
	 */
	@Nonnull
	public static List<SplitResult> splitBySections(@Nonnull Document document, boolean includePreamble) {
		Objects.requireNonNull(document, "document must not be null");
		return sectionParts(document, DocumentSections.getAllSections(document), includePreamble);
	}

	/**
	 * Splits the document at every heading of the given level.
	 *
	 * @param document        document to split
	 * @param level           heading level, 1-6
	 * @param includePreamble whether content before the first heading becomes the first part
	 * @return parts in document order
	 * @throws IllegalArgumentException when the level is outside 1-6
	 */
	@Nonnull
	public static List<SplitResult> splitByHeadingLevel(@Nonnull Document document, int level, boolean includePreamble) {
		Objects.requireNonNull(document, "document must not be null");
		if (level < Heading.MIN_LEVEL || level > Heading.MAX_LEVEL) {
			throw new IllegalArgumentException("Heading level must be between 1 and 6, got " + level);
		}
		final List<SplitResult> parts = sectionParts(document, DocumentSections.getAllSections(document, level, level), includePreamble);
		if (parts.isEmpty()) {
			return List.of(whole(document, null, "no_headings_found"));
		}
		return parts;
	}

	/**
	 * Accumulates sections into parts until adding the next section would exceed the target word
	 * count. Parts always end at section boundaries, so a single large section yields a part above
	 * the target. The preamble opens the first part.
	 *
	 * @param document    document to split
	 * @param targetWords approximate number of words per part
	 * @return parts in document order
	 * @throws IllegalArgumentException when the target is less than 1
	 */
	@Nonnull
	public static List<SplitResult> splitByWordCount(@Nonnull Document document, int targetWords) {
		Objects.requireNonNull(document, "document must not be null");
		if (targetWords < 1) {
			throw new IllegalArgumentException("targetWords must be at least 1, got " + targetWords);
		}
		final List<Section> sections = DocumentSections.getAllSections(document);
		if (sections.isEmpty()) {
			return List.of(whole(document, null, "no_sections"));
		}

		final List<SplitResult> parts = new ArrayList<>();
		final List<Block> current = new ArrayList<>();
		int currentWords = 0;
		String currentTitle = null;

		final List<Block> preamble = DocumentSections.getPreamble(document);
		if (!preamble.isEmpty()) {
			current.addAll(preamble);
			currentWords = countWords(preamble);
			currentTitle = PREAMBLE_TITLE;
		}

		for (final Section section : sections) {
			final List<Block> nodes = section.nodes();
			final int sectionWords = countWords(nodes);
			if (currentWords + sectionWords > targetWords && !current.isEmpty()) {
				parts.add(part(document, current, parts.size() + 1, currentTitle, currentWords));
				current.clear();
				currentWords = 0;
				currentTitle = null;
			}
			current.addAll(nodes);
			currentWords += sectionWords;
			if (currentTitle == null) {
				currentTitle = section.headingText();
			}
		}
		if (!current.isEmpty()) {
			parts.add(part(document, current, parts.size() + 1, currentTitle, currentWords));
		}
		return parts;
	}

	/**
	 * Splits the document into roughly the given number of parts of similar word count. The
	 * target per part is the total word count divided by the number of parts, the actual number of
	 * parts depends on where the section boundaries fall.
	 *
	 * @param document document to split
	 * @param parts    requested number of parts
	 * @return parts in document order
	 * @throws IllegalArgumentException when the number of parts is less than 1
	 */
	@Nonnull
	public static List<SplitResult> splitByParts(@Nonnull Document document, int parts) {
		Objects.requireNonNull(document, "document must not be null");
		if (parts < 1) {
			throw new IllegalArgumentException("parts must be at least 1, got " + parts);
		}
		final int totalWords = countWords(document.children());
		if (totalWords == 0) {
			return List.of(new SplitResult(document, 1, null, 0));
		}
		return splitByWordCount(document, Math.max(1, totalWords / parts));
	}

	/**
	 * Splits the document at top-level thematic breaks. The breaks themselves are dropped and
	 * parts are titled "Part N".
	 *
	 * @param document document to split
	 * @return parts in document order
	 */
	@Nonnull
	public static List<SplitResult> splitByBreak(@Nonnull Document document) {
		Objects.requireNonNull(document, "document must not be null");
		return splitAt(document, ThematicBreak.class::isInstance, "no_breaks_found");
	}

	/**
	 * Splits the document at top-level paragraphs, HTML blocks or HTML comments whose whole text is
	 * the delimiter, ignoring surrounding whitespace. A delimiter that looks like a horizontal rule ({@code ---},
	 * {@code ***}, {@code ___}) also matches thematic breaks, since markdown parses such lines as
	 * breaks. Delimiter nodes are dropped and parts are titled "Part N".
	 *
	 * @param document  document to split
	 * @param delimiter delimiter text
	 * @return parts in document order
	 * @throws IllegalArgumentException when the delimiter is empty
	 */
	@Nonnull
	public static List<SplitResult> splitByDelimiter(@Nonnull Document document, @Nonnull String delimiter) {
		Objects.requireNonNull(document, "document must not be null");
		Objects.requireNonNull(delimiter, "delimiter must not be null");
		if (delimiter.isEmpty()) {
			throw new IllegalArgumentException("Delimiter cannot be empty");
		}
		final String expected = delimiter.strip();
		final boolean rule = RULE_DELIMITER.matcher(expected).matches();
		return splitAt(document, block -> isDelimiter(block, expected, rule), "no_delimiters_found");
	}

	/**
	 * Splits with the default target of {@value #DEFAULT_AUTO_TARGET_WORDS} words per part.
	 *
	 * @param document document to split
	 * @return parts in document order
	 * @see #splitAuto(Document, int)
	 */
	@Nonnull
	public static List<SplitResult> splitAuto(@Nonnull Document document) {
		return splitAuto(document, DEFAULT_AUTO_TARGET_WORDS);
	}

	/**
	 * Picks the strategy from the document structure. Level 1 sections are used when they average
	 * at most twice the target and none exceeds three times the target. Otherwise level 2 sections
	 * are used when they average at most one and a half times the target. Word count splitting is
	 * the fallback. Every part records the choice under {@value #STRATEGY} as {@code auto:h1},
	 * {@code auto:h2} or {@code auto:word_count}.
	 *
	 * @param document    document to split
	 * @param targetWords target words per part
	 * @return parts in document order
	 */
	@Nonnull
	public static List<SplitResult> splitAuto(@Nonnull Document document, int targetWords) {
		Objects.requireNonNull(document, "document must not be null");
		if (targetWords < 1) {
			throw new IllegalArgumentException("targetWords must be at least 1, got " + targetWords);
		}
		final List<Section> topSections = DocumentSections.getAllSections(document, 1, 1);
		if (!topSections.isEmpty()) {
			int total = 0;
			int max = 0;
			for (final Section section : topSections) {
				final int words = countWords(section.nodes());
				total += words;
				max = Math.max(max, words);
			}
			final double average = (double) total / topSections.size();
			if (average <= targetWords * 2.0 && max <= targetWords * 3L) {
				return tag(splitByHeadingLevel(document, 1, true), "auto:h1");
			}
		}

		final List<Section> secondSections = DocumentSections.getAllSections(document, 2, 2);
		if (!secondSections.isEmpty()) {
			int total = 0;
			for (final Section section : secondSections) {
				total += countWords(section.nodes());
			}
			if ((double) total / secondSections.size() <= targetWords * 1.5) {
				return tag(splitByHeadingLevel(document, 2, true), "auto:h2");
			}
		}

		return tag(splitByWordCount(document, targetWords), "auto:word_count");
	}

	/**
	 * Counts whitespace separated words in the plain text of the blocks.
	 *
	 * @param blocks blocks to count
	 * @return word count
	 */
	public static int countWords(@Nonnull List<? extends Block> blocks) {
		int count = 0;
		for (final Block block : blocks) {
			final String text = Nodes.extractText(block).strip();
			if (!text.isEmpty()) {
				count += WHITESPACE.split(text).length;
			}
		}
		return count;
	}

	private static boolean isDelimiter(@Nonnull Block block, @Nonnull String expected, boolean rule) {
		if (block instanceof ThematicBreak) {
			return rule;
		} else if (block instanceof Paragraph) {
			return Nodes.extractText(block).strip().equals(expected);
		} else if (block instanceof HtmlBlock html) {
			return html.content().strip().equals(expected);
		} else if (block instanceof Comment comment) {
			// markdown parses a lone <!-- ... --> line into a comment node
			return expected.startsWith(COMMENT_OPEN) && expected.endsWith(COMMENT_CLOSE) &&
				expected.length() >= COMMENT_OPEN.length() + COMMENT_CLOSE.length() &&
				expected.substring(COMMENT_OPEN.length(), expected.length() - COMMENT_CLOSE.length()).strip()
					.equals(comment.content().strip());
		}
		return false;
	}

	@Nonnull
	private static List<SplitResult> sectionParts(
		@Nonnull Document document,
		@Nonnull List<Section> sections,
		boolean includePreamble
	) {
		final List<SplitResult> parts = new ArrayList<>();
		if (includePreamble) {
			final List<Block> preamble = DocumentSections.getPreamble(document);
			if (!preamble.isEmpty()) {
				parts.add(part(document, preamble, 1, PREAMBLE_TITLE, countWords(preamble)));
			}
		}
		for (final Section section : sections) {
			final List<Block> nodes = section.nodes();
			parts.add(part(document, nodes, parts.size() + 1, section.headingText(), countWords(nodes)));
		}
		return parts;
	}

	@Nonnull
	private static List<SplitResult> splitAt(
		@Nonnull Document document,
		@Nonnull Predicate<Block> boundary,
		@Nonnull String reasonWhenNone
	) {
		final List<SplitResult> parts = new ArrayList<>();
		final List<Block> current = new ArrayList<>();
		for (final Block child : document.children()) {
			if (boundary.test(child)) {
				if (!current.isEmpty()) {
					parts.add(numberedPart(document, current, parts.size() + 1));
					current.clear();
				}
			} else {
				current.add(child);
			}
		}
		if (!current.isEmpty()) {
			parts.add(numberedPart(document, current, parts.size() + 1));
		}
		if (parts.isEmpty()) {
			return List.of(whole(document, "Part 1", reasonWhenNone));
		}
		return parts;
	}

	@Nonnull
	private static SplitResult numberedPart(@Nonnull Document document, @Nonnull List<Block> nodes, int index) {
		return part(document, nodes, index, "Part " + index, countWords(nodes));
	}

	@Nonnull
	private static SplitResult part(
		@Nonnull Document document,
		@Nonnull List<Block> nodes,
		int index,
		@Nullable String title,
		int wordCount
	) {
		final Document part = new Document(nodes, document.metadata(), document.sourceLocation());
		return new SplitResult(part, index, title, wordCount);
	}

	@Nonnull
	private static SplitResult whole(@Nonnull Document document, @Nullable String title, @Nonnull String reason) {
		return new SplitResult(document, 1, title, countWords(document.children()), Metadata.of(REASON, reason));
	}

	@Nonnull
	private static List<SplitResult> tag(@Nonnull List<SplitResult> parts, @Nonnull String strategy) {
		final List<SplitResult> result = new ArrayList<>(parts.size());
		for (final SplitResult part : parts) {
			result.add(part.with(STRATEGY, strategy));
		}
		return result;
	}
}
