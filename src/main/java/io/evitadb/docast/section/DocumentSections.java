package io.evitadb.docast.section;

import io.evitadb.docast.node.Block;
import io.evitadb.docast.node.Document;
import io.evitadb.docast.node.Heading;
import io.evitadb.docast.node.ThematicBreak;
import io.evitadb.docast.visitor.Nodes;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Section queries and section level edits of a document.
 *
 * Sections are recomputed from the top-level children of the document on every call. Edits never
 * modify their input: they splice the children list around the section bounds and return a new
 * document with the metadata and source location of the original one.
 *
 * Heading text comparisons ignore case unless stated otherwise and compare the plain text of the
 * heading as returned by {@link Nodes#extractText(io.evitadb.docast.node.Node)}.
 *
 * @author Jan Novotný (novotny@fg.cz), FG Forrest a.s. (c) 2025
 */
public final class DocumentSections {

	private DocumentSections() {
	}

	/**
	 * Returns all sections of the document.
	 *
	 * @param document source document
	 * @return sections in document order
	 */
	@Nonnull
	public static List<Section> getAllSections(@Nonnull Document document) {
		return getAllSections(document, Heading.MIN_LEVEL, Heading.MAX_LEVEL);
	}

	/**
	 * Returns the sections opened by headings within the level range.
	 *
	 * The children are scanned once. An in-range heading closes the open section and opens a new
	 * one. A heading outside the range is ignored while no section is open, closes the open section
	 * without opening another one when its level is the same or more significant, and is kept as
	 * content of the open section when it is less significant. Other nodes are added to the open
	 * section or dropped when no section is open.
	 *
	 * @param document source document
	 * @param minLevel most significant level opening a section
	 * @param maxLevel least significant level opening a section
	 * @return sections in document order
	 * @throws IllegalArgumentException when the levels are outside 1-6 or {@code minLevel > maxLevel}
	 */
	@Nonnull
	public static List<Section> getAllSections(@Nonnull Document document, int minLevel, int maxLevel) {
		Objects.requireNonNull(document, "document must not be null");
		if (minLevel < Heading.MIN_LEVEL || maxLevel > Heading.MAX_LEVEL || minLevel > maxLevel) {
			throw new IllegalArgumentException(
				"Invalid level range: min_level=" + minLevel + ", max_level=" + maxLevel +
					". Levels must be between 1 and 6, with min_level <= max_level."
			);
		}
		final List<Block> children = document.children();
		final List<Section> sections = new ArrayList<>();
		Heading openHeading = null;
		int openIndex = -1;
		List<Block> content = new ArrayList<>();
		for (int i = 0; i < children.size(); i++) {
			final Block child = children.get(i);
			if (child instanceof Heading heading) {
				if (heading.level() >= minLevel && heading.level() <= maxLevel) {
					if (openHeading != null) {
						sections.add(new Section(openHeading, content, openHeading.level(), openIndex, i));
					}
					openHeading = heading;
					openIndex = i;
					content = new ArrayList<>();
				} else if (openHeading != null) {
					if (heading.level() <= openHeading.level()) {
						sections.add(new Section(openHeading, content, openHeading.level(), openIndex, i));
						openHeading = null;
						content = new ArrayList<>();
					} else {
						content.add(heading);
					}
				}
			} else if (openHeading != null) {
				content.add(child);
			}
		}
		if (openHeading != null) {
			sections.add(new Section(openHeading, content, openHeading.level(), openIndex, children.size()));
		}
		return sections;
	}

	/**
	 * Returns the top-level nodes preceding the first heading of any level.
	 *
	 * @param document source document
	 * @return preamble nodes, empty when the document starts with a heading
	 */
	@Nonnull
	public static List<Block> getPreamble(@Nonnull Document document) {
		final List<Block> preamble = new ArrayList<>();
		for (final Block child : document.children()) {
			if (child instanceof Heading) {
				break;
			}
			preamble.add(child);
		}
		return preamble;
	}

	/**
	 * Finds the first section whose heading text equals the text, ignoring case.
	 *
	 * @param document source document
	 * @param text     heading text
	 * @return matching section
	 */
	@Nonnull
	public static Optional<Section> findSectionByHeading(@Nonnull Document document, @Nonnull String text) {
		return findSectionByHeading(document, text, null, false);
	}

	/**
	 * Finds the first section whose heading text equals the text.
	 *
	 * @param document      source document
	 * @param text          heading text
	 * @param level         required heading level or null for any level
	 * @param caseSensitive whether the comparison respects case
	 * @return matching section
	 */
	@Nonnull
	public static Optional<Section> findSectionByHeading(
		@Nonnull Document document,
		@Nonnull String text,
		@Nullable Integer level,
		boolean caseSensitive
	) {
		Objects.requireNonNull(text, "text must not be null");
		for (final Section section : getAllSections(document)) {
			if (level != null && section.level() != level) {
				continue;
			}
			if (textEquals(section.headingText(), text, caseSensitive)) {
				return Optional.of(section);
			}
		}
		return Optional.empty();
	}

	/**
	 * Returns all sections satisfying the predicate.
	 *
	 * @param document  source document
	 * @param predicate section test
	 * @return matching sections in document order
	 */
	@Nonnull
	public static List<Section> findSections(@Nonnull Document document, @Nonnull Predicate<? super Section> predicate) {
		Objects.requireNonNull(predicate, "predicate must not be null");
		final List<Section> result = new ArrayList<>();
		for (final Section section : getAllSections(document)) {
			if (predicate.test(section)) {
				result.add(section);
			}
		}
		return result;
	}

	/**
	 * Returns the section at the index. Negative indexes count from the end, -1 being the last
	 * section.
	 *
	 * @param document source document
	 * @param index    section index
	 * @return section or empty when the index is out of range
	 */
	@Nonnull
	public static Optional<Section> getSectionByIndex(@Nonnull Document document, int index) {
		final List<Section> sections = getAllSections(document);
		final int resolved = index < 0 ? sections.size() + index : index;
		if (resolved < 0 || resolved >= sections.size()) {
			return Optional.empty();
		}
		return Optional.of(sections.get(resolved));
	}

	/**
	 * Counts all sections of the document.
	 *
	 * @param document source document
	 * @return number of sections
	 */
	public static int countSections(@Nonnull Document document) {
		return getAllSections(document).size();
	}

	/**
	 * Counts the sections opened by headings of the given level.
	 *
	 * @param document source document
	 * @param level    heading level
	 * @return number of sections
	 */
	public static int countSections(@Nonnull Document document, int level) {
		return getAllSections(document, level, level).size();
	}

	/**
	 * Finds the first top-level heading whose text equals the text.
	 *
	 * @param document      source document
	 * @param text          heading text
	 * @param level         required heading level or null for any level
	 * @param caseSensitive whether the comparison respects case
	 * @return index of the heading in the document children and the heading itself
	 */
	@Nonnull
	public static Optional<Map.Entry<Integer, Heading>> findHeading(
		@Nonnull Document document,
		@Nonnull String text,
		@Nullable Integer level,
		boolean caseSensitive
	) {
		final List<Block> children = document.children();
		for (int i = 0; i < children.size(); i++) {
			if (children.get(i) instanceof Heading heading) {
				if (level != null && heading.level() != level) {
					continue;
				}
				if (textEquals(Nodes.extractText(heading), text, caseSensitive)) {
					return Optional.of(Map.entry(i, heading));
				}
			}
		}
		return Optional.empty();
	}

	/**
	 * Returns the sections whose heading text matches the pattern. A pattern containing {@code *}
	 * or {@code ?} is a wildcard pattern, any other pattern must equal the heading text.
	 *
	 * @param document source document
	 * @param pattern  heading text or wildcard pattern
	 * @return matching sections in document order
	 */
	@Nonnull
	public static List<Section> querySections(@Nonnull Document document, @Nonnull String pattern) {
		return querySections(document, pattern, Heading.MIN_LEVEL, Heading.MAX_LEVEL, false);
	}

	/**
	 * Returns the sections within the level range whose heading text matches the pattern.
	 *
	 * @param document      source document
	 * @param pattern       heading text or wildcard pattern, null selects all sections
	 * @param minLevel      most significant level opening a section
	 * @param maxLevel      least significant level opening a section
	 * @param caseSensitive whether the matching respects case
	 * @return matching sections in document order
	 */
	@Nonnull
	public static List<Section> querySections(
		@Nonnull Document document,
		@Nullable String pattern,
		int minLevel,
		int maxLevel,
		boolean caseSensitive
	) {
		final List<Section> sections = getAllSections(document, minLevel, maxLevel);
		if (pattern == null) {
			return sections;
		}
		final boolean wildcard = pattern.indexOf('*') >= 0 || pattern.indexOf('?') >= 0;
		final Pattern compiled = wildcard ? compileWildcard(pattern, caseSensitive) : null;
		final List<Section> result = new ArrayList<>();
		for (final Section section : sections) {
			final String text = section.headingText();
			final boolean matches = compiled != null ?
				compiled.matcher(text).matches() :
				textEquals(text, pattern, caseSensitive);
			if (matches) {
				result.add(section);
			}
		}
		return result;
	}

	/**
	 * Returns the sections at the given indexes, negative indexes counting from the end.
	 *
	 * @param document source document
	 * @param indexes  section indexes
	 * @return sections in the order of the indexes
	 * @throws IllegalArgumentException when an index is out of range
	 */
	@Nonnull
	public static List<Section> querySections(@Nonnull Document document, @Nonnull List<Integer> indexes) {
		final List<Section> sections = getAllSections(document);
		final List<Section> result = new ArrayList<>(indexes.size());
		for (final int index : indexes) {
			final int resolved = index < 0 ? sections.size() + index : index;
			if (resolved < 0 || resolved >= sections.size()) {
				throw new IllegalArgumentException(
					"Section index " + index + " out of range (0-" + (sections.size() - 1) + ")"
				);
			}
			result.add(sections.get(resolved));
		}
		return result;
	}

	/**
	 * Extracts the selected sections into one document, separated by thematic breaks.
	 *
	 * @param document source document
	 * @param spec     {@code #:} followed by 1-based ranges (see {@link SectionRanges}), or a heading
	 *                 text or wildcard pattern
	 * @return document with the selected sections and the metadata of the source document
	 * @throws IllegalArgumentException when the document has no sections or nothing matches
	 */
	@Nonnull
	public static Document extractSections(@Nonnull Document document, @Nonnull String spec) {
		return extractSections(document, spec, false, new ThematicBreak());
	}

	/**
	 * Extracts the selected sections into one document.
	 *
	 * @param document      source document
	 * @param spec          {@code #:} followed by 1-based ranges, or a heading text or wildcard pattern
	 * @param caseSensitive whether heading matching respects case
	 * @param separator     node placed between extracted sections, null for none
	 * @return document with the selected sections and the metadata of the source document
	 * @throws IllegalArgumentException when the document has no sections or nothing matches
	 */
	@Nonnull
	public static Document extractSections(
		@Nonnull Document document,
		@Nonnull String spec,
		boolean caseSensitive,
		@Nullable Block separator
	) {
		final List<Section> sections = getAllSections(document);
		if (sections.isEmpty()) {
			throw new IllegalArgumentException("Document contains no sections (headings)");
		}
		final List<Section> selected = new ArrayList<>();
		if (spec.startsWith("#:")) {
			final List<Integer> indexes;
			try {
				indexes = SectionRanges.parse(spec.substring(2), sections.size());
			} catch (IllegalArgumentException e) {
				throw new IllegalArgumentException("Invalid section index specification '" + spec + "': " + e.getMessage(), e);
			}
			if (indexes.isEmpty()) {
				throw new IllegalArgumentException("No valid sections in range: " + spec);
			}
			for (final int index : indexes) {
				selected.add(sections.get(index));
			}
		} else {
			final Pattern pattern = compileWildcard(spec, caseSensitive);
			for (final Section section : sections) {
				if (pattern.matcher(section.headingText()).matches()) {
					selected.add(section);
				}
			}
			if (selected.isEmpty()) {
				throw new IllegalArgumentException(noMatchMessage(spec, sections));
			}
		}
		return joinSections(document, selected, separator);
	}

	/**
	 * Extracts the sections at the given 0-based indexes into one document, separated by thematic
	 * breaks. Indexes out of range are skipped.
	 *
	 * @param document source document
	 * @param indexes  section indexes
	 * @return document with the selected sections
	 * @throws IllegalArgumentException when no index is valid
	 */
	@Nonnull
	public static Document extractSections(@Nonnull Document document, @Nonnull List<Integer> indexes) {
		final List<Section> sections = getAllSections(document);
		final List<Section> selected = new ArrayList<>();
		for (final int index : indexes) {
			if (index >= 0 && index < sections.size()) {
				selected.add(sections.get(index));
			}
		}
		if (selected.isEmpty()) {
			throw new IllegalArgumentException("No valid sections in index list: " + indexes);
		}
		return joinSections(document, selected, new ThematicBreak());
	}

	/**
	 * Extracts one section as a standalone document.
	 *
	 * @param document source document
	 * @param target   section to extract
	 * @return document with the heading and the content of the section
	 * @throws SectionNotFoundException when the target does not resolve
	 */
	@Nonnull
	public static Document extractSection(@Nonnull Document document, @Nonnull SectionTarget target) {
		return resolve(document, target).toDocument();
	}

	/**
	 * Inserts the nodes right after the target section.
	 *
	 * @param document source document
	 * @param target   section after which the nodes are inserted
	 * @param nodes    nodes to insert, e.g. {@link Section#nodes()} of another section
	 * @return new document
	 * @throws SectionNotFoundException when the target does not resolve
	 */
	@Nonnull
	public static Document addSectionAfter(
		@Nonnull Document document,
		@Nonnull SectionTarget target,
		@Nonnull List<? extends Block> nodes
	) {
		final Section section = resolve(document, target);
		return splice(document, section.endIndex(), section.endIndex(), nodes);
	}

	/**
	 * Inserts the nodes right before the heading of the target section.
	 *
	 * @param document source document
	 * @param target   section before which the nodes are inserted
	 * @param nodes    nodes to insert
	 * @return new document
	 * @throws SectionNotFoundException when the target does not resolve
	 */
	@Nonnull
	public static Document addSectionBefore(
		@Nonnull Document document,
		@Nonnull SectionTarget target,
		@Nonnull List<? extends Block> nodes
	) {
		final Section section = resolve(document, target);
		return splice(document, section.startIndex(), section.startIndex(), nodes);
	}

	/**
	 * Removes the target section, heading included.
	 *
	 * @param document source document
	 * @param target   section to remove
	 * @return new document
	 * @throws SectionNotFoundException when the target does not resolve
	 */
	@Nonnull
	public static Document removeSection(@Nonnull Document document, @Nonnull SectionTarget target) {
		final Section section = resolve(document, target);
		return splice(document, section.startIndex(), section.endIndex(), List.of());
	}

	/**
	 * Replaces the target section, heading included, with the nodes.
	 *
	 * @param document source document
	 * @param target   section to replace
	 * @param nodes    replacement nodes
	 * @return new document
	 * @throws SectionNotFoundException when the target does not resolve
	 */
	@Nonnull
	public static Document replaceSection(
		@Nonnull Document document,
		@Nonnull SectionTarget target,
		@Nonnull List<? extends Block> nodes
	) {
		final Section section = resolve(document, target);
		return splice(document, section.startIndex(), section.endIndex(), nodes);
	}

	/**
	 * Inserts the nodes into the content of the target section.
	 *
	 * @param document source document
	 * @param target   section receiving the nodes
	 * @param nodes    nodes to insert
	 * @param position where in the section the nodes go
	 * @return new document
	 * @throws SectionNotFoundException when the target does not resolve
	 */
	@Nonnull
	public static Document insertIntoSection(
		@Nonnull Document document,
		@Nonnull SectionTarget target,
		@Nonnull List<? extends Block> nodes,
		@Nonnull InsertPosition position
	) {
		Objects.requireNonNull(position, "position must not be null");
		final Section section = resolve(document, target);
		final int index = position == InsertPosition.END ? section.endIndex() : section.startIndex() + 1;
		return splice(document, index, index, nodes);
	}

	/**
	 * Splits the document into one document per section.
	 *
	 * @param document        source document
	 * @param includePreamble whether a non-empty preamble becomes the first document
	 * @return documents in order
	 */
	@Nonnull
	public static List<Document> splitBySections(@Nonnull Document document, boolean includePreamble) {
		final List<Document> documents = new ArrayList<>();
		if (includePreamble) {
			final List<Block> preamble = getPreamble(document);
			if (!preamble.isEmpty()) {
				documents.add(new Document(preamble));
			}
		}
		for (final Section section : getAllSections(document)) {
			documents.add(section.toDocument());
		}
		return documents;
	}

	@Nonnull
	private static Section resolve(@Nonnull Document document, @Nonnull SectionTarget target) {
		Objects.requireNonNull(target, "target must not be null");
		final Optional<Section> section = target.isHeading() ?
			findSectionByHeading(document, Objects.requireNonNull(target.headingText()), null, target.caseSensitive()) :
			getSectionByIndex(document, target.index());
		return section.orElseThrow(() -> new SectionNotFoundException(target));
	}

	@Nonnull
	private static Document splice(
		@Nonnull Document document,
		int from,
		int to,
		@Nonnull List<? extends Block> nodes
	) {
		Objects.requireNonNull(nodes, "nodes must not be null");
		final List<Block> children = document.children();
		final List<Block> result = new ArrayList<>(children.size() + nodes.size());
		result.addAll(children.subList(0, from));
		result.addAll(nodes);
		result.addAll(children.subList(to, children.size()));
		return document.withChildren(result);
	}

	@Nonnull
	private static Document joinSections(
		@Nonnull Document document,
		@Nonnull List<Section> sections,
		@Nullable Block separator
	) {
		final List<Block> children = new ArrayList<>();
		for (int i = 0; i < sections.size(); i++) {
			if (i > 0 && separator != null) {
				children.add(separator);
			}
			children.addAll(sections.get(i).nodes());
		}
		return new Document(children, document.metadata());
	}

	private static boolean textEquals(@Nonnull String actual, @Nonnull String expected, boolean caseSensitive) {
		return caseSensitive ? actual.equals(expected) : actual.equalsIgnoreCase(expected);
	}

	/**
	 * Translates a wildcard pattern with {@code *} (any run of characters) and {@code ?} (one
	 * character) to a regular expression matching the whole text.
	 */
	@Nonnull
	private static Pattern compileWildcard(@Nonnull String wildcard, boolean caseSensitive) {
		final StringBuilder regex = new StringBuilder(wildcard.length() + 8);
		final StringBuilder literal = new StringBuilder();
		for (int i = 0; i < wildcard.length(); i++) {
			final char c = wildcard.charAt(i);
			if (c == '*' || c == '?') {
				if (literal.length() > 0) {
					regex.append(Pattern.quote(literal.toString()));
					literal.setLength(0);
				}
				regex.append(c == '*' ? ".*" : ".");
			} else {
				literal.append(c);
			}
		}
		if (literal.length() > 0) {
			regex.append(Pattern.quote(literal.toString()));
		}
		final int flags = Pattern.DOTALL | (caseSensitive ? 0 : Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
		return Pattern.compile(regex.toString(), flags);
	}

	@Nonnull
	private static String noMatchMessage(@Nonnull String pattern, @Nonnull List<Section> sections) {
		final String message = "No sections match pattern: " + pattern;
		if (pattern.indexOf('*') >= 0 || pattern.indexOf('?') >= 0) {
			return message;
		}
		final String lowerPattern = pattern.toLowerCase(Locale.ROOT);
		final List<String> suggestions = new ArrayList<>();
		for (final Section section : sections) {
			final String text = section.headingText();
			if (suggestions.size() < 3 && similarity(lowerPattern, text.toLowerCase(Locale.ROOT)) >= 0.6) {
				suggestions.add(text);
			}
		}
		return suggestions.isEmpty() ? message : message + "\nDid you mean: " + String.join(", ", suggestions) + "?";
	}

	/**
	 * Returns 1 minus the edit distance divided by the length of the longer text.
	 */
	private static double similarity(@Nonnull String a, @Nonnull String b) {
		final int longer = Math.max(a.length(), b.length());
		if (longer == 0) {
			return 1.0;
		}
		int[] previous = new int[b.length() + 1];
		int[] current = new int[b.length() + 1];
		for (int j = 0; j <= b.length(); j++) {
			previous[j] = j;
		}
		for (int i = 1; i <= a.length(); i++) {
			current[0] = i;
			for (int j = 1; j <= b.length(); j++) {
				final int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
				current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
			}
			final int[] swap = previous;
			previous = current;
			current = swap;
		}
		return 1.0 - (double) previous[b.length()] / longer;
	}
}
