package io.evitadb.docast.visitor;

import io.evitadb.docast.node.Document;
import io.evitadb.docast.node.FootnoteDefinition;
import io.evitadb.docast.node.FootnoteReference;
import io.evitadb.docast.node.HtmlBlock;
import io.evitadb.docast.node.HtmlInline;
import io.evitadb.docast.node.Image;
import io.evitadb.docast.node.Link;
import io.evitadb.docast.node.ListBlock;
import io.evitadb.docast.node.Table;
import io.evitadb.docast.node.TableCell;
import io.evitadb.docast.node.TableRow;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks tree invariants that the node records cannot enforce on their own:
 *
 * - every table row spans the same number of columns, counting cells carried down from rows above
 *   by their rowspan, and no rowspan reaches past the last row,
 * - only the header row of a table is flagged as header,
 * - the number of explicit column alignments matches the column count,
 * - lists have at least one item and ordered lists start at 1 or above,
 * - link and image URLs are not blank,
 * - every footnote reference has a matching footnote definition,
 * - raw HTML is present only when allowed.
 *
 * In strict mode the first problem aborts the walk with {@link InvalidStructureException},
 * otherwise all problems are collected and available through {@link #getProblems()}.
 */
public class StructureValidator extends AbstractVisitor {

	private final boolean strict;
	private final boolean allowRawHtml;
	@Nonnull
	private final List<String> problems = new ArrayList<>();
	@Nonnull
	private final Set<String> footnoteReferences = new LinkedHashSet<>();
	@Nonnull
	private final Set<String> footnoteDefinitions = new LinkedHashSet<>();

	public StructureValidator(boolean strict, boolean allowRawHtml) {
		this.strict = strict;
		this.allowRawHtml = allowRawHtml;
	}

	/**
	 * Validates the document in lenient mode with raw HTML allowed.
	 *
	 * @param document document to validate
	 * @return problems found, empty when the document is valid
	 */
	@Nonnull
	public static List<String> validate(@Nonnull Document document) {
		final StructureValidator validator = new StructureValidator(false, true);
		document.accept(validator);
		return validator.getProblems();
	}

	@Nonnull
	public List<String> getProblems() {
		return Collections.unmodifiableList(this.problems);
	}

	private void problem(@Nonnull String message) {
		this.problems.add(message);
		if (this.strict) {
			throw new InvalidStructureException(this.problems);
		}
	}

	@Override
	public Void visit(@Nonnull Document document) {
		visitChildren(document);
		for (final String identifier : this.footnoteReferences) {
			if (!this.footnoteDefinitions.contains(identifier)) {
				problem("Footnote reference '" + identifier + "' has no matching definition");
			}
		}
		return null;
	}

	@Override
	public Void visit(@Nonnull ListBlock listBlock) {
		if (listBlock.items().isEmpty()) {
			problem("List must have at least one item");
		}
		if (listBlock.ordered() && listBlock.start() < 1) {
			problem("Ordered list start must be >= 1, got " + listBlock.start());
		}
		visitChildren(listBlock);
		return null;
	}

	@Override
	public Void visit(@Nonnull Table table) {
		for (int i = 0; i < table.rows().size(); i++) {
			if (table.rows().get(i).header()) {
				problem("Table body row " + i + " is flagged as header");
			}
		}
		final List<TableRow> rows = table.allRows();
		if (!rows.isEmpty()) {
			final int[] carried = new int[rows.size()];
			int expectedColumns = -1;
			for (int i = 0; i < rows.size(); i++) {
				final TableRow row = rows.get(i);
				for (final TableCell cell : row.cells()) {
					if (i + cell.rowspan() > rows.size()) {
						problem("Table cell in row " + i + " spans " + cell.rowspan() + " rows, only " + (rows.size() - i) + " remain");
					}
					for (int j = i + 1; j < Math.min(rows.size(), i + cell.rowspan()); j++) {
						carried[j] += cell.colspan();
					}
				}
				final int columns = row.columnCount() + carried[i];
				if (expectedColumns < 0) {
					expectedColumns = columns;
				} else if (columns != expectedColumns) {
					problem("Table row " + i + " spans " + columns + " columns, expected " + expectedColumns);
				}
			}
			if (!table.alignments().isEmpty() && table.alignments().size() != expectedColumns) {
				problem("Table has " + table.alignments().size() + " alignments but " + expectedColumns + " columns");
			}
		}
		visitChildren(table);
		return null;
	}

	@Override
	public Void visit(@Nonnull Link link) {
		if (link.url().isBlank()) {
			problem("Link URL must not be blank");
		}
		visitChildren(link);
		return null;
	}

	@Override
	public Void visit(@Nonnull Image image) {
		if (image.url().isBlank()) {
			problem("Image URL must not be blank");
		}
		return null;
	}

	@Override
	public Void visit(@Nonnull FootnoteReference footnoteReference) {
		this.footnoteReferences.add(footnoteReference.identifier());
		return null;
	}

	@Override
	public Void visit(@Nonnull FootnoteDefinition footnoteDefinition) {
		this.footnoteDefinitions.add(footnoteDefinition.identifier());
		visitChildren(footnoteDefinition);
		return null;
	}

	@Override
	public Void visit(@Nonnull HtmlBlock htmlBlock) {
		if (!this.allowRawHtml) {
			problem("Raw HTML block is not allowed");
		}
		return null;
	}

	@Override
	public Void visit(@Nonnull HtmlInline htmlInline) {
		if (!this.allowRawHtml) {
			problem("Raw inline HTML is not allowed");
		}
		return null;
	}
}
