package io.evitadb.docast.node;

import io.evitadb.docast.visitor.NodeVisitor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * List of terms with their descriptions.
 *
 * @param entries        term/description groups in document order
 * @param metadata       node metadata
 * @param sourceLocation provenance
 */
public record DefinitionList(
	@Nonnull List<Entry> entries,
	@Nonnull Metadata metadata,
	@Nullable SourceLocation sourceLocation
) implements Block {

	public DefinitionList {
		entries = List.copyOf(Objects.requireNonNull(entries, "entries must not be null"));
		Objects.requireNonNull(metadata, "metadata must not be null");
	}

	public DefinitionList(@Nonnull List<Entry> entries) {
		this(entries, Metadata.empty(), null);
	}

	@Override
	public <R> R accept(@Nonnull NodeVisitor<R> visitor) {
		return visitor.visit(this);
	}

	/**
	 * One term together with all of its descriptions.
	 *
	 * @param term         the defined term
	 * @param descriptions descriptions of the term
	 */
	public record Entry(
		@Nonnull DefinitionTerm term,
		@Nonnull List<DefinitionDescription> descriptions
	) {

		public Entry {
			Objects.requireNonNull(term, "term must not be null");
			descriptions = List.copyOf(Objects.requireNonNull(descriptions, "descriptions must not be null"));
		}
	}
}
