package io.evitadb.docast.transform;

import io.evitadb.docast.node.Document;
import io.evitadb.docast.node.Heading;
import io.evitadb.docast.node.Node;
import io.evitadb.docast.section.Slugifier;
import io.evitadb.docast.visitor.Nodes;

import javax.annotation.Nonnull;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Stores a unique anchor identifier in the {@code id} metadata entry of every heading. The
 * identifier is the slug of the heading text with an optional prefix; repeated slugs get a
 * numeric suffix starting with 2. Identifiers are unique within one transformed document.
 */
public class HeadingIdTransformer extends NodeTransformer {

	/**
	 * Metadata key holding the heading identifier.
	 */
	public static final String ID = "id";

	@Nonnull
	private final String idPrefix;
	@Nonnull
	private final String separator;
	@Nonnull
	private final Set<String> seenIds = new HashSet<>();

	public HeadingIdTransformer() {
		this("", "-");
	}

	/**
	 * Creates the transformer.
	 *
	 * @param idPrefix  prefix prepended to every identifier
	 * @param separator separator of words and of the collision suffix
	 */
	public HeadingIdTransformer(@Nonnull String idPrefix, @Nonnull String separator) {
		this.idPrefix = Objects.requireNonNull(idPrefix, "idPrefix must not be null");
		this.separator = Objects.requireNonNull(separator, "separator must not be null");
	}

	@Override
	public Node visit(@Nonnull Document document) {
		this.seenIds.clear();
		return super.visit(document);
	}

	@Override
	public Node visit(@Nonnull Heading heading) {
		String slug = Slugifier.slugify(Nodes.extractText(heading));
		if (!"-".equals(this.separator)) {
			slug = slug.replace("-", this.separator);
		}
		String id = slug;
		for (int counter = 2; this.seenIds.contains(id); counter++) {
			id = slug + this.separator + counter;
		}
		this.seenIds.add(id);
		return new Heading(
			heading.level(),
			transformInlines(heading.content()),
			heading.metadata().with(ID, this.idPrefix + id),
			heading.sourceLocation()
		);
	}
}
