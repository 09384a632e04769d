package io.evitadb.docast.markdown;

import io.evitadb.docast.node.Metadata;
import org.commonmark.Extension;
import org.commonmark.ext.front.matter.YamlFrontMatterExtension;
import org.commonmark.ext.front.matter.YamlFrontMatterVisitor;
import org.commonmark.ext.gfm.strikethrough.StrikethroughExtension;
import org.commonmark.ext.gfm.tables.TablesExtension;
import org.commonmark.ext.task.list.items.TaskListItemsExtension;
import org.commonmark.node.Node;
import org.commonmark.parser.IncludeSourceSpans;
import org.commonmark.parser.Parser;

import javax.annotation.Nonnull;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Markdown source parsed by CommonMark together with its YAML front matter.
 *
 * The CommonMark tree keeps block source spans, so converted nodes can report the line they came
 * from.
 *
 * @author Jan Novotný (novotny@fg.cz), FG Forrest a.s. (c) 2025
 */
public class MarkdownDocument {

	/**
	 * List of CommonMark extensions used for parsing.
	 */
	public static final List<Extension> MARKDOWN_EXTENSIONS = List.of(
		YamlFrontMatterExtension.create(),
		StrikethroughExtension.create(),
		TablesExtension.create(),
		TaskListItemsExtension.create()
	);

	private static final Pattern FRONT_MATTER_PATTERN = Pattern.compile(
		"^---\\s*\\n(.*?)\\n---\\s*\\n?",
		Pattern.DOTALL
	);

	private static final Parser PARSER = Parser.builder()
		.extensions(MARKDOWN_EXTENSIONS)
		.includeSourceSpans(IncludeSourceSpans.BLOCKS)
		.build();

	private final Node root;
	private final Map<String, List<String>> properties;
	private final String rawMarkdown;

	/**
	 * Parses the markdown content and captures its front matter.
	 *
	 * @param markdown the Markdown content to parse; must not be null
	 */
	public MarkdownDocument(@Nonnull String markdown) {
		Objects.requireNonNull(markdown, "markdown must not be null");
		this.rawMarkdown = markdown;
		this.root = PARSER.parse(markdown);

		final YamlFrontMatterVisitor visitor = new YamlFrontMatterVisitor();
		this.root.accept(visitor);
		this.properties = new LinkedHashMap<>(visitor.getData());
	}

	/**
	 * Returns the root of the CommonMark tree.
	 */
	@Nonnull
	public Node getRoot() {
		return this.root;
	}

	/**
	 * Retrieves the first value of the front matter property.
	 *
	 * @param key property name
	 * @return first value or empty when the property is missing or has no values
	 */
	@Nonnull
	public Optional<String> getProperty(@Nonnull String key) {
		Objects.requireNonNull(key, "key must not be null");
		final List<String> values = this.properties.get(key);
		if (values == null || values.isEmpty()) {
			return Optional.empty();
		}
		return Optional.of(values.get(0));
	}

	/**
	 * Returns all front matter properties in the order of declaration.
	 */
	@Nonnull
	public Map<String, List<String>> getProperties() {
		return Collections.unmodifiableMap(new LinkedHashMap<>(this.properties));
	}

	/**
	 * Converts the front matter into node metadata. A property with a single value becomes a string,
	 * a property with several values a list of strings. Properties without values are skipped.
	 *
	 * @return metadata in the order of declaration
	 */
	@Nonnull
	public Metadata toMetadata() {
		final Map<String, Object> values = new LinkedHashMap<>();
		for (final Map.Entry<String, List<String>> entry : this.properties.entrySet()) {
			final List<String> propertyValues = entry.getValue();
			if (propertyValues.size() == 1) {
				values.put(entry.getKey(), propertyValues.get(0));
			} else if (!propertyValues.isEmpty()) {
				values.put(entry.getKey(), List.copyOf(propertyValues));
			}
		}
		return Metadata.of(values);
	}

	/**
	 * Returns the markdown body content without front matter.
	 *
	 * @return markdown body content, or the full content if no front matter
	 */
	@Nonnull
	public String getBodyContent() {
		final Matcher matcher = FRONT_MATTER_PATTERN.matcher(this.rawMarkdown);
		if (matcher.find()) {
			return this.rawMarkdown.substring(matcher.end());
		}
		return this.rawMarkdown;
	}

	@Nonnull
	public String getRawMarkdown() {
		return this.rawMarkdown;
	}
}
